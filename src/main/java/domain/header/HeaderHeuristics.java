package domain.header;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Header Inference 휴리스틱 상수.
 *
 * <p>{@link #defaults()} 는 현재 운영 중인 HR/프로그램 실적 엑셀 양식에 맞춘 값이다.
 * 다른 양식은 profile JSON 으로 덮어쓴다.</p>
 */
public final class HeaderHeuristics {

    private final int metaScanRows;
    private final int headerScanRows;
    private final int minHeaderCells;
    private final int shortLabelMin;
    private final int shortLabelMax;
    private final int cellWeight;
    private final int shortLabelWeight;
    private final int numberLabelBonus;
    private final int nameLabelBonus;
    private final int metaCellPenalty;
    private final int upwardRows;
    private final int downwardRows;
    private final Pattern metaRowPattern;
    private final Pattern metaCellPattern;
    private final Pattern numberLabelPattern;
    private final Pattern nameLabelPattern;
    private final Pattern dataRowMarker;
    private final List<Pattern> subHeaderPatterns;
    private final List<Pattern> basicColumnPatterns;
    private final List<Pattern> compositeNoisePatterns;
    private final int fallbackScanRows;
    private final int fallbackShortMax;
    private final Pattern sectionMarkerPattern;
    private final Pattern groupHeaderPattern;

    private HeaderHeuristics(Builder b) {
        this.metaScanRows = b.metaScanRows;
        this.headerScanRows = b.headerScanRows;
        this.minHeaderCells = b.minHeaderCells;
        this.shortLabelMin = b.shortLabelMin;
        this.shortLabelMax = b.shortLabelMax;
        this.cellWeight = b.cellWeight;
        this.shortLabelWeight = b.shortLabelWeight;
        this.numberLabelBonus = b.numberLabelBonus;
        this.nameLabelBonus = b.nameLabelBonus;
        this.metaCellPenalty = b.metaCellPenalty;
        this.upwardRows = b.upwardRows;
        this.downwardRows = b.downwardRows;
        this.metaRowPattern = b.metaRowPattern;
        this.metaCellPattern = b.metaCellPattern;
        this.numberLabelPattern = b.numberLabelPattern;
        this.nameLabelPattern = b.nameLabelPattern;
        this.dataRowMarker = b.dataRowMarker;
        this.subHeaderPatterns = List.copyOf(b.subHeaderPatterns);
        this.basicColumnPatterns = List.copyOf(b.basicColumnPatterns);
        this.compositeNoisePatterns = List.copyOf(b.compositeNoisePatterns);
        this.fallbackScanRows = b.fallbackScanRows;
        this.fallbackShortMax = b.fallbackShortMax;
        this.sectionMarkerPattern = b.sectionMarkerPattern;
        this.groupHeaderPattern = b.groupHeaderPattern;
    }

    public static HeaderHeuristics defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.metaScanRows = metaScanRows;
        b.headerScanRows = headerScanRows;
        b.minHeaderCells = minHeaderCells;
        b.shortLabelMin = shortLabelMin;
        b.shortLabelMax = shortLabelMax;
        b.cellWeight = cellWeight;
        b.shortLabelWeight = shortLabelWeight;
        b.numberLabelBonus = numberLabelBonus;
        b.nameLabelBonus = nameLabelBonus;
        b.metaCellPenalty = metaCellPenalty;
        b.upwardRows = upwardRows;
        b.downwardRows = downwardRows;
        b.metaRowPattern = metaRowPattern;
        b.metaCellPattern = metaCellPattern;
        b.numberLabelPattern = numberLabelPattern;
        b.nameLabelPattern = nameLabelPattern;
        b.dataRowMarker = dataRowMarker;
        b.subHeaderPatterns = subHeaderPatterns;
        b.basicColumnPatterns = basicColumnPatterns;
        b.compositeNoisePatterns = compositeNoisePatterns;
        b.fallbackScanRows = fallbackScanRows;
        b.fallbackShortMax = fallbackShortMax;
        b.sectionMarkerPattern = sectionMarkerPattern;
        b.groupHeaderPattern = groupHeaderPattern;
        return b;
    }

    public int getMetaScanRows() {
        return metaScanRows;
    }

    public int getHeaderScanRows() {
        return headerScanRows;
    }

    public int getMinHeaderCells() {
        return minHeaderCells;
    }

    public boolean isShortLabel(String text) {
        int n = text.length();
        return n >= shortLabelMin && n <= shortLabelMax;
    }

    public int getShortLabelMin() {
        return shortLabelMin;
    }

    public int getShortLabelMax() {
        return shortLabelMax;
    }

    public int getCellWeight() {
        return cellWeight;
    }

    public int getShortLabelWeight() {
        return shortLabelWeight;
    }

    public int getNumberLabelBonus() {
        return numberLabelBonus;
    }

    public int getNameLabelBonus() {
        return nameLabelBonus;
    }

    public int getMetaCellPenalty() {
        return metaCellPenalty;
    }

    public int getUpwardRows() {
        return upwardRows;
    }

    public int getDownwardRows() {
        return downwardRows;
    }

    public Pattern getMetaRowPattern() {
        return metaRowPattern;
    }

    public Pattern getMetaCellPattern() {
        return metaCellPattern;
    }

    public Pattern getNumberLabelPattern() {
        return numberLabelPattern;
    }

    public Pattern getNameLabelPattern() {
        return nameLabelPattern;
    }

    public Pattern getDataRowMarker() {
        return dataRowMarker;
    }

    public List<Pattern> getSubHeaderPatterns() {
        return subHeaderPatterns;
    }

    public List<Pattern> getBasicColumnPatterns() {
        return basicColumnPatterns;
    }

    public List<Pattern> getCompositeNoisePatterns() {
        return compositeNoisePatterns;
    }

    public int getFallbackScanRows() {
        return fallbackScanRows;
    }

    public int getFallbackShortMax() {
        return fallbackShortMax;
    }

    public Pattern getSectionMarkerPattern() {
        return sectionMarkerPattern;
    }

    public Pattern getGroupHeaderPattern() {
        return groupHeaderPattern;
    }

    static boolean anyMatches(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            if (p.matcher(text).matches()) return true;
        }
        return false;
    }

    public static final class Builder {

        private int metaScanRows = 10;
        private int headerScanRows = 15;
        private int minHeaderCells = 3;
        private int shortLabelMin = 2;
        private int shortLabelMax = 15;
        private int cellWeight = 2;
        private int shortLabelWeight = 3;
        private int numberLabelBonus = 30;
        private int nameLabelBonus = 30;
        private int metaCellPenalty = 20;
        private int upwardRows = 2;
        private int downwardRows = 3;
        private Pattern metaRowPattern = Pattern.compile("^([A-Za-z\\s]+)\\s*:\\s*(.+)$");
        private Pattern metaCellPattern = Pattern.compile("^[A-Za-z\\s]+\\s*:\\s*.+");
        private Pattern numberLabelPattern = Pattern.compile("^(No\\.?|번호|순번)$", Pattern.CASE_INSENSITIVE);
        private Pattern nameLabelPattern = Pattern.compile("^(이름|성명|한글이름|영문이름|Name)$", Pattern.CASE_INSENSITIVE);
        private Pattern dataRowMarker = Pattern.compile("^\\d+$");
        private List<Pattern> subHeaderPatterns = List.of(
                Pattern.compile("^\\d+회차?$"),
                Pattern.compile("^\\d{1,2}\\s*\\([A-Za-z]{2,3}\\)$"),
                Pattern.compile("^[A-Za-z]{3,}$")
        );
        private List<Pattern> basicColumnPatterns = List.of(
                Pattern.compile("^No\\.?$", Pattern.CASE_INSENSITIVE),
                Pattern.compile("^번호$"),
                Pattern.compile("^순번$"),
                Pattern.compile("^이름$"),
                Pattern.compile("^성명$"),
                Pattern.compile("^한글이름$"),
                Pattern.compile("^영문이름$"),
                Pattern.compile("^이메일$"),
                Pattern.compile("^연락처$"),
                Pattern.compile("^전화번호$"),
                Pattern.compile("^생년월일$"),
                Pattern.compile("^성별$"),
                Pattern.compile("^거주지$")
        );
        private List<Pattern> compositeNoisePatterns = List.of(
                Pattern.compile("^\\d{2}\\s*\\([A-Za-z]{2,3}\\)$"),
                Pattern.compile("^\\d+$")
        );
        private int fallbackScanRows = 10;
        private int fallbackShortMax = 10;
        private Pattern sectionMarkerPattern = Pattern.compile("^\\d+\\..*", Pattern.DOTALL);
        private Pattern groupHeaderPattern = Pattern.compile("^[1-4]분기$");

        private Builder() {
        }

        public Builder metaScanRows(int v) {
            this.metaScanRows = v;
            return this;
        }

        public Builder headerScanRows(int v) {
            this.headerScanRows = v;
            return this;
        }

        public Builder minHeaderCells(int v) {
            this.minHeaderCells = v;
            return this;
        }

        public Builder shortLabelRange(int min, int max) {
            this.shortLabelMin = min;
            this.shortLabelMax = max;
            return this;
        }

        public Builder weights(int cell, int shortLabel, int numberLabel, int nameLabel, int metaPenalty) {
            this.cellWeight = cell;
            this.shortLabelWeight = shortLabel;
            this.numberLabelBonus = numberLabel;
            this.nameLabelBonus = nameLabel;
            this.metaCellPenalty = metaPenalty;
            return this;
        }

        public Builder walk(int upward, int downward) {
            this.upwardRows = upward;
            this.downwardRows = downward;
            return this;
        }

        public Builder subHeaderPatterns(List<Pattern> v) {
            this.subHeaderPatterns = v;
            return this;
        }

        public Builder basicColumnPatterns(List<Pattern> v) {
            this.basicColumnPatterns = v;
            return this;
        }

        public Builder compositeNoisePatterns(List<Pattern> v) {
            this.compositeNoisePatterns = v;
            return this;
        }

        public Builder fallbackScan(int rows, int shortMax) {
            this.fallbackScanRows = rows;
            this.fallbackShortMax = shortMax;
            return this;
        }

        public HeaderHeuristics build() {
            if (minHeaderCells < 1) throw new IllegalArgumentException("minHeaderCells must be >= 1");
            if (shortLabelMin > shortLabelMax) {
                throw new IllegalArgumentException("shortLabel range is empty: " + shortLabelMin + ".." + shortLabelMax);
            }
            return new HeaderHeuristics(this);
        }
    }
}
