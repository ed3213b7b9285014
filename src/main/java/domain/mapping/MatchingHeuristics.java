package domain.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * template 라벨 판별, 신뢰도, 고정 매핑 규칙.
 *
 * <p>{@link #defaults()} 의 override 표는 개인이력카드 양식(분기별 취업현황 18~20행,
 * 프로그램 참여현황 13~15행) 기준이다.</p>
 */
public final class MatchingHeuristics {

    private final int labelMinLength;
    private final int shortLabelMax;
    private final int titleLengthThreshold;
    private final int belowScanRows;
    private final Pattern sectionTitlePattern;
    private final Set<String> documentTitles;
    private final double exactConfidence;
    private final double partialConfidence;
    private final double overrideConfidence;
    private final double externalDefaultConfidence;
    private final double consensusStep;
    private final double confidenceFloor;
    private final List<OverrideRule> overrideRules;

    private MatchingHeuristics(Builder b) {
        this.labelMinLength = b.labelMinLength;
        this.shortLabelMax = b.shortLabelMax;
        this.titleLengthThreshold = b.titleLengthThreshold;
        this.belowScanRows = b.belowScanRows;
        this.sectionTitlePattern = b.sectionTitlePattern;
        this.documentTitles = Set.copyOf(b.documentTitles);
        this.exactConfidence = b.exactConfidence;
        this.partialConfidence = b.partialConfidence;
        this.overrideConfidence = b.overrideConfidence;
        this.externalDefaultConfidence = b.externalDefaultConfidence;
        this.consensusStep = b.consensusStep;
        this.confidenceFloor = b.confidenceFloor;
        this.overrideRules = List.copyOf(b.overrideRules);
    }

    public static MatchingHeuristics defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.labelMinLength = labelMinLength;
        b.shortLabelMax = shortLabelMax;
        b.titleLengthThreshold = titleLengthThreshold;
        b.belowScanRows = belowScanRows;
        b.sectionTitlePattern = sectionTitlePattern;
        b.documentTitles = documentTitles;
        b.exactConfidence = exactConfidence;
        b.partialConfidence = partialConfidence;
        b.overrideConfidence = overrideConfidence;
        b.externalDefaultConfidence = externalDefaultConfidence;
        b.consensusStep = consensusStep;
        b.confidenceFloor = confidenceFloor;
        b.overrideRules = overrideRules;
        return b;
    }

    /** 개인이력카드 분기/회차 영역 고정 규칙. */
    public static List<OverrideRule> defaultOverrideRules() {
        List<OverrideRule> rules = new ArrayList<>();

        // 분기별 취업현황: 2/3/4분기 → 열 2/6/11
        int[] quarterCols = {2, 6, 11};
        String[][] quarterFields = {{"취업여부", "18"}, {"취업처", "19"}, {"담당직무", "20"}};
        for (String[] field : quarterFields) {
            for (int q = 2; q <= 4; q++) {
                rules.add(OverrideRule.of(
                        "(?:취업현황[_\\s]*)?" + q + "분기[_\\s]*" + field[0],
                        Integer.parseInt(field[1]), quarterCols[q - 2], q + "분기 " + field[0]));
            }
        }

        // 프로그램 참여현황
        String prefix = "(?:프로그램\\s*참여현황[_\\s]*)?";
        for (int i = 1; i <= 7; i++) {
            rules.add(OverrideRule.of(prefix + "전문가\\s?강연[_\\s]*" + i + "회", 13, 1 + i, "핵심 세미나 " + i + "회"));
        }
        int[] consultingCols = {2, 3, 5};
        for (int i = 1; i <= 3; i++) {
            rules.add(OverrideRule.of(prefix + "전문가\\s?컨설팅[_\\s]*" + i + "회", 14, consultingCols[i - 1], "전문가 컨설팅 " + i + "회"));
        }
        int[] interviewCols = {7, 8, 9, 10, 11, 13};
        for (int i = 1; i <= 6; i++) {
            rules.add(OverrideRule.of(prefix + "실전\\s?모의\\s?면접[_\\s]*" + i + "회", 15, interviewCols[i - 1], "실전모의면접 " + i + "회"));
        }
        return rules;
    }

    public int getLabelMinLength() {
        return labelMinLength;
    }

    public int getShortLabelMax() {
        return shortLabelMax;
    }

    public int getTitleLengthThreshold() {
        return titleLengthThreshold;
    }

    /** 라벨 아래로 몇 행 더 볼지 (라벨 바로 아래 행 + belowScanRows). */
    public int getBelowScanRows() {
        return belowScanRows;
    }

    public Pattern getSectionTitlePattern() {
        return sectionTitlePattern;
    }

    public Set<String> getDocumentTitles() {
        return documentTitles;
    }

    public double getExactConfidence() {
        return exactConfidence;
    }

    public double getPartialConfidence() {
        return partialConfidence;
    }

    public double getOverrideConfidence() {
        return overrideConfidence;
    }

    public double getExternalDefaultConfidence() {
        return externalDefaultConfidence;
    }

    public double getConsensusStep() {
        return consensusStep;
    }

    public double getConfidenceFloor() {
        return confidenceFloor;
    }

    public List<OverrideRule> getOverrideRules() {
        return overrideRules;
    }

    public static final class Builder {

        private int labelMinLength = 2;
        private int shortLabelMax = 15;
        private int titleLengthThreshold = 20;
        private int belowScanRows = 2;
        private Pattern sectionTitlePattern = Pattern.compile("^\\d+\\..*", Pattern.DOTALL);
        private Set<String> documentTitles = Set.of("개인이력카드");
        private double exactConfidence = 0.95;
        private double partialConfidence = 0.85;
        private double overrideConfidence = 0.98;
        private double externalDefaultConfidence = 0.7;
        private double consensusStep = 0.1;
        private double confidenceFloor = 0.5;
        private List<OverrideRule> overrideRules = defaultOverrideRules();

        private Builder() {
        }

        public Builder labelLength(int min, int shortMax) {
            this.labelMinLength = min;
            this.shortLabelMax = shortMax;
            return this;
        }

        public Builder titleLengthThreshold(int v) {
            this.titleLengthThreshold = v;
            return this;
        }

        public Builder belowScanRows(int v) {
            this.belowScanRows = v;
            return this;
        }

        public Builder documentTitles(Set<String> v) {
            this.documentTitles = v;
            return this;
        }

        public Builder confidences(double exact, double partial, double override, double externalDefault) {
            this.exactConfidence = exact;
            this.partialConfidence = partial;
            this.overrideConfidence = override;
            this.externalDefaultConfidence = externalDefault;
            return this;
        }

        public Builder consensusStep(double v) {
            this.consensusStep = v;
            return this;
        }

        public Builder confidenceFloor(double v) {
            this.confidenceFloor = v;
            return this;
        }

        public Builder overrideRules(List<OverrideRule> v) {
            this.overrideRules = v;
            return this;
        }

        public MatchingHeuristics build() {
            checkUnit("exactConfidence", exactConfidence);
            checkUnit("partialConfidence", partialConfidence);
            checkUnit("overrideConfidence", overrideConfidence);
            checkUnit("externalDefaultConfidence", externalDefaultConfidence);
            checkUnit("confidenceFloor", confidenceFloor);
            return new MatchingHeuristics(this);
        }

        private static void checkUnit(String name, double v) {
            if (v < 0.0 || v > 1.0) throw new IllegalArgumentException(name + " must be in [0,1]: " + v);
        }
    }
}
