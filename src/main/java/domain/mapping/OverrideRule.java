package domain.mapping;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 컬럼명 패턴 → 고정 template 셀.
 *
 * <p>라벨/데이터 인접 규칙으로는 찾을 수 없는 격자형 영역(분기별 취업현황, 회차별 참여현황)에 쓴다.</p>
 */
public final class OverrideRule {

    private final Pattern sourceColumnPattern;
    private final int targetRow;
    private final int targetCol;
    private final String label;

    public OverrideRule(Pattern sourceColumnPattern, int targetRow, int targetCol, String label) {
        this.sourceColumnPattern = Objects.requireNonNull(sourceColumnPattern, "sourceColumnPattern");
        this.targetRow = targetRow;
        this.targetCol = targetCol;
        this.label = label == null ? "" : label;
    }

    /** 대소문자 무시, 부분 일치. */
    public static OverrideRule of(String regex, int targetRow, int targetCol, String label) {
        return new OverrideRule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), targetRow, targetCol, label);
    }

    public boolean matches(String sourceColumn) {
        return sourceColumn != null && sourceColumnPattern.matcher(sourceColumn).find();
    }

    public Pattern getSourceColumnPattern() {
        return sourceColumnPattern;
    }

    public int getTargetRow() {
        return targetRow;
    }

    public int getTargetCol() {
        return targetCol;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return sourceColumnPattern.pattern() + " -> [" + targetRow + "," + targetCol + "]";
    }
}
