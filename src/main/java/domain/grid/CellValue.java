package domain.grid;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 원본 셀 값 (tagged union).
 *
 * <p>reader 는 라이브러리 고유 타입을 이 값으로 바꾸고, 그리드에는 {@link #toText()} 결과만 들어간다.</p>
 */
public final class CellValue {

    public enum Kind {
        EMPTY,
        PLAIN,
        RICH_TEXT,
        FORMULA_RESULT,
        DATE
    }

    private static final CellValue EMPTY = new CellValue(Kind.EMPTY, null, List.of(), null);

    private final Kind kind;
    private final Object scalar;
    private final List<String> runs;
    private final LocalDate date;

    private CellValue(Kind kind, Object scalar, List<String> runs, LocalDate date) {
        this.kind = kind;
        this.scalar = scalar;
        this.runs = runs;
        this.date = date;
    }

    public static CellValue empty() {
        return EMPTY;
    }

    /** 문자열, 숫자, boolean. null 이면 EMPTY. */
    public static CellValue plain(Object value) {
        if (value == null) return EMPTY;
        return new CellValue(Kind.PLAIN, value, List.of(), null);
    }

    public static CellValue richText(List<String> runs) {
        if (runs == null || runs.isEmpty()) return EMPTY;
        return new CellValue(Kind.RICH_TEXT, null, List.copyOf(runs), null);
    }

    /** 수식의 캐시된 결과. 결과가 날짜면 {@link LocalDate} 를 넘긴다. */
    public static CellValue formulaResult(Object cached) {
        if (cached == null) return EMPTY;
        return new CellValue(Kind.FORMULA_RESULT, cached, List.of(), null);
    }

    public static CellValue date(LocalDate date) {
        if (date == null) return EMPTY;
        return new CellValue(Kind.DATE, null, List.of(), date);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 셀 값을 텍스트로 변환 (trim).
     * <ul>
     *   <li>rich text: run 들을 이어 붙임</li>
     *   <li>formula: 캐시 값 기준</li>
     *   <li>date: YYYY-MM-DD</li>
     *   <li>정수인 숫자: 소수부 없이 (3.0 -> "3")</li>
     * </ul>
     */
    public String toText() {
        String s = switch (kind) {
            case EMPTY -> "";
            case PLAIN, FORMULA_RESULT -> scalarText(scalar);
            case RICH_TEXT -> String.join("", runs);
            case DATE -> date.toString();
        };
        return s.trim();
    }

    private static String scalarText(Object v) {
        if (v == null) return "";
        if (v instanceof LocalDate d) return d.toString();
        if (v instanceof LocalDateTime dt) return dt.toLocalDate().toString();
        if (v instanceof Double d) return numberText(d);
        if (v instanceof Float f) return numberText(f.doubleValue());
        if (v instanceof BigDecimal bd) return bd.stripTrailingZeros().toPlainString();
        return String.valueOf(v);
    }

    private static String numberText(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return String.valueOf(d);
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return String.valueOf((long) d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return kind + "(" + toText() + ")";
    }
}
