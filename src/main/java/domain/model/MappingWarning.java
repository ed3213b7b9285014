package domain.model;

/**
 * A single warning emitted while mapping columns to template cells.
 *
 * <p>Warnings are not fatal; they describe a fallback or a rejected candidate
 * that operators should review.</p>
 */
public final class MappingWarning {

    private final WarningCode code;
    private final String sourceColumn;
    private final String message;
    private final String detail;

    public MappingWarning(WarningCode code, String sourceColumn, String message, String detail) {
        this.code = code == null ? WarningCode.MATCHER_FAILED : code;
        this.sourceColumn = nullToEmpty(sourceColumn);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static MappingWarning of(WarningCode code, String sourceColumn, String message) {
        return new MappingWarning(code, sourceColumn, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    public String getSourceColumn() {
        return sourceColumn;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
