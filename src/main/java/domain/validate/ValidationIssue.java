package domain.validate;

/**
 * 검증 이슈.
 *
 * <p>targetRow/targetCol 은 template 에서 찾은 데이터 셀 위치 (못 찾으면 -1),
 * suggestedColumn 은 제안 컬럼 (없으면 "").</p>
 */
public final class ValidationIssue {

    public static final int NO_POSITION = -1;

    private final IssueKind kind;
    private final String field;
    private final String message;
    private final int targetRow;
    private final int targetCol;
    private final String suggestedColumn;

    public ValidationIssue(IssueKind kind, String field, String message, int targetRow, int targetCol, String suggestedColumn) {
        this.kind = kind == null ? IssueKind.WARNING : kind;
        this.field = field == null ? "" : field;
        this.message = message == null ? "" : message;
        this.targetRow = targetRow;
        this.targetCol = targetCol;
        this.suggestedColumn = suggestedColumn == null ? "" : suggestedColumn;
    }

    public static ValidationIssue missing(String field, String message) {
        return new ValidationIssue(IssueKind.MISSING, field, message, NO_POSITION, NO_POSITION, "");
    }

    public IssueKind getKind() {
        return kind;
    }

    public String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }

    public int getTargetRow() {
        return targetRow;
    }

    public int getTargetCol() {
        return targetCol;
    }

    public boolean hasTarget() {
        return targetRow != NO_POSITION && targetCol != NO_POSITION;
    }

    public String getSuggestedColumn() {
        return suggestedColumn;
    }

    public boolean hasSuggestion() {
        return !suggestedColumn.isEmpty();
    }

    @Override
    public String toString() {
        return kind + " " + field + ": " + message;
    }
}
