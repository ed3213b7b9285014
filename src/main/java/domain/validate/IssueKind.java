package domain.validate;

public enum IssueKind {
    MISSING,
    WARNING,
    INFO
}
