package domain.validate;

import domain.mapping.FinalMapping;

import java.util.List;

/** 필수 필드 검증 결과. suggestions 는 권고일 뿐 확정 매핑에 반영되지 않는다. */
public final class ValidationResult {

    private final int totalRequiredFields;
    private final int mappedFields;
    private final List<ValidationIssue> issues;
    private final List<FinalMapping> suggestions;

    public ValidationResult(int totalRequiredFields, int mappedFields, List<ValidationIssue> issues, List<FinalMapping> suggestions) {
        this.totalRequiredFields = totalRequiredFields;
        this.mappedFields = mappedFields;
        this.issues = List.copyOf(issues);
        this.suggestions = List.copyOf(suggestions);
    }

    /** MISSING 이슈가 없을 때만 true. */
    public boolean isValid() {
        return issues.stream().noneMatch(i -> i.getKind() == IssueKind.MISSING);
    }

    public int getTotalRequiredFields() {
        return totalRequiredFields;
    }

    public int getMappedFields() {
        return mappedFields;
    }

    public int getMissingFields() {
        return totalRequiredFields - mappedFields;
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    public List<FinalMapping> getSuggestions() {
        return suggestions;
    }
}
