package domain.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 도메인 힌트 (선택). 컬럼 의미 분석 프롬프트에만 쓰인다.
 *
 * <p>예: "수료여부" 는 "프로그램 이수 여부" 와 같은 뜻, 여러 컬럼을 합쳐 한 칸에 넣는 규칙 등.</p>
 */
public final class MappingContext {

    private static final MappingContext EMPTY = new MappingContext("", List.of(), Map.of(), List.of());

    private final String description;
    private final List<FieldRelation> fieldRelations;
    private final Map<String, List<String>> synonyms;
    private final List<SpecialRule> specialRules;

    public MappingContext(
            String description,
            List<FieldRelation> fieldRelations,
            Map<String, List<String>> synonyms,
            List<SpecialRule> specialRules
    ) {
        this.description = description == null ? "" : description;
        this.fieldRelations = fieldRelations == null ? List.of() : List.copyOf(fieldRelations);
        Map<String, List<String>> syn = new LinkedHashMap<>();
        if (synonyms != null) synonyms.forEach((k, v) -> syn.put(k, v == null ? List.of() : List.copyOf(v)));
        this.synonyms = Collections.unmodifiableMap(syn);
        this.specialRules = specialRules == null ? List.of() : List.copyOf(specialRules);
    }

    public static MappingContext empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return description.isBlank() && fieldRelations.isEmpty() && synonyms.isEmpty() && specialRules.isEmpty();
    }

    public String getDescription() {
        return description;
    }

    public List<FieldRelation> getFieldRelations() {
        return fieldRelations;
    }

    public Map<String, List<String>> getSynonyms() {
        return synonyms;
    }

    public List<SpecialRule> getSpecialRules() {
        return specialRules;
    }

    public enum MergeStrategy {
        CONCAT, FIRST, ALL
    }

    /** targetField 하나에 여러 sourceFields 가 들어가는 관계. */
    public static final class FieldRelation {

        private final String targetField;
        private final List<String> sourceFields;
        private final MergeStrategy mergeStrategy;
        private final String description;

        public FieldRelation(String targetField, List<String> sourceFields, MergeStrategy mergeStrategy, String description) {
            this.targetField = targetField == null ? "" : targetField;
            this.sourceFields = sourceFields == null ? List.of() : List.copyOf(sourceFields);
            this.mergeStrategy = mergeStrategy;
            this.description = description == null ? "" : description;
        }

        public String getTargetField() {
            return targetField;
        }

        public List<String> getSourceFields() {
            return sourceFields;
        }

        /** null 가능. */
        public MergeStrategy getMergeStrategy() {
            return mergeStrategy;
        }

        public String getDescription() {
            return description;
        }
    }

    public static final class SpecialRule {

        private final String condition;
        private final String action;

        public SpecialRule(String condition, String action) {
            this.condition = condition == null ? "" : condition;
            this.action = action == null ? "" : action;
        }

        public String getCondition() {
            return condition;
        }

        public String getAction() {
            return action;
        }
    }
}
