package domain.mapping;

/** 후보를 만든 matcher. */
public enum CandidateOrigin {

    /** 라벨/데이터 인접 규칙. */
    RULE("rule"),

    /** 외부 추론: template 구조 분석. */
    TEMPLATE_STRUCTURE("external_a"),

    /** 외부 추론: 컬럼 의미 분석. */
    COLUMN_SEMANTICS("external_b");

    private final String code;

    CandidateOrigin(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
