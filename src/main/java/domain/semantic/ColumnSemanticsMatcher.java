package domain.semantic;

import domain.grid.GridCell;
import domain.mapping.CandidateOrigin;
import domain.mapping.MappingCandidate;
import domain.mapping.MatchRequest;
import domain.mapping.MatchingHeuristics;

import java.util.List;
import java.util.Optional;

/**
 * 컬럼명의 의미를 template 라벨과 맞춘다 ("핸드폰" = "연락처", "이름" = "성명").
 *
 * <p>도메인 컨텍스트(필드 관계, 동의어, 특수 규칙)가 있으면 프롬프트에 넣는다.
 * 응답은 라벨 위치만 주므로 데이터 셀은 라벨에서 찾는다.</p>
 */
public final class ColumnSemanticsMatcher extends AbstractReasoningMatcher {

    public ColumnSemanticsMatcher(Optional<ReasoningService> service) {
        this(service, new ReasoningResponseParser(), MatchingHeuristics.defaults());
    }

    public ColumnSemanticsMatcher(
            Optional<ReasoningService> service,
            ReasoningResponseParser parser,
            MatchingHeuristics heuristics
    ) {
        super(service, parser, heuristics);
    }

    @Override
    public CandidateOrigin origin() {
        return CandidateOrigin.COLUMN_SEMANTICS;
    }

    @Override
    protected String buildPrompt(MatchRequest request) {
        List<GridCell> labels = policy.headerLabels(request.getTemplate());
        StringBuilder labelList = new StringBuilder();
        for (int i = 0; i < labels.size(); i++) {
            GridCell l = labels.get(i);
            labelList.append(i + 1).append(". \"").append(l.getText())
                    .append("\" (위치: ").append(l.getRow()).append(", ").append(l.getCol()).append(")\n");
        }

        String relationHint = request.getContext().getFieldRelations().isEmpty() ? "" : """

                중요: 도메인 컨텍스트의 필드 관계를 반드시 우선 적용하세요.
                여러 Excel 컬럼이 한 템플릿 필드에 대응하면 각 컬럼을 모두 그 라벨에 매핑하세요.
                """;

        return """
                Excel 컬럼과 HWPX 라벨을 시맨틱 매칭합니다.

                ## Excel 컬럼
                %s
                ## HWPX 라벨
                %s%s
                ## 작업
                같은 의미의 Excel 컬럼-HWPX 라벨 쌍을 찾아주세요.
                예: "핸드폰" = "연락처", "이름" = "성명"
                %s
                JSON 형식:
                {
                  "matches": [
                    {"sourceColumn": "컬럼명", "labelText": "라벨텍스트", "labelRow": 행, "labelCol": 열, "confidence": 0.8}
                  ]
                }
                """.formatted(
                PromptSections.numberedColumns(request.getColumns()),
                labelList,
                PromptSections.contextSection(request.getContext()),
                relationHint);
    }

    @Override
    protected MappingCandidate toCandidate(ReportedMatch m, MatchRequest request) {
        String column = resolveColumn(m, request.getColumns());
        if (column == null) return null;

        GridCell label = resolveLabelCell(m, request.getTemplate());
        if (label == null) return null;
        GridCell data = locator.locate(request.getTemplate(), label);
        if (data == null) return null;

        return new MappingCandidate(
                column, data.getRow(), data.getCol(), label.getText(), confidenceOf(m), origin(),
                "의미 매칭: \"" + column + "\" ≈ \"" + label.getText() + "\" → 데이터 셀 [" + data.getRow() + "," + data.getCol() + "]");
    }
}
