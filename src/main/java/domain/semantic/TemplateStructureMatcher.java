package domain.semantic;

import domain.grid.Grid;
import domain.grid.GridCell;
import domain.mapping.CandidateOrigin;
import domain.mapping.MappingCandidate;
import domain.mapping.MatchRequest;
import domain.mapping.MatchingHeuristics;

import java.util.Optional;

/**
 * template 표 구조를 외부 추론 서비스에 설명하고, 라벨별 데이터 칸 위치를 받는다.
 *
 * <p>응답에 dataRow/dataCol 이 없으면 라벨 위치에서 규칙 matcher 와 같은 방식으로 데이터 셀을 찾는다.</p>
 */
public final class TemplateStructureMatcher extends AbstractReasoningMatcher {

    public TemplateStructureMatcher(Optional<ReasoningService> service) {
        this(service, new ReasoningResponseParser(), MatchingHeuristics.defaults());
    }

    public TemplateStructureMatcher(
            Optional<ReasoningService> service,
            ReasoningResponseParser parser,
            MatchingHeuristics heuristics
    ) {
        super(service, parser, heuristics);
    }

    @Override
    public CandidateOrigin origin() {
        return CandidateOrigin.TEMPLATE_STRUCTURE;
    }

    @Override
    protected String buildPrompt(MatchRequest request) {
        return """
                HWPX 문서 템플릿의 표 구조를 분석합니다.

                ## 표 구조
                %s
                ## 분석 규칙
                - [라벨] = 색칠된 셀 = 필드명 (예: "성명", "연락처")
                - [라벨] 없음 = 데이터가 들어갈 빈 셀
                - [제목] = 섹션 제목 또는 문서 제목 (무시)

                ## Excel 컬럼
                %s
                ## 작업
                각 Excel 컬럼에 해당하는 라벨을 찾고, 그 라벨 옆/아래의 데이터 셀 위치를 알려주세요.
                해당하는 라벨이 없는 컬럼은 생략하세요.

                JSON 형식으로 응답:
                {
                  "matches": [
                    {"sourceColumn": "컬럼명", "labelText": "라벨텍스트", "labelRow": 행, "labelCol": 열, "dataRow": 행, "dataCol": 열, "confidence": 0.9}
                  ]
                }
                """.formatted(
                PromptSections.tableDescription(request.getTemplate(), policy),
                PromptSections.numberedColumns(request.getColumns()));
    }

    @Override
    protected MappingCandidate toCandidate(ReportedMatch m, MatchRequest request) {
        String column = resolveColumn(m, request.getColumns());
        if (column == null) return null;

        Grid template = request.getTemplate();
        int row;
        int col;
        if (m.hasDataPosition()) {
            row = m.getDataRow();
            col = m.getDataCol();
        } else {
            GridCell label = resolveLabelCell(m, template);
            if (label == null) return null;
            GridCell data = locator.locate(template, label);
            if (data == null) return null;
            row = data.getRow();
            col = data.getCol();
        }

        String label = m.getLabelText();
        return new MappingCandidate(
                column, row, col, label, confidenceOf(m), origin(),
                "추론: \"" + (label == null ? column : label) + "\" 라벨의 데이터 위치 [" + row + "," + col + "]");
    }
}
