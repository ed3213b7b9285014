package domain.semantic;

import domain.grid.Grid;
import domain.grid.GridCell;
import domain.mapping.LabelCellPolicy;
import domain.mapping.MappingContext;

import java.util.List;
import java.util.Map;

/** 프롬프트 공통 조각. */
final class PromptSections {

    static final int MAX_TABLE_ROWS = 25;

    private PromptSections() {
    }

    /** (r,c): "text" [라벨] 형식, 앞쪽 MAX_TABLE_ROWS 행. 섹션/문서 제목은 [제목]. */
    static String tableDescription(Grid template, LabelCellPolicy policy) {
        StringBuilder sb = new StringBuilder();
        int lastRow = Math.min(template.getLastRow(), template.getFirstRow() + MAX_TABLE_ROWS - 1);
        for (int r = template.getFirstRow(); r <= lastRow; r++) {
            List<GridCell> cells = template.rowCells(r);
            if (cells.isEmpty()) continue;
            sb.append("행 ").append(r).append(": ");
            for (int i = 0; i < cells.size(); i++) {
                GridCell c = cells.get(i);
                if (i > 0) sb.append(", ");
                sb.append('(').append(c.getRow()).append(',').append(c.getCol()).append("): \"")
                        .append(c.getText()).append('"');
                if (c.getColSpan() > 1) sb.append(" colSpan=").append(c.getColSpan());
                if (c.getRowSpan() > 1) sb.append(" rowSpan=").append(c.getRowSpan());
                if (policy.isSectionOrTitle(c.getText()) && !c.isEmpty()) {
                    sb.append(" [제목]");
                } else if (c.isHeader()) {
                    sb.append(" [라벨]");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    static String numberedColumns(List<String> columns) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < columns.size(); i++) {
            sb.append(i + 1).append(". \"").append(columns.get(i)).append("\"\n");
        }
        return sb.toString();
    }

    /** 컨텍스트가 비어 있으면 "". */
    static String contextSection(MappingContext context) {
        if (context == null || context.isEmpty()) return "";

        StringBuilder sb = new StringBuilder("\n## 도메인 컨텍스트 (매핑 시 반드시 참고)\n");
        if (!context.getDescription().isBlank()) {
            sb.append("### 설명\n").append(context.getDescription()).append("\n\n");
        }
        if (!context.getFieldRelations().isEmpty()) {
            sb.append("### 필드 관계\n");
            for (MappingContext.FieldRelation rel : context.getFieldRelations()) {
                sb.append("- \"").append(rel.getTargetField()).append("\" (템플릿 필드) = ");
                List<String> sources = rel.getSourceFields();
                for (int i = 0; i < sources.size(); i++) {
                    if (i > 0) sb.append(" + ");
                    sb.append('"').append(sources.get(i)).append('"');
                }
                sb.append(" (Excel 컬럼들)\n");
                if (!rel.getDescription().isBlank()) {
                    sb.append("  설명: ").append(rel.getDescription()).append('\n');
                }
                if (rel.getMergeStrategy() != null) {
                    sb.append("  병합 전략: ").append(switch (rel.getMergeStrategy()) {
                        case CONCAT -> "연결";
                        case ALL -> "모두 매핑";
                        case FIRST -> "첫번째만";
                    }).append('\n');
                }
            }
            sb.append('\n');
        }
        if (!context.getSynonyms().isEmpty()) {
            sb.append("### 동의어/대체 용어\n");
            for (Map.Entry<String, List<String>> e : context.getSynonyms().entrySet()) {
                sb.append("- \"").append(e.getKey()).append("\" = ");
                List<String> values = e.getValue();
                for (int i = 0; i < values.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append('"').append(values.get(i)).append('"');
                }
                sb.append('\n');
            }
            sb.append('\n');
        }
        if (!context.getSpecialRules().isEmpty()) {
            sb.append("### 특수 규칙\n");
            for (MappingContext.SpecialRule rule : context.getSpecialRules()) {
                sb.append("- 조건: ").append(rule.getCondition()).append("\n  작업: ").append(rule.getAction()).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
