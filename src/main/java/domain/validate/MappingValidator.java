package domain.validate;

import domain.grid.Grid;
import domain.grid.GridCell;
import domain.mapping.CellPosition;
import domain.mapping.DataCellLocator;
import domain.mapping.FinalMapping;
import domain.mapping.LabelCellPolicy;
import domain.mapping.LabelText;
import domain.mapping.MatchingHeuristics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 확정 매핑이 필수 필드를 채우는지 검사한다.
 *
 * <p>빠진 필드마다 MISSING 이슈를 만들고, template 에서 그 필드의 데이터 셀과
 * 아직 쓰이지 않은 컬럼을 찾을 수 있으면 제안(suggestion)을 붙인다. 확정 매핑은 건드리지 않는다.</p>
 */
public final class MappingValidator {

    private static final Logger log = LoggerFactory.getLogger(MappingValidator.class);

    private static final int SCORE_EXACT = 100;
    private static final int SCORE_PARTIAL = 70;

    private final List<RequiredField> requiredFields;
    private final LabelCellPolicy policy;
    private final DataCellLocator locator;

    public MappingValidator() {
        this(RequiredField.defaults(), MatchingHeuristics.defaults());
    }

    public MappingValidator(List<RequiredField> requiredFields, MatchingHeuristics heuristics) {
        this.requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        MatchingHeuristics h = heuristics == null ? MatchingHeuristics.defaults() : heuristics;
        this.policy = new LabelCellPolicy(h);
        this.locator = new DataCellLocator(policy, h.getBelowScanRows());
    }

    public ValidationResult validate(List<FinalMapping> mappings, List<String> columns, Grid template) {
        Set<String> mappedColumns = new HashSet<>();
        Set<CellPosition> claimedCells = new HashSet<>();
        for (FinalMapping m : mappings) {
            mappedColumns.add(m.getSourceColumn());
            claimedCells.add(m.getTarget());
        }

        List<GridCell> labels = policy.headerLabels(template);
        List<ValidationIssue> issues = new ArrayList<>();
        List<FinalMapping> suggestions = new ArrayList<>();
        int mappedCount = 0;

        for (RequiredField field : requiredFields) {
            List<String> names = field.allNames().stream().map(LabelText::normalize).toList();

            if (isMapped(names, mappedColumns)) {
                mappedCount++;
                continue;
            }

            GridCell dataCell = findDataCell(template, labels, names);
            String suggested = suggestColumn(names, columns, mappedColumns);

            int row = dataCell == null ? ValidationIssue.NO_POSITION : dataCell.getRow();
            int col = dataCell == null ? ValidationIssue.NO_POSITION : dataCell.getCol();
            issues.add(new ValidationIssue(
                    IssueKind.MISSING,
                    field.getName(),
                    "\"" + field.getName() + "\" 필드가 매핑되지 않았습니다.",
                    row, col,
                    suggested));

            if (dataCell != null && suggested != null && !claimedCells.contains(CellPosition.of(row, col))) {
                suggestions.add(new FinalMapping(suggested, row, col));
                log.debug("[VALIDATE] suggest \"{}\" -> [{},{}] for {}", suggested, row, col, field.getName());
            }
        }

        log.info("[VALIDATE] required={}, mapped={}, missing={}, suggestions={}",
                requiredFields.size(), mappedCount, requiredFields.size() - mappedCount, suggestions.size());
        return new ValidationResult(requiredFields.size(), mappedCount, issues, suggestions);
    }

    private static boolean isMapped(List<String> names, Set<String> mappedColumns) {
        for (String column : mappedColumns) {
            String nc = LabelText.normalize(column);
            if (nc.isEmpty()) continue;
            for (String n : names) {
                if (n.isEmpty()) continue;
                if (nc.equals(n) || nc.contains(n) || n.contains(nc)) return true;
            }
        }
        return false;
    }

    private GridCell findDataCell(Grid template, List<GridCell> labels, List<String> names) {
        for (GridCell label : labels) {
            if (names.contains(LabelText.normalize(label.getText()))) {
                return locator.locate(template, label);
            }
        }
        return null;
    }

    /** 아직 매핑되지 않은 컬럼 중 별칭과 가장 잘 맞는 것. 없으면 null. */
    private static String suggestColumn(List<String> names, List<String> columns, Set<String> mappedColumns) {
        String best = null;
        int bestScore = 0;
        for (String column : columns) {
            if (mappedColumns.contains(column)) continue;
            String nc = LabelText.normalize(column);
            if (nc.isEmpty()) continue;

            int score = 0;
            for (String n : names) {
                if (n.isEmpty()) continue;
                if (nc.equals(n)) {
                    score = SCORE_EXACT;
                    break;
                }
                if (nc.contains(n) || n.contains(nc)) score = Math.max(score, SCORE_PARTIAL);
            }
            if (score > bestScore) {
                bestScore = score;
                best = column;
            }
        }
        return best;
    }
}
