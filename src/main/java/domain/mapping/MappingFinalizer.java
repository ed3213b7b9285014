package domain.mapping;

import domain.grid.Grid;
import domain.model.MappingWarning;
import domain.model.WarningCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 신뢰도 내림차순으로 후보를 받아들이며 불변식을 강제한다.
 *
 * <ul>
 *   <li>한 셀에는 한 컬럼만</li>
 *   <li>한 컬럼은 한 셀에만</li>
 *   <li>template 범위 안</li>
 *   <li>신뢰도 &gt;= floor</li>
 * </ul>
 * 위반은 issue 로 남기고 계속 진행한다.
 */
public final class MappingFinalizer {

    private static final Logger log = LoggerFactory.getLogger(MappingFinalizer.class);

    private final double confidenceFloor;

    public MappingFinalizer() {
        this(MatchingHeuristics.defaults().getConfidenceFloor());
    }

    public MappingFinalizer(double confidenceFloor) {
        this.confidenceFloor = confidenceFloor;
    }

    public FinalizeResult finalizeMappings(List<MappingCandidate> merged, Grid template) {
        List<MappingCandidate> sorted = new ArrayList<>(merged);
        // List.sort 는 stable
        sorted.sort(Comparator.comparingDouble(MappingCandidate::getConfidence).reversed());

        Set<CellPosition> usedCells = new HashSet<>();
        Set<String> usedColumns = new HashSet<>();
        List<FinalMapping> accepted = new ArrayList<>();
        List<MappingWarning> rejected = new ArrayList<>();

        for (MappingCandidate c : sorted) {
            String col = c.getSourceColumn();
            CellPosition cell = c.getTarget();

            if (usedCells.contains(cell)) {
                rejected.add(reject(WarningCode.DUPLICATE_CELL, c,
                        "셀 중복: \"" + col + "\" → " + cell + " (이미 다른 컬럼이 사용)"));
                continue;
            }
            if (usedColumns.contains(col)) {
                rejected.add(reject(WarningCode.DUPLICATE_COLUMN, c,
                        "컬럼 중복: \"" + col + "\" → " + cell + " (이미 매핑됨)"));
                continue;
            }
            if (!template.contains(cell.getRow(), cell.getCol())) {
                rejected.add(reject(WarningCode.OUT_OF_RANGE, c,
                        "범위 초과: \"" + col + "\" → " + cell
                                + " (rows=" + template.getRowCount() + ", cols=" + template.getColCount() + ")"));
                continue;
            }
            if (c.getConfidence() < confidenceFloor) {
                rejected.add(reject(WarningCode.LOW_CONFIDENCE, c,
                        "낮은 신뢰도: \"" + col + "\" (" + String.format("%.2f", c.getConfidence()) + ")"));
                continue;
            }

            usedCells.add(cell);
            usedColumns.add(col);
            accepted.add(new FinalMapping(col, cell.getRow(), cell.getCol()));
        }

        log.info("[FINALIZE] accepted={}, rejected={}", accepted.size(), rejected.size());
        return new FinalizeResult(accepted, rejected);
    }

    private static MappingWarning reject(WarningCode code, MappingCandidate c, String message) {
        log.debug("[FINALIZE] {}", message);
        return new MappingWarning(code, c.getSourceColumn(), message, c.getOrigin().code() + ": " + c.getReason());
    }
}
