package domain.mapping;

import domain.grid.Grid;
import domain.grid.GridCell;

import java.util.Comparator;

/**
 * 라벨 셀에 대응하는 데이터 셀 찾기.
 *
 * <ol>
 *   <li>같은 행, 라벨 colSpan 오른쪽: 가장 가까운 non-header 셀 (header 셀은 건너뜀)</li>
 *   <li>없으면 같은 열, 라벨 rowSpan 아래 (belowScanRows 만큼 더): 가장 가까운 non-header 셀</li>
 * </ol>
 * 섹션/제목 셀은 어느 쪽에서도 데이터 셀이 아니다.
 */
public final class DataCellLocator {

    private final LabelCellPolicy policy;
    private final int belowScanRows;

    public DataCellLocator(LabelCellPolicy policy, int belowScanRows) {
        this.policy = policy;
        this.belowScanRows = belowScanRows;
    }

    public DataCellLocator(MatchingHeuristics heuristics) {
        this(new LabelCellPolicy(heuristics), heuristics.getBelowScanRows());
    }

    /** @return 데이터 셀, 없으면 null */
    public GridCell locate(Grid template, GridCell label) {
        int labelEndCol = label.getEndCol();
        GridCell right = template.rowCells(label.getRow()).stream()
                .filter(c -> c.getCol() > labelEndCol)
                .sorted(Comparator.comparingInt(GridCell::getCol))
                .filter(policy::isDataCandidate)
                .findFirst()
                .orElse(null);
        if (right != null) return right;

        int startRow = label.getRow() + label.getRowSpan();
        for (int r = startRow; r <= startRow + belowScanRows; r++) {
            GridCell below = template.cellAt(r, label.getCol());
            if (below != null && policy.isDataCandidate(below)) return below;
        }
        return null;
    }
}
