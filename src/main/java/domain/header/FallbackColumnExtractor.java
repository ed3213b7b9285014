package domain.header;

import domain.grid.Grid;
import domain.grid.GridCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 단일 헤더 행 기반 컬럼 추출 (계층 합성이 실패했을 때만 사용).
 *
 * <p>점수 = 값 개수*2 + 짧은 라벨(2~10자)*3 - 섹션 마커*10. 같은 이름이 여러 번 나오면
 * 바로 위 행의 그룹 헤더를 앞에 붙인다 (예: "2분기_취업여부").</p>
 */
final class FallbackColumnExtractor {

    private static final Logger log = LoggerFactory.getLogger(FallbackColumnExtractor.class);

    private final HeaderHeuristics heuristics;

    FallbackColumnExtractor(HeaderHeuristics heuristics) {
        this.heuristics = heuristics;
    }

    List<HierarchicalColumn> extract(Grid grid) {
        int first = grid.getFirstRow();
        int last = Math.min(grid.getLastRow(), first + heuristics.getFallbackScanRows() - 1);

        int bestRow = -1;
        int bestScore = Integer.MIN_VALUE;
        for (int r = first; r <= last; r++) {
            int nonEmpty = 0;
            int shortLabels = 0;
            int sections = 0;
            for (GridCell c : grid.rowCells(r)) {
                String t = c.getText();
                if (t.isEmpty()) continue;
                nonEmpty++;
                if (t.length() >= 2 && t.length() <= heuristics.getFallbackShortMax()) shortLabels++;
                if (isSectionMarker(t)) sections++;
            }
            if (nonEmpty < heuristics.getMinHeaderCells()) continue;

            int score = nonEmpty * 2 + shortLabels * 3 - sections * 10;
            if (score > bestScore) {
                bestScore = score;
                bestRow = r;
            }
        }

        if (bestRow < 0) {
            log.warn("[HEADER] fallback extraction found no header row");
            return List.of();
        }

        List<GridCell> cells = grid.rowCells(bestRow).stream()
                .filter(c -> !c.isEmpty() && !"undefined".equals(c.getText()))
                .toList();

        Map<String, Integer> counts = new HashMap<>();
        for (GridCell c : cells) counts.merge(c.getText(), 1, Integer::sum);

        int groupRow = bestRow - 1;
        List<HierarchicalColumn> out = new ArrayList<>(cells.size());
        Set<String> seen = new HashSet<>();
        for (GridCell c : cells) {
            String value = c.getText();
            String name = value;

            if (counts.get(value) > 1 && groupRow >= first) {
                GridCell groupCell = grid.anchorOf(groupRow, c.getCol());
                String group = groupCell == null ? "" : groupCell.getText();
                if (!group.isEmpty()) {
                    if (heuristics.getGroupHeaderPattern().matcher(group).matches()) {
                        name = group + "_" + value;
                    } else if (!isSectionMarker(group) && !group.equals(value)) {
                        name = group + "_" + value;
                    }
                }
            }

            name = ColumnNames.unique(name, seen);
            out.add(new HierarchicalColumn(name, c.getCol(), 0));
        }

        log.info("[HEADER] fallback header row={}, score={}, columns={}", bestRow, bestScore, out.size());
        return out;
    }

    private boolean isSectionMarker(String text) {
        return heuristics.getSectionMarkerPattern().matcher(text).matches();
    }
}
