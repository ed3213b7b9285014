package domain.grid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 정규화된 2차원 그리드 (spreadsheet / template 공용).
 *
 * <p>생성 이후 불변. span 으로 덮인 위치는 독립적으로 주소 지정되지 않는다:
 * {@link #cellAt(int, int)} 는 primary 위치에서만 셀을 돌려주고,
 * 덮인 위치의 소유 셀은 {@link #anchorOf(int, int)} 로 찾는다.</p>
 *
 * <p>origin 은 첫 행/열 번호다. spreadsheet 는 1, template 은 0.</p>
 */
public final class Grid {

    private static final Logger log = LoggerFactory.getLogger(Grid.class);

    private final int origin;
    private final int rowCount;
    private final int colCount;
    private final List<GridCell> cells;
    private final Map<Long, GridCell> primary;
    private final Map<Integer, List<GridCell>> byRow;

    private Grid(int origin, int rowCount, int colCount, List<GridCell> cells) {
        this.origin = origin;
        this.rowCount = rowCount;
        this.colCount = colCount;
        this.cells = Collections.unmodifiableList(cells);

        Map<Long, GridCell> p = new HashMap<>(Math.max(16, cells.size() * 2));
        Map<Integer, List<GridCell>> rows = new HashMap<>();
        for (GridCell c : cells) {
            p.put(pos(c.getRow(), c.getCol()), c);
            rows.computeIfAbsent(c.getRow(), k -> new ArrayList<>()).add(c);
        }
        rows.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.primary = p;
        this.byRow = rows;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Grid empty(int origin) {
        return new Grid(origin, 0, 0, new ArrayList<>());
    }

    private static long pos(int r, int c) {
        return (((long) r) << 32) | (c & 0xffffffffL);
    }

    public int getOrigin() {
        return origin;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColCount() {
        return colCount;
    }

    public int getFirstRow() {
        return origin;
    }

    /** inclusive */
    public int getLastRow() {
        return origin + rowCount - 1;
    }

    public int getFirstCol() {
        return origin;
    }

    /** inclusive */
    public int getLastCol() {
        return origin + colCount - 1;
    }

    public boolean contains(int r, int c) {
        return r >= origin && r < origin + rowCount && c >= origin && c < origin + colCount;
    }

    /** primary 셀들. 행, 열 순서. */
    public List<GridCell> getCells() {
        return cells;
    }

    /** primary 위치의 셀. 빈 위치나 span 으로 덮인 위치는 null. */
    public GridCell cellAt(int r, int c) {
        return primary.get(pos(r, c));
    }

    /** (r, c) 를 차지하는 셀 (primary 또는 span 의 소유 셀). */
    public GridCell anchorOf(int r, int c) {
        GridCell direct = cellAt(r, c);
        if (direct != null) return direct;
        for (GridCell cell : cells) {
            if (cell.isMerged() && cell.covers(r, c)) return cell;
        }
        return null;
    }

    /** primary 위치의 trim 된 텍스트. 없으면 "". */
    public String text(int r, int c) {
        GridCell cell = cellAt(r, c);
        return cell == null ? "" : cell.getText();
    }

    /** 해당 행의 primary 셀들 (열 순서). */
    public List<GridCell> rowCells(int r) {
        List<GridCell> l = byRow.get(r);
        return l == null ? List.of() : l;
    }

    /** 해당 행의 비어있지 않은 셀 수. */
    public int nonEmptyCount(int r) {
        int n = 0;
        for (GridCell c : rowCells(r)) {
            if (!c.isEmpty()) n++;
        }
        return n;
    }

    public List<GridCell> mergedCells() {
        return cells.stream().filter(GridCell::isMerged).toList();
    }

    @Override
    public String toString() {
        return "Grid{origin=" + origin + ", rows=" + rowCount + ", cols=" + colCount + ", cells=" + cells.size() + "}";
    }

    public static final class Builder {

        private int origin = 0;
        private int rowCount = -1;
        private int colCount = -1;
        private final List<GridCell> cells = new ArrayList<>();

        private Builder() {
        }

        public Builder origin(int origin) {
            this.origin = origin;
            return this;
        }

        /** 선언 크기. 생략하면 셀 범위에서 계산한다. */
        public Builder size(int rowCount, int colCount) {
            this.rowCount = rowCount;
            this.colCount = colCount;
            return this;
        }

        public Builder add(GridCell cell) {
            if (cell != null) cells.add(cell);
            return this;
        }

        public Builder addAll(List<GridCell> list) {
            if (list != null) list.forEach(this::add);
            return this;
        }

        /**
         * 정렬 후 span 으로 덮인 위치의 셀을 버린다.
         * 같은 primary 위치가 두 번 들어오면 IllegalArgumentException.
         */
        public Grid build() {
            List<GridCell> sorted = new ArrayList<>(cells);
            sorted.sort(Comparator.comparingInt(GridCell::getRow).thenComparingInt(GridCell::getCol));

            Map<Long, GridCell> seen = new HashMap<>();
            for (GridCell c : sorted) {
                GridCell prev = seen.put(pos(c.getRow(), c.getCol()), c);
                if (prev != null) {
                    throw new IllegalArgumentException("duplicate cell position: " + c.key());
                }
            }

            List<GridCell> kept = new ArrayList<>(sorted.size());
            List<GridCell> merged = sorted.stream().filter(GridCell::isMerged).toList();
            for (GridCell c : sorted) {
                boolean covered = false;
                for (GridCell m : merged) {
                    if (m != c && m.covers(c.getRow(), c.getCol())) {
                        covered = true;
                        break;
                    }
                }
                if (covered) {
                    log.debug("[GRID] dropping covered cell {}", c);
                    continue;
                }
                kept.add(c);
            }

            int rows = rowCount;
            int cols = colCount;
            if (rows < 0 || cols < 0) {
                int maxRow = origin - 1;
                int maxCol = origin - 1;
                for (GridCell c : kept) {
                    maxRow = Math.max(maxRow, c.getEndRow());
                    maxCol = Math.max(maxCol, c.getEndCol());
                }
                if (rows < 0) rows = maxRow - origin + 1;
                if (cols < 0) cols = maxCol - origin + 1;
            }
            return new Grid(origin, rows, cols, kept);
        }
    }
}
