package domain.grid;

import java.util.Objects;

/**
 * 그리드의 한 셀 (primary position 기준).
 *
 * <p>rowSpan/colSpan 이 1보다 크면 (row, col) 을 좌상단으로 하는 사각형 전체를 차지한다.
 * 덮인 위치는 별도 셀로 존재하지 않는다.</p>
 */
public final class GridCell {

    private final int row;
    private final int col;
    private final String text;
    private final boolean header;
    private final int rowSpan;
    private final int colSpan;

    public GridCell(int row, int col, String text, boolean header, int rowSpan, int colSpan) {
        if (rowSpan < 1 || colSpan < 1) {
            throw new IllegalArgumentException("span must be >= 1: rowSpan=" + rowSpan + ", colSpan=" + colSpan);
        }
        this.row = row;
        this.col = col;
        this.text = text == null ? "" : text.trim();
        this.header = header;
        this.rowSpan = rowSpan;
        this.colSpan = colSpan;
    }

    public static GridCell of(int row, int col, String text) {
        return new GridCell(row, col, text, false, 1, 1);
    }

    public static GridCell header(int row, int col, String text) {
        return new GridCell(row, col, text, true, 1, 1);
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public String getText() {
        return text;
    }

    public boolean isHeader() {
        return header;
    }

    public int getRowSpan() {
        return rowSpan;
    }

    public int getColSpan() {
        return colSpan;
    }

    /** 마지막으로 덮는 행 (inclusive). */
    public int getEndRow() {
        return row + rowSpan - 1;
    }

    /** 마지막으로 덮는 열 (inclusive). */
    public int getEndCol() {
        return col + colSpan - 1;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public boolean isMerged() {
        return rowSpan > 1 || colSpan > 1;
    }

    public boolean covers(int r, int c) {
        return r >= row && r <= getEndRow() && c >= col && c <= getEndCol();
    }

    public GridCell withHeader(boolean header) {
        if (this.header == header) return this;
        return new GridCell(row, col, text, header, rowSpan, colSpan);
    }

    public String key() {
        return row + "-" + col;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridCell)) return false;
        GridCell that = (GridCell) o;
        return row == that.row && col == that.col && header == that.header
                && rowSpan == that.rowSpan && colSpan == that.colSpan
                && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col, text, header, rowSpan, colSpan);
    }

    @Override
    public String toString() {
        return "[" + row + "," + col + "] \"" + text + "\"" + (header ? " H" : "")
                + (isMerged() ? " span=" + rowSpan + "x" + colSpan : "");
    }
}
