package domain.header;

/** 헤더 행에 anchor 가 있는 병합 영역. 좌표는 inclusive. */
public final class MergeSpan {

    private final int startRow;
    private final int endRow;
    private final int startCol;
    private final int endCol;
    private final String text;

    public MergeSpan(int startRow, int endRow, int startCol, int endCol, String text) {
        if (endRow < startRow || endCol < startCol) {
            throw new IllegalArgumentException("invalid merge range: rows " + startRow + ".." + endRow
                    + ", cols " + startCol + ".." + endCol);
        }
        this.startRow = startRow;
        this.endRow = endRow;
        this.startCol = startCol;
        this.endCol = endCol;
        this.text = text == null ? "" : text;
    }

    public int getStartRow() {
        return startRow;
    }

    public int getEndRow() {
        return endRow;
    }

    public int getStartCol() {
        return startCol;
    }

    public int getEndCol() {
        return endCol;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "MergeSpan{" + startRow + ":" + startCol + "-" + endRow + ":" + endCol + " \"" + text + "\"}";
    }
}
