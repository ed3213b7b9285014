package domain.mapping;

import java.util.Objects;

/** 확정된 매핑. 한 번의 실행 안에서 sourceColumn 과 target 셀은 각각 유일하다. */
public final class FinalMapping {

    private final String sourceColumn;
    private final int targetRow;
    private final int targetCol;

    public FinalMapping(String sourceColumn, int targetRow, int targetCol) {
        this.sourceColumn = Objects.requireNonNull(sourceColumn, "sourceColumn");
        this.targetRow = targetRow;
        this.targetCol = targetCol;
    }

    public String getSourceColumn() {
        return sourceColumn;
    }

    public int getTargetRow() {
        return targetRow;
    }

    public int getTargetCol() {
        return targetCol;
    }

    public CellPosition getTarget() {
        return CellPosition.of(targetRow, targetCol);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FinalMapping that)) return false;
        return targetRow == that.targetRow && targetCol == that.targetCol && sourceColumn.equals(that.sourceColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceColumn, targetRow, targetCol);
    }

    @Override
    public String toString() {
        return "\"" + sourceColumn + "\" -> [" + targetRow + "," + targetCol + "]";
    }
}
