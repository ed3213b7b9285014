package domain.mapping;

import java.util.HashSet;
import java.util.Set;

/**
 * greedy 매칭에서 이미 사용된 컬럼/셀 집합. 불변.
 *
 * <p>{@link #claim(String, CellPosition)} 은 새 ledger 를 돌려준다.</p>
 */
public final class MatchLedger {

    private static final MatchLedger EMPTY = new MatchLedger(Set.of(), Set.of());

    private final Set<String> usedColumns;
    private final Set<CellPosition> usedCells;

    private MatchLedger(Set<String> usedColumns, Set<CellPosition> usedCells) {
        this.usedColumns = usedColumns;
        this.usedCells = usedCells;
    }

    public static MatchLedger empty() {
        return EMPTY;
    }

    public boolean isColumnUsed(String column) {
        return usedColumns.contains(column);
    }

    public boolean isCellUsed(CellPosition cell) {
        return usedCells.contains(cell);
    }

    public MatchLedger claim(String column, CellPosition cell) {
        Set<String> cols = new HashSet<>(usedColumns);
        cols.add(column);
        Set<CellPosition> cells = new HashSet<>(usedCells);
        cells.add(cell);
        return new MatchLedger(Set.copyOf(cols), Set.copyOf(cells));
    }

    public Set<String> getUsedColumns() {
        return usedColumns;
    }

    public Set<CellPosition> getUsedCells() {
        return usedCells;
    }
}
