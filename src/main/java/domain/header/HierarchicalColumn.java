package domain.header;

import java.util.Objects;

/**
 * 헤더 행들을 합성한 컬럼.
 *
 * <p>name 은 결과 안에서 유일하다. depth 는 headerRows 안에서 main header 행의 위치.</p>
 */
public final class HierarchicalColumn {

    private final String name;
    private final int sourceColIndex;
    private final int depth;

    public HierarchicalColumn(String name, int sourceColIndex, int depth) {
        this.name = Objects.requireNonNull(name, "name");
        this.sourceColIndex = sourceColIndex;
        this.depth = depth;
    }

    public String getName() {
        return name;
    }

    public int getSourceColIndex() {
        return sourceColIndex;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HierarchicalColumn that)) return false;
        return sourceColIndex == that.sourceColIndex && depth == that.depth && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sourceColIndex, depth);
    }

    @Override
    public String toString() {
        return name + "@" + sourceColIndex;
    }
}
