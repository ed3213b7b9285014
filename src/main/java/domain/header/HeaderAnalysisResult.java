package domain.header;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * spreadsheet 헤더 분석 결과.
 *
 * <p>불변식: dataStartRow &gt; max(headerRows), headerRows 와 metaRows 는 겹치지 않는다.</p>
 */
public final class HeaderAnalysisResult {

    private final List<Integer> metaRows;
    private final List<Integer> headerRows;
    private final int dataStartRow;
    private final List<HierarchicalColumn> columns;
    private final Map<String, String> metaInfo;
    private final boolean headerFallback;
    private final boolean columnFallback;

    public HeaderAnalysisResult(
            List<Integer> metaRows,
            List<Integer> headerRows,
            int dataStartRow,
            List<HierarchicalColumn> columns,
            Map<String, String> metaInfo
    ) {
        this(metaRows, headerRows, dataStartRow, columns, metaInfo, false, false);
    }

    public HeaderAnalysisResult(
            List<Integer> metaRows,
            List<Integer> headerRows,
            int dataStartRow,
            List<HierarchicalColumn> columns,
            Map<String, String> metaInfo,
            boolean headerFallback,
            boolean columnFallback
    ) {
        this.metaRows = metaRows == null ? List.of() : List.copyOf(metaRows);
        this.headerRows = headerRows == null ? List.of() : List.copyOf(headerRows);
        this.dataStartRow = dataStartRow;
        this.columns = columns == null ? List.of() : List.copyOf(columns);
        this.metaInfo = metaInfo == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metaInfo));
        this.headerFallback = headerFallback;
        this.columnFallback = columnFallback;

        int maxHeader = Integer.MIN_VALUE;
        for (int r : this.headerRows) maxHeader = Math.max(maxHeader, r);
        if (!this.headerRows.isEmpty() && dataStartRow <= maxHeader) {
            throw new IllegalArgumentException("dataStartRow(" + dataStartRow + ") must be after header rows " + this.headerRows);
        }
        Set<Integer> meta = new HashSet<>(this.metaRows);
        for (int r : this.headerRows) {
            if (meta.contains(r)) {
                throw new IllegalArgumentException("row " + r + " is both metadata and header");
            }
        }
    }

    public List<Integer> getMetaRows() {
        return metaRows;
    }

    public List<Integer> getHeaderRows() {
        return headerRows;
    }

    public int getDataStartRow() {
        return dataStartRow;
    }

    public List<HierarchicalColumn> getColumns() {
        return columns;
    }

    public List<String> getColumnNames() {
        return columns.stream().map(HierarchicalColumn::getName).toList();
    }

    public Map<String, String> getMetaInfo() {
        return metaInfo;
    }

    public boolean isHeaderFallback() {
        return headerFallback;
    }

    public boolean isColumnFallback() {
        return columnFallback;
    }
}
