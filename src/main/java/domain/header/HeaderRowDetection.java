package domain.header;

import java.util.List;

/** 헤더 행 탐지 결과. */
public final class HeaderRowDetection {

    private final List<Integer> headerRows;
    private final int dataStartRow;
    private final int mainHeaderRow;
    private final boolean fallback;

    public HeaderRowDetection(List<Integer> headerRows, int dataStartRow, int mainHeaderRow, boolean fallback) {
        this.headerRows = List.copyOf(headerRows);
        this.dataStartRow = dataStartRow;
        this.mainHeaderRow = mainHeaderRow;
        this.fallback = fallback;
    }

    /** 점수 후보가 없을 때: 첫 행을 헤더로, 다음 행부터 데이터. */
    static HeaderRowDetection fallback(int firstRow) {
        return new HeaderRowDetection(List.of(firstRow), firstRow + 1, firstRow, true);
    }

    /** 오름차순. */
    public List<Integer> getHeaderRows() {
        return headerRows;
    }

    public int getDataStartRow() {
        return dataStartRow;
    }

    public int getMainHeaderRow() {
        return mainHeaderRow;
    }

    public boolean isFallback() {
        return fallback;
    }
}
