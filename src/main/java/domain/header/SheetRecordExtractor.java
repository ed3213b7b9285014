package domain.header;

import domain.grid.Grid;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** dataStartRow 부터 행마다 (컬럼명 → 값) 레코드를 만든다. 빈 행은 건너뛴다. */
public final class SheetRecordExtractor {

    public List<Map<String, String>> extract(Grid grid, HeaderAnalysisResult analysis) {
        return extract(grid, analysis, -1);
    }

    /**
     * @param maxRecords 0 이하면 제한 없음
     */
    public List<Map<String, String>> extract(Grid grid, HeaderAnalysisResult analysis, int maxRecords) {
        List<Map<String, String>> out = new ArrayList<>();
        if (analysis.getColumns().isEmpty()) return out;

        for (int r = analysis.getDataStartRow(); r <= grid.getLastRow(); r++) {
            Map<String, String> record = new LinkedHashMap<>();
            boolean any = false;
            for (HierarchicalColumn col : analysis.getColumns()) {
                String v = grid.text(r, col.getSourceColIndex());
                if (!v.isEmpty()) any = true;
                record.put(col.getName(), v);
            }
            if (!any) continue;

            out.add(record);
            if (maxRecords > 0 && out.size() >= maxRecords) break;
        }
        return out;
    }
}
