package domain.header;

import domain.grid.Grid;
import domain.grid.GridCell;
import domain.model.MappingWarning;
import domain.model.MappingWarningSink;
import domain.model.WarningCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;

/**
 * 불규칙한 엑셀 헤더 분석기.
 *
 * <p>처리 순서: 메타데이터 행 → 헤더 행(점수 기반) → 병합 영역 → 계층 컬럼명 합성.</p>
 *
 * <p>모든 연산은 Grid 만 읽고 상태를 갖지 않는다 (같은 입력이면 같은 결과).</p>
 */
public final class HeaderInferenceEngine {

    private static final Logger log = LoggerFactory.getLogger(HeaderInferenceEngine.class);

    private static final String UNDEFINED_TEXT = "undefined";

    private final HeaderHeuristics heuristics;
    private final FallbackColumnExtractor fallbackExtractor;

    public HeaderInferenceEngine() {
        this(HeaderHeuristics.defaults());
    }

    public HeaderInferenceEngine(HeaderHeuristics heuristics) {
        this.heuristics = heuristics == null ? HeaderHeuristics.defaults() : heuristics;
        this.fallbackExtractor = new FallbackColumnExtractor(this.heuristics);
    }

    public HeaderAnalysisResult analyze(Grid grid) {
        return analyze(grid, MappingWarningSink.none());
    }

    /**
     * 전체 분석.
     *
     * <p>합성 결과 컬럼이 없으면 단일 행 추출({@link FallbackColumnExtractor})로 한 번 더 시도한다.</p>
     */
    public HeaderAnalysisResult analyze(Grid grid, MappingWarningSink sink) {
        if (sink == null) sink = MappingWarningSink.none();

        MetadataScan meta = detectMetadataRows(grid);
        HeaderRowDetection detection = detectHeaderRows(grid, meta.getMetaRows());
        if (detection.isFallback()) {
            sink.warn(MappingWarning.of(WarningCode.HEADER_FALLBACK, "",
                    "no header row candidate; assuming row " + grid.getFirstRow()));
        }

        List<MergeSpan> merges = extractMergeSpans(grid, detection.getHeaderRows());
        List<HierarchicalColumn> columns = synthesizeHierarchicalColumns(
                grid, detection.getHeaderRows(), merges, detection.getMainHeaderRow());

        boolean columnFallback = false;
        if (columns.isEmpty()) {
            columns = fallbackExtractor.extract(grid);
            columnFallback = true;
            log.warn("[HEADER] hierarchical synthesis produced no columns; single-row fallback -> {}", columns.size());
            sink.warn(MappingWarning.of(WarningCode.COLUMN_FALLBACK, "",
                    "single-row column extraction used, columns=" + columns.size()));
        }

        // fallback 헤더 행이 메타 행과 겹치면 헤더 쪽을 우선
        List<Integer> metaRows = new ArrayList<>(meta.getMetaRows());
        metaRows.removeAll(detection.getHeaderRows());

        log.info("[HEADER] metaRows={}, headerRows={}, dataStartRow={}, columns={}",
                metaRows, detection.getHeaderRows(), detection.getDataStartRow(), columns.size());

        return new HeaderAnalysisResult(
                metaRows,
                detection.getHeaderRows(),
                detection.getDataStartRow(),
                columns,
                meta.getMetaInfo(),
                detection.isFallback(),
                columnFallback
        );
    }

    // ------------------------------------------------------------------
    // 1) metadata rows
    // ------------------------------------------------------------------

    public MetadataScan detectMetadataRows(Grid grid) {
        return detectMetadataRows(grid, heuristics.getMetaScanRows());
    }

    /** "Key: value" 셀이 하나라도 있는 행. 같은 key 는 뒤의 값이 이긴다. */
    public MetadataScan detectMetadataRows(Grid grid, int maxRows) {
        List<Integer> rows = new ArrayList<>();
        Map<String, String> info = new LinkedHashMap<>();

        int last = Math.min(grid.getLastRow(), grid.getFirstRow() + maxRows - 1);
        for (int r = grid.getFirstRow(); r <= last; r++) {
            boolean meta = false;
            for (GridCell cell : grid.rowCells(r)) {
                if (cell.isEmpty()) continue;
                Matcher m = heuristics.getMetaRowPattern().matcher(cell.getText());
                if (m.matches()) {
                    meta = true;
                    info.put(m.group(1).trim(), m.group(2).trim());
                }
            }
            if (meta) rows.add(r);
        }

        log.debug("[HEADER] meta rows={}, info={}", rows, info);
        return new MetadataScan(rows, info);
    }

    // ------------------------------------------------------------------
    // 2) header rows
    // ------------------------------------------------------------------

    public HeaderRowDetection detectHeaderRows(Grid grid, List<Integer> metaRows) {
        return detectHeaderRows(grid, metaRows, heuristics.getHeaderScanRows());
    }

    /**
     * 점수가 가장 높은 행을 main header 로 잡고 위/아래로 확장한다.
     *
     * <ul>
     *   <li>위로: 최대 upwardRows 행. 메타 행이 아니고 값이 하나라도 있으면 헤더에 포함</li>
     *   <li>아래로: 최대 downwardRows 행. 앞 두 열에 순수 숫자가 있으면 데이터 시작,
     *       sub-header 패턴이 있으면 헤더에 포함, 그 외 행은 건너뛴다</li>
     * </ul>
     */
    public HeaderRowDetection detectHeaderRows(Grid grid, List<Integer> metaRows, int maxRows) {
        Set<Integer> meta = metaRows == null ? Set.of() : new HashSet<>(metaRows);
        int first = grid.getFirstRow();
        int last = Math.min(grid.getLastRow(), first + maxRows - 1);

        int bestRow = -1;
        int bestScore = Integer.MIN_VALUE;
        for (int r = first; r <= last; r++) {
            if (meta.contains(r)) continue;
            List<GridCell> cells = nonEmptyCells(grid, r);
            if (cells.size() < heuristics.getMinHeaderCells()) continue;

            int score = scoreRow(cells);
            log.debug("[HEADER] row {} score={}", r, score);
            // 동점이면 먼저 나온 행
            if (score > bestScore) {
                bestScore = score;
                bestRow = r;
            }
        }

        if (bestRow < 0) {
            log.warn("[HEADER] no header candidate in rows {}..{}; fallback to row {}", first, last, first);
            return HeaderRowDetection.fallback(first);
        }

        int main = bestRow;
        List<Integer> headerRows = new ArrayList<>();
        headerRows.add(main);

        for (int r = main - 1; r >= Math.max(first, main - heuristics.getUpwardRows()); r--) {
            if (meta.contains(r)) continue;
            if (grid.nonEmptyCount(r) > 0) {
                headerRows.add(0, r);
            }
        }

        int dataStart = main + 1;
        for (int r = main + 1; r <= main + heuristics.getDownwardRows() && r <= grid.getLastRow(); r++) {
            if (meta.contains(r)) break;
            List<GridCell> cells = nonEmptyCells(grid, r);
            if (cells.size() < heuristics.getMinHeaderCells()) break;

            if (looksLikeDataRow(grid, cells)) {
                dataStart = r;
                break;
            }
            if (hasSubHeader(cells)) {
                headerRows.add(r);
                dataStart = r + 1;
            }
            // 단위/비고 행: 헤더도 데이터도 아님, 계속 내려간다
        }

        log.debug("[HEADER] main={}, headerRows={}, dataStart={}", main, headerRows, dataStart);
        return new HeaderRowDetection(headerRows, dataStart, main, false);
    }

    private int scoreRow(List<GridCell> cells) {
        int shortLabels = 0;
        boolean hasNumber = false;
        boolean hasName = false;
        boolean hasMeta = false;

        for (GridCell c : cells) {
            String t = c.getText();
            if (heuristics.isShortLabel(t)) shortLabels++;
            if (heuristics.getNumberLabelPattern().matcher(t).matches()) hasNumber = true;
            if (heuristics.getNameLabelPattern().matcher(t).matches()) hasName = true;
            if (heuristics.getMetaCellPattern().matcher(t).matches()) hasMeta = true;
        }

        int score = cells.size() * heuristics.getCellWeight() + shortLabels * heuristics.getShortLabelWeight();
        if (hasNumber) score += heuristics.getNumberLabelBonus();
        if (hasName) score += heuristics.getNameLabelBonus();
        if (hasMeta) score -= heuristics.getMetaCellPenalty();
        return score;
    }

    private boolean looksLikeDataRow(Grid grid, List<GridCell> cells) {
        int limit = grid.getFirstCol() + 2;
        for (GridCell c : cells) {
            if (c.getCol() < limit && heuristics.getDataRowMarker().matcher(c.getText()).matches()) {
                return true;
            }
        }
        return false;
    }

    private boolean hasSubHeader(List<GridCell> cells) {
        for (GridCell c : cells) {
            if (HeaderHeuristics.anyMatches(heuristics.getSubHeaderPatterns(), c.getText())) return true;
        }
        return false;
    }

    private static List<GridCell> nonEmptyCells(Grid grid, int r) {
        return grid.rowCells(r).stream().filter(c -> !c.isEmpty()).toList();
    }

    // ------------------------------------------------------------------
    // 3) merges
    // ------------------------------------------------------------------

    /** anchor 가 헤더 행에 있고 텍스트가 비어있지 않은 병합 영역만. */
    public List<MergeSpan> extractMergeSpans(Grid grid, List<Integer> headerRows) {
        Set<Integer> header = new HashSet<>(headerRows);
        List<MergeSpan> out = new ArrayList<>();
        for (GridCell cell : grid.mergedCells()) {
            if (!header.contains(cell.getRow())) continue;
            if (cell.isEmpty()) continue;
            out.add(new MergeSpan(cell.getRow(), cell.getEndRow(), cell.getCol(), cell.getEndCol(), cell.getText()));
        }
        return out;
    }

    // ------------------------------------------------------------------
    // 4) hierarchical columns
    // ------------------------------------------------------------------

    /** main header 행을 모를 때는 마지막 헤더 행 기준으로 depth 를 준다. */
    public List<HierarchicalColumn> synthesizeHierarchicalColumns(Grid grid, List<Integer> headerRows, List<MergeSpan> merges) {
        int main = headerRows.isEmpty() ? grid.getFirstRow() : headerRows.get(headerRows.size() - 1);
        return synthesizeHierarchicalColumns(grid, headerRows, merges, main);
    }

    /**
     * 열마다 헤더 행 값을 위에서부터 모아 이름을 만든다.
     *
     * <ul>
     *   <li>기본 컬럼(성명, 연락처 등) → 마지막 값 그대로</li>
     *   <li>그 외 → 숫자/월 토큰을 뺀 고유 값들을 "_" 로 연결, 비면 마지막 원본 값</li>
     *   <li>이름 충돌 → _2, _3 ...</li>
     * </ul>
     */
    public List<HierarchicalColumn> synthesizeHierarchicalColumns(
            Grid grid,
            List<Integer> headerRows,
            List<MergeSpan> merges,
            int mainHeaderRow
    ) {
        Set<Integer> header = new HashSet<>(headerRows);
        TreeMap<Integer, TreeMap<Integer, String>> byCol = new TreeMap<>();

        for (int r : headerRows) {
            for (GridCell cell : grid.rowCells(r)) {
                String t = cell.getText();
                if (t.isEmpty() || UNDEFINED_TEXT.equals(t)) continue;
                byCol.computeIfAbsent(cell.getCol(), k -> new TreeMap<>()).put(r, t);
            }
        }

        // 병합 텍스트 전파: 자기 값이 없는 칸에만
        if (merges != null) {
            for (MergeSpan m : merges) {
                for (int c = m.getStartCol(); c <= m.getEndCol(); c++) {
                    for (int r = m.getStartRow(); r <= m.getEndRow(); r++) {
                        if (!header.contains(r)) continue;
                        byCol.computeIfAbsent(c, k -> new TreeMap<>()).putIfAbsent(r, m.getText());
                    }
                }
            }
        }

        int depth = headerRows.indexOf(mainHeaderRow);
        if (depth < 0) depth = Math.max(0, headerRows.size() - 1);

        List<HierarchicalColumn> out = new ArrayList<>(byCol.size());
        Set<String> seen = new HashSet<>();
        for (Map.Entry<Integer, TreeMap<Integer, String>> e : byCol.entrySet()) {
            List<String> values = new ArrayList<>(e.getValue().values());
            if (values.isEmpty()) continue;

            String name = ColumnNames.unique(composeName(values), seen);
            out.add(new HierarchicalColumn(name, e.getKey(), depth));
        }
        return out;
    }

    private String composeName(List<String> values) {
        String last = values.get(values.size() - 1);
        for (String v : values) {
            if (HeaderHeuristics.anyMatches(heuristics.getBasicColumnPatterns(), v)) {
                return last;
            }
        }

        Set<String> parts = new LinkedHashSet<>();
        for (String v : values) {
            if (HeaderHeuristics.anyMatches(heuristics.getCompositeNoisePatterns(), v)) continue;
            parts.add(v);
        }
        return parts.isEmpty() ? last : String.join("_", parts);
    }

}
