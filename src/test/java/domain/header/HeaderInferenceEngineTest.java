package domain.header;

import domain.grid.Grid;
import domain.grid.GridCell;
import domain.model.ListMappingWarningSink;
import domain.model.MappingWarning;
import domain.model.WarningCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HeaderInferenceEngineTest {

    private final HeaderInferenceEngine engine = new HeaderInferenceEngine();

    private static Grid simpleSheet() {
        return Grid.builder()
                .origin(1)
                .add(GridCell.of(1, 1, "Report: 2024 summary"))
                .add(GridCell.of(2, 1, "No"))
                .add(GridCell.of(2, 2, "성명"))
                .add(GridCell.of(2, 3, "연락처"))
                .add(GridCell.of(2, 4, "이메일"))
                .add(GridCell.of(3, 1, "1"))
                .add(GridCell.of(3, 2, "홍길동"))
                .add(GridCell.of(3, 3, "010-1234-5678"))
                .add(GridCell.of(3, 4, "hong@example.com"))
                .build();
    }

    /**
     * 1행: 인적사항(1~2열 병합), 4. Program(3~4열 병합)
     * 2행: Expert Talk(3~4열 병합)
     * 3행: No, 성명, 1회, 2회
     * 4행: 데이터
     */
    private static Grid compositeSheet() {
        return Grid.builder()
                .origin(1)
                .add(new GridCell(1, 1, "인적사항", false, 1, 2))
                .add(new GridCell(1, 3, "4. Program", false, 1, 2))
                .add(new GridCell(2, 3, "Expert Talk", false, 1, 2))
                .add(GridCell.of(3, 1, "No"))
                .add(GridCell.of(3, 2, "성명"))
                .add(GridCell.of(3, 3, "1회"))
                .add(GridCell.of(3, 4, "2회"))
                .add(GridCell.of(4, 1, "1"))
                .add(GridCell.of(4, 2, "홍길동"))
                .add(GridCell.of(4, 3, "O"))
                .add(GridCell.of(4, 4, "X"))
                .build();
    }

    @Test
    void metadata_rows_are_collected_with_key_value_pairs() {
        MetadataScan scan = engine.detectMetadataRows(simpleSheet());

        assertEquals(List.of(1), scan.getMetaRows());
        assertEquals(Map.of("Report", "2024 summary"), scan.getMetaInfo());
    }

    @Test
    void highest_scoring_row_becomes_header_and_numeric_row_starts_data() {
        HeaderAnalysisResult r = engine.analyze(simpleSheet());

        assertEquals(List.of(1), r.getMetaRows());
        assertEquals(List.of(2), r.getHeaderRows());
        assertEquals(3, r.getDataStartRow());
        assertEquals(List.of("No", "성명", "연락처", "이메일"), r.getColumnNames());
        assertFalse(r.isHeaderFallback());
        assertFalse(r.isColumnFallback());
    }

    @Test
    void no_candidate_row_falls_back_to_first_row() {
        Grid g = Grid.builder()
                .origin(1)
                .add(GridCell.of(1, 1, "a"))
                .add(GridCell.of(1, 2, "b"))
                .add(GridCell.of(2, 1, "c"))
                .build();

        List<MappingWarning> warnings = new ArrayList<>();
        HeaderAnalysisResult r = engine.analyze(g, new ListMappingWarningSink(warnings));

        assertEquals(List.of(1), r.getHeaderRows());
        assertEquals(2, r.getDataStartRow());
        assertTrue(r.isHeaderFallback());
        assertEquals(List.of("a", "b"), r.getColumnNames());
        assertTrue(warnings.stream().anyMatch(w -> w.getCode() == WarningCode.HEADER_FALLBACK));
    }

    @Test
    void fallback_header_row_wins_over_metadata_on_the_same_row() {
        Grid g = Grid.builder()
                .origin(1)
                .add(GridCell.of(1, 1, "Title: 명단"))
                .add(GridCell.of(2, 1, "x"))
                .build();

        HeaderAnalysisResult r = engine.analyze(g);

        assertEquals(List.of(1), r.getHeaderRows());
        assertTrue(r.getMetaRows().isEmpty());
        assertEquals("명단", r.getMetaInfo().get("Title"));
    }

    @Test
    void rows_above_main_header_join_the_header_block() {
        HeaderRowDetection d = engine.detectHeaderRows(compositeSheet(), List.of());

        assertEquals(3, d.getMainHeaderRow());
        assertEquals(List.of(1, 2, 3), d.getHeaderRows());
        assertEquals(4, d.getDataStartRow());
    }

    @Test
    void sub_header_row_below_main_header_is_absorbed() {
        Grid g = Grid.builder()
                .origin(1)
                .add(GridCell.of(1, 1, "No"))
                .add(GridCell.of(1, 2, "성명"))
                .add(GridCell.of(1, 3, "상담"))
                .add(GridCell.of(1, 4, "상담"))
                .add(GridCell.of(2, 2, "구분"))
                .add(GridCell.of(2, 3, "1회"))
                .add(GridCell.of(2, 4, "2회"))
                .add(GridCell.of(3, 1, "1"))
                .add(GridCell.of(3, 2, "홍길동"))
                .add(GridCell.of(3, 3, "O"))
                .build();

        HeaderRowDetection d = engine.detectHeaderRows(g, List.of());

        assertEquals(1, d.getMainHeaderRow());
        assertEquals(List.of(1, 2), d.getHeaderRows());
        assertEquals(3, d.getDataStartRow());
    }

    /** 헤더 바로 아래 단위 행은 데이터 시작으로 보지 않는다. */
    @Test
    void unit_row_under_header_is_skipped_until_numeric_row() {
        Grid g = Grid.builder()
                .origin(1)
                .add(GridCell.of(1, 1, "No"))
                .add(GridCell.of(1, 2, "성명"))
                .add(GridCell.of(1, 3, "점수"))
                .add(GridCell.of(1, 4, "금액"))
                .add(GridCell.of(2, 2, "(명)"))
                .add(GridCell.of(2, 3, "(점)"))
                .add(GridCell.of(2, 4, "(원)"))
                .add(GridCell.of(3, 1, "1"))
                .add(GridCell.of(3, 2, "홍길동"))
                .add(GridCell.of(3, 3, "90"))
                .add(GridCell.of(3, 4, "100"))
                .build();

        HeaderRowDetection d = engine.detectHeaderRows(g, List.of());

        assertEquals(List.of(1), d.getHeaderRows());
        assertEquals(3, d.getDataStartRow());

        List<Map<String, String>> records = new SheetRecordExtractor().extract(g, engine.analyze(g));
        assertEquals(1, records.size());
        assertEquals("홍길동", records.get(0).get("성명"));
    }

    @Test
    void composite_names_join_merged_ancestors_and_basic_columns_short_circuit() {
        HeaderAnalysisResult r = engine.analyze(compositeSheet());

        assertEquals(List.of(
                "No",
                "성명",
                "4. Program_Expert Talk_1회",
                "4. Program_Expert Talk_2회"
        ), r.getColumnNames());

        HierarchicalColumn talk1 = r.getColumns().get(2);
        assertEquals(3, talk1.getSourceColIndex());
        assertEquals(2, talk1.getDepth());
    }

    @Test
    void merge_spans_only_come_from_header_rows() {
        Grid g = compositeSheet();
        List<MergeSpan> spans = engine.extractMergeSpans(g, List.of(1));

        assertEquals(2, spans.size());
        assertEquals("인적사항", spans.get(0).getText());
        assertEquals(1, spans.get(0).getStartCol());
        assertEquals(2, spans.get(0).getEndCol());
    }

    @Test
    void duplicate_names_get_numeric_suffixes() {
        Grid g = Grid.builder()
                .origin(1)
                .add(GridCell.of(1, 1, "No"))
                .add(GridCell.of(1, 2, "성명"))
                .add(GridCell.of(1, 3, "비고"))
                .add(GridCell.of(1, 4, "비고"))
                .add(GridCell.of(1, 5, "비고"))
                .build();

        HeaderAnalysisResult r = engine.analyze(g);

        assertEquals(List.of("No", "성명", "비고", "비고_2", "비고_3"), r.getColumnNames());
    }

    @Test
    void fallback_extraction_keeps_names_unique_when_suffix_is_taken() {
        Grid g = Grid.builder()
                .origin(1)
                .add(GridCell.of(1, 1, "Class: A"))
                .add(GridCell.of(1, 2, "비고_4"))
                .add(GridCell.of(1, 3, "비고"))
                .add(GridCell.of(1, 4, "비고"))
                .build();

        List<HierarchicalColumn> cols = new FallbackColumnExtractor(HeaderHeuristics.defaults()).extract(g);
        List<String> names = cols.stream().map(HierarchicalColumn::getName).toList();

        assertEquals(List.of("Class: A", "비고_4", "비고", "비고_2"), names);
    }

    @Test
    void analysis_is_deterministic() {
        Grid g = compositeSheet();
        assertEquals(engine.analyze(g).getColumns(), engine.analyze(g).getColumns());
    }

    @Test
    void empty_sheet_yields_no_columns_and_flags_column_fallback() {
        HeaderAnalysisResult r = engine.analyze(Grid.empty(1));

        assertTrue(r.getColumns().isEmpty());
        assertTrue(r.isHeaderFallback());
        assertTrue(r.isColumnFallback());
    }

    @Test
    void custom_heuristics_lower_the_cell_threshold() {
        Grid g = Grid.builder()
                .origin(1)
                .add(GridCell.of(1, 1, "이름"))
                .add(GridCell.of(1, 2, "국가"))
                .add(GridCell.of(2, 1, "홍길동"))
                .add(GridCell.of(2, 2, "일본"))
                .build();

        HeaderInferenceEngine relaxed = new HeaderInferenceEngine(
                HeaderHeuristics.builder().minHeaderCells(2).build());
        HeaderAnalysisResult r = relaxed.analyze(g);

        assertFalse(r.isHeaderFallback());
        assertEquals(List.of(1), r.getHeaderRows());
        assertEquals(List.of("이름", "국가"), r.getColumnNames());
    }

    @Test
    void header_invariants_are_enforced() {
        assertThrows(IllegalArgumentException.class,
                () -> new HeaderAnalysisResult(List.of(), List.of(2), 2, List.of(), Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new HeaderAnalysisResult(List.of(1), List.of(1), 2, List.of(), Map.of()));
    }

    @Test
    void records_are_read_from_data_start_row() {
        Grid g = simpleSheet();
        HeaderAnalysisResult r = engine.analyze(g);

        List<Map<String, String>> records = new SheetRecordExtractor().extract(g, r);

        assertEquals(1, records.size());
        assertEquals("홍길동", records.get(0).get("성명"));
        assertEquals("hong@example.com", records.get(0).get("이메일"));
    }
}
