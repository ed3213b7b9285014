package domain.grid;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CellValueTest {

    @Test
    void integral_numbers_drop_the_fraction() {
        assertEquals("3", CellValue.plain(3.0).toText());
        assertEquals("2.5", CellValue.plain(2.5).toText());
        assertEquals("1012345678", CellValue.plain(1012345678d).toText());
    }

    @Test
    void rich_text_runs_are_concatenated() {
        CellValue v = CellValue.richText(List.of("홍", "길동 "));
        assertEquals(CellValue.Kind.RICH_TEXT, v.getKind());
        assertEquals("홍길동", v.toText());
    }

    @Test
    void formula_uses_cached_result() {
        assertEquals("42", CellValue.formulaResult(42.0).toText());
        assertEquals("OK", CellValue.formulaResult("OK").toText());
        assertEquals("2024-03-01", CellValue.formulaResult(LocalDate.of(2024, 3, 1)).toText());
    }

    @Test
    void dates_are_iso_formatted() {
        assertEquals("1999-12-31", CellValue.date(LocalDate.of(1999, 12, 31)).toText());
    }

    @Test
    void nulls_collapse_to_empty() {
        assertSame(CellValue.empty(), CellValue.plain(null));
        assertSame(CellValue.empty(), CellValue.date(null));
        assertSame(CellValue.empty(), CellValue.richText(List.of()));
        assertEquals("", CellValue.empty().toText());
    }

    @Test
    void booleans_print_as_words() {
        assertEquals("true", CellValue.plain(Boolean.TRUE).toText());
    }
}
