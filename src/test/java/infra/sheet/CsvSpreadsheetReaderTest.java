package infra.sheet;

import domain.grid.Grid;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvSpreadsheetReaderTest {

    private final CsvSpreadsheetReader reader = new CsvSpreadsheetReader();

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void bom_is_stripped_and_values_trimmed() {
        Grid g = reader.read(utf8("\uFEFFNo, 성명 ,연락처\n1,홍길동,010-1234-5678\n"), null);

        assertEquals(1, g.getOrigin());
        assertEquals("No", g.text(1, 1));
        assertEquals("성명", g.text(1, 2));
        assertEquals("010-1234-5678", g.text(2, 3));
    }

    @Test
    void blank_cells_are_skipped_and_empty_lines_keep_row_numbers() {
        Grid g = reader.read(utf8("이름,,국가\n\n홍길동,,일본\n"), null);

        assertEquals(2, g.nonEmptyCount(1));
        assertNull(g.cellAt(1, 2));
        assertEquals(0, g.nonEmptyCount(2));
        assertEquals("일본", g.text(3, 3));
    }

    @Test
    void quoted_values_may_contain_commas() {
        Grid g = reader.read(utf8("주소,비고\n\"서울, 중구\",\"a,b\"\n"), "ignored");

        assertEquals("서울, 중구", g.text(2, 1));
        assertEquals("a,b", g.text(2, 2));
    }

    @Test
    void single_pseudo_sheet() {
        assertEquals(List.of("csv"), reader.sheetNames(utf8("a,b")));
    }
}
