package infra.sheet;

import domain.grid.Grid;
import domain.grid.GridCell;
import domain.grid.GridReadException;
import domain.grid.SpreadsheetReader;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * CSV → {@link Grid} (origin=1). 병합이 없으므로 span 은 항상 1.
 *
 * <p>sheet 개념이 없어 sheetSelector 는 무시한다. 빈 줄도 행 번호를 차지한다.</p>
 */
public final class CsvSpreadsheetReader implements SpreadsheetReader {

    private static final Logger log = LoggerFactory.getLogger(CsvSpreadsheetReader.class);

    static final String SHEET_NAME = "csv";

    @Override
    public Grid read(byte[] bytes, String sheetSelector) {
        if (bytes == null) throw new GridReadException("CSV input is null");

        try (InputStreamReader reader = new InputStreamReader(new ByteArrayInputStream(bytes), StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .setTrim(true)
                     .setIgnoreEmptyLines(false)
                     .build()
                     .parse(reader)) {

            Grid.Builder b = Grid.builder().origin(1);
            int r = 1;
            for (CSVRecord rec : parser) {
                for (int i = 0; i < rec.size(); i++) {
                    String v = rec.get(i);
                    if (r == 1 && i == 0) v = stripBom(v);
                    if (v == null || v.isBlank()) continue;
                    b.add(GridCell.of(r, i + 1, v));
                }
                r++;
            }
            Grid grid = b.build();
            log.info("[SHEET] csv -> {}", grid);
            return grid;
        } catch (Exception e) {
            throw new GridReadException("Failed to read CSV: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> sheetNames(byte[] bytes) {
        return List.of(SHEET_NAME);
    }

    private static String stripBom(String s) {
        if (s == null) return "";
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }
}
