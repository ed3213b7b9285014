package infra.sheet;

import domain.grid.CellValue;
import domain.grid.Grid;
import domain.grid.GridCell;
import domain.grid.GridReadException;
import domain.grid.SpreadsheetReader;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.CellRangeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * xlsx / xls → {@link Grid} (origin=1, Excel 행/열 번호 그대로).
 *
 * <p>병합 영역은 좌상단 셀의 span 으로, 나머지 칸은 버린다. 빈 셀은 그리드에 넣지 않는다.</p>
 */
public final class PoiSpreadsheetReader implements SpreadsheetReader {

    private static final Logger log = LoggerFactory.getLogger(PoiSpreadsheetReader.class);

    @Override
    public Grid read(byte[] bytes, String sheetSelector) {
        try (Workbook wb = open(bytes)) {
            Sheet sheet = selectSheet(wb, sheetSelector);
            Grid grid = toGrid(sheet);
            log.info("[SHEET] '{}' -> {}", sheet.getSheetName(), grid);
            return grid;
        } catch (GridReadException e) {
            throw e;
        } catch (Exception e) {
            throw new GridReadException("Failed to read workbook: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> sheetNames(byte[] bytes) {
        try (Workbook wb = open(bytes)) {
            List<String> names = new ArrayList<>(wb.getNumberOfSheets());
            for (int i = 0; i < wb.getNumberOfSheets(); i++) {
                names.add(wb.getSheetName(i));
            }
            return names;
        } catch (GridReadException e) {
            throw e;
        } catch (Exception e) {
            throw new GridReadException("Failed to read workbook: " + e.getMessage(), e);
        }
    }

    private static Workbook open(byte[] bytes) throws Exception {
        if (bytes == null || bytes.length == 0) {
            throw new GridReadException("Workbook is empty");
        }
        return WorkbookFactory.create(new ByteArrayInputStream(bytes));
    }

    private static Sheet selectSheet(Workbook wb, String selector) {
        if (selector == null || selector.isBlank()) {
            if (wb.getNumberOfSheets() == 0) throw new GridReadException("Workbook has no sheets");
            return wb.getSheetAt(0);
        }
        Sheet sheet = wb.getSheet(selector.trim());
        if (sheet == null) {
            List<String> names = new ArrayList<>();
            for (int i = 0; i < wb.getNumberOfSheets(); i++) names.add(wb.getSheetName(i));
            throw new GridReadException("Sheet \"" + selector + "\" not found. available=" + names);
        }
        return sheet;
    }

    static Grid toGrid(Sheet sheet) {
        Map<Long, CellRangeAddress> anchors = new HashMap<>();
        Set<Long> covered = new HashSet<>();
        for (CellRangeAddress region : sheet.getMergedRegions()) {
            anchors.put(key(region.getFirstRow(), region.getFirstColumn()), region);
            for (int r = region.getFirstRow(); r <= region.getLastRow(); r++) {
                for (int c = region.getFirstColumn(); c <= region.getLastColumn(); c++) {
                    if (r == region.getFirstRow() && c == region.getFirstColumn()) continue;
                    covered.add(key(r, c));
                }
            }
        }

        Grid.Builder b = Grid.builder().origin(1);
        Set<Long> added = new HashSet<>();

        for (Row row : sheet) {
            for (Cell cell : row) {
                int r = cell.getRowIndex();
                int c = cell.getColumnIndex();
                long k = key(r, c);
                if (covered.contains(k)) continue;

                CellValue value = PoiCellValues.read(cell);
                String text = value.toText();
                CellRangeAddress region = anchors.get(k);
                if (text.isEmpty() && region == null) continue;

                b.add(toCell(r, c, text, region));
                added.add(k);
            }
        }

        // 값이 없는 병합 anchor 도 영역은 차지한다
        for (Map.Entry<Long, CellRangeAddress> e : anchors.entrySet()) {
            if (added.contains(e.getKey())) continue;
            CellRangeAddress region = e.getValue();
            b.add(toCell(region.getFirstRow(), region.getFirstColumn(), "", region));
        }

        return b.build();
    }

    private static GridCell toCell(int r0, int c0, String text, CellRangeAddress region) {
        int rowSpan = region == null ? 1 : region.getLastRow() - region.getFirstRow() + 1;
        int colSpan = region == null ? 1 : region.getLastColumn() - region.getFirstColumn() + 1;
        return new GridCell(r0 + 1, c0 + 1, text, false, rowSpan, colSpan);
    }

    private static long key(int r, int c) {
        return (((long) r) << 32) | (c & 0xffffffffL);
    }
}
