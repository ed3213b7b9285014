package infra.sheet;

import domain.grid.CellValue;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.RichTextString;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** POI 셀 → {@link CellValue}. 수식은 캐시된 결과만 본다 (재계산 안 함). */
final class PoiCellValues {

    private PoiCellValues() {
    }

    static CellValue read(Cell cell) {
        if (cell == null) return CellValue.empty();

        return switch (cell.getCellType()) {
            case STRING -> stringValue(cell);
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? CellValue.date(dateOf(cell))
                    : CellValue.plain(cell.getNumericCellValue());
            case BOOLEAN -> CellValue.plain(cell.getBooleanCellValue());
            case FORMULA -> formulaValue(cell);
            default -> CellValue.empty();
        };
    }

    private static CellValue stringValue(Cell cell) {
        RichTextString rts = cell.getRichStringCellValue();
        String s = rts == null ? null : rts.getString();
        if (s == null || s.isEmpty()) return CellValue.empty();

        int runs = rts.numFormattingRuns();
        if (runs <= 1) return CellValue.plain(s);

        // run 경계로 잘라서 보관 (서식 정보는 버림)
        List<Integer> bounds = new ArrayList<>();
        bounds.add(0);
        for (int i = 0; i < runs; i++) {
            int start = rts.getIndexOfFormattingRun(i);
            if (start > bounds.get(bounds.size() - 1) && start < s.length()) bounds.add(start);
        }
        bounds.add(s.length());

        List<String> parts = new ArrayList<>(bounds.size());
        for (int i = 0; i + 1 < bounds.size(); i++) {
            parts.add(s.substring(bounds.get(i), bounds.get(i + 1)));
        }
        return CellValue.richText(parts);
    }

    private static CellValue formulaValue(Cell cell) {
        return switch (cell.getCachedFormulaResultType()) {
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? CellValue.formulaResult(dateOf(cell))
                    : CellValue.formulaResult(cell.getNumericCellValue());
            case STRING -> CellValue.formulaResult(cell.getRichStringCellValue().getString());
            case BOOLEAN -> CellValue.formulaResult(cell.getBooleanCellValue());
            default -> CellValue.empty();
        };
    }

    private static LocalDate dateOf(Cell cell) {
        var dt = cell.getLocalDateTimeCellValue();
        return dt == null ? null : dt.toLocalDate();
    }
}
