package domain.grid;

import java.util.List;

/**
 * 원본 spreadsheet 를 {@link Grid} (origin=1) 로 읽는 포트.
 *
 * <p>구현은 rich text / 수식 결과를 평문으로, 날짜를 YYYY-MM-DD 로 정규화하고
 * 병합 영역을 anchor 셀의 span 으로 표현해야 한다.</p>
 */
public interface SpreadsheetReader {

    /**
     * @param sheetSelector sheet 이름. null/blank 이면 첫 sheet.
     * @throws GridReadException 손상된 입력, 없는 sheet
     */
    Grid read(byte[] bytes, String sheetSelector);

    List<String> sheetNames(byte[] bytes);
}
