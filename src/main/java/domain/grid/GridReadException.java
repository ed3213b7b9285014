package domain.grid;

/**
 * 입력 파일 자체를 읽을 수 없는 경우 (손상된 workbook/template, 없는 sheet,
 * 표가 없는 template, 컬럼이 하나도 없는 sheet).
 *
 * <p>매핑 파이프라인에서 유일하게 실행을 중단시키는 예외다.</p>
 */
public class GridReadException extends RuntimeException {

    public GridReadException(String message) {
        super(message);
    }

    public GridReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
