package domain.grid;

/** 구조화된 문서 template 를 표(Grid, origin=0) 목록으로 읽는 포트. */
public interface TemplateGridReader {

    /**
     * @throws GridReadException template 을 읽을 수 없는 경우
     */
    TemplateDocument read(byte[] bytes, String fileName);
}
