package domain.grid;

/**
 * template 셀이 라벨(header)인지 데이터 칸인지 판정하는 정책.
 *
 * <p>template 형식마다 시각적 단서(배경색, 테두리 스타일 등)가 달라서 reader 쪽에서 주입한다.</p>
 */
public interface CellRoleClassifier {

    /**
     * @param text       trim 된 셀 텍스트
     * @param styleRef   서식 참조 id (없으면 0)
     */
    boolean isHeader(String text, int styleRef);
}
