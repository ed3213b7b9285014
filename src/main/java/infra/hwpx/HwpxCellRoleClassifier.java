package infra.hwpx;

import domain.grid.CellRoleClassifier;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 한글(HWPX) 양식 셀의 라벨/데이터 판정.
 *
 * <p>판정 순서 (먼저 걸리는 규칙이 이긴다):</p>
 * <ol>
 *   <li>섹션 제목 ("1. 신상정보", 개인이력카드) → header</li>
 *   <li>데이터 값처럼 보이는 텍스트 (이메일, 전화번호, 날짜, 2~4자 한글 이름) → data</li>
 *   <li>빈 칸, "-" → data</li>
 *   <li>알려진 라벨 텍스트 → header</li>
 *   <li>borderFillIDRef 8/9/11 → header, 10 → data</li>
 *   <li>그 외 6자 이하 → header</li>
 * </ol>
 */
public final class HwpxCellRoleClassifier implements CellRoleClassifier {

    public static final List<String> DEFAULT_LABELS = List.of(
            "성명", "성 명", "성  명", "생년월일", "성별", "성 별", "성  별", "연락처", "이메일", "거주지",
            "참여분야", "수행기관", "사업명", "참여기간", "국가", "직무",
            "희망직종", "희망직무", "구 분", "구분",
            "취업여부", "취업처", "취 업 처", "담당직무",
            "핵심 세미나", "전문가 컨설팅", "실전 모의면접",
            "1회", "2회", "3회", "4회", "5회", "6회", "7회",
            "1분기", "2분기", "3분기", "4분기",
            "해외취업", "사전참여여부"
    );

    private static final Pattern SECTION_TITLE = Pattern.compile("^\\d+\\.\\s*.*", Pattern.DOTALL);
    private static final Pattern PHONE = Pattern.compile("^\\d{2,4}[-\\s]?\\d{3,4}[-\\s]?\\d{4}$");
    private static final Pattern DATE = Pattern.compile("^\\d{4}[-/]\\d{1,2}[-/]\\d{1,2}$");
    private static final Pattern HANGUL_NAME = Pattern.compile("^[가-힣]{2,4}$");
    private static final Pattern WS = Pattern.compile("\\s+");

    private static final Set<Integer> HEADER_FILLS = Set.of(8, 9, 11);
    private static final int DATA_FILL = 10;
    private static final int SHORT_LABEL_MAX = 6;

    private final Set<String> labels;
    private final Set<String> documentTitles;

    public HwpxCellRoleClassifier() {
        this(DEFAULT_LABELS, Set.of("개인이력카드"));
    }

    public HwpxCellRoleClassifier(List<String> labels, Set<String> documentTitles) {
        this.labels = labels == null ? Set.of()
                : labels.stream().map(HwpxCellRoleClassifier::squash).collect(Collectors.toUnmodifiableSet());
        this.documentTitles = documentTitles == null ? Set.of() : Set.copyOf(documentTitles);
    }

    @Override
    public boolean isHeader(String text, int styleRef) {
        String t = text == null ? "" : text.trim();

        if (SECTION_TITLE.matcher(t).matches() || documentTitles.contains(t)) return true;

        boolean label = !t.isEmpty() && labels.contains(squash(t));
        if (looksLikeValue(t, label)) return false;
        if (t.isEmpty() || "-".equals(t)) return false;
        if (label) return true;

        if (HEADER_FILLS.contains(styleRef)) return true;
        if (styleRef == DATA_FILL) return false;

        return t.length() <= SHORT_LABEL_MAX;
    }

    private static boolean looksLikeValue(String t, boolean label) {
        if (t.isEmpty()) return false;
        if (t.contains("@")) return true;
        if (PHONE.matcher(WS.matcher(t).replaceAll("")).matches()) return true;
        if (DATE.matcher(t).matches()) return true;
        return !label && HANGUL_NAME.matcher(t).matches();
    }

    private static String squash(String s) {
        return WS.matcher(s == null ? "" : s).replaceAll("");
    }
}
