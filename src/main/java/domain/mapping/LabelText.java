package domain.mapping;

import java.util.Locale;

/** 라벨/컬럼명 비교용 정규화. */
public final class LabelText {

    private LabelText() {
    }

    /** 공백 전부 제거 + 소문자. */
    public static String normalize(String s) {
        if (s == null) return "";
        return s.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }

    /** 정규화된 두 문자열이 같거나 한쪽이 다른 쪽을 포함 (포함되는 쪽은 2자 이상). */
    public static boolean overlaps(String normalizedA, String normalizedB) {
        if (normalizedA.isEmpty() || normalizedB.isEmpty()) return false;
        if (normalizedA.equals(normalizedB)) return true;
        return (normalizedB.length() >= 2 && normalizedA.contains(normalizedB))
                || (normalizedA.length() >= 2 && normalizedB.contains(normalizedA));
    }
}
