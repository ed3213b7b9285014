package domain.header;

import java.util.Set;

/** 컬럼 이름 충돌 처리. */
final class ColumnNames {

    private ColumnNames() {
    }

    /**
     * 이미 쓰인 이름이면 _2, _3 ... 을 붙여 비어있는 첫 이름을 고르고 {@code seen} 에 등록한다.
     */
    static String unique(String name, Set<String> seen) {
        String candidate = name;
        int n = 2;
        while (seen.contains(candidate)) {
            candidate = name + "_" + n++;
        }
        seen.add(candidate);
        return candidate;
    }
}
