package domain.header;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 메타데이터 행 탐지 결과 ("Key: value" 형태의 행). */
public final class MetadataScan {

    private final List<Integer> metaRows;
    private final Map<String, String> metaInfo;

    public MetadataScan(List<Integer> metaRows, Map<String, String> metaInfo) {
        this.metaRows = metaRows == null ? List.of() : List.copyOf(metaRows);
        this.metaInfo = metaInfo == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metaInfo));
    }

    public List<Integer> getMetaRows() {
        return metaRows;
    }

    public Map<String, String> getMetaInfo() {
        return metaInfo;
    }
}
