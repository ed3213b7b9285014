package domain.mapping;

import domain.model.MappingWarning;

import java.util.List;

/** Finalizer 결과: 확정 매핑 + 거부 사유. */
public final class FinalizeResult {

    private final List<FinalMapping> mappings;
    private final List<MappingWarning> rejections;

    public FinalizeResult(List<FinalMapping> mappings, List<MappingWarning> rejections) {
        this.mappings = List.copyOf(mappings);
        this.rejections = List.copyOf(rejections);
    }

    public List<FinalMapping> getMappings() {
        return mappings;
    }

    public List<MappingWarning> getRejections() {
        return rejections;
    }

    /** 사람이 읽는 거부 사유 문자열. */
    public List<String> getIssues() {
        return rejections.stream().map(MappingWarning::getMessage).toList();
    }
}
