package infra.output;

import domain.mapping.CellPosition;
import domain.mapping.FinalMapping;
import domain.mapping.MappingCandidate;
import domain.pipeline.PipelineResult;

import java.util.HashMap;
import java.util.Map;

/** 최종 매핑 → 그 매핑을 만든 merged 후보 (신뢰도, 출처, 사유 표시용). */
final class ReportRows {

    private ReportRows() {
    }

    static Map<FinalMapping, MappingCandidate> candidatesByMapping(PipelineResult result) {
        Map<String, MappingCandidate> byKey = new HashMap<>();
        for (MappingCandidate c : result.getMergedCandidates()) {
            byKey.putIfAbsent(key(c.getSourceColumn(), c.getTarget()), c);
        }
        Map<FinalMapping, MappingCandidate> out = new HashMap<>();
        for (FinalMapping m : result.getMappings()) {
            MappingCandidate c = byKey.get(key(m.getSourceColumn(), m.getTarget()));
            if (c != null) out.put(m, c);
        }
        return out;
    }

    static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String key(String column, CellPosition target) {
        return column + "\u0000" + target;
    }
}
