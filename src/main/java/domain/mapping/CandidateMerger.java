package domain.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 여러 matcher 후보를 컬럼당 하나로 합친다.
 *
 * <p>같은 셀을 가리키는 후보 수(vote)가 가장 많은 셀을 고르고, 동률이면 신뢰도 합이 큰 쪽.
 * 합의한 후보 수만큼 신뢰도를 올린다: min(1.0, c + step * (votes - 1)).</p>
 */
public final class CandidateMerger {

    private static final Logger log = LoggerFactory.getLogger(CandidateMerger.class);

    private final double consensusStep;

    public CandidateMerger() {
        this(MatchingHeuristics.defaults().getConsensusStep());
    }

    public CandidateMerger(double consensusStep) {
        this.consensusStep = consensusStep;
    }

    /** 결과 순서는 컬럼이 처음 등장한 순서. */
    public List<MappingCandidate> merge(List<MappingCandidate> candidates) {
        Map<String, List<MappingCandidate>> byColumn = new LinkedHashMap<>();
        for (MappingCandidate c : candidates) {
            byColumn.computeIfAbsent(c.getSourceColumn(), k -> new ArrayList<>()).add(c);
        }

        List<MappingCandidate> out = new ArrayList<>(byColumn.size());
        for (Map.Entry<String, List<MappingCandidate>> e : byColumn.entrySet()) {
            List<MappingCandidate> group = e.getValue();
            if (group.size() == 1) {
                out.add(group.get(0));
                continue;
            }
            out.add(vote(group));
        }

        log.info("[MERGE] candidates={}, columns={}", candidates.size(), out.size());
        return out;
    }

    private MappingCandidate vote(List<MappingCandidate> group) {
        Map<CellPosition, List<MappingCandidate>> byCell = new LinkedHashMap<>();
        for (MappingCandidate c : group) {
            byCell.computeIfAbsent(c.getTarget(), k -> new ArrayList<>()).add(c);
        }

        List<MappingCandidate> winner = null;
        double winnerSum = 0.0;
        for (List<MappingCandidate> sub : byCell.values()) {
            double sum = 0.0;
            for (MappingCandidate c : sub) sum += c.getConfidence();

            if (winner == null
                    || sub.size() > winner.size()
                    || (sub.size() == winner.size() && sum > winnerSum)) {
                winner = sub;
                winnerSum = sum;
            }
        }

        MappingCandidate best = winner.get(0);
        for (MappingCandidate c : winner) {
            if (c.getConfidence() > best.getConfidence()) best = c;
        }

        int votes = winner.size();
        double boosted = Math.min(1.0, best.getConfidence() + consensusStep * (votes - 1));
        String reason = votes > 1 ? votes + "개 소스 동의: " + best.getReason() : best.getReason();
        log.debug("[MERGE] \"{}\" -> {} votes={}, confidence {} -> {}",
                best.getSourceColumn(), best.getTarget(), votes, best.getConfidence(), boosted);
        return best.withConfidence(boosted, reason);
    }
}
