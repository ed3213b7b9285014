package domain.mapping;

import java.util.List;

/** greedy 단계의 결과: 새로 만든 후보 + 갱신된 ledger. */
public final class MatchOutcome {

    private final List<MappingCandidate> candidates;
    private final MatchLedger ledger;

    public MatchOutcome(List<MappingCandidate> candidates, MatchLedger ledger) {
        this.candidates = List.copyOf(candidates);
        this.ledger = ledger;
    }

    public List<MappingCandidate> getCandidates() {
        return candidates;
    }

    public MatchLedger getLedger() {
        return ledger;
    }
}
