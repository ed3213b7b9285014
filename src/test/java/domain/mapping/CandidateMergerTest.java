package domain.mapping;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CandidateMergerTest {

    private final CandidateMerger merger = new CandidateMerger();

    private static MappingCandidate cand(String col, int r, int c, double conf, CandidateOrigin origin) {
        return new MappingCandidate(col, r, c, null, conf, origin, origin.code());
    }

    @Test
    void agreeing_sources_boost_the_best_confidence() {
        List<MappingCandidate> merged = merger.merge(List.of(
                cand("성명", 1, 1, 0.85, CandidateOrigin.RULE),
                cand("성명", 1, 1, 0.7, CandidateOrigin.TEMPLATE_STRUCTURE)
        ));

        assertEquals(1, merged.size());
        assertEquals(0.95, merged.get(0).getConfidence(), 1e-9);
        assertEquals(CandidateOrigin.RULE, merged.get(0).getOrigin());
        assertTrue(merged.get(0).getReason().startsWith("2개 소스 동의"));
    }

    @Test
    void majority_cell_wins_over_single_higher_confidence() {
        List<MappingCandidate> merged = merger.merge(List.of(
                cand("연락처", 1, 3, 0.95, CandidateOrigin.RULE),
                cand("연락처", 2, 3, 0.7, CandidateOrigin.TEMPLATE_STRUCTURE),
                cand("연락처", 2, 3, 0.6, CandidateOrigin.COLUMN_SEMANTICS)
        ));

        assertEquals(CellPosition.of(2, 3), merged.get(0).getTarget());
        assertEquals(0.8, merged.get(0).getConfidence(), 1e-9);
    }

    @Test
    void tie_on_votes_goes_to_higher_confidence_sum() {
        List<MappingCandidate> merged = merger.merge(List.of(
                cand("이메일", 2, 1, 0.7, CandidateOrigin.TEMPLATE_STRUCTURE),
                cand("이메일", 3, 1, 0.9, CandidateOrigin.RULE)
        ));

        assertEquals(CellPosition.of(3, 1), merged.get(0).getTarget());
        assertEquals(0.9, merged.get(0).getConfidence(), 1e-9);
    }

    @Test
    void single_vote_winner_keeps_its_own_reason() {
        List<MappingCandidate> merged = merger.merge(List.of(
                cand("이메일", 2, 1, 0.7, CandidateOrigin.TEMPLATE_STRUCTURE),
                cand("이메일", 3, 1, 0.9, CandidateOrigin.RULE)
        ));

        assertEquals("rule", merged.get(0).getReason());
    }

    @Test
    void boost_is_capped_at_one_and_single_candidates_pass_through() {
        MappingCandidate single = cand("국가", 5, 1, 0.4, CandidateOrigin.COLUMN_SEMANTICS);
        List<MappingCandidate> merged = merger.merge(List.of(
                cand("성명", 1, 1, 0.98, CandidateOrigin.RULE),
                cand("성명", 1, 1, 0.95, CandidateOrigin.TEMPLATE_STRUCTURE),
                cand("성명", 1, 1, 0.9, CandidateOrigin.COLUMN_SEMANTICS),
                single
        ));

        assertEquals(2, merged.size());
        assertEquals(1.0, merged.get(0).getConfidence(), 1e-9);
        assertSame(single, merged.get(1));
    }
}
