package domain.mapping;

import domain.grid.Grid;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SpatialRuleMatcherTest {

    private final SpatialRuleMatcher matcher = new SpatialRuleMatcher();

    private static Map<String, MappingCandidate> byColumn(List<MappingCandidate> candidates) {
        return candidates.stream().collect(Collectors.toMap(MappingCandidate::getSourceColumn, c -> c));
    }

    @Test
    void exact_label_maps_to_cell_on_the_right() {
        List<MappingCandidate> out = matcher.match(new MatchRequest(
                TemplateFixtures.profileCard(), List.of("성명", "연락처"), MappingContext.empty()));

        Map<String, MappingCandidate> m = byColumn(out);
        assertEquals(CellPosition.of(1, 1), m.get("성명").getTarget());
        assertEquals(0.95, m.get("성명").getConfidence(), 1e-9);
        assertEquals(CellPosition.of(1, 3), m.get("연락처").getTarget());
        assertEquals(CandidateOrigin.RULE, m.get("성명").getOrigin());
    }

    @Test
    void containment_match_gets_partial_confidence() {
        List<MappingCandidate> out = matcher.match(new MatchRequest(
                TemplateFixtures.profileCard(), List.of("이메일 주소"), MappingContext.empty()));

        assertEquals(1, out.size());
        assertEquals(CellPosition.of(2, 1), out.get(0).getTarget());
        assertEquals(0.85, out.get(0).getConfidence(), 1e-9);
        assertEquals("이메일", out.get(0).getLabelText());
    }

    @Test
    void label_spanning_the_row_uses_cell_below() {
        List<MappingCandidate> out = matcher.match(new MatchRequest(
                TemplateFixtures.profileCard(), List.of("희망 직무"), MappingContext.empty()));

        assertEquals(1, out.size());
        assertEquals(CellPosition.of(4, 0), out.get(0).getTarget());
    }

    @Test
    void section_titles_and_single_char_columns_are_never_matched() {
        List<MappingCandidate> out = matcher.match(new MatchRequest(
                TemplateFixtures.profileCard(), List.of("신상정보", "X"), MappingContext.empty()));

        assertTrue(out.isEmpty());
    }

    @Test
    void a_cell_is_claimed_only_once() {
        List<MappingCandidate> out = matcher.match(new MatchRequest(
                TemplateFixtures.profileCard(), List.of("성명", "성 명"), MappingContext.empty()));

        assertEquals(1, out.size());
        assertEquals("성명", out.get(0).getSourceColumn());
    }

    @Test
    void override_rule_places_quarter_columns_at_fixed_cells() {
        MatchOutcome o = matcher.applyOverrides(List.of("3분기_담당직무", "성명"), MatchLedger.empty());

        assertEquals(1, o.getCandidates().size());
        MappingCandidate c = o.getCandidates().get(0);
        assertEquals(CellPosition.of(20, 6), c.getTarget());
        assertEquals(0.98, c.getConfidence(), 1e-9);
        assertTrue(o.getLedger().isColumnUsed("3분기_담당직무"));
        assertTrue(o.getLedger().isCellUsed(CellPosition.of(20, 6)));
    }

    @Test
    void override_skips_cell_already_in_the_ledger() {
        MatchLedger ledger = MatchLedger.empty().claim("other", CellPosition.of(13, 2));

        MatchOutcome o = matcher.applyOverrides(List.of("프로그램 참여현황_전문가 강연_1회"), ledger);

        assertTrue(o.getCandidates().isEmpty());
        assertSame(ledger, o.getLedger());
    }

    @Test
    void label_matching_respects_incoming_ledger_and_does_not_mutate_it() {
        Grid template = TemplateFixtures.profileCard();
        MatchLedger before = MatchLedger.empty().claim("x", CellPosition.of(1, 1));

        MatchOutcome o = matcher.matchLabels(template, List.of("성명", "연락처"), before);

        assertEquals(1, o.getCandidates().size());
        assertEquals("연락처", o.getCandidates().get(0).getSourceColumn());
        assertEquals(1, before.getUsedCells().size());
        assertEquals(2, o.getLedger().getUsedCells().size());
    }
}
