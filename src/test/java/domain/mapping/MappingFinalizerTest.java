package domain.mapping;

import domain.grid.Grid;
import domain.model.MappingWarning;
import domain.model.WarningCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MappingFinalizerTest {

    private final MappingFinalizer finalizer = new MappingFinalizer();
    private final Grid template = TemplateFixtures.profileCard();

    private static MappingCandidate cand(String col, int r, int c, double conf) {
        return new MappingCandidate(col, r, c, null, conf, CandidateOrigin.RULE, "test");
    }

    @Test
    void higher_confidence_claims_the_cell_first() {
        FinalizeResult r = finalizer.finalizeMappings(List.of(
                cand("이름", 1, 1, 0.7),
                cand("성명", 1, 1, 0.95)
        ), template);

        assertEquals(List.of(new FinalMapping("성명", 1, 1)), r.getMappings());
        assertEquals(1, r.getRejections().size());
        assertEquals(WarningCode.DUPLICATE_CELL, r.getRejections().get(0).getCode());
        assertEquals("이름", r.getRejections().get(0).getSourceColumn());
    }

    @Test
    void out_of_range_and_low_confidence_are_rejected_with_issues() {
        FinalizeResult r = finalizer.finalizeMappings(List.of(
                cand("2분기_취업처", 19, 2, 0.98),
                cand("국가", 2, 3, 0.4),
                cand("연락처", 1, 3, 0.85)
        ), template);

        assertEquals(List.of(new FinalMapping("연락처", 1, 3)), r.getMappings());
        List<WarningCode> codes = r.getRejections().stream().map(MappingWarning::getCode).toList();
        assertEquals(List.of(WarningCode.OUT_OF_RANGE, WarningCode.LOW_CONFIDENCE), codes);
        assertEquals(2, r.getIssues().size());
    }

    @Test
    void a_column_is_mapped_at_most_once() {
        FinalizeResult r = finalizer.finalizeMappings(List.of(
                cand("성명", 1, 1, 0.95),
                cand("성명", 2, 1, 0.9)
        ), template);

        assertEquals(1, r.getMappings().size());
        assertEquals(WarningCode.DUPLICATE_COLUMN, r.getRejections().get(0).getCode());
    }

    @Test
    void floor_is_inclusive() {
        FinalizeResult r = finalizer.finalizeMappings(List.of(cand("성명", 1, 1, 0.5)), template);
        assertEquals(1, r.getMappings().size());
    }

    @Test
    void confidence_outside_unit_interval_is_rejected_on_construction() {
        assertThrows(IllegalArgumentException.class, () -> cand("x", 0, 0, 1.2));
        assertThrows(IllegalArgumentException.class, () -> cand("x", 0, 0, -0.1));
    }
}
