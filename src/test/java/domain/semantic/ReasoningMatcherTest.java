package domain.semantic;

import domain.mapping.CandidateOrigin;
import domain.mapping.CellPosition;
import domain.mapping.MappingCandidate;
import domain.mapping.MappingContext;
import domain.mapping.MatchRequest;
import domain.mapping.TemplateFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 외부 추론 matcher 두 종류. 서비스는 람다로 대신한다.
 */
class ReasoningMatcherTest {

    private static MatchRequest request(List<String> columns) {
        return new MatchRequest(TemplateFixtures.profileCard(), columns, MappingContext.empty());
    }

    @Test
    void template_structure_uses_reported_data_position() {
        ReasoningService svc = prompt -> "{\"matches\": [{\"sourceColumn\": \"핸드폰\", \"labelText\": \"연락처\", "
                + "\"labelRow\": 1, \"labelCol\": 2, \"dataRow\": 1, \"dataCol\": 3, \"confidence\": 0.9}]}";
        TemplateStructureMatcher matcher = new TemplateStructureMatcher(Optional.of(svc));

        List<MappingCandidate> out = matcher.match(request(List.of("핸드폰")));

        assertEquals(1, out.size());
        assertEquals(CellPosition.of(1, 3), out.get(0).getTarget());
        assertEquals(CandidateOrigin.TEMPLATE_STRUCTURE, out.get(0).getOrigin());
        assertEquals(0.9, out.get(0).getConfidence(), 1e-9);
    }

    @Test
    void template_structure_locates_data_cell_from_label_when_position_missing() {
        ReasoningService svc = prompt -> "{\"matches\": [{\"sourceColumn\": \"mail\", \"labelText\": \"이메일\"}]}";
        TemplateStructureMatcher matcher = new TemplateStructureMatcher(Optional.of(svc));

        List<MappingCandidate> out = matcher.match(request(List.of("mail")));

        assertEquals(1, out.size());
        assertEquals(CellPosition.of(2, 1), out.get(0).getTarget());
        assertEquals(0.7, out.get(0).getConfidence(), 1e-9);
    }

    @Test
    void column_semantics_maps_synonym_through_label_and_includes_context_in_prompt() {
        AtomicReference<String> seen = new AtomicReference<>();
        ReasoningService svc = prompt -> {
            seen.set(prompt);
            return "{\"matches\": [{\"sourceColumn\": \"이름\", \"labelText\": \"성명\", \"labelRow\": 1, \"labelCol\": 0, \"confidence\": 1.7}]}";
        };
        MappingContext ctx = new MappingContext("참여자 명단", List.of(), Map.of("성명", List.of("이름")), List.of());
        ColumnSemanticsMatcher matcher = new ColumnSemanticsMatcher(Optional.of(svc));

        List<MappingCandidate> out = matcher.match(new MatchRequest(TemplateFixtures.profileCard(), List.of("이름"), ctx));

        assertEquals(1, out.size());
        assertEquals(CellPosition.of(1, 1), out.get(0).getTarget());
        assertEquals(1.0, out.get(0).getConfidence(), 1e-9);
        assertTrue(seen.get().contains("\"성명\""));
        assertTrue(seen.get().contains("참여자 명단"));
    }

    @Test
    void unknown_columns_and_duplicate_reports_are_dropped() {
        ReasoningService svc = prompt -> "{\"matches\": ["
                + "{\"sourceColumn\": \"없는컬럼\", \"labelText\": \"성명\"},"
                + "{\"sourceColumn\": \"이름\", \"labelText\": \"성명\"},"
                + "{\"sourceColumn\": \"이름\", \"labelText\": \"연락처\"}]}";
        ColumnSemanticsMatcher matcher = new ColumnSemanticsMatcher(Optional.of(svc));

        List<MappingCandidate> out = matcher.match(request(List.of("이름")));

        assertEquals(1, out.size());
        assertEquals(CellPosition.of(1, 1), out.get(0).getTarget());
    }

    @Test
    void failing_service_yields_no_candidates() {
        ReasoningService svc = prompt -> {
            throw new IllegalStateException("quota exceeded");
        };
        assertTrue(new TemplateStructureMatcher(Optional.of(svc)).match(request(List.of("성명"))).isEmpty());
        assertTrue(new ColumnSemanticsMatcher(Optional.of(svc)).match(request(List.of("성명"))).isEmpty());
    }

    @Test
    void missing_service_is_not_available() {
        ColumnSemanticsMatcher matcher = new ColumnSemanticsMatcher(Optional.empty());
        assertFalse(matcher.isAvailable());
        assertTrue(matcher.match(request(List.of("성명"))).isEmpty());
    }
}
