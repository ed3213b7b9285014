package domain.pipeline;

import domain.grid.Grid;
import domain.grid.GridCell;
import domain.grid.GridReadException;
import domain.header.HeaderInferenceEngine;
import domain.mapping.CandidateMatcher;
import domain.mapping.CandidateMerger;
import domain.mapping.CandidateOrigin;
import domain.mapping.FinalMapping;
import domain.mapping.MappingCandidate;
import domain.mapping.MappingContext;
import domain.mapping.MappingFinalizer;
import domain.mapping.MatchRequest;
import domain.mapping.MatchingHeuristics;
import domain.mapping.SpatialRuleMatcher;
import domain.mapping.TemplateFixtures;
import domain.model.MappingWarning;
import domain.model.WarningCode;
import domain.validate.MappingValidator;
import domain.validate.RequiredField;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class MappingPipelineTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(3);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Grid sheet() {
        return Grid.builder()
                .origin(1)
                .add(GridCell.of(1, 1, "No"))
                .add(GridCell.of(1, 2, "성명"))
                .add(GridCell.of(1, 3, "연락처"))
                .add(GridCell.of(1, 4, "이메일"))
                .add(GridCell.of(2, 1, "1"))
                .add(GridCell.of(2, 2, "홍길동"))
                .add(GridCell.of(2, 3, "010-1234-5678"))
                .add(GridCell.of(2, 4, "hong@example.com"))
                .build();
    }

    private MappingPipeline pipeline(List<CandidateMatcher> matchers, Duration timeout) {
        return new MappingPipeline(
                new HeaderInferenceEngine(),
                matchers,
                new CandidateMerger(),
                new MappingFinalizer(),
                new MappingValidator(
                        List.of(RequiredField.of("성명", "이름"), RequiredField.of("생년월일")),
                        MatchingHeuristics.defaults()),
                executor,
                timeout);
    }

    private static CandidateMatcher matcher(CandidateOrigin origin, java.util.function.Function<MatchRequest, List<MappingCandidate>> fn) {
        return new CandidateMatcher() {
            @Override
            public CandidateOrigin origin() {
                return origin;
            }

            @Override
            public List<MappingCandidate> match(MatchRequest request) {
                return fn.apply(request);
            }
        };
    }

    private static List<WarningCode> codes(PipelineResult r) {
        return r.getWarnings().stream().map(MappingWarning::getCode).toList();
    }

    @Test
    void rule_matcher_alone_maps_labelled_columns() {
        PipelineResult r = pipeline(List.of(new SpatialRuleMatcher()), null)
                .run(sheet(), TemplateFixtures.profileCard(), MappingContext.empty());

        assertEquals(List.of("No", "성명", "연락처", "이메일"), r.getColumns());
        assertEquals(3, r.getMappings().size());
        assertTrue(r.getMappings().contains(new FinalMapping("성명", 1, 1)));
        assertTrue(r.getMappings().contains(new FinalMapping("연락처", 1, 3)));
        assertTrue(r.getMappings().contains(new FinalMapping("이메일", 2, 1)));
        assertEquals(2, r.getValidation().getTotalRequiredFields());
        assertEquals(1, r.getValidation().getMissingFields());
        assertNotNull(r.getHeader());
    }

    @Test
    void failing_matcher_does_not_change_rule_result() {
        PipelineResult ruleOnly = pipeline(List.of(new SpatialRuleMatcher()), null)
                .run(sheet(), TemplateFixtures.profileCard(), MappingContext.empty());

        CandidateMatcher broken = matcher(CandidateOrigin.TEMPLATE_STRUCTURE, req -> {
            throw new IllegalStateException("boom");
        });
        PipelineResult withBroken = pipeline(List.of(new SpatialRuleMatcher(), broken), null)
                .run(sheet(), TemplateFixtures.profileCard(), MappingContext.empty());

        assertEquals(ruleOnly.getMappings(), withBroken.getMappings());
        assertTrue(codes(withBroken).contains(WarningCode.MATCHER_FAILED));
    }

    @Test
    void slow_matcher_is_abandoned_after_timeout() {
        CandidateMatcher slow = matcher(CandidateOrigin.COLUMN_SEMANTICS, req -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(new MappingCandidate("No", 4, 0, null, 0.99, CandidateOrigin.COLUMN_SEMANTICS, "late"));
        });

        long start = System.nanoTime();
        PipelineResult r = pipeline(List.of(new SpatialRuleMatcher(), slow), Duration.ofMillis(200))
                .run(sheet(), TemplateFixtures.profileCard(), MappingContext.empty());
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs < 4_000, "elapsed=" + elapsedMs);
        assertEquals(3, r.getMappings().size());
        assertTrue(codes(r).contains(WarningCode.MATCHER_FAILED));
    }

    @Test
    void unavailable_matcher_is_skipped_with_warning() {
        CandidateMatcher off = new CandidateMatcher() {
            @Override
            public CandidateOrigin origin() {
                return CandidateOrigin.COLUMN_SEMANTICS;
            }

            @Override
            public boolean isAvailable() {
                return false;
            }

            @Override
            public List<MappingCandidate> match(MatchRequest request) {
                throw new AssertionError("must not be called");
            }
        };

        PipelineResult r = pipeline(List.of(new SpatialRuleMatcher(), off), null)
                .run(sheet(), TemplateFixtures.profileCard(), MappingContext.empty());

        assertEquals(List.of(WarningCode.MATCHER_SKIPPED), codes(r));
    }

    @Test
    void conflicting_candidates_end_up_unique_and_above_floor() {
        CandidateMatcher noisy = matcher(CandidateOrigin.TEMPLATE_STRUCTURE, req -> List.of(
                new MappingCandidate("No", 1, 1, null, 0.6, CandidateOrigin.TEMPLATE_STRUCTURE, "same cell as 성명"),
                new MappingCandidate("연락처", 30, 30, null, 0.9, CandidateOrigin.TEMPLATE_STRUCTURE, "outside"),
                new MappingCandidate("이메일", 2, 3, null, 0.3, CandidateOrigin.TEMPLATE_STRUCTURE, "weak")
        ));

        PipelineResult r = pipeline(List.of(new SpatialRuleMatcher(), noisy), null)
                .run(sheet(), TemplateFixtures.profileCard(), MappingContext.empty());

        Set<String> columns = new HashSet<>();
        Set<Object> cells = new HashSet<>();
        for (FinalMapping m : r.getMappings()) {
            assertTrue(columns.add(m.getSourceColumn()), "duplicate column " + m);
            assertTrue(cells.add(m.getTarget()), "duplicate cell " + m);
            assertTrue(TemplateFixtures.profileCard().contains(m.getTargetRow(), m.getTargetCol()));
        }
        for (MappingCandidate c : r.getMergedCandidates()) {
            if (r.getMappings().contains(new FinalMapping(c.getSourceColumn(), c.getTargetRow(), c.getTargetCol()))) {
                assertTrue(c.getConfidence() >= 0.5);
            }
        }
        assertFalse(r.getMappings().contains(new FinalMapping("No", 1, 1)));
        assertTrue(codes(r).contains(WarningCode.DUPLICATE_CELL));
    }

    @Test
    void sheet_without_columns_is_rejected() {
        MappingPipeline p = pipeline(List.of(new SpatialRuleMatcher()), null);
        assertThrows(GridReadException.class,
                () -> p.run(Grid.empty(1), TemplateFixtures.profileCard(), MappingContext.empty()));
    }

    @Test
    void explicit_column_list_skips_header_analysis() {
        PipelineResult r = pipeline(new ArrayList<>(List.of(new SpatialRuleMatcher())), null)
                .mapColumns(List.of("이름", "생년월일"), TemplateFixtures.profileCard(), MappingContext.empty());

        assertNull(r.getHeader());
        assertEquals(List.of(new FinalMapping("생년월일", 2, 3)), r.getMappings());
        assertEquals(1, r.getValidation().getMissingFields());
    }
}
