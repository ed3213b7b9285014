package domain.pipeline;

import domain.grid.Grid;
import domain.grid.GridReadException;
import domain.header.HeaderAnalysisResult;
import domain.header.HeaderInferenceEngine;
import domain.mapping.CandidateMatcher;
import domain.mapping.CandidateMerger;
import domain.mapping.FinalizeResult;
import domain.mapping.MappingCandidate;
import domain.mapping.MappingContext;
import domain.mapping.MappingFinalizer;
import domain.mapping.MatchRequest;
import domain.model.ListMappingWarningSink;
import domain.model.MappingWarning;
import domain.model.MappingWarningSink;
import domain.model.WarningCode;
import domain.validate.MappingValidator;
import domain.validate.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 헤더 분석 → matcher 병렬 실행 → 병합 → 확정 → 검증.
 *
 * <p>matcher 하나가 예외를 던지거나 timeout 이 나도 나머지 결과로 계속 진행한다.
 * 병합 이후 단계는 동기/순수 함수다.</p>
 */
public final class MappingPipeline {

    private static final Logger log = LoggerFactory.getLogger(MappingPipeline.class);

    public static final Duration DEFAULT_MATCHER_TIMEOUT = Duration.ofSeconds(30);

    private final HeaderInferenceEngine headerEngine;
    private final List<CandidateMatcher> matchers;
    private final CandidateMerger merger;
    private final MappingFinalizer finalizer;
    private final MappingValidator validator;
    private final Executor executor;
    private final Duration matcherTimeout;

    public MappingPipeline(
            HeaderInferenceEngine headerEngine,
            List<CandidateMatcher> matchers,
            CandidateMerger merger,
            MappingFinalizer finalizer,
            MappingValidator validator,
            Executor executor,
            Duration matcherTimeout
    ) {
        this.headerEngine = headerEngine;
        this.matchers = List.copyOf(matchers);
        this.merger = merger;
        this.finalizer = finalizer;
        this.validator = validator;
        this.executor = executor;
        this.matcherTimeout = (matcherTimeout == null || matcherTimeout.isZero() || matcherTimeout.isNegative())
                ? DEFAULT_MATCHER_TIMEOUT
                : matcherTimeout;
    }

    /**
     * spreadsheet 헤더를 분석한 뒤 매핑.
     *
     * @throws GridReadException 컬럼을 하나도 얻지 못한 경우
     */
    public PipelineResult run(Grid spreadsheet, Grid template, MappingContext context) {
        List<MappingWarning> warnings = new ArrayList<>();
        ListMappingWarningSink sink = new ListMappingWarningSink(warnings);

        HeaderAnalysisResult header = headerEngine.analyze(spreadsheet, sink);
        if (header.getColumns().isEmpty()) {
            throw new GridReadException("No columns could be derived from the spreadsheet header");
        }
        return map(header, header.getColumnNames(), template, context, sink);
    }

    /** 컬럼 목록이 이미 있을 때. */
    public PipelineResult mapColumns(List<String> columns, Grid template, MappingContext context) {
        List<MappingWarning> warnings = new ArrayList<>();
        return map(null, columns, template, context, new ListMappingWarningSink(warnings));
    }

    private PipelineResult map(
            HeaderAnalysisResult header,
            List<String> columns,
            Grid template,
            MappingContext context,
            ListMappingWarningSink sink
    ) {
        MatchRequest request = new MatchRequest(template, columns, context);

        List<MappingCandidate> candidates = collectCandidates(request, sink);
        List<MappingCandidate> merged = merger.merge(candidates);
        FinalizeResult finalized = finalizer.finalizeMappings(merged, template);
        finalized.getRejections().forEach(sink::warn);
        ValidationResult validation = validator.validate(finalized.getMappings(), columns, template);

        log.info("[PIPELINE] columns={}, candidates={}, merged={}, final={}, issues={}, valid={}",
                columns.size(), candidates.size(), merged.size(),
                finalized.getMappings().size(), finalized.getIssues().size(), validation.isValid());

        return new PipelineResult(header, columns, candidates, merged, finalized, validation, sink.snapshot());
    }

    /**
     * matcher 를 모두 동시에 제출하고 전부 끝날 때까지 기다린다. 결과는 matcher 등록 순서로 이어 붙인다.
     */
    List<MappingCandidate> collectCandidates(MatchRequest request, MappingWarningSink sink) {
        List<CompletableFuture<List<MappingCandidate>>> futures = new ArrayList<>(matchers.size());

        for (CandidateMatcher matcher : matchers) {
            String tag = matcher.origin().code();
            if (!matcher.isAvailable()) {
                sink.warn(MappingWarning.of(WarningCode.MATCHER_SKIPPED, "", tag + " matcher not configured"));
                futures.add(CompletableFuture.completedFuture(List.of()));
                continue;
            }

            CompletableFuture<List<MappingCandidate>> f = CompletableFuture
                    .supplyAsync(() -> nullToEmpty(matcher.match(request)), executor)
                    .orTimeout(matcherTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> {
                        Throwable cause = unwrap(ex);
                        String reason = (cause instanceof TimeoutException)
                                ? "timed out after " + matcherTimeout.toMillis() + "ms"
                                : cause.getClass().getSimpleName() + ": " + cause.getMessage();
                        log.error("[PIPELINE] {} matcher failed, continuing without it: {}", tag, reason);
                        sink.warn(new MappingWarning(WarningCode.MATCHER_FAILED, "", tag + " matcher failed", reason));
                        return List.of();
                    });
            futures.add(f);
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<MappingCandidate> all = new ArrayList<>();
        for (CompletableFuture<List<MappingCandidate>> f : futures) {
            all.addAll(f.join());
        }
        return all;
    }

    private static List<MappingCandidate> nullToEmpty(List<MappingCandidate> l) {
        return l == null ? List.of() : l;
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable t = ex;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
