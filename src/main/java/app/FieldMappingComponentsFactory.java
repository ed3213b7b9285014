package app;

import cli.CliArgParser.ReportFormat;
import domain.grid.SpreadsheetReader;
import domain.grid.TemplateGridReader;
import domain.header.HeaderInferenceEngine;
import domain.mapping.CandidateMatcher;
import domain.mapping.CandidateMerger;
import domain.mapping.MappingContext;
import domain.mapping.MappingFinalizer;
import domain.mapping.MatchingHeuristics;
import domain.mapping.SpatialRuleMatcher;
import domain.output.MappingReportWriter;
import domain.pipeline.FieldMappingService;
import domain.pipeline.MappingPipeline;
import domain.profile.HeuristicProfile;
import domain.semantic.ColumnSemanticsMatcher;
import domain.semantic.ReasoningResponseParser;
import domain.semantic.ReasoningService;
import domain.semantic.TemplateStructureMatcher;
import domain.validate.MappingValidator;
import infra.config.HeuristicProfileJsonLoader;
import infra.config.MappingContextJsonLoader;
import infra.hwpx.HwpxTemplateReader;
import infra.output.JsonMappingReportWriter;
import infra.output.MappingReportXlsxWriter;
import infra.output.NullMappingReportWriter;
import infra.reasoning.ReasoningConfig;
import infra.reasoning.ReasoningServiceFactory;
import infra.sheet.CsvSpreadsheetReader;
import infra.sheet.PoiSpreadsheetReader;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Object-assembly factory for {@link FieldMappingCliApp}.
 * <p>
 * CLI app 은 진행 출력과 흐름만 맡고, 객체 생성과 초기화는 여기서 한다.
 */
final class FieldMappingComponentsFactory {

    HeuristicProfile loadProfile(Path profilePath) {
        if (profilePath == null) return HeuristicProfile.defaults();
        return new HeuristicProfileJsonLoader().load(profilePath);
    }

    MappingContext loadContext(Path contextPath) {
        if (contextPath == null) return MappingContext.empty();
        return new MappingContextJsonLoader().load(contextPath);
    }

    SpreadsheetReader createSpreadsheetReader(Path dataPath) {
        String name = dataPath == null ? "" : dataPath.getFileName()
                .toString()
                .toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) return new CsvSpreadsheetReader();
        return new PoiSpreadsheetReader();
    }

    TemplateGridReader createTemplateReader() {
        return new HwpxTemplateReader();
    }

    Optional<ReasoningService> createReasoningService(ReasoningConfig config, boolean enable) {
        if (!enable) return Optional.empty();
        return ReasoningServiceFactory.create(config);
    }

    MappingPipeline createPipeline(HeuristicProfile profile,
                                   Optional<ReasoningService> reasoning,
                                   Executor executor,
                                   Duration matcherTimeout) {
        MatchingHeuristics matching = profile.getMatching();
        ReasoningResponseParser parser = new ReasoningResponseParser();

        List<CandidateMatcher> matchers = List.of(
                new SpatialRuleMatcher(matching),
                new TemplateStructureMatcher(reasoning, parser, matching),
                new ColumnSemanticsMatcher(reasoning, parser, matching)
        );

        return new MappingPipeline(
                new HeaderInferenceEngine(profile.getHeader()),
                matchers,
                new CandidateMerger(matching.getConsensusStep()),
                new MappingFinalizer(matching.getConfidenceFloor()),
                new MappingValidator(profile.getRequiredFields(), matching),
                executor,
                matcherTimeout
        );
    }

    FieldMappingService createService(TemplateGridReader templateReader,
                                      SpreadsheetReader spreadsheetReader,
                                      MappingPipeline pipeline) {
        return new FieldMappingService(templateReader, spreadsheetReader, pipeline);
    }

    MappingReportWriter createReportWriter(ReportFormat format, boolean enable) {
        if (!enable) return new NullMappingReportWriter();
        if (format == null) format = ReportFormat.XLSX;

        return switch (format) {
            case XLSX -> new MappingReportXlsxWriter();
            case JSON -> new JsonMappingReportWriter();
        };
    }
}
