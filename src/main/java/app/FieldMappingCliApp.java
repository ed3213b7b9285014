package app;

import cli.CliArgParser;
import cli.CliArgParser.ReportFormat;
import cli.CliPathResolver;
import cli.FieldMappingCli;
import domain.grid.GridReadException;
import domain.grid.SpreadsheetReader;
import domain.grid.TemplateGridReader;
import domain.mapping.FinalMapping;
import domain.mapping.MappingContext;
import domain.output.MappingReportWriter;
import domain.pipeline.FieldMappingService;
import domain.pipeline.MappingPipeline;
import domain.pipeline.PipelineResult;
import domain.profile.HeuristicProfile;
import domain.semantic.ReasoningService;
import domain.validate.ValidationIssue;
import infra.reasoning.ReasoningConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/** CLI entry (invoked by {@link FieldMappingCli}). */
public final class FieldMappingCliApp {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final int MATCHER_THREADS = 3;

    private FieldMappingCliApp() {}

    public static void main(String[] args) {
        int code = run(args);
        if (code != EXIT_OK) System.exit(code);
    }

    /** @return process exit status */
    public static int run(String[] args) {
        try {
            return execute(args);
        } catch (GridReadException e) {
            System.out.println("[FAIL] " + safe(e.getMessage()));
            if (e.getCause() != null) {
                System.out.println("       cause=" + e.getCause().getClass().getName() + ": " + safe(e.getCause().getMessage()));
            }
            return EXIT_FAILED;
        } catch (IllegalArgumentException e) {
            System.out.println("[USAGE] " + safe(e.getMessage()));
            printUsage();
            return EXIT_USAGE;
        }
    }

    private static int execute(String[] args) {
        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        if (CliArgParser.flag(argv, "help")) {
            printUsage();
            return EXIT_OK;
        }

        // ------------------------------------------------------------
        // baseDir / input / output
        // ------------------------------------------------------------
        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();

        Path dataPath = CliPathResolver.resolvePath(baseDir, argv.get("data"));
        Path templatePath = CliPathResolver.resolvePath(baseDir, argv.get("template"));
        Path profilePath = CliPathResolver.resolvePath(baseDir, argv.get("profile"));
        Path contextPath = CliPathResolver.resolvePath(baseDir, argv.get("context"));
        String sheet = CliPathResolver.trimToNull(argv.get("sheet"));

        CliPathResolver.validateFileExists(dataPath, "data spreadsheet (--data)");
        CliPathResolver.validateFileExists(templatePath, "template (--template)");
        if (profilePath != null) CliPathResolver.validateFileExists(profilePath, "heuristic profile (--profile)");
        if (contextPath != null) CliPathResolver.validateFileExists(contextPath, "mapping context (--context)");

        ReportFormat format = CliArgParser.parseReportFormat(argv.get("format"), argv.get("out"));
        String ext = format == ReportFormat.JSON ? "json" : "xlsx";
        Path outPath = argv.containsKey("out") && !CliPathResolver.isBlank(argv.get("out"))
                ? CliPathResolver.resolvePath(baseDir, argv.get("out"))
                : CliPathResolver.defaultReportPath(dataPath, ext);

        // ------------------------------------------------------------
        // feature toggles / timeouts
        // ------------------------------------------------------------
        boolean noExternal = CliArgParser.flag(argv, "noExternal");
        boolean noReport = CliArgParser.flag(argv, "noReport");

        ReasoningConfig reasoningConfig = ReasoningConfig.fromEnvironment(System.getenv());
        long timeoutMs = CliArgParser.parseLong(argv.get("timeoutMs"), reasoningConfig.getTimeout().toMillis());
        Duration timeout = Duration.ofMillis(Math.max(1L, timeoutMs));
        reasoningConfig = reasoningConfig.withTimeout(timeout);

        System.out.println("==================================================");
        System.out.println("[START] Field mapping");
        System.out.println("[CONF] baseDir        = " + baseDir);
        System.out.println("[CONF] data           = " + dataPath);
        System.out.println("[CONF] sheet          = " + (sheet == null ? "(first)" : sheet));
        System.out.println("[CONF] template       = " + templatePath);
        System.out.println("[CONF] profile        = " + (profilePath == null ? "(default)" : profilePath));
        System.out.println("[CONF] context        = " + (contextPath == null ? "(none)" : contextPath));
        System.out.println("[CONF] out            = " + outPath);
        System.out.println("[CONF] format         = " + format);
        System.out.println("[CONF] timeoutMs      = " + timeout.toMillis());
        System.out.println("[CONF] enableExternal = " + (!noExternal) + " (use --noExternal)");
        System.out.println("[CONF] reasoning      = " + reasoningConfig);
        System.out.println("[CONF] enableReport   = " + (!noReport) + " (use --noReport)");
        System.out.println("==================================================");

        // ------------------------------------------------------------
        // assemble runtime components
        // ------------------------------------------------------------
        FieldMappingComponentsFactory factory = new FieldMappingComponentsFactory();

        long tConf0 = System.nanoTime();
        HeuristicProfile profile = factory.loadProfile(profilePath);
        MappingContext context = factory.loadContext(contextPath);
        System.out.println("[STEP1] profile '" + profile.getName() + "' / context loaded. elapsed=" + ms(tConf0) + "ms");

        Optional<ReasoningService> reasoning = factory.createReasoningService(reasoningConfig, !noExternal);
        if (reasoning.isEmpty()) {
            System.out.println("[STEP1] external matchers disabled"
                    + (noExternal ? " (--noExternal)" : " (no API key)"));
        }

        SpreadsheetReader sheetReader = factory.createSpreadsheetReader(dataPath);
        TemplateGridReader templateReader = factory.createTemplateReader();
        MappingReportWriter reportWriter = factory.createReportWriter(format, !noReport);

        byte[] dataBytes = readAll(dataPath);
        byte[] templateBytes = readAll(templatePath);

        ExecutorService executor = Executors.newFixedThreadPool(MATCHER_THREADS);
        PipelineResult result;
        try {
            MappingPipeline pipeline = factory.createPipeline(profile, reasoning, executor, timeout);
            FieldMappingService service = factory.createService(templateReader, sheetReader, pipeline);

            long tRun0 = System.nanoTime();
            System.out.println("[STEP2] mapping start...");
            result = service.execute(templateBytes, templatePath.getFileName().toString(), dataBytes, sheet, context);
            System.out.println("[STEP2] mapping done. elapsed=" + ms(tRun0) + "ms");
        } finally {
            executor.shutdownNow();
            awaitQuietly(executor);
        }

        System.out.println("[STAT] columns=" + result.getColumns().size()
                + ", candidates=" + result.getCandidates().size()
                + ", mappings=" + result.getMappings().size()
                + ", issues=" + result.getIssues().size()
                + ", warnings=" + result.getWarnings().size());
        System.out.println("[STAT] required=" + result.getValidation().getTotalRequiredFields()
                + ", mapped=" + result.getValidation().getMappedFields()
                + ", missing=" + result.getValidation().getMissingFields()
                + ", valid=" + result.getValidation().isValid());

        for (FinalMapping m : result.getMappings()) {
            System.out.println("[MAP] " + m.getSourceColumn() + " -> " + m.getTarget());
        }
        for (ValidationIssue issue : result.getValidation().getIssues()) {
            System.out.println("[MISSING] " + issue.getField() + " : " + issue.getMessage());
        }

        if (!noReport) {
            long tOut0 = System.nanoTime();
            System.out.println("[STEP3] writing " + format + " report...");
            reportWriter.write(outPath, result);
            System.out.println("[STEP3] report written: " + outPath + " elapsed=" + ms(tOut0) + "ms");
        } else {
            System.out.println("[STEP3] report skipped (--noReport)");
        }

        System.out.println("==================================================");
        System.out.println("[DONE] totalElapsed=" + ms(t0) + "ms");
        System.out.println("==================================================");
        return EXIT_OK;
    }

    private static byte[] readAll(Path p) {
        try {
            return Files.readAllBytes(p);
        } catch (Exception e) {
            throw new GridReadException("Failed to read file: " + p, e);
        }
    }

    private static void awaitQuietly(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                System.out.println("[WARN] matcher threads still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void printUsage() {
        System.out.println("usage: --data <xlsx|xls|csv> --template <hwpx> [--sheet <name>]");
        System.out.println("       [--profile <json>] [--context <json>] [--out <path>] [--format=xlsx|json]");
        System.out.println("       [--noExternal] [--noReport] [--timeoutMs <ms>] [--baseDir <dir>]");
        System.out.println("env:   " + ReasoningConfig.ENV_API_KEY + " | " + ReasoningConfig.ENV_GEMINI_API_KEY
                + ", " + ReasoningConfig.ENV_BASE_URL + ", " + ReasoningConfig.ENV_MODEL + ", " + ReasoningConfig.ENV_TIMEOUT_MS);
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }
}
