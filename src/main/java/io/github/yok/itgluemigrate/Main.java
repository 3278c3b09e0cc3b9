package io.github.yok.itgluemigrate;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.itgluemigrate.attachment.AttachmentScanner;
import io.github.yok.itgluemigrate.client.ApiException;
import io.github.yok.itgluemigrate.client.DestinationApiClient;
import io.github.yok.itgluemigrate.client.HttpDestinationApiClient;
import io.github.yok.itgluemigrate.config.ApiConfig;
import io.github.yok.itgluemigrate.config.MigrationConfig;
import io.github.yok.itgluemigrate.core.ExportData;
import io.github.yok.itgluemigrate.core.LoggingProgressReporter;
import io.github.yok.itgluemigrate.core.MigrationOrchestrator;
import io.github.yok.itgluemigrate.core.MigrationPlan;
import io.github.yok.itgluemigrate.core.PreviewPlanner;
import io.github.yok.itgluemigrate.core.ProgressReporter;
import io.github.yok.itgluemigrate.core.RunOptions;
import io.github.yok.itgluemigrate.core.WarningDetector;
import io.github.yok.itgluemigrate.document.DocumentProcessor;
import io.github.yok.itgluemigrate.parser.ExportCsvParser;
import io.github.yok.itgluemigrate.parser.FieldInferrer;
import io.github.yok.itgluemigrate.state.MigrationState;
import io.github.yok.itgluemigrate.util.ErrorHandler;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

/**
 * Provides the application entry point.
 *
 * <p>
 * Two commands are supported:
 * </p>
 * <ul>
 * <li>{@code preview --export-path DIR [--api-url URL] [--token TOKEN] [--output FILE]} scans the
 * export, matches organizations against the destination, and writes the migration plan.</li>
 * <li>{@code run --plan FILE (--org NAME | --all) [--api-url URL] [--token TOKEN]
 * [--state-file FILE] [--dry-run] [--clear-failures] [--verbose]} executes the plan phase by
 * phase, resuming from the state file when one exists.</li>
 * </ul>
 *
 * <p>
 * Options given on the command line override {@link ApiConfig} and {@link MigrationConfig}. The
 * token defaults to the {@code BIFROST_API_TOKEN} environment variable through
 * {@code application.yml}. The process exits with {@code 1} when a fatal error occurs or any
 * entity failed to migrate.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see PreviewPlanner
 * @see MigrationOrchestrator
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ApiConfig.class, MigrationConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private static final String BASE_PACKAGE = "io.github.yok.itgluemigrate";

    private final ApiConfig apiConfig;
    private final MigrationConfig migrationConfig;

    @Getter
    private int exitCode;

    /**
     * Bootstraps the application and exits with the status of the command.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(maskToken(args)));
        if (args.length == 0) {
            exitCode = ErrorHandler.errorAndExit("No command given. " + usage());
            return;
        }
        String command = args[0];
        String[] options = Arrays.copyOfRange(args, 1, args.length);
        try {
            switch (command) {
                case "preview":
                    exitCode = preview(options);
                    break;
                case "run":
                    exitCode = runMigration(options);
                    break;
                default:
                    exitCode = ErrorHandler.errorAndExit("Unknown command: " + command + ". "
                            + usage());
            }
        } catch (Exception e) {
            log.error("Fatal error occurred (command={}): {}", command, e.getMessage(), e);
            exitCode = ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    // ----------------------------------------------------------------------
    // preview
    // ----------------------------------------------------------------------

    private int preview(String[] args) throws Exception {
        String exportPath = null;
        String apiUrl = null;
        String token = null;
        String output = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--export-path":
                case "-e":
                    exportPath = value(args, ++i);
                    break;
                case "--api-url":
                case "-u":
                    apiUrl = value(args, ++i);
                    break;
                case "--token":
                case "-t":
                    token = value(args, ++i);
                    break;
                case "--output":
                case "-o":
                    output = value(args, ++i);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (StringUtils.isBlank(exportPath)) {
            return ErrorHandler.errorAndExit("--export-path is required.");
        }
        Path export = Paths.get(exportPath).toAbsolutePath().normalize();
        if (!Files.isDirectory(export)) {
            return ErrorHandler.errorAndExit("Export path is not a directory: " + export);
        }
        String effectiveUrl = apiConfig.resolveUrl(apiUrl);
        if (effectiveUrl == null) {
            return ErrorHandler.errorAndExit("No API URL specified. Use --api-url or api.url.");
        }
        String effectiveToken = apiConfig.resolveToken(token);
        if (effectiveToken == null) {
            return ErrorHandler
                    .errorAndExit("No API token specified. Use --token or set BIFROST_API_TOKEN.");
        }
        Path planFile = Paths.get(StringUtils.defaultIfBlank(output, migrationConfig.getPlanFile()))
                .toAbsolutePath();

        log.info("Starting preview. Export [{}], API [{}]", export, effectiveUrl);
        FieldInferrer fieldInferrer = new FieldInferrer();
        PreviewPlanner planner = new PreviewPlanner(
                new ExportCsvParser(fieldInferrer, new ObjectMapper()), new AttachmentScanner(),
                fieldInferrer, new WarningDetector());
        MigrationPlan plan;
        try (DestinationApiClient client = createClient(effectiveUrl, effectiveToken)) {
            plan = planner.createPlan(export, effectiveUrl, client);
        }
        plan.write(planFile);
        PreviewPlanner.logSummary(plan);
        log.info("Preview complete. Plan saved to {}", planFile);
        log.info("Review the plan file and run `run --plan {} --all` to execute the migration.",
                planFile);
        return 0;
    }

    // ----------------------------------------------------------------------
    // run
    // ----------------------------------------------------------------------

    private int runMigration(String[] args) throws Exception {
        String planPath = null;
        String org = null;
        boolean all = false;
        String apiUrl = null;
        String token = null;
        String stateFile = null;
        boolean dryRun = false;
        boolean clearFailures = false;
        boolean verbose = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--plan":
                case "-p":
                    planPath = value(args, ++i);
                    break;
                case "--org":
                case "-o":
                    org = value(args, ++i);
                    break;
                case "--all":
                case "-a":
                    all = true;
                    break;
                case "--api-url":
                case "-u":
                    apiUrl = value(args, ++i);
                    break;
                case "--token":
                case "-t":
                    token = value(args, ++i);
                    break;
                case "--state-file":
                case "-s":
                    stateFile = value(args, ++i);
                    break;
                case "--dry-run":
                case "-n":
                    dryRun = true;
                    break;
                case "--clear-failures":
                    clearFailures = true;
                    break;
                case "--verbose":
                case "-v":
                    verbose = true;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        if (verbose) {
            LoggingSystem.get(Main.class.getClassLoader()).setLogLevel(BASE_PACKAGE,
                    LogLevel.DEBUG);
        }

        // Validate inputs
        if (org == null && !all) {
            return ErrorHandler.errorAndExit("You must specify either --org <name> or --all");
        }
        if (org != null && all) {
            return ErrorHandler.errorAndExit("Cannot specify both --org and --all");
        }
        if (StringUtils.isBlank(planPath)) {
            return ErrorHandler.errorAndExit("--plan is required.");
        }
        Path planFile = Paths.get(planPath).toAbsolutePath();
        if (!Files.isRegularFile(planFile)) {
            return ErrorHandler.errorAndExit("Plan file does not exist: " + planFile);
        }
        MigrationPlan plan = MigrationPlan.read(planFile);
        if (StringUtils.isBlank(plan.getExportPath())) {
            return ErrorHandler.errorAndExit("Plan file missing export_path");
        }
        Path exportPath = Paths.get(plan.getExportPath());
        if (!Files.exists(exportPath)) {
            return ErrorHandler.errorAndExit("Export path does not exist: " + exportPath);
        }
        String effectiveUrl = apiConfig.resolveUrl(StringUtils.defaultIfBlank(apiUrl,
                plan.getApiUrl()));
        if (effectiveUrl == null) {
            return ErrorHandler.errorAndExit(
                    "No API URL specified. Use --api-url or ensure plan file has api_url.");
        }
        String effectiveToken = apiConfig.resolveToken(token);
        if (effectiveToken == null) {
            return ErrorHandler
                    .errorAndExit("No API token specified. Use --token or set BIFROST_API_TOKEN.");
        }
        if (org != null && !plan.getOrganizations().getMapping().containsKey(org)) {
            return ErrorHandler.errorAndExit("Organization '" + org + "' not found in plan file");
        }
        String stateSetting = StringUtils.defaultIfBlank(stateFile, migrationConfig.getStateFile());
        Path statePath = StringUtils.isBlank(stateSetting) ? null
                : Paths.get(stateSetting).toAbsolutePath();

        log.info("Plan file: {}", planFile);
        log.info("API URL: {}", effectiveUrl);
        log.info("Export path: {}", exportPath);
        log.info("Target: {}", org != null ? "Single organization: " + org
                : "All " + plan.getOrganizations().getTotal() + " organizations");
        if (statePath != null) {
            log.info("State file: {}", statePath);
        }

        try (DestinationApiClient client = createClient(effectiveUrl, effectiveToken)) {
            if (dryRun) {
                log.info("Mode: DRY RUN - No changes will be made");
            } else {
                log.info("Verifying API connectivity...");
                try {
                    client.listOrganizations();
                } catch (ApiException e) {
                    return ErrorHandler.errorAndExit(
                            "Failed to connect to API. Check URL and token.", e);
                }
                log.info("API connection verified");
            }

            MigrationState state;
            if (statePath != null && Files.exists(statePath)) {
                log.info("Loading existing state from {}", statePath);
                state = MigrationState.load(statePath);
                log.info("Resumed migration: {} completed, {} failed", state.getTotalCompleted(),
                        state.getTotalFailed());
                if (clearFailures) {
                    int cleared = state.clearAllFailures();
                    if (cleared > 0) {
                        log.info("Cleared {} previous failures for retry", cleared);
                        state.save(statePath);
                    }
                }
            } else {
                state = new MigrationState(exportPath.toString(), effectiveUrl);
            }

            if (dryRun) {
                logDryRunSummary(plan, org);
            }

            ExportData data = ExportData.load(new ExportCsvParser(), exportPath);
            ProgressReporter reporter = new LoggingProgressReporter(verbose);
            AttachmentScanner scanner = new AttachmentScanner();
            int result;
            try (DocumentProcessor processor = new DocumentProcessor(client, exportPath, scanner,
                    migrationConfig.getUploadConcurrency())) {
                MigrationOrchestrator orchestrator =
                        new MigrationOrchestrator(client, processor, scanner, reporter);
                result = orchestrator.execute(plan, data, state,
                        new RunOptions(org, dryRun, statePath));
            }
            reporter.printFinalSummary();

            if (statePath != null && !dryRun) {
                state.save(statePath);
                log.info("State saved to: {}", statePath);
            }
            if (result == 0) {
                log.info(dryRun ? "Dry run complete! No changes were made."
                        : "Migration complete!");
            } else {
                log.warn("Migration completed with {} failures. Use --state-file with "
                        + "--clear-failures to retry.", state.getTotalFailed());
            }
            return result;
        }
    }

    private static void logDryRunSummary(MigrationPlan plan, String org) {
        MigrationPlan.Organizations orgs = plan.getOrganizations();
        if (org != null) {
            log.info("Organizations: 1 (filtered to '{}')", org);
        } else {
            log.info("Organizations: {} (matched: {}, to create: {})", orgs.getTotal(),
                    orgs.getMatched(), orgs.getToCreate());
        }
        plan.getEntityCounts().forEach((entity, count) -> log.info("{}: {}", entity, count));
        if (!plan.getCustomAssetTypes().isEmpty()) {
            log.info("Custom Asset Types: {}", plan.getCustomAssetTypes().size());
        }
        if (plan.getAttachmentValidation() != null) {
            log.info("Attachments to upload: {} files ({})",
                    plan.getAttachmentValidation().getTotalMatchedFiles(),
                    plan.getAttachmentValidation().getFormattedMatchedSize());
        }
    }

    // ----------------------------------------------------------------------
    // Helpers
    // ----------------------------------------------------------------------

    /**
     * Creates the destination client. Overridden in tests.
     *
     * @param apiUrl destination base URL
     * @param token API token
     * @return a new client; the caller closes it
     */
    DestinationApiClient createClient(String apiUrl, String token) {
        return new HttpDestinationApiClient(apiUrl, token, apiConfig, new ObjectMapper());
    }

    private static String value(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException(
                    "Missing value for option " + args[index - 1] + ". " + usage());
        }
        return args[index];
    }

    private static String[] maskToken(String[] args) {
        String[] masked = args.clone();
        for (int i = 0; i + 1 < masked.length; i++) {
            if ("--token".equals(masked[i]) || "-t".equals(masked[i])) {
                masked[i + 1] = "****";
            }
        }
        return masked;
    }

    private static String usage() {
        return "Usage: preview --export-path DIR [--api-url URL] [--token TOKEN] [--output FILE]"
                + " | run --plan FILE (--org NAME | --all) [--api-url URL] [--token TOKEN]"
                + " [--state-file FILE] [--dry-run] [--clear-failures] [--verbose]";
    }
}
