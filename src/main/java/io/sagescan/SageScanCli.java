package io.sagescan;

import ch.qos.logback.classic.Level;
import io.sagescan.aggregate.IssueFilter;
import io.sagescan.config.SageConfig;
import io.sagescan.discovery.GlobFileDiscovery;
import io.sagescan.engine.AnalysisEngine;
import io.sagescan.enrich.AiEnricher;
import io.sagescan.enrich.LlmClient;
import io.sagescan.model.ProjectResult;
import io.sagescan.model.Severity;
import io.sagescan.report.ConsoleReporter;
import io.sagescan.report.JsonReporter;
import io.sagescan.report.Reporter;
import io.sagescan.report.SarifReporter;
import io.sagescan.rules.RuleCatalog;
import io.sagescan.rules.RuleFileLoader;
import io.sagescan.security.SecretScanner;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the sage-scan tool.
 */
@Command(
        name = "sage-scan",
        mixinStandardHelpOptions = true,
        version = "sage-scan 1.0.0",
        description = "Scans source trees for bugs, security risks, style violations and complexity hotspots.",
        subcommands = {
                SageScanCli.AnalyzeCommand.class,
                SageScanCli.InitCommand.class
        },
        footer = {
                "",
                "Examples:",
                "  sage-scan analyze /path/to/project",
                "  sage-scan analyze src --format sarif --output report.sarif",
                "  sage-scan analyze . --severity high --no-security",
                "  sage-scan init"
        }
)
public class SageScanCli implements Runnable {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_CRITICAL = 2;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public enum OutputFormat {
        console,
        json,
        sarif
    }

    @Command(
            name = "analyze",
            mixinStandardHelpOptions = true,
            description = "Analyze a file or directory. Exits with 2 when critical issues are found."
    )
    static class AnalyzeCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(
                index = "0",
                defaultValue = ".",
                description = "File or directory to analyze (default: current directory)"
        )
        private Path path;

        @Option(
                names = {"-f", "--format"},
                description = "Output format: console (default), json, sarif",
                defaultValue = "console"
        )
        private OutputFormat format;

        @Option(
                names = {"-o", "--output"},
                description = "Write the report to this file instead of stdout"
        )
        private Path output;

        @Option(
                names = {"-s", "--severity"},
                description = "Minimum severity to report: critical, high, medium, low, info"
        )
        private String severity;

        @Option(
                names = {"--security"},
                negatable = true,
                description = "Enable or disable secret and injection scanning (default: from config)"
        )
        private Boolean security;

        @Option(
                names = {"--ai"},
                description = "Enrich the top-ranked issues with explanations (needs an API key)"
        )
        private boolean ai;

        @Option(
                names = {"-c", "--config"},
                description = "Path to configuration YAML file (default: sage-scan.yaml in the project)"
        )
        private Path configFile;

        @Option(
                names = {"-r", "--rules"},
                description = "Additional rule file (YAML or JSON)"
        )
        private Path rulesFile;

        @Option(
                names = {"-w", "--workers"},
                description = "Number of worker threads"
        )
        private Integer workers;

        @Option(
                names = {"--sequential"},
                description = "Analyze files one at a time on the calling thread"
        )
        private boolean sequential;

        @Option(
                names = {"-v", "--verbose"},
                description = "Enable verbose output"
        )
        private boolean verbose;

        @Option(
                names = {"--no-color"},
                description = "Disable ANSI colors in console output"
        )
        private boolean noColor;

        @Option(
                names = {"-d", "--detailed"},
                description = "Show code snippets, fixes and explanations in console output"
        )
        private boolean detailed;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            if (verbose) {
                enableDebugLogging();
            }

            try {
                if (!Files.exists(path)) {
                    err.println("Error: Path does not exist: " + path);
                    return EXIT_ERROR;
                }
                Path projectDir = Files.isDirectory(path) ? path : path.toAbsolutePath().getParent();

                SageConfig config = loadConfig(projectDir);
                RuleCatalog rules = loadRules(config, projectDir);

                AnalysisEngine.Builder builder = AnalysisEngine.builder()
                        .settings(config.toAnalysisSettings())
                        .discovery(new GlobFileDiscovery(config.getIncludePatterns(), config.getIgnorePatterns(), true))
                        .rules(rules)
                        .parallel(config.isParallel())
                        .maxWorkers(config.getMaxWorkers())
                        .filter(IssueFilter.minSeverity(config.getMinSeverity()));
                if (config.isSecurityEnabled()) {
                    builder.secretScanner(new SecretScanner(config.getMinEntropy()));
                }
                if (config.isAiEnabled()) {
                    configureEnrichment(builder, config, err);
                }

                if (format == OutputFormat.console && output == null) {
                    printBanner(out);
                }
                log(out, "Analyzing " + path + " ...");

                ProjectResult result = builder.build().analyzeProject(path);
                writeReport(result, out);

                if (result.hasCriticalIssues()) {
                    if (format == OutputFormat.console) {
                        err.println("Failing due to " + result.countBySeverity(Severity.CRITICAL) + " critical issue(s).");
                    }
                    return EXIT_CRITICAL;
                }
                return EXIT_OK;

            } catch (IOException | RuntimeException e) {
                err.println("Error: " + e.getMessage());
                if (verbose) {
                    e.printStackTrace(err);
                }
                return EXIT_ERROR;
            }
        }

        private SageConfig loadConfig(Path projectDir) {
            SageConfig config = SageConfig.resolve(configFile, projectDir);
            if (severity != null) {
                config = config.withMinSeverity(Severity.parse(severity));
            }
            if (security != null) {
                config = config.withSecurityEnabled(security);
            }
            if (ai) {
                config = config.withAiEnabled(true);
            }
            if (workers != null) {
                config = config.withMaxWorkers(workers);
            }
            if (sequential) {
                config = config.withParallel(false);
            }
            return config;
        }

        private RuleCatalog loadRules(SageConfig config, Path projectDir) {
            RuleCatalog rules = RuleCatalog.loadDefault();
            if (config.getCustomRules().isPresent()) {
                Path configured = projectDir.resolve(config.getCustomRules().get());
                rules = rules.extend(RuleFileLoader.load(configured));
            }
            if (rulesFile != null) {
                rules = rules.extend(RuleFileLoader.load(rulesFile));
            }
            return rules;
        }

        private void configureEnrichment(AnalysisEngine.Builder builder, SageConfig config, PrintWriter err) {
            String apiKey = System.getenv(config.getAiApiKeyEnv());
            if (apiKey == null || apiKey.isBlank()) {
                err.println("Warning: " + config.getAiApiKeyEnv() + " is not set; skipping AI enrichment.");
                return;
            }
            LlmClient client = config.getAiProvider().createClient(
                    apiKey,
                    config.getAiModel(),
                    config.getAiBaseUrl(),
                    config.getAiMaxTokens(),
                    config.getAiTemperature(),
                    Duration.ofSeconds(config.getAiTimeoutSeconds()));
            builder.enricher(new AiEnricher(client), config.getAiMaxIssues());
        }

        private Reporter createReporter() {
            return switch (format) {
                case console -> new ConsoleReporter(!noColor && output == null, detailed);
                case json -> new JsonReporter(true);
                case sarif -> new SarifReporter();
            };
        }

        private void writeReport(ProjectResult result, PrintWriter out) throws IOException {
            Reporter reporter = createReporter();
            if (output != null) {
                reporter.write(result, output);
                if (format == OutputFormat.console) {
                    out.println("Report written to: " + output);
                }
            } else {
                reporter.write(result, out);
                out.flush();
            }
        }

        private void log(PrintWriter out, String message) {
            if (verbose && format == OutputFormat.console) {
                out.println(message);
            }
        }

        private void printBanner(PrintWriter out) {
            out.println("""
                    ╔═══════════════════════════════════════════════════════════════╗
                    ║                          SAGE-SCAN                            ║
                    ║      Bugs, Security Risks and Complexity Hotspots             ║
                    ╚═══════════════════════════════════════════════════════════════╝
                    """);
        }
    }

    @Command(
            name = "init",
            mixinStandardHelpOptions = true,
            description = "Write a default " + SageConfig.PROJECT_CONFIG_FILE + " into a directory."
    )
    static class InitCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(
                index = "0",
                defaultValue = ".",
                description = "Target directory (default: current directory)"
        )
        private Path directory;

        @Option(
                names = {"--force"},
                description = "Overwrite an existing configuration file"
        )
        private boolean force;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            Path target = directory.resolve(SageConfig.PROJECT_CONFIG_FILE);
            try {
                if (Files.exists(target) && !force) {
                    err.println("Error: " + target + " already exists (use --force to overwrite)");
                    return EXIT_ERROR;
                }
                Files.createDirectories(directory);
                Files.writeString(target, SageConfig.defaultYaml(), StandardCharsets.UTF_8);
                out.println("Created " + target);
                return EXIT_OK;
            } catch (IOException e) {
                err.println("Error: Cannot write " + target + ": " + e.getMessage());
                return EXIT_ERROR;
            }
        }
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger logger = LoggerFactory.getLogger("io.sagescan");
        if (logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        }
    }

    /**
     * Builds the command line with usage errors mapped to exit code 1.
     */
    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new SageScanCli());
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println("Error: " + ex.getMessage());
            failed.usage(failed.getErr());
            return EXIT_ERROR;
        });
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
