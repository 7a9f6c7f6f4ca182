package com.raditha.usage.cli;

import com.raditha.usage.analyzer.UsageAnalysisException;
import com.raditha.usage.analyzer.UsageAnalyzer;
import com.raditha.usage.analyzer.UsageReport;
import com.raditha.usage.config.UsageConfig;
import com.raditha.usage.config.UsageSettings;
import com.raditha.usage.report.ReportPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the usage sweeper.
 * <p>
 * Usage:
 * java -jar usage-sweeper.jar [options]
 * <p>
 * Configuration priority: CLI arguments > sweeper.yml > defaults
 */
@Command(name = "sweeper", mixinStandardHelpOptions = true, version = "Sweeper v1.0.0",
        description = "Reports private fields, parameters and local variables whose values are never read")
@SuppressWarnings("java:S106")
public class SweeperCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(SweeperCLI.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_CONFIGURATION = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_FINDINGS = 5;

    @Option(names = "--config-file", description = "Use custom configuration file (default: sweeper.yml)", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--base-path", description = "Project directory to analyze (default: current directory)", paramLabel = "<path>")
    private String basePath;

    @Option(names = "--strict", description = "Strict preset (tests included, no annotation exemptions)")
    private boolean strict = false;

    @Option(names = "--lenient", description = "Lenient preset (fields and callable parameters only)")
    private boolean lenient = false;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--parallelism", description = "Worker threads (default: available processors)", paramLabel = "<n>")
    private int parallelism = 0; // 0 = use YAML/default

    @Option(names = "--no-lambda-parameters", description = "Do not report unused lambda parameters")
    private boolean noLambdaParameters = false;

    @Option(names = "--no-local-variables", description = "Do not report unused local variables")
    private boolean noLocalVariables = false;

    @Option(names = "--fail-on-findings", description = "Exit with code 5 when unused declarations are found")
    private boolean failOnFindings = false;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, 5 for findings with --fail-on-findings)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        Path config = configFile != null ? Paths.get(configFile) : Paths.get(UsageSettings.DEFAULT_CONFIG_FILE);
        Map<String, Object> yaml = UsageSettings.readYaml(config);

        UsageConfig usageConfig = loadConfig(yaml);
        Path projectRoot = resolveBasePath(yaml);
        logger.info("Analyzing {}", projectRoot);

        UsageReport report = new UsageAnalyzer(usageConfig).analyzeProject(projectRoot);

        ReportPrinter printer = new ReportPrinter(System.out);
        if (jsonOutput) {
            printer.printJson(report);
        } else {
            printer.printText(report);
        }

        return failOnFindings && report.hasFindings() ? EXIT_FINDINGS : EXIT_OK;
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Run the command with the exit code mapping used by {@link #main(String[])}.
     */
    static int execute(String... args) {
        CommandLine cmd = new CommandLine(new SweeperCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIGURATION;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else if (ex instanceof UsageAnalysisException) {
                commandLine.getErr().println("Analysis failed: " + ex.getMessage());
                return EXIT_ERROR;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_ERROR;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_CONFIGURATION;
        });

        return cmd.execute(args);
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    void validateConfiguration() {
        if (strict && lenient) {
            throw new IllegalArgumentException("Cannot use both --strict and --lenient presets simultaneously");
        }
        if (parallelism < 0) {
            throw new IllegalArgumentException("Parallelism must be >= 0, got: " + parallelism);
        }
        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (basePath != null && !new File(basePath).isDirectory()) {
            throw new IllegalArgumentException("Base path not found: " + basePath);
        }
    }

    UsageConfig loadConfig(Map<String, Object> yaml) {
        String preset = null;
        if (strict) {
            preset = "strict";
        } else if (lenient) {
            preset = "lenient";
        }

        UsageConfig config = UsageSettings.loadConfig(yaml, preset, parallelism);
        if (noLambdaParameters || noLocalVariables) {
            config = config.withTracking(
                    config.trackLambdaParameters() && !noLambdaParameters,
                    config.trackLocalVariables() && !noLocalVariables);
        }
        return config;
    }

    private Path resolveBasePath(Map<String, Object> yaml) {
        if (basePath != null) {
            return Paths.get(basePath);
        }
        String configured = UsageSettings.getBasePath(yaml);
        return Paths.get(configured != null ? configured : ".");
    }
}
