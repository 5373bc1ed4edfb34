package com.raditha.smells.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.smells.ai.GeminiNamingOracle;
import com.raditha.smells.analyzer.SmellAnalyzer;
import com.raditha.smells.analyzer.SmellReport;
import com.raditha.smells.config.SmellDetectorConfig;
import com.raditha.smells.config.SmellDetectorSettings;
import com.raditha.smells.model.Finding;
import com.raditha.smells.refactoring.NamingOracle;
import com.raditha.smells.refactoring.RewriteException;
import com.raditha.smells.tree.SerializationException;
import com.raditha.smells.tree.SourceParseException;
import com.raditha.smells.tree.SourceTree;
import com.raditha.smells.tree.SourceTreeBuilder;
import com.raditha.smells.workflow.RefactoringResult;
import com.raditha.smells.workflow.RefactoringWorkflow;
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
import java.util.concurrent.Callable;

/**
 * Command-line interface for the Smell Detector.
 * <p>
 * Usage:
 * java -jar smell-detector.jar [options] [refactor] <file>
 * <p>
 * Configuration priority: CLI arguments > smell-detector.yml > defaults
 */
@Command(name = "smell-detector", mixinStandardHelpOptions = true, version = "Smell Detector v1.0.0",
        description = "Code smell detector and duplicate extraction tool")
@SuppressWarnings("java:S106")
public class SmellDetectorCLI implements Callable<Integer> {

    static final int EXIT_UNEXPECTED = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_PARSE = 5;
    static final int EXIT_REWRITE = 6;

    @Parameters(index = "0", description = "Java source file to analyze", paramLabel = "<file>")
    private Path file;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--long-method", description = "Maximum non-empty lines per function (default: 15)", paramLabel = "<n>")
    private Integer longMethod; // null = use YAML/default

    @Option(names = "--max-params", description = "Maximum parameters per function (default: 3)", paramLabel = "<n>")
    private Integer maxParams;

    @Option(names = "--window", description = "Statements per duplicate block window (default: 2)", paramLabel = "<n>")
    private Integer window;

    @Option(names = "--threshold", description = "Block similarity threshold 0-100 (default: 75)", paramLabel = "<n>")
    private Integer threshold;

    @Option(names = "--strict", description = "Strict preset (90%% threshold, 3 statement windows)")
    private boolean strict = false;

    @Option(names = "--lenient", description = "Lenient preset (60%% threshold)")
    private boolean lenient = false;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    // Command selection
    @Option(names = "refactor", description = "Extract duplicates and print the refactored file")
    private boolean refactorCommand = false;

    @Option(names = "--diff", description = "With refactor: print a unified diff instead of the whole file")
    private boolean diffOnly = false;

    @Option(names = "--output", description = "With refactor: write the refactored file here", paramLabel = "<path>")
    private Path outputFile;

    @Option(names = "--no-ai", description = "Do not ask the naming service for helper names")
    private boolean noAI = false;

    @Spec
    private CommandSpec spec;

    private PrintWriter out;

    @Override
    public Integer call() throws Exception {
        validateConfiguration();
        out = spec.commandLine().getOut();

        SmellDetectorConfig config = SmellDetectorSettings.loadConfig(configFile, new SmellDetectorSettings.CliOverrides(
                longMethod, maxParams, window, threshold, preset(), noAI));

        SourceTree tree = new SourceTreeBuilder().parse(file);
        String fileName = file.getFileName().toString();

        SmellReport report = new SmellAnalyzer(config).analyze(tree, fileName);
        if (jsonOutput) {
            printJsonReport(report);
        } else {
            out.print(report.getDetailedReport());
        }

        if (refactorCommand) {
            runRefactoring(tree, config, fileName);
        }
        out.flush();
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Build the command line with the error handlers that map failures to exit codes.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new SmellDetectorCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIG;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else if (ex instanceof SourceParseException) {
                commandLine.getErr().println("Parse error: " + ex.getMessage());
                return EXIT_PARSE;
            } else if (ex instanceof RewriteException || ex instanceof SerializationException) {
                commandLine.getErr().println("Refactoring failed: " + ex.getMessage());
                return EXIT_REWRITE;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_UNEXPECTED;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_CONFIG;
        });
        return cmd;
    }

    /**
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (threshold != null && (threshold < 0 || threshold > 100)) {
            throw new IllegalArgumentException("Threshold must be between 0 and 100, got: " + threshold);
        }
        if (isNegative(longMethod) || isNegative(maxParams) || isNegative(window)) {
            throw new IllegalArgumentException("Thresholds and window size must not be negative");
        }
        if (strict && lenient) {
            throw new IllegalArgumentException("Cannot use both --strict and --lenient presets simultaneously");
        }
        if (!refactorCommand && (diffOnly || outputFile != null)) {
            throw new IllegalArgumentException("--diff and --output require the refactor command");
        }
    }

    private static boolean isNegative(Integer value) {
        return value != null && value < 0;
    }

    private String preset() {
        if (strict) {
            return "strict";
        } else if (lenient) {
            return "lenient";
        }
        return null;
    }

    private void runRefactoring(SourceTree tree, SmellDetectorConfig config, String fileName) throws IOException {
        NamingOracle oracle = GeminiNamingOracle.create(config.aiService());

        RefactoringResult result = new RefactoringWorkflow(config, oracle).run(tree, fileName);

        out.println();
        if (!result.changed()) {
            out.println("No duplicates found. Nothing to refactor.");
            return;
        }
        out.printf("Delegated %d duplicate functions, extracted %d helpers %s%n",
                result.replacedFunctions().size(), result.helpers().size(), result.helperNames());
        if (!result.skippedFunctions().isEmpty()) {
            out.printf("Skipped %d duplicate functions that cannot call their primary%n",
                    result.skippedFunctions().size());
        }
        if (!result.skippedGroups().isEmpty()) {
            out.printf("Skipped %d overlapping block groups%n", result.skippedGroups().size());
        }
        out.println();

        if (diffOnly) {
            out.println(result.diff());
        } else if (outputFile == null) {
            out.println(result.refactoredText());
        }

        if (outputFile != null) {
            Files.writeString(outputFile, result.refactoredText(), StandardCharsets.UTF_8);
            out.println("Refactored file written to: " + outputFile.toAbsolutePath());
        }
    }

    private void printJsonReport(SmellReport report) throws IOException {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        ObjectNode root = mapper.createObjectNode();
        root.put("file", report.sourceName());

        ArrayNode findings = root.putArray("findings");
        for (Finding finding : report.findings()) {
            ObjectNode node = findings.addObject();
            node.put("kind", finding.kind().name());
            node.put("subject", finding.subject());
            node.put("metric", finding.metric());
            node.put("detail", finding.detail());
        }

        ArrayNode errors = root.putArray("errors");
        for (SmellReport.DetectorError error : report.errors()) {
            errors.addObject()
                    .put("detector", error.detector())
                    .put("message", error.message());
        }

        out.println(mapper.writeValueAsString(root));
    }
}
