package com.raditha.copycheck.cli;

import com.raditha.copycheck.analyzer.DetectionReport;
import com.raditha.copycheck.analyzer.PairResult;
import com.raditha.copycheck.analyzer.PairwiseAnalyzer;
import com.raditha.copycheck.analyzer.PlagiarismReport;
import com.raditha.copycheck.analyzer.SourceCollector;
import com.raditha.copycheck.analyzer.SourceFile;
import com.raditha.copycheck.config.DetectionConfig;
import com.raditha.copycheck.config.DetectorSettings;
import com.raditha.copycheck.metrics.ReportExporter;
import com.raditha.copycheck.model.Segment;
import com.raditha.copycheck.model.SimilarityResult;
import org.jspecify.annotations.Nullable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the plagiarism checker.
 * <p>
 * Usage:
 * java -jar copycheck.jar [options] &lt;file-or-directory&gt;...
 * <p>
 * Configuration priority: CLI arguments > copycheck.yml > defaults
 */
@Command(name = "copycheck", mixinStandardHelpOptions = true, version = "copycheck v1.0.0",
        description = "Structural Source Code Plagiarism Checker")
@SuppressWarnings("java:S106")
public class CopycheckCLI implements Callable<Integer> {

    static final String VERSION = "1.0.0";

    @Parameters(paramLabel = "<file-or-dir>", arity = "1..*", description = "Source files or directories to compare")
    private List<Path> inputs;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private @Nullable String configFile;

    @Option(names = "--threshold", description = "Flagging threshold 0-100 (default: 70)", paramLabel = "<n>")
    private int threshold = 0; // 0 = use YAML/default

    @Option(names = "--strict", description = "Strict preset (90%% threshold)")
    private boolean strict = false;

    @Option(names = "--lenient", description = "Lenient preset (50%% threshold)")
    private boolean lenient = false;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--flagged-only", description = "Only list pairs at or above the threshold")
    private boolean flaggedOnly = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>")
    private @Nullable String exportFormat;

    @Option(names = "--output", description = "Directory for exported metrics", paramLabel = "<path>")
    private @Nullable String outputPath;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        DetectionConfig config = DetectorSettings.loadConfig(resolveConfigFile(), threshold, preset());
        List<SourceFile> files = new SourceCollector(config).collect(inputs);
        PlagiarismReport report = new PairwiseAnalyzer(config).analyze(files);

        if (jsonOutput) {
            System.out.println(new ReportExporter().renderReport(report, VERSION));
        } else {
            printTextReport(report);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            exportMetrics(report);
        }
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit-code mapping used by {@link #main(String[])}.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new CopycheckCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });

        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("Threshold must be between 0 and 100, got: " + threshold);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            String format = exportFormat.toLowerCase(Locale.ROOT);
            if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
            exportFormat = format;
        }

        if (strict && lenient) {
            throw new IllegalArgumentException("Cannot use both --strict and --lenient presets simultaneously");
        }

        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null) {
            File outputDir = new File(outputPath);
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
        }
    }

    private @Nullable String preset() {
        if (strict) {
            return "strict";
        } else if (lenient) {
            return "lenient";
        }
        return null;
    }

    /**
     * Explicit --config-file, else copycheck.yml in the working directory if
     * present.
     */
    private @Nullable Path resolveConfigFile() {
        if (configFile != null) {
            return Paths.get(configFile);
        }
        Path local = Paths.get(DetectorSettings.DEFAULT_CONFIG_FILE);
        return Files.isRegularFile(local) ? local : null;
    }

    private void printTextReport(PlagiarismReport report) {
        DetectionConfig config = report.config();
        List<PairResult> pairs = flaggedOnly ? report.getFlagged() : report.pairs();

        System.out.println("=".repeat(80));
        System.out.println("PLAGIARISM DETECTION REPORT");
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.printf("Files analyzed: %d%n", report.files().size());
        System.out.printf("Pairs compared: %d%n", report.pairs().size());
        System.out.printf("Flagged pairs: %d (threshold=%.0f%%)%n", report.getFlaggedCount(), config.threshold() * 100);
        System.out.println();

        if (!report.hasFlagged()) {
            System.out.println("✓ No pair reached the similarity threshold.");
            System.out.println();
        }

        for (PairResult pair : pairs) {
            printPair(pair, config);
        }
    }

    private static void printPair(PairResult pair, DetectionConfig config) {
        DetectionReport detection = pair.detection();
        SimilarityResult result = detection.result();

        System.out.println("-".repeat(80));
        System.out.printf("%s <-> %s%n", pair.first().displayName(), pair.second().displayName());
        System.out.println("-".repeat(80));
        System.out.printf("Similarity: %s [%s]%s%n",
                result.formatScore(),
                result.severity(),
                pair.isFlagged(config.threshold()) ? " ⚠ FLAGGED" : "");

        List<Segment> segments = result.matchedSegments();
        if (segments.isEmpty()) {
            System.out.println("  No matching segments.");
            System.out.println();
            return;
        }

        int shown = Math.min(config.maxSegments(), segments.size());
        for (int i = 0; i < shown; i++) {
            Segment segment = segments.get(i);
            System.out.printf("  Segment #%d: %s %s <-> %s %s (normalized %d-%d / %d-%d)%n",
                    i + 1,
                    pair.first().displayName(),
                    detection.sourceRangeInFirst(segment),
                    pair.second().displayName(),
                    detection.sourceRangeInSecond(segment),
                    segment.start1(), segment.end1(), segment.start2(), segment.end2());
            for (String line : segment.lines()) {
                System.out.println("    " + line);
            }
        }
        if (shown < segments.size()) {
            System.out.printf("  ... %d more segments%n", segments.size() - shown);
        }
        System.out.println();
    }

    /**
     * Export metrics to CSV/JSON files.
     */
    private void exportMetrics(PlagiarismReport report) throws IOException {
        ReportExporter exporter = new ReportExporter();
        ReportExporter.ProjectMetrics metrics = exporter.buildMetrics(report, projectName());

        Path outputDir = outputPath != null ? Paths.get(outputPath) : Paths.get(".");
        Files.createDirectories(outputDir);

        if ("csv".equals(exportFormat) || "both".equals(exportFormat)) {
            Path csvPath = outputDir.resolve("plagiarism-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            System.out.println("\n✓ Metrics exported to: " + csvPath.toAbsolutePath());
        }

        if ("json".equals(exportFormat) || "both".equals(exportFormat)) {
            Path jsonPath = outputDir.resolve("plagiarism-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            System.out.println("✓ Metrics exported to: " + jsonPath.toAbsolutePath());
        }
    }

    private String projectName() {
        Path first = inputs.get(0).toAbsolutePath().normalize();
        Path dir = Files.isDirectory(first) ? first : first.getParent();
        Path name = dir != null ? dir.getFileName() : null;
        return name != null ? name.toString() : "project";
    }
}
