package com.raditha.smells.cli;

import ch.qos.logback.classic.Level;
import com.raditha.smells.analyzer.ProjectAnalyzer;
import com.raditha.smells.analyzer.ProjectReport;
import com.raditha.smells.config.DetectorSelection;
import com.raditha.smells.config.SmellConfig;
import com.raditha.smells.config.SmellDetectorSettings;
import com.raditha.smells.report.ReportExporter;
import com.raditha.smells.report.ReportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the code smell detector.
 * <p>
 * Usage:
 * java -jar smell-detector.jar [options] &lt;file-or-directory&gt;
 * <p>
 * Configuration priority: CLI arguments &gt; config.yaml &gt; defaults
 */
@Command(name = "smells", mixinStandardHelpOptions = true, version = "smells 1.0.0",
        description = "Detects code smells in Java sources")
@SuppressWarnings("java:S106")
public class SmellDetectorCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(SmellDetectorCLI.class);

    private static final String DEFAULT_OUTPUT_DIR = "output";

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "File or directory to analyze", paramLabel = "<target>")
    private Path target;

    @Option(names = {"-c", "--config"}, description = "Configuration file path (default: ${DEFAULT-VALUE})",
            paramLabel = "<path>", defaultValue = "config.yaml")
    private Path configFile;

    @Option(names = {"-o", "--output"}, description = "Output file path for the report (default: output/report.<format>)",
            paramLabel = "<path>")
    private Path outputPath;

    @Option(names = {"-f", "--format"}, description = "Output format: json or txt", paramLabel = "<format>",
            converter = ReportFormatConverter.class)
    private ReportFormat format;

    @Option(names = "--only", split = ",", description = "Only run these detectors (comma-separated)",
            paramLabel = "<detector>")
    private List<String> only = new ArrayList<>();

    @Option(names = "--exclude", split = ",", description = "Skip these detectors (comma-separated)",
            paramLabel = "<detector>")
    private List<String> exclude = new ArrayList<>();

    @Option(names = {"-v", "--verbose"}, description = "Verbose output")
    private boolean verbose;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws IOException {
        if (verbose) {
            enableDebugLogging();
        }
        if (!Files.exists(target)) {
            throw new IllegalArgumentException("Target not found: " + target);
        }

        SmellConfig config = SmellDetectorSettings.load(configFile);
        DetectorSelection selection = DetectorSelection.resolve(config, only, exclude);
        ReportFormat reportFormat = format != null ? format : config.reportFormat();
        Path output = outputPath != null
                ? outputPath
                : Path.of(DEFAULT_OUTPUT_DIR, "report." + reportFormat.extension());

        PrintWriter out = spec.commandLine().getOut();
        out.println("Analyzing " + target + " with detectors: " + String.join(", ", selection.names()));

        ProjectReport report = new ProjectAnalyzer(selection).analyze(target);

        ReportExporter exporter = new ReportExporter();
        exporter.printSummary(report, out);
        exporter.write(report, output, reportFormat);
        logger.debug("Wrote {} report to {}", reportFormat.extension(), output.toAbsolutePath());

        out.println();
        out.println("Report saved to: " + output);
        out.flush();
        return 0;
    }

    private static void enableDebugLogging() {
        for (String name : List.of(Logger.ROOT_LOGGER_NAME, "com.raditha.smells")) {
            if (LoggerFactory.getLogger(name) instanceof ch.qos.logback.classic.Logger logbackLogger) {
                logbackLogger.setLevel(Level.DEBUG);
            }
        }
    }

    /**
     * Command line with the project's exit code mapping: 2 for configuration and
     * argument errors, 3 for I/O errors, 1 for anything else.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new SmellDetectorCLI());

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

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Accepts "json" and "txt" in any case.
     */
    public static class ReportFormatConverter implements ITypeConverter<ReportFormat> {
        @Override
        public ReportFormat convert(String value) {
            return ReportFormat.fromName(value).orElseThrow(() ->
                    new CommandLine.TypeConversionException("Invalid format '" + value + "', expected json or txt"));
        }
    }
}
