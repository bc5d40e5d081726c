/*
 * PDF-Auto-XHTML - Tagged PDF to XHTML Conversion
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.autoxhtml.ui.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.autoxhtml.core.ConversionConfig;
import net.boyechko.pdf.autoxhtml.core.ConversionException;
import net.boyechko.pdf.autoxhtml.core.ConversionResult;
import net.boyechko.pdf.autoxhtml.core.ConversionService;
import net.boyechko.pdf.autoxhtml.core.ConversionSettings;
import net.boyechko.pdf.autoxhtml.core.VerbosityLevel;
import net.boyechko.pdf.autoxhtml.document.XhtmlSerializer;
import net.boyechko.pdf.autoxhtml.ui.ConversionReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfAutoXhtmlCLI {
    private static final String DEFAULT_OUTPUT_SUFFIX = "_autoxhtml";
    private static final String OUTPUT_EXTENSION = ".xhtml";

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            Path outputPath,
            Path reportPath,
            Path configPath,
            String projectId,
            List<String> runningHeaders,
            Boolean normalizeHeaders,
            boolean compact,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (outputPath == null) {
                throw new IllegalArgumentException("Output path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
            runningHeaders = List.copyOf(runningHeaders);
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments and resolves derived paths. */
    static class CLIConfigBuilder {
        Path inputPath;
        Path outputPath;
        boolean generateReport;
        Path reportPath;
        Path configPath;
        String projectId;
        List<String> runningHeaders = new ArrayList<>();
        Boolean normalizeHeaders;
        boolean compact;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            if (configPath != null && !Files.isRegularFile(configPath)) {
                throw new CLIException("Config file not found: " + configPath);
            }

            String baseName =
                    inputPath
                            .getFileName()
                            .toString()
                            .replaceFirst("(" + DEFAULT_OUTPUT_SUFFIX + ")*[.][^.]+$", "");
            resolveOutputPath(baseName);
            resolveReportPath(baseName);

            return new CLIConfig(
                    inputPath,
                    outputPath,
                    reportPath,
                    configPath,
                    projectId,
                    runningHeaders,
                    normalizeHeaders,
                    compact,
                    verbosity);
        }

        private void resolveOutputPath(String baseName) {
            String outputFilename = baseName + DEFAULT_OUTPUT_SUFFIX + OUTPUT_EXTENSION;
            if (outputPath == null) {
                outputPath = inputPath.resolveSibling(outputFilename);
            } else if (Files.isDirectory(outputPath)) {
                outputPath = outputPath.resolve(outputFilename);
            }
        }

        private void resolveReportPath(String baseName) {
            String reportFilename = baseName + DEFAULT_OUTPUT_SUFFIX + ".txt";
            if (generateReport && reportPath == null) {
                reportPath = outputPath.resolveSibling(reportFilename);
            } else if (reportPath != null && Files.isDirectory(reportPath)) {
                reportPath = reportPath.resolve(reportFilename);
            }
        }
    }

    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    /** Runs the CLI and returns the process exit status. */
    static int run(String[] args, PrintStream console) {
        try {
            if (isHelpRequested(args)) {
                console.println(usageMessage());
                return 0;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            logger().info(
                            "Starting conversion of {} with verbosity level {}",
                            config.inputPath(),
                            config.verbosity());
            return convertFile(config, console) ? 0 : 1;
        } catch (CLIException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--report=")) {
                b.reportPath = Paths.get(arg.substring("--report=".length()));
                b.generateReport = true;
            } else if (arg.startsWith("-r=")) {
                b.reportPath = Paths.get(arg.substring("-r=".length()));
                b.generateReport = true;
            } else if (arg.startsWith("--project-id=")) {
                b.projectId = arg.substring("--project-id=".length());
            } else if (arg.startsWith("--running-header=")) {
                b.runningHeaders.add(arg.substring("--running-header=".length()));
            } else if (arg.startsWith("--config=")) {
                b.configPath = Paths.get(arg.substring("--config=".length()));
            } else {
                switch (arg) {
                    case "--project-id" -> b.projectId = requireValue(args, ++i, arg);
                    case "--running-header" -> b.runningHeaders.add(requireValue(args, ++i, arg));
                    case "--config" -> b.configPath = Paths.get(requireValue(args, ++i, arg));
                    case "--normalize-headers" -> b.normalizeHeaders = true;
                    case "--no-normalize-headers" -> b.normalizeHeaders = false;
                    case "--compact" -> b.compact = true;
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "-r", "--report" -> b.generateReport = true;
                    default -> {
                        if (arg.startsWith("-") && arg.length() > 1) {
                            throw new CLIException("Unknown option: " + arg);
                        }
                        if (b.inputPath == null) {
                            b.inputPath = Paths.get(arg);
                        } else if (b.outputPath == null) {
                            b.outputPath = Paths.get(arg);
                        } else {
                            throw new CLIException("Multiple input files specified");
                        }
                    }
                }
            }
        }

        return b.build();
    }

    private static String requireValue(String[] args, int index, String option)
            throws CLIException {
        if (index >= args.length) {
            throw new CLIException("Value not specified after " + option);
        }
        return args[index];
    }

    /**
     * Resolves the effective settings: bundled defaults, then the user config file, then the
     * command-line flags.
     */
    static ConversionSettings resolveSettings(CLIConfig config) {
        ConversionConfig merged = ConversionConfig.loadDefault();
        if (config.configPath() != null) {
            merged = merged.overlaidWith(ConversionConfig.fromFile(config.configPath()));
        }

        ConversionConfig flags = new ConversionConfig();
        flags.project_id = config.projectId();
        if (!config.runningHeaders().isEmpty()) {
            flags.running_headers = config.runningHeaders();
        }
        flags.normalize_headers = config.normalizeHeaders();
        if (config.compact()) {
            flags.pretty_print = false;
        }
        return merged.overlaidWith(flags).toSettings();
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        Level level =
                switch (verbosity) {
                    case QUIET -> Level.ERROR;
                    case NORMAL -> Level.WARN;
                    case VERBOSE -> Level.INFO;
                    case DEBUG -> Level.DEBUG;
                };
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(level);
        ctx.getLogger("net.boyechko.pdf.autoxhtml").setLevel(level);
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(PdfAutoXhtmlCLI.class);
        }
        return logger;
    }

    /** Converts the input and writes the output; returns false when no output was written. */
    private static boolean convertFile(CLIConfig config, PrintStream console) {
        OutputStream reportFile = null;
        PrintStream output = console;

        try {
            reportFile = openReportStream(config);
            if (reportFile != null) {
                output =
                        new PrintStream(
                                new TeeOutputStream(console, reportFile),
                                true,
                                StandardCharsets.UTF_8);
            }

            ConversionSettings settings = resolveSettings(config);
            ConversionReporter reporter = new ConversionReporter(output, config.verbosity());

            ConversionService service =
                    new ConversionService.ConversionServiceBuilder()
                            .withSettings(settings)
                            .withListener(reporter)
                            .withPrintOutline(config.verbosity().isAtLeast(VerbosityLevel.VERBOSE))
                            .build();

            ConversionResult result = service.convertFile(config.inputPath());
            if (result.isAborted()) {
                return false;
            }
            saveResult(result, settings, config, reporter);
            return true;
        } catch (IOException | ConversionException e) {
            System.err.println("✗ Conversion failed: " + e.getMessage());
            logger().error("Conversion of {} failed", config.inputPath(), e);
            return false;
        } finally {
            if (reportFile != null) {
                output.flush();
                try {
                    reportFile.close();
                } catch (IOException e) {
                    logger().warn("Failed to close report file", e);
                }
            }
        }
    }

    private static OutputStream openReportStream(CLIConfig config) throws IOException {
        if (config.reportPath() == null) {
            return null;
        }
        Path reportParent = config.reportPath().getParent();
        if (reportParent != null) {
            Files.createDirectories(reportParent);
        }
        logger().info("Saving report to {}", config.reportPath());
        return Files.newOutputStream(config.reportPath());
    }

    private static void saveResult(
            ConversionResult result,
            ConversionSettings settings,
            CLIConfig config,
            ConversionReporter reporter)
            throws IOException {
        Path outputParent = config.outputPath().getParent();
        if (outputParent != null) {
            Files.createDirectories(outputParent);
        }
        String xhtml = new XhtmlSerializer(settings.prettyPrint()).serialize(result.document());
        Files.writeString(config.outputPath(), xhtml, StandardCharsets.UTF_8);
        logger().info("Wrote {} characters to {}", xhtml.length(), config.outputPath());

        reporter.onSuccess("Output saved to " + config.outputPath());
    }

    /** Writes to two output streams simultaneously, like the Unix tee command. */
    private static class TeeOutputStream extends OutputStream {
        private final OutputStream out1;
        private final OutputStream out2;

        TeeOutputStream(OutputStream out1, OutputStream out2) {
            this.out1 = out1;
            this.out2 = out2;
        }

        @Override
        public void write(int b) throws IOException {
            out1.write(b);
            out2.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out1.write(b, off, len);
            out2.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            out1.flush();
            out2.flush();
        }
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return "Usage: pdf-autoxhtml [options] <input.xml|input.pdf> [<output.xhtml>]\n"
                + "  -h, --help                Show this help message\n"
                + "  --project-id=ID           Project id used in rewritten image paths\n"
                + "                            (default: unknown)\n"
                + "  --running-header=TEXT     Drop paragraphs whose text is TEXT (repeatable)\n"
                + "  --config=FILE             Read settings from a YAML file\n"
                + "  --normalize-headers       Re-level headings against the first heading\n"
                + "  --no-normalize-headers    Keep heading levels as tagged (the default)\n"
                + "  --compact                 Write the XHTML without indentation\n"
                + "  -q, --quiet               Only show errors and final status\n"
                + "  -v, --verbose             Show repairs and the output outline\n"
                + "  -vv, --debug              Show all debug information\n"
                + "  -r, --report              Save output to report file (auto-named from input)\n"
                + "                            Use -r=<file> or --report=<file> for a custom path\n"
                + "Examples:\n"
                + "  pdf-autoxhtml --project-id=acme42 export.xml\n"
                + "  pdf-autoxhtml -v --running-header=\"Annual Report\" report.pdf out.xhtml\n"
                + "  pdf-autoxhtml --config=project.yaml --report=report.txt export.xml";
    }
}
