package teranet.mapdev.layout.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import teranet.mapdev.layout.dto.LayoutValidationReport;
import teranet.mapdev.layout.dto.ParsingResult;
import teranet.mapdev.layout.exception.LayoutCompilationException;
import teranet.mapdev.layout.model.FormatType;
import teranet.mapdev.layout.service.LayoutProcessingService;
import teranet.mapdev.layout.util.CorrelationIdUtil;
import teranet.mapdev.layout.util.InputFileUtil;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line boundary of the engine: reads the files named on the command line,
 * runs one command and writes its output to stdout or to the --out file.
 *
 * Commands:
 * - detect &lt;document&gt;
 * - validate &lt;layout.xml&gt;
 * - parse &lt;layout.xml&gt; &lt;document&gt;
 * - tcl &lt;layout.xml&gt;
 * - xsl &lt;map.xml&gt;
 */
@Component
public class LayoutEngineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(LayoutEngineRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_USAGE = 2;

    private static final String OUT_OPTION = "out";
    private static final String USAGE =
            "Usage: layout-engine <detect|validate|parse|tcl|xsl> <file>... [--out=<file>]";

    private final LayoutProcessingService processingService;
    private final ObjectMapper objectMapper;
    private final PrintStream console;

    private int exitCode = EXIT_OK;

    @Autowired
    public LayoutEngineRunner(LayoutProcessingService processingService, ObjectMapper objectMapper) {
        this(processingService, objectMapper, System.out);
    }

    LayoutEngineRunner(LayoutProcessingService processingService, ObjectMapper objectMapper, PrintStream console) {
        this.processingService = processingService;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.console = console;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> arguments = args.getNonOptionArgs();
        if (arguments.isEmpty()) {
            logger.info(USAGE);
            return;
        }

        String correlationId = CorrelationIdUtil.startNewCorrelationId();
        String command = arguments.get(0).toLowerCase();
        List<String> files = arguments.subList(1, arguments.size());
        logger.info("Running '{}' on {} (correlation ID {})", command, files, correlationId);

        try {
            String output = execute(command, files);
            write(output, args.getOptionValues(OUT_OPTION));
        } catch (IllegalArgumentException e) {
            logger.error("Invalid arguments: {}", e.getMessage());
            logger.info(USAGE);
            exitCode = EXIT_USAGE;
        } catch (LayoutCompilationException e) {
            logger.error("Cannot process input: {}", e.getMessage());
            exitCode = EXIT_INVALID;
        } catch (IOException e) {
            logger.error("I/O error: {}", e.getMessage(), e);
            exitCode = EXIT_INVALID;
        } finally {
            CorrelationIdUtil.clearCorrelationId();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    String execute(String command, List<String> files) throws IOException {
        switch (command) {
            case "detect": {
                requireFiles(command, files, 1);
                FormatType format = processingService.detectFormat(InputFileUtil.readUtf8(path(files.get(0))));
                return format.getCode();
            }
            case "validate": {
                requireFiles(command, files, 1);
                LayoutValidationReport report = processingService.validateLayout(readXml(files.get(0)));
                if (!report.isAllValid()) {
                    exitCode = EXIT_INVALID;
                }
                return toJson(report);
            }
            case "parse": {
                requireFiles(command, files, 2);
                String layoutXml = readXml(files.get(0));
                String content = InputFileUtil.readUtf8(path(files.get(1)));
                ParsingResult result = processingService.parseDocument(content, layoutXml);
                if (!result.isSuccess()) {
                    exitCode = EXIT_INVALID;
                }
                return toJson(result);
            }
            case "tcl":
                requireFiles(command, files, 1);
                return processingService.generateTcl(readXml(files.get(0)));
            case "xsl":
                requireFiles(command, files, 1);
                return processingService.generateXsl(readXml(files.get(0)));
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private void write(String output, List<String> outFiles) throws IOException {
        if (outFiles == null || outFiles.isEmpty()) {
            console.println(output);
            return;
        }
        Path target = path(outFiles.get(0));
        Files.writeString(target, output, StandardCharsets.UTF_8);
        logger.info("Output written to {}", target.toAbsolutePath());
    }

    private String readXml(String file) throws IOException {
        return InputFileUtil.readUtf8(path(file), "xml");
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize result", e);
        }
    }

    private static Path path(String file) {
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("File is not provided");
        }
        return Paths.get(file);
    }

    private static void requireFiles(String command, List<String> files, int count) {
        if (files.size() < count) {
            throw new IllegalArgumentException(
                    String.format("Command '%s' expects %d file argument(s), got %d", command, count, files.size()));
        }
    }
}
