package teranet.mapdev.layout.service;

import org.springframework.stereotype.Service;
import teranet.mapdev.layout.config.LayoutEngineConfig;
import teranet.mapdev.layout.logging.TechLogger;
import teranet.mapdev.layout.model.FormatType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cuts raw document text into physical lines.
 *
 * mqseries content is cut into fixed-width records (the last one right-padded with spaces);
 * every other format is split on line terminators with empty fragments dropped.
 */
@Service
public class LineSplitterService {

    private static final String ENDPOINT = "LineSplitter";

    private final LayoutEngineConfig config;
    private final TechLogger techLogger;

    public LineSplitterService(LayoutEngineConfig config, TechLogger techLogger) {
        this.config = config;
        this.techLogger = techLogger;
    }

    /**
     * Split text using the configured record length for mqseries content.
     *
     * @param text   raw document text
     * @param format detected or declared format
     * @return the lines in order, empty for null or empty input
     */
    public List<String> split(String text, FormatType format) {
        return split(text, format, config.getRecordLength());
    }

    /**
     * Split text using an explicit record width for mqseries content (e.g. 2500 for wide layouts).
     */
    public List<String> split(String text, FormatType format, int recordLength) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }

        if (format == FormatType.MQSERIES) {
            return splitFixedLength(text, recordLength);
        }
        return splitOnLineBreaks(text);
    }

    /**
     * Partition text into ceil(len / lineLength) chunks of exactly lineLength characters.
     */
    public List<String> splitFixedLength(String text, int lineLength) {
        if (text == null || text.isEmpty() || lineLength <= 0) {
            return Collections.emptyList();
        }

        int totalLines = (text.length() + lineLength - 1) / lineLength;
        List<String> lines = new ArrayList<>(totalLines);

        for (int i = 0; i < totalLines; i++) {
            int start = i * lineLength;
            int end = Math.min(start + lineLength, text.length());
            String line = text.substring(start, end);
            if (line.length() < lineLength) {
                line = padRight(line, lineLength);
            }
            lines.add(line);

            techLogger.debug(ENDPOINT, String.format("Line %d: sequence '%s', length %d",
                    i + 1, line.substring(0, Math.min(config.getSequencePrefixLength(), line.length())),
                    line.length()));
        }

        techLogger.info(ENDPOINT, String.format("Split %d characters into %d records of %d",
                text.length(), totalLines, lineLength));
        return lines;
    }

    private List<String> splitOnLineBreaks(String text) {
        List<String> lines = new ArrayList<>();
        for (String fragment : text.split("[\\r\\n]")) {
            if (!fragment.isEmpty()) {
                lines.add(fragment);
            }
        }
        techLogger.info(ENDPOINT, String.format("Split content into %d delimited lines", lines.size()));
        return lines;
    }

    static String padRight(String value, int length) {
        if (value.length() >= length) {
            return value;
        }
        StringBuilder padded = new StringBuilder(length).append(value);
        while (padded.length() < length) {
            padded.append(' ');
        }
        return padded.toString();
    }
}
