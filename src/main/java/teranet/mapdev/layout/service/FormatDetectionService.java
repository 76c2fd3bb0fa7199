package teranet.mapdev.layout.service;

import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;
import teranet.mapdev.layout.config.LayoutEngineConfig;
import teranet.mapdev.layout.logging.TechLogger;
import teranet.mapdev.layout.model.FormatType;
import teranet.mapdev.layout.util.XmlDocumentUtil;

import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies raw document content as xml, mqseries, idoc or unknown.
 *
 * Checks run in that order and the first match wins. Detection is a pure function of the
 * content; the only side effect is a debug entry on the technical log.
 *
 * mqseries uses the strict multi-signal heuristic:
 * 1. first non-blank line starts with HEADER
 * 2. content without line terminators is a positive multiple of the record length
 * 3. at least two 9-digit sequence tags (6-digit counter + 3-digit line tag)
 * 4. a terminal "999" tag, or at least three sequence tags
 */
@Service
public class FormatDetectionService {

    private static final String ENDPOINT = "FormatDetection";

    private static final Pattern SEQUENCE_TAG = Pattern.compile("\\d{6}\\d{3}");
    private static final Pattern TERMINAL_TAG = Pattern.compile("\\d{6}999");
    private static final Pattern IDOC_TOKEN = Pattern.compile("[0-9A-Z_\\-]+");

    private static final int MIN_SEQUENCE_TAGS = 2;
    private static final int SEQUENCE_TAGS_WITHOUT_TERMINAL = 3;
    private static final int IDOC_MIN_TOKENS = 6;
    private static final int IDOC_MIN_TOKEN_LENGTH = 16;

    private final LayoutEngineConfig config;
    private final TechLogger techLogger;

    public FormatDetectionService(LayoutEngineConfig config, TechLogger techLogger) {
        this.config = config;
        this.techLogger = techLogger;
    }

    /**
     * Detect the format of raw content.
     *
     * @param content document text, may be null
     * @return the detected format, UNKNOWN for blank content
     */
    public FormatType detect(String content) {
        if (content == null || content.isBlank()) {
            return FormatType.UNKNOWN;
        }

        FormatType detected;
        if (looksLikeXml(content) && isWellFormedXml(content)) {
            detected = FormatType.XML;
        } else if (looksLikeMqSeries(content)) {
            detected = FormatType.MQSERIES;
        } else if (looksLikeIdoc(content)) {
            detected = FormatType.IDOC;
        } else {
            detected = FormatType.UNKNOWN;
        }

        techLogger.debug(ENDPOINT, String.format("Detected format '%s' for %d characters of content",
                detected.getCode(), content.length()));
        return detected;
    }

    boolean looksLikeXml(String content) {
        String trimmed = content.stripLeading();
        return trimmed.startsWith("<")
                && (trimmed.contains("<?xml") || trimmed.contains("<NFe") || trimmed.contains("</"));
    }

    boolean isWellFormedXml(String content) {
        try {
            XmlDocumentUtil.parse(XmlDocumentUtil.cleanXmlContent(content));
            return true;
        } catch (SAXException | IOException e) {
            techLogger.debug(ENDPOINT, "Content looks like XML but is not well-formed: " + e.getMessage());
            return false;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not configurable", e);
        }
    }

    boolean looksLikeMqSeries(String content) {
        String firstLine = firstNonBlankLine(content);
        if (!firstLine.startsWith("HEADER")) {
            return false;
        }

        String stripped = content.replace("\r", "").replace("\n", "");
        int recordLength = config.getRecordLength();
        if (stripped.isEmpty() || recordLength <= 0 || stripped.length() % recordLength != 0) {
            return false;
        }

        int sequenceTags = countMatches(SEQUENCE_TAG, stripped);
        if (sequenceTags < MIN_SEQUENCE_TAGS) {
            return false;
        }

        return TERMINAL_TAG.matcher(stripped).find() || sequenceTags >= SEQUENCE_TAGS_WITHOUT_TERMINAL;
    }

    boolean looksLikeIdoc(String content) {
        String firstLine = firstLine(content);
        if (firstLine.isEmpty()) {
            return false;
        }

        if (firstLine.startsWith("EDI_") || firstLine.contains("ZRSDM_")) {
            return true;
        }

        String[] tokens = firstLine.trim().split(" +");
        if (tokens.length < IDOC_MIN_TOKENS) {
            return false;
        }
        for (String token : tokens) {
            if (token.length() >= IDOC_MIN_TOKEN_LENGTH && IDOC_TOKEN.matcher(token).matches()) {
                return true;
            }
        }
        return false;
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static String firstLine(String content) {
        int end = 0;
        while (end < content.length() && content.charAt(end) != '\n' && content.charAt(end) != '\r') {
            end++;
        }
        return content.substring(0, end);
    }

    private static String firstNonBlankLine(String content) {
        for (String line : content.split("\\r?\\n|\\r")) {
            if (!line.isBlank()) {
                return line.stripLeading();
            }
        }
        return "";
    }
}
