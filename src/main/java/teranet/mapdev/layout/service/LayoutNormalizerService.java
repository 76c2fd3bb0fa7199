package teranet.mapdev.layout.service;

import org.springframework.stereotype.Service;
import teranet.mapdev.layout.logging.TechLogger;
import teranet.mapdev.layout.model.ClassifiedElement;
import teranet.mapdev.layout.model.Layout;
import teranet.mapdev.layout.model.LineElement;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repairs the shape of a layout before validation and parsing.
 *
 * Both operations return a new Layout and leave their input untouched.
 */
@Service
public class LayoutNormalizerService {

    private static final String ENDPOINT = "LayoutNormalizer";

    /** Line whose legacy definitions nest sibling LINHA records one level too deep */
    public static final String NESTING_LINE_NAME = "LINHA020";

    static final String LINE_NAME_PREFIX = "LINHA";
    static final int UNNUMBERED_LINE_KEY = 9999;

    private static final Pattern NUMBERED_LINE = Pattern.compile("^" + LINE_NAME_PREFIX + "(\\d+)$");

    private final ElementClassifier elementClassifier;
    private final TechLogger techLogger;

    public LayoutNormalizerService(ElementClassifier elementClassifier, TechLogger techLogger) {
        this.elementClassifier = elementClassifier;
        this.techLogger = techLogger;
    }

    /**
     * Promote the LINHA records nested inside each top-level LINHA020 to top-level siblings.
     *
     * Legacy layouts were authored with sub-documents one level too deep under LINHA020 only.
     * For each top-level LINHA020, child blobs that classify as a line named LINHA* (other than
     * LINHA020) are removed and inserted right after the cleaned LINHA020, in encounter order.
     * Every other line passes through unchanged.
     *
     * @param layout the layout to repair, may be null
     * @return a new layout, or the input itself when it is null or has no lines
     */
    public Layout restructure(Layout layout) {
        if (layout == null || layout.getElements() == null) {
            return layout;
        }

        Layout restructured = layout.copyWithoutElements();
        List<LineElement> lines = new ArrayList<>();

        for (LineElement line : layout.getElements()) {
            if (line == null) {
                continue;
            }
            if (!NESTING_LINE_NAME.equals(line.getName())) {
                lines.add(line.copy());
                continue;
            }

            LineElement cleaned = line.copyWithoutElements();
            List<LineElement> promoted = new ArrayList<>();

            if (line.getElements() != null) {
                for (String blob : line.getElements()) {
                    ClassifiedElement element = elementClassifier.classify(blob);
                    if (element.isLine() && isPromotable(element.getLine())) {
                        promoted.add(element.getLine());
                    } else {
                        cleaned.getElements().add(blob);
                    }
                }
            }

            lines.add(cleaned);
            lines.addAll(promoted);

            if (!promoted.isEmpty()) {
                techLogger.info(ENDPOINT, String.format("Promoted %d nested line(s) out of %s in layout '%s'",
                        promoted.size(), NESTING_LINE_NAME, layout.getName()));
            }
        }

        restructured.setElements(lines);
        return restructured;
    }

    /**
     * Sort top-level lines by the number in their LINHA&lt;NNN&gt; name and renumber their sequence 1..n.
     *
     * Lines without such a number (HEADER, TRAILER, ...) sort last, keeping their relative order.
     *
     * @param layout the layout to reorder, may be null
     * @return a new layout, or the input itself when it is null or has no lines
     */
    public Layout reorderSequences(Layout layout) {
        if (layout == null || layout.getElements() == null) {
            return layout;
        }

        List<LineElement> ordered = new ArrayList<>();
        for (LineElement line : layout.getElements()) {
            if (line != null) {
                ordered.add(line.copy());
            }
        }
        // List.sort is stable, which keeps the operation idempotent
        ordered.sort(Comparator.comparingInt(line -> lineNumber(line.getName())));

        for (int i = 0; i < ordered.size(); i++) {
            ordered.get(i).setSequence(i + 1);
        }

        Layout reordered = layout.copyWithoutElements();
        reordered.setElements(ordered);
        return reordered;
    }

    /**
     * Numeric sort key of a line name: NNN for LINHA&lt;NNN&gt;, 9999 for anything else.
     */
    static int lineNumber(String lineName) {
        if (lineName == null) {
            return UNNUMBERED_LINE_KEY;
        }
        Matcher matcher = NUMBERED_LINE.matcher(lineName);
        if (!matcher.matches()) {
            return UNNUMBERED_LINE_KEY;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return UNNUMBERED_LINE_KEY;
        }
    }

    private static boolean isPromotable(LineElement child) {
        String name = child.getName();
        return name != null && name.startsWith(LINE_NAME_PREFIX) && !NESTING_LINE_NAME.equals(name);
    }
}
