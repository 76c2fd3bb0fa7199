package teranet.mapdev.layout.model;

import java.util.Collections;
import java.util.List;

/**
 * Own fields and nested child lines of one line definition, each in original order.
 */
public class SeparatedElements {

    private final List<FieldElement> fields;
    private final List<LineElement> childLines;

    public SeparatedElements(List<FieldElement> fields, List<LineElement> childLines) {
        this.fields = fields != null ? Collections.unmodifiableList(fields) : Collections.emptyList();
        this.childLines = childLines != null ? Collections.unmodifiableList(childLines) : Collections.emptyList();
    }

    public static SeparatedElements empty() {
        return new SeparatedElements(null, null);
    }

    public List<FieldElement> getFields() {
        return fields;
    }

    public List<LineElement> getChildLines() {
        return childLines;
    }

    public boolean hasChildLines() {
        return !childLines.isEmpty();
    }
}
