package teranet.mapdev.layout.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative schema of a document: its line definitions in order.
 *
 * The engine never mutates a Layout it receives; normalization returns new instances.
 */
@Data
@NoArgsConstructor
public class Layout {

    public static final String GUID_PREFIX = "LAY_";

    private String layoutGuid;
    private LayoutType layoutType = LayoutType.TEXT_POSITIONAL;
    private String name;
    private String description;
    private int limitOfCharacters;
    private List<LineElement> elements = new ArrayList<>();

    public Layout(String layoutGuid, String name, LayoutType layoutType) {
        this.layoutGuid = layoutGuid;
        this.name = name;
        this.layoutType = layoutType;
    }

    /**
     * Copy of the layout attributes with an empty line list.
     */
    public Layout copyWithoutElements() {
        Layout copy = new Layout();
        copy.setLayoutGuid(layoutGuid);
        copy.setLayoutType(layoutType);
        copy.setName(name);
        copy.setDescription(description);
        copy.setLimitOfCharacters(limitOfCharacters);
        return copy;
    }
}
