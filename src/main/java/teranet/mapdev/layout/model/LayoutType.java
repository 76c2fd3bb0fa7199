package teranet.mapdev.layout.model;

/**
 * Declared type of a layout definition (the LayoutType element of a LayoutVO).
 */
public enum LayoutType {
    TEXT_POSITIONAL("TextPositional"),
    XML("Xml"),
    IDOC("IDOC");

    private final String value;

    LayoutType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parse the layout XML value. Blank or unrecognized values fall back to TEXT_POSITIONAL,
     * the type of every mqseries layout.
     */
    public static LayoutType fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return TEXT_POSITIONAL;
        }
        for (LayoutType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return TEXT_POSITIONAL;
    }

    /**
     * Format used to split instance documents of this layout type.
     */
    public FormatType toFormatType() {
        switch (this) {
            case XML:
                return FormatType.XML;
            case IDOC:
                return FormatType.IDOC;
            default:
                return FormatType.MQSERIES;
        }
    }
}
