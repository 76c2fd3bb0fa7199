package teranet.mapdev.layout.model;

/**
 * Padding alignment of a fixed-width field value.
 */
public enum AlignmentType {
    LEFT,
    RIGHT,
    CENTER,
    NONE;

    public static AlignmentType fromValue(String value) {
        if (value == null) {
            return NONE;
        }
        switch (value.trim().toLowerCase()) {
            case "left":
                return LEFT;
            case "right":
                return RIGHT;
            case "center":
                return CENTER;
            default:
                return NONE;
        }
    }

    /**
     * Strip the padding this alignment adds to a raw field value.
     */
    public String strip(String value) {
        if (value == null) {
            return "";
        }
        switch (this) {
            case LEFT:
                return value.stripTrailing();
            case RIGHT:
                return value.stripLeading();
            case CENTER:
                return value.strip();
            default:
                return value;
        }
    }
}
