package teranet.mapdev.layout.model;

/**
 * Physical format of a raw instance document.
 *
 * The code is the lowercase name used in logs and on the command line.
 */
public enum FormatType {
    XML("xml"),
    MQSERIES("mqseries"),
    IDOC("idoc"),
    UNKNOWN("unknown");

    private final String code;

    FormatType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolve a format from its code (case-insensitive).
     *
     * @param code the format code, e.g. "mqseries"
     * @return the matching format, or UNKNOWN for null or unrecognized codes
     */
    public static FormatType fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        for (FormatType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
