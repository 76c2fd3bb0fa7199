package teranet.mapdev.layout.model;

/**
 * Kind of a serialized child element of a line, with the type discriminator written into each blob.
 */
public enum ElementKind {
    FIELD("FieldElementVO"),
    LINE("LineElementVO"),
    UNRECOGNIZED(null);

    private final String discriminator;

    ElementKind(String discriminator) {
        this.discriminator = discriminator;
    }

    public String getDiscriminator() {
        return discriminator;
    }

    /**
     * Resolve a kind from a discriminator value such as "FieldElementVO".
     * Prefixed values ("ns:LineElementVO") are accepted.
     */
    public static ElementKind fromDiscriminator(String value) {
        if (value == null || value.isBlank()) {
            return UNRECOGNIZED;
        }
        String local = value.substring(value.indexOf(':') + 1).trim();
        if (FIELD.discriminator.equals(local)) {
            return FIELD;
        }
        if (LINE.discriminator.equals(local)) {
            return LINE;
        }
        return UNRECOGNIZED;
    }
}
