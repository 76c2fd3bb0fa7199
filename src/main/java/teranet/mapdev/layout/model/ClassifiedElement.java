package teranet.mapdev.layout.model;

/**
 * Result of classifying one serialized child blob: a field, a nested line, or nothing usable.
 */
public final class ClassifiedElement {

    private static final ClassifiedElement UNRECOGNIZED = new ClassifiedElement(ElementKind.UNRECOGNIZED, null, null);

    private final ElementKind kind;
    private final FieldElement field;
    private final LineElement line;

    private ClassifiedElement(ElementKind kind, FieldElement field, LineElement line) {
        this.kind = kind;
        this.field = field;
        this.line = line;
    }

    public static ClassifiedElement field(FieldElement field) {
        return new ClassifiedElement(ElementKind.FIELD, field, null);
    }

    public static ClassifiedElement line(LineElement line) {
        return new ClassifiedElement(ElementKind.LINE, null, line);
    }

    public static ClassifiedElement unrecognized() {
        return UNRECOGNIZED;
    }

    public ElementKind getKind() {
        return kind;
    }

    public boolean isField() {
        return kind == ElementKind.FIELD;
    }

    public boolean isLine() {
        return kind == ElementKind.LINE;
    }

    public FieldElement getField() {
        if (!isField()) {
            throw new IllegalStateException("Element is not a field: " + kind);
        }
        return field;
    }

    public LineElement getLine() {
        if (!isLine()) {
            throw new IllegalStateException("Element is not a line: " + kind);
        }
        return line;
    }
}
