package org.olympiac.compiler.frontend.semantics;

/**
 * The inferred type of a node or the declared type of a symbol.
 * A tag is a category with an optional detail, rendered as {@code category} or
 * {@code category:detail}, e.g. {@code entity:Deportista} or {@code list:Pais}.
 *
 * @param category The category, such as {@code entity}, {@code list} or {@code int}.
 * @param detail The entity kind or list element type, or {@code null} for primitives.
 */
public record TypeTag(String category, String detail) {

    public static final String ENTITY = "entity";
    public static final String LIST = "list";

    public static final TypeTag INT = new TypeTag("int", null);
    public static final TypeTag STRING = new TypeTag("string", null);
    public static final TypeTag BOOL = new TypeTag("bool", null);
    public static final TypeTag VOID = new TypeTag("void", null);
    public static final TypeTag UNKNOWN = new TypeTag("unknown", null);

    public static TypeTag entity(String kind) {
        return new TypeTag(ENTITY, kind);
    }

    public static TypeTag list(String elementType) {
        return new TypeTag(LIST, elementType == null ? UNKNOWN.category() : elementType);
    }

    public boolean isEntity() {
        return ENTITY.equals(category);
    }

    public boolean isList() {
        return LIST.equals(category);
    }

    public boolean isUnknown() {
        return UNKNOWN.equals(this);
    }

    @Override
    public String toString() {
        return detail == null ? category : category + ":" + detail;
    }
}
