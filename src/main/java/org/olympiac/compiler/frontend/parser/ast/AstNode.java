package org.olympiac.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the Abstract Syntax Tree.
 * <p>
 * Nodes are created by a {@link NodeArena}, which gives every node a dense id equal to its
 * index in the arena. A node owns its children exclusively. Children and attributes are only
 * added while the parser builds the tree; readers get unmodifiable views.
 */
public final class AstNode {

    private final int id;
    private final NodeKind kind;
    private final String content;
    private final int line;
    private final int column;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final List<AstNode> children = new ArrayList<>();

    AstNode(int id, NodeKind kind, String content, int line, int column) {
        this.id = id;
        this.kind = kind;
        this.content = content == null ? "" : content;
        this.line = line;
        this.column = column;
    }

    public int id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    public String content() {
        return content;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    /**
     * Returns a list of the direct child nodes.
     * @return An unmodifiable list of child nodes, empty for leaves.
     */
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * @return An unmodifiable, insertion-ordered view of the attributes.
     */
    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Appends a child. Only the parser calls this while the tree is under construction.
     * @param child The child to append; {@code null} is ignored.
     * @return this node.
     */
    public AstNode addChild(AstNode child) {
        if (child != null) {
            children.add(child);
        }
        return this;
    }

    /**
     * Sets an attribute. Only the parser calls this while the tree is under construction.
     * {@code null} values are kept, they mark slots the parser could not fill.
     * @param key The attribute name.
     * @param value The attribute value.
     * @return this node.
     */
    public AstNode put(String key, Object value) {
        attributes.put(key, value);
        return this;
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    public String stringAttribute(String key) {
        Object value = attributes.get(key);
        return value == null ? null : value.toString();
    }

    public Integer intAttribute(String key) {
        Object value = attributes.get(key);
        return value instanceof Integer i ? i : null;
    }

    public boolean flag(String key) {
        return Boolean.TRUE.equals(attributes.get(key));
    }

    /**
     * Returns the list stored under {@code key}, or an empty list.
     * @param key The attribute name.
     * @return The stored list elements as strings.
     */
    public List<String> stringListAttribute(String key) {
        Object value = attributes.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> out = new ArrayList<>(list.size());
        for (Object o : list) {
            out.add(o == null ? null : o.toString());
        }
        return out;
    }

    @Override
    public String toString() {
        return String.format("<\"%s\", \"%s\", %s>", kind.displayName(), content, attributes);
    }
}
