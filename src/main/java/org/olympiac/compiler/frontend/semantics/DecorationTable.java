package org.olympiac.compiler.frontend.semantics;

import org.olympiac.compiler.frontend.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decorations indexed by node id, parallel to the node arena of one syntax tree.
 * Every node is decorated at most once; a second write is an internal error.
 */
public class DecorationTable {

    private final List<Decoration> slots;

    /**
     * @param nodeCount The size of the node arena.
     */
    public DecorationTable(int nodeCount) {
        this.slots = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            slots.add(null);
        }
    }

    /**
     * Attaches a decoration to a node.
     * @param node The node.
     * @param decoration The decoration.
     * @throws IllegalStateException if the node is already decorated.
     */
    public void decorate(AstNode node, Decoration decoration) {
        int id = node.id();
        if (id < 0 || id >= slots.size()) {
            throw new IllegalArgumentException("Node " + id + " does not belong to this tree");
        }
        if (slots.get(id) != null) {
            throw new IllegalStateException("Node " + id + " (" + node.kind().displayName() + ") is already decorated");
        }
        slots.set(id, decoration);
    }

    public Optional<Decoration> get(AstNode node) {
        int id = node.id();
        return id >= 0 && id < slots.size() ? Optional.ofNullable(slots.get(id)) : Optional.empty();
    }

    /**
     * @return The inferred type of a node, {@link TypeTag#UNKNOWN} if it is not decorated.
     */
    public TypeTag typeOf(AstNode node) {
        return get(node).map(Decoration::type).orElse(TypeTag.UNKNOWN);
    }

    public int size() {
        return slots.size();
    }

    public int decoratedCount() {
        int count = 0;
        for (Decoration decoration : slots) {
            if (decoration != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return {@code node id -> decoration map}, for decorated nodes in id order.
     */
    public Map<String, Map<String, Object>> toMap() {
        Map<String, Map<String, Object>> map = new LinkedHashMap<>();
        for (int id = 0; id < slots.size(); id++) {
            Decoration decoration = slots.get(id);
            if (decoration != null) {
                map.put(String.valueOf(id), decoration.toMap());
            }
        }
        return map;
    }
}
