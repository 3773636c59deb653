package org.olympiac.compiler.frontend.semantics;

import org.olympiac.compiler.frontend.parser.ast.AstNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A declared name.
 *
 * @param name The declared name.
 * @param type The declared type.
 * @param node The declaring node.
 * @param line The line of the declaration.
 * @param scopeLevel The depth of the scope the name was declared in, 0 for the global scope.
 */
public record SymbolEntry(String name, TypeTag type, AstNode node, int line, int scopeLevel) {

    /**
     * @return A detached, insertion-ordered copy suitable for printing and serialization.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("type", type.toString());
        map.put("line", line);
        map.put("scopeLevel", scopeLevel);
        return map;
    }
}
