package org.olympiac.compiler.frontend.semantics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The symbol table as it stood right after a declaration.
 *
 * @param node The display name of the declaring node kind.
 * @param line The line of the declaration.
 * @param table The deep copy returned by {@link SymbolTable#snapshot()}.
 */
public record TableSnapshot(String node, int line, Map<String, Map<String, Map<String, Object>>> table) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("node", node);
        map.put("line", line);
        map.put("table", table);
        return map;
    }
}
