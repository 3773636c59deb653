package org.olympiac.compiler.frontend.semantics;

import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A symbol table for managing scopes and symbols during verification.
 * <p>
 * Scopes form a stack whose bottom is the global scope (level 0). The stack is never empty
 * and the global scope cannot be exited. Each scope keeps its names in declaration order.
 * Shadowing a name from an outer scope is allowed; declaring it twice in one scope is not.
 */
public class SymbolTable {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolTable.class);

    private final List<Map<String, SymbolEntry>> scopes = new ArrayList<>();

    /**
     * Constructs a symbol table holding only the global scope.
     */
    public SymbolTable() {
        scopes.add(new LinkedHashMap<>());
    }

    /**
     * Enters a new scope.
     * @return The level of the new scope.
     */
    public int enterScope() {
        scopes.add(new LinkedHashMap<>());
        int level = currentLevel();
        LOG.debug("Enter scope -> level {}", level);
        return level;
    }

    /**
     * Leaves the current scope. Leaving the global scope has no effect.
     * @return The level of the scope that is current afterwards.
     */
    public int exitScope() {
        if (scopes.size() > 1) {
            scopes.remove(scopes.size() - 1);
            LOG.debug("Exit scope -> level {}", currentLevel());
        }
        return currentLevel();
    }

    /**
     * @return The level of the innermost scope, 0 for the global scope.
     */
    public int currentLevel() {
        return scopes.size() - 1;
    }

    /**
     * Declares a name in the innermost scope.
     * @param name The name.
     * @param type The declared type.
     * @param node The declaring node.
     * @param line The line of the declaration.
     * @return An error message if the name already exists in the innermost scope, otherwise empty.
     */
    public Optional<String> declare(String name, TypeTag type, AstNode node, int line) {
        Map<String, SymbolEntry> scope = scopes.get(scopes.size() - 1);
        if (scope.containsKey(name)) {
            return Optional.of("duplicate declaration: '" + name + "' already exists in the current scope (level "
                    + currentLevel() + ")");
        }
        scope.put(name, new SymbolEntry(name, type, node, line, currentLevel()));
        LOG.debug("scope={} - declared name='{}' type='{}' line={}", currentLevel(), name, type, line);
        return Optional.empty();
    }

    /**
     * Resolves a name, searching from the innermost scope outwards.
     * @param name The name.
     * @return The first matching entry, or empty if the name is not declared in any open scope.
     */
    public Optional<SymbolEntry> lookup(String name) {
        for (int i = scopes.size() - 1; i >= 0; i--) {
            SymbolEntry entry = scopes.get(i).get(name);
            if (entry != null) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * @return The entries of the global scope in declaration order.
     */
    public List<SymbolEntry> globalEntries() {
        return Collections.unmodifiableList(new ArrayList<>(scopes.get(0).values()));
    }

    /**
     * Takes a deep, order-stable copy of every open scope:
     * {@code scope_<level> -> name -> {name, type, line, scopeLevel}}.
     * The copy shares nothing with the live table.
     * @return The snapshot.
     */
    public Map<String, Map<String, Map<String, Object>>> snapshot() {
        Map<String, Map<String, Map<String, Object>>> copy = new LinkedHashMap<>();
        for (int level = 0; level < scopes.size(); level++) {
            Map<String, Map<String, Object>> scope = new LinkedHashMap<>();
            for (SymbolEntry entry : scopes.get(level).values()) {
                scope.put(entry.name(), entry.toMap());
            }
            copy.put("scope_" + level, scope);
        }
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int level = 0; level < scopes.size(); level++) {
            sb.append("scope ").append(level).append(':');
            for (SymbolEntry entry : scopes.get(level).values()) {
                sb.append(' ').append(entry.name()).append('=').append(entry.type());
            }
            if (level < scopes.size() - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }
}
