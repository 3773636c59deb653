package org.olympiac.compiler.frontend.semantics;

import org.olympiac.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Everything a verification pass produces.
 *
 * @param decorations The decoration of each node, indexed by node id.
 * @param errors The semantic diagnostics in traversal order.
 * @param table The final symbol table; only its global scope is still open.
 * @param snapshots The symbol table after each declaration, empty if recording is off.
 */
public record VerificationResult(
        DecorationTable decorations,
        List<Diagnostic> errors,
        SymbolTable table,
        List<TableSnapshot> snapshots
) {
    public VerificationResult {
        errors = List.copyOf(errors);
        snapshots = List.copyOf(snapshots);
    }

    public boolean hasErrors() {
        return errors.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }
}
