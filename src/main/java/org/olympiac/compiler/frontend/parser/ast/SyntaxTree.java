package org.olympiac.compiler.frontend.parser.ast;

import org.olympiac.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The result of a parse: the root node, the arena of every node created, and the
 * syntax diagnostics. The same diagnostics are also attached to the root under the
 * {@code diagnostics} attribute.
 *
 * @param root The {@link NodeKind#PROGRAM} node.
 * @param nodes Every node created by the parser, indexed by node id.
 * @param syntaxErrors The deduplicated syntax diagnostics, in report order.
 */
public record SyntaxTree(
        AstNode root,
        List<AstNode> nodes,
        List<Diagnostic> syntaxErrors
) {
    public SyntaxTree {
        nodes = List.copyOf(nodes);
        syntaxErrors = List.copyOf(syntaxErrors);
    }

    /**
     * @return The number of ids in use; decoration tables are sized to this.
     */
    public int size() {
        return nodes.size();
    }
}
