package org.olympiac.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Renders a tree in preorder, one node per line:
 * <pre>{@code <"Kind", "content", {attributes}>}</pre>
 * indented by two spaces per level. The root's {@code diagnostics} attribute is left out.
 */
public final class AstPrinter {

    private AstPrinter() {}

    public static List<String> preorderLines(AstNode root) {
        return preorderLines(root, node -> null);
    }

    /**
     * Renders the tree, adding an extra line below every node for which {@code extra}
     * returns a non-null text.
     * @param root The root to print.
     * @param extra Supplies an optional annotation per node.
     * @return The rendered lines.
     */
    public static List<String> preorderLines(AstNode root, Function<AstNode, String> extra) {
        List<String> out = new ArrayList<>();
        append(root, 0, extra, out);
        return out;
    }

    private static void append(AstNode node, int level, Function<AstNode, String> extra, List<String> out) {
        String indent = "  ".repeat(level);
        Map<String, Object> attributes = node.attributes();
        if (node.kind() == NodeKind.PROGRAM && attributes.containsKey("diagnostics")) {
            Map<String, Object> copy = new LinkedHashMap<>(attributes);
            copy.remove("diagnostics");
            attributes = copy;
        }
        out.add(String.format("%s<\"%s\", \"%s\", %s>", indent, node.kind().displayName(), node.content(), attributes));
        String annotation = extra.apply(node);
        if (annotation != null) {
            out.add(indent + "  " + annotation);
        }
        for (AstNode child : node.getChildren()) {
            append(child, level + 1, extra, out);
        }
    }
}
