package org.olympiac.compiler.frontend.semantics;

import org.olympiac.compiler.diagnostics.DiagnosticsEngine;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.compiler.frontend.semantics.analysis.IAnalysisHandler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The state of one verification pass: scope stack, diagnostics sink, decoration table and
 * the path from the root to the node being analyzed. Handlers receive it explicitly and
 * drive the traversal of their node's children through {@link #visitChildren(AstNode)}.
 */
public class VerificationContext {

    private static final Pattern BARE_IDENTIFIER = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private final Map<NodeKind, IAnalysisHandler> handlers;
    private final SymbolTable table;
    private final DiagnosticsEngine diagnostics;
    private final DecorationTable decorations;
    private final boolean recordSnapshots;
    private final List<TableSnapshot> snapshots = new ArrayList<>();
    private final Deque<AstNode> path = new ArrayDeque<>();
    private final Deque<Integer> positions = new ArrayDeque<>();
    private int syntaxErrorDepth = 0;

    VerificationContext(Map<NodeKind, IAnalysisHandler> handlers, int nodeCount, boolean recordSnapshots) {
        this.handlers = handlers;
        this.table = new SymbolTable();
        this.diagnostics = new DiagnosticsEngine();
        this.decorations = new DecorationTable(nodeCount);
        this.recordSnapshots = recordSnapshots;
    }

    /**
     * Dispatches a node to the handler of its kind.
     * @param node The node to analyze.
     */
    public void visit(AstNode node) {
        visit(node, -1);
    }

    private void visit(AstNode node, int position) {
        boolean errorNode = node.kind() == NodeKind.SYNTAX_ERROR;
        if (errorNode) {
            syntaxErrorDepth++;
        }
        path.push(node);
        positions.push(position);
        try {
            handlers.get(node.kind()).analyze(node, this);
        } finally {
            positions.pop();
            path.pop();
            if (errorNode) {
                syntaxErrorDepth--;
            }
        }
    }

    /**
     * Visits the children of a node in order.
     * @param node The parent node.
     */
    public void visitChildren(AstNode node) {
        List<AstNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            visit(children.get(i), i);
        }
    }

    /**
     * @return The index of the node being analyzed among its parent's children, or -1 when it
     *         was visited directly.
     */
    public int position() {
        Integer position = positions.peek();
        return position == null ? -1 : position;
    }

    /**
     * @return The parent of the node being analyzed, or empty for the root.
     */
    public Optional<AstNode> parent() {
        if (path.size() < 2) {
            return Optional.empty();
        }
        AstNode current = path.pop();
        AstNode parent = path.peek();
        path.push(current);
        return Optional.ofNullable(parent);
    }

    /**
     * @return true while the traversal is below a {@code SyntaxError} node.
     */
    public boolean insideSyntaxError() {
        return syntaxErrorDepth > 0;
    }

    public SymbolTable table() {
        return table;
    }

    public DecorationTable decorations() {
        return decorations;
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    List<TableSnapshot> snapshots() {
        return snapshots;
    }

    public void decorate(AstNode node, Decoration decoration) {
        decorations.decorate(node, decoration);
    }

    public TypeTag typeOf(AstNode node) {
        return decorations.typeOf(node);
    }

    public void reportError(String message, AstNode node) {
        diagnostics.reportError(message, node.line(), node.column());
    }

    /**
     * Declares a name in the current scope. A duplicate is reported; a successful declaration
     * is recorded as a snapshot when snapshots are enabled.
     * @return true if the name was declared.
     */
    public boolean declare(String name, TypeTag type, AstNode node) {
        Optional<String> error = table.declare(name, type, node, node.line());
        if (error.isPresent()) {
            reportError(error.get(), node);
            return false;
        }
        if (recordSnapshots) {
            snapshots.add(new TableSnapshot(node.kind().displayName(), node.line(), table.snapshot()));
        }
        return true;
    }

    /**
     * Infers the type of an argument given as source text: quoted text is a {@code string},
     * digits are an {@code int}, {@code True} and {@code False} are a {@code bool}, anything else is looked up and defaults to {@code unknown}.
     * @param argument The argument text.
     * @return The inferred type.
     */
    public TypeTag resolveArgType(String argument) {
        if (argument == null) {
            return TypeTag.UNKNOWN;
        }
        String text = argument.strip();
        if (text.length() >= 2 && ((text.startsWith("\"") && text.endsWith("\""))
                || (text.startsWith("'") && text.endsWith("'")))) {
            return TypeTag.STRING;
        }
        if (DIGITS.matcher(text).matches()) {
            return TypeTag.INT;
        }
        if (text.equals("True") || text.equals("False")) {
            return TypeTag.BOOL;
        }
        return table.lookup(text).map(SymbolEntry::type).orElse(TypeTag.UNKNOWN);
    }

    /**
     * @return true if the argument is a single word that is not a number.
     */
    public static boolean isBareIdentifier(String argument) {
        return argument != null && BARE_IDENTIFIER.matcher(argument.strip()).matches()
                && !DIGITS.matcher(argument.strip()).matches();
    }
}
