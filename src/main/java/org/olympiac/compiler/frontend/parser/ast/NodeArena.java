package org.olympiac.compiler.frontend.parser.ast;

import org.olympiac.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Creates AST nodes and keeps them in a flat list.
 * The id of every node is its index in this list, which lets later phases keep
 * per-node data in parallel lists instead of identity-keyed maps.
 */
public class NodeArena {

    private final List<AstNode> nodes = new ArrayList<>();

    /**
     * Creates a node positioned at the given token.
     * @param kind The node kind.
     * @param content The content label.
     * @param at The token providing line and column, may be null.
     * @return The new node.
     */
    public AstNode create(NodeKind kind, String content, Token at) {
        return at == null ? create(kind, content, 0, 0) : create(kind, content, at.line(), at.column());
    }

    /**
     * Creates a node at an explicit position.
     * @param kind The node kind.
     * @param content The content label.
     * @param line The source line.
     * @param column The source column.
     * @return The new node.
     */
    public AstNode create(NodeKind kind, String content, int line, int column) {
        AstNode node = new AstNode(nodes.size(), kind, content, line, column);
        nodes.add(node);
        if (line > 0) {
            node.put("line", line);
        }
        return node;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * @return An unmodifiable view of every node created so far, indexed by id.
     */
    public List<AstNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }
}
