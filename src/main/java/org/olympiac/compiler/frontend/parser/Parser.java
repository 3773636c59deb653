package org.olympiac.compiler.frontend.parser;

import org.olympiac.compiler.api.FrontendOptions;
import org.olympiac.compiler.diagnostics.Diagnostic;
import org.olympiac.compiler.diagnostics.DiagnosticsEngine;
import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.lexer.TokenType;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeArena;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.compiler.frontend.parser.ast.SyntaxTree;
import org.olympiac.compiler.frontend.parser.features.competition.ActionStubHandler;
import org.olympiac.compiler.frontend.parser.features.competition.MatchHandler;
import org.olympiac.compiler.frontend.parser.features.expression.ExpressionParser;
import org.olympiac.compiler.frontend.parser.features.invocation.InvocationHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The main parser for the Olympiac language. It consumes a list of tokens
 * from the {@link org.olympiac.compiler.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * The parser never throws for malformed input. Failed expectations are recorded as syntax
 * diagnostics and the parser resynchronizes at the next stable anchor. Recovery is bounded by
 * {@link FrontendOptions#maxRecoverySteps()}; when one recovery exceeds it, the rest of the
 * stream is discarded so parsing always terminates.
 */
public class Parser implements ParsingContext {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private final FrontendOptions options;
    private final DiagnosticsEngine diagnostics;
    private final KeywordHandlerRegistry keywordRegistry;
    private final NodeArena arena = new NodeArena();
    private final ExpressionParser expressionParser = new ExpressionParser();
    private final InvocationHandler invocationHandler = new InvocationHandler();
    private final MatchHandler matchHandler = new MatchHandler();
    private final ActionStubHandler actionStubHandler = new ActionStubHandler();
    private int current = 0;
    private boolean recoveryExhausted = false;

    /**
     * Constructs a new Parser with the default options.
     * @param tokens The list of tokens to parse.
     */
    public Parser(List<Token> tokens) {
        this(tokens, FrontendOptions.DEFAULTS);
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     * @param options The recovery bound and deduplication setting.
     */
    public Parser(List<Token> tokens, FrontendOptions options) {
        this.tokens = List.copyOf(tokens);
        this.options = options;
        this.diagnostics = new DiagnosticsEngine(options.deduplicateDiagnostics());
        this.keywordRegistry = KeywordHandlerRegistry.initialize();
    }

    /**
     * Parses the entire token stream.
     * @return The tree rooted at a {@code Program} node, with its node arena and syntax diagnostics.
     */
    public SyntaxTree parse() {
        AstNode root = arena.create(NodeKind.PROGRAM, "root", 0, 0);
        while (!isAtEnd()) {
            root.addChild(parseCommand());
        }
        List<Object> reported = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            reported.add(diagnostic.toMap());
        }
        root.put("diagnostics", reported);
        if (recoveryExhausted) {
            root.put("recoveryExhausted", true);
        }
        LOG.debug("Parsed {} tokens into {} nodes with {} syntax diagnostics",
                tokens.size(), arena.size(), reported.size());
        return new SyntaxTree(root, arena.nodes(), diagnostics.getDiagnostics());
    }

    @Override
    public AstNode parseCommand() {
        if (isAtEnd()) {
            return null;
        }
        int before = current;
        Token token = peek();
        AstNode command = dispatch(token);
        if (current == before) {
            // The production consumed nothing; wrap the token so the loop advances.
            advance();
            return arena.create(NodeKind.UNKNOWN, token.text(), token);
        }
        return command;
    }

    private AstNode dispatch(Token token) {
        return switch (token.type()) {
            case COMMENT -> {
                advance();
                yield arena.create(NodeKind.COMMENT, token.text(), token);
            }
            case ENTITY_DECLARATION, CONTROL_FLOW, DOMAIN_KEYWORD, DOMAIN_TYPE, RESULT_MARKER, TIE_MARKER,
                    FUNCTION_INVOCATION -> keywordCommand(token);
            case IDENTIFIER -> identifierCommand(token);
            case PUNCTUATION -> {
                advance();
                yield arena.create(NodeKind.SYMBOL, token.text(), token);
            }
            default -> {
                advance();
                yield arena.create(NodeKind.UNKNOWN, token.text(), token);
            }
        };
    }

    private AstNode keywordCommand(Token token) {
        Optional<IKeywordHandler> handler = keywordRegistry.get(token.text());
        if (handler.isPresent()) {
            return handler.get().parse(this);
        }
        String word = Keywords.normalize(token.text());
        if (token.type() == TokenType.FUNCTION_INVOCATION) {
            return invocationHandler.parse(this);
        }
        if (token.type() == TokenType.CONTROL_FLOW
                || (token.type() == TokenType.DOMAIN_KEYWORD && Keywords.COMPETITION_TERMINATORS.contains(word))) {
            advance();
            return arena.create(NodeKind.CLOSE, token.text(), token);
        }
        if (token.type() == TokenType.DOMAIN_KEYWORD) {
            return actionStubHandler.parse(this);
        }
        advance();
        return arena.create(NodeKind.UNKNOWN, token.text(), token);
    }

    private AstNode identifierCommand(Token token) {
        Token next = peekAt(1);
        if (next != null && next.type() == TokenType.SPECIAL_OPERATOR && next.is(Keywords.VERSUS)) {
            return matchHandler.parse(this);
        }
        advance();
        return arena.create(NodeKind.IDENTIFIER, token.text(), token).put("name", token.text());
    }

    @Override
    public List<AstNode> parseBody(String... terminators) {
        Set<String> stop = normalized(terminators);
        List<AstNode> body = new ArrayList<>();
        while (!isAtEnd()) {
            Token token = peek();
            if (token.type() == TokenType.PUNCTUATION && (token.is("}") || token.is("]"))) {
                break;
            }
            if (stop.contains(Keywords.normalize(token.text()))) {
                break;
            }
            body.add(parseCommand());
        }
        return body;
    }

    @Override
    public AstNode parseExpression() {
        return expressionParser.parse(this);
    }

    // --- cursor ---

    @Override
    public Token peek() {
        return peekAt(0);
    }

    @Override
    public Token peekAt(int offset) {
        int index = current + offset;
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }

    @Override
    public Token advance() {
        if (isAtEnd()) {
            return null;
        }
        return tokens.get(current++);
    }

    @Override
    public boolean isAtEnd() {
        return current >= tokens.size();
    }

    @Override
    public boolean check(TokenType type) {
        Token token = peek();
        return token != null && token.type() == type;
    }

    @Override
    public boolean checkText(String text) {
        Token token = peek();
        return token != null && token.is(text);
    }

    @Override
    public boolean matchText(String text) {
        if (checkText(text)) {
            advance();
            return true;
        }
        return false;
    }

    @Override
    public int mark() {
        return current;
    }

    @Override
    public void reset(int mark) {
        if (mark < 0 || mark > tokens.size()) {
            throw new IllegalArgumentException("Invalid parser mark " + mark);
        }
        current = mark;
    }

    // --- expectations and recovery ---

    @Override
    public Token expect(TokenType type, String text, String what) {
        Token token = peek();
        if (token != null && (type == null || token.type() == type) && (text == null || token.is(text))) {
            return advance();
        }
        reportError("Expected " + what + " but " + describeCurrent(), token);
        return null;
    }

    @Override
    public boolean expectDelimiter(String text, String... follow) {
        if (matchText(text)) {
            return true;
        }
        expect(null, text, "'" + text + "'");
        String[] stopAt = new String[follow.length + 1];
        System.arraycopy(follow, 0, stopAt, 0, follow.length);
        stopAt[follow.length] = text;
        synchronize(stopAt);
        matchText(text);
        return false;
    }

    @Override
    public void synchronize(String... follow) {
        Set<String> accepted = normalized(follow);
        int skipped = 0;
        while (!isAtEnd()) {
            if (isAnchorAt(0) || accepted.contains(Keywords.normalize(peek().text()))) {
                if (skipped > 0) {
                    LOG.debug("Recovered after skipping {} tokens, resuming at {}", skipped, peek());
                }
                return;
            }
            if (skipped >= options.maxRecoverySteps()) {
                Token at = peek();
                int discarded = tokens.size() - current;
                LOG.warn("Error recovery skipped {} tokens without finding an anchor at line {}; discarding the remaining {} tokens",
                        skipped, at.line(), discarded);
                current = tokens.size();
                recoveryExhausted = true;
                return;
            }
            advance();
            skipped++;
        }
    }

    @Override
    public boolean isAnchorAt(int offset) {
        Token token = peekAt(offset);
        if (token == null) {
            return false;
        }
        switch (token.type()) {
            case ENTITY_DECLARATION, CONTROL_FLOW, DOMAIN_KEYWORD:
                return true;
            case FUNCTION_INVOCATION:
                return startsLineAt(offset);
            case PUNCTUATION:
                return Keywords.BLOCK_CLOSERS.contains(token.text());
            default:
                break;
        }
        if (!startsLineAt(offset)) {
            return false;
        }
        if (token.type() == TokenType.RESULT_MARKER || token.type() == TokenType.TIE_MARKER) {
            return true;
        }
        if (token.type() == TokenType.DOMAIN_TYPE && token.is(Keywords.RESULT)) {
            return true;
        }
        Token next = peekAt(offset + 1);
        return token.type() == TokenType.IDENTIFIER && next != null
                && next.type() == TokenType.SPECIAL_OPERATOR && next.is(Keywords.VERSUS);
    }

    @Override
    public boolean startsLineAt(int offset) {
        int index = current + offset;
        if (index <= 0) {
            return index == 0;
        }
        if (index >= tokens.size()) {
            return false;
        }
        return tokens.get(index - 1).line() != tokens.get(index).line();
    }

    // --- reporting and services ---

    @Override
    public void reportError(String message, Token at) {
        Token position = at != null ? at : lastToken();
        diagnostics.reportError(message, position == null ? 0 : position.line(), position == null ? 0 : position.column());
    }

    @Override
    public void reportWarning(String message, Token at) {
        Token position = at != null ? at : lastToken();
        diagnostics.reportWarning(message, position == null ? 0 : position.line(), position == null ? 0 : position.column());
    }

    @Override
    public NodeArena nodes() {
        return arena;
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return true if an error recovery hit the step bound and discarded the rest of the stream.
     */
    public boolean isRecoveryExhausted() {
        return recoveryExhausted;
    }

    private Token lastToken() {
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }

    private static Set<String> normalized(String... texts) {
        Set<String> set = new HashSet<>();
        for (String text : texts) {
            set.add(Keywords.normalize(text));
        }
        return set;
    }
}
