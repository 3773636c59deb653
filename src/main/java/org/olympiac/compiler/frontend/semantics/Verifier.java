package org.olympiac.compiler.frontend.semantics;

import org.olympiac.compiler.api.FrontendOptions;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.compiler.frontend.parser.ast.SyntaxTree;
import org.olympiac.compiler.frontend.semantics.analysis.AthleteAnalysisHandler;
import org.olympiac.compiler.frontend.semantics.analysis.CompetitionAnalysisHandler;
import org.olympiac.compiler.frontend.semantics.analysis.ExpressionAnalysisHandler;
import org.olympiac.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.olympiac.compiler.frontend.semantics.analysis.IdentifierAnalysisHandler;
import org.olympiac.compiler.frontend.semantics.analysis.InvocationAnalysisHandler;
import org.olympiac.compiler.frontend.semantics.analysis.ListAnalysisHandler;
import org.olympiac.compiler.frontend.semantics.analysis.PassThroughAnalysisHandler;
import org.olympiac.compiler.frontend.semantics.analysis.ResultAnalysisHandler;
import org.olympiac.compiler.frontend.semantics.analysis.ScopeAnalysisHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Performs semantic verification of a syntax tree. This includes symbol table management,
 * declare-before-use checks, type inference and the structural rules of competitions.
 * It walks the tree once and dispatches every node to the handler registered for its kind.
 * <p>
 * Verification is advisory: it never changes the tree and never throws for defects in the
 * program. Its findings are returned as diagnostics next to the decorations.
 */
public class Verifier {

    private static final Logger LOG = LoggerFactory.getLogger(Verifier.class);

    private final FrontendOptions options;
    private final Map<NodeKind, IAnalysisHandler> handlers;

    public Verifier() {
        this(FrontendOptions.DEFAULTS);
    }

    /**
     * Constructs a new verifier.
     * @param options Whether to record symbol table snapshots.
     */
    public Verifier(FrontendOptions options) {
        this.options = options;
        this.handlers = registerDefaultHandlers();
    }

    private static Map<NodeKind, IAnalysisHandler> registerDefaultHandlers() {
        IAnalysisHandler passThrough = new PassThroughAnalysisHandler();
        IAnalysisHandler scope = new ScopeAnalysisHandler();
        IAnalysisHandler athlete = new AthleteAnalysisHandler();
        IAnalysisHandler list = new ListAnalysisHandler();
        IAnalysisHandler identifier = new IdentifierAnalysisHandler();
        IAnalysisHandler invocation = new InvocationAnalysisHandler();
        IAnalysisHandler expression = new ExpressionAnalysisHandler();
        IAnalysisHandler result = new ResultAnalysisHandler();
        IAnalysisHandler competition = new CompetitionAnalysisHandler();

        Map<NodeKind, IAnalysisHandler> map = new EnumMap<>(NodeKind.class);
        for (NodeKind kind : NodeKind.values()) {
            // No default branch: a new node kind does not compile until it is mapped here.
            IAnalysisHandler handler = switch (kind) {
                case PROGRAM, COMMENT, SYMBOL, CLOSE, ACTION_STUB, RESULT_EXTRA, SYNTAX_ERROR, UNKNOWN -> passThrough;
                case CONDITIONAL, ELSE, LOOP, LOOP_UNTIL -> scope;
                case ATHLETE_DECL -> athlete;
                case LIST_DECL, BULK_LOAD -> list;
                case IDENTIFIER, NAME -> identifier;
                case INVOCATION, NARRATE, DIRECT -> invocation;
                case BINARY_OP, UNARY_OP, NUMBER, TEXT, BOOLEAN, TIE -> expression;
                case RESULT -> result;
                case MATCH, RACE, ROUTINE, COMBAT -> competition;
            };
            map.put(kind, handler);
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * Verifies a syntax tree.
     * This is the main entry point for the verification phase.
     * @param tree The tree produced by the parser.
     * @return The decorations, the semantic diagnostics, the final symbol table and the snapshots.
     */
    public VerificationResult verify(SyntaxTree tree) {
        VerificationContext context = new VerificationContext(handlers, tree.size(), options.recordSnapshots());
        context.visit(tree.root());
        VerificationResult result = new VerificationResult(
                context.decorations(),
                context.diagnostics().getDiagnostics(),
                context.table(),
                context.snapshots());
        LOG.debug("Verified {} nodes: {} decorated, {} semantic diagnostics, {} global symbols",
                tree.size(), result.decorations().decoratedCount(), result.errors().size(),
                result.table().globalEntries().size());
        return result;
    }
}
