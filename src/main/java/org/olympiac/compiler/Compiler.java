package org.olympiac.compiler;

import org.olympiac.compiler.api.CompilationException;
import org.olympiac.compiler.api.CompilationResult;
import org.olympiac.compiler.api.FrontendOptions;
import org.olympiac.compiler.api.ICompiler;
import org.olympiac.compiler.diagnostics.DiagnosticsEngine;
import org.olympiac.compiler.frontend.lexer.Lexer;
import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.parser.Parser;
import org.olympiac.compiler.frontend.parser.ast.SyntaxTree;
import org.olympiac.compiler.frontend.semantics.VerificationResult;
import org.olympiac.compiler.frontend.semantics.Verifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the front end pipeline:
 * scanning, parsing and verification. Each call works on fresh state, so one instance may
 * compile any number of programs, one at a time.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final FrontendOptions options;

    public Compiler() {
        this(FrontendOptions.DEFAULTS);
    }

    /**
     * @param options The parser and verifier settings.
     */
    public Compiler(FrontendOptions options) {
        this.options = options;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public CompilationResult compile(List<String> sourceLines) {
        DiagnosticsEngine lexical = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(sourceLines, lexical).scanTokens();
        LOG.debug("Scanned {} lines into {} tokens", sourceLines.size(), tokens.size());

        SyntaxTree tree = new Parser(tokens, options).parse();
        VerificationResult verification = new Verifier(options).verify(tree);

        CompilationResult result = new CompilationResult(tokens, lexical.getDiagnostics(), tree, verification);
        LOG.debug("Compiled {} lines: {} lexical, {} syntax, {} semantic diagnostics", sourceLines.size(),
                result.lexicalErrors().size(), tree.syntaxErrors().size(), verification.errors().size());
        return result;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public CompilationResult compile(Path sourceFile) throws CompilationException {
        List<String> lines;
        try {
            lines = Files.readAllLines(sourceFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CompilationException("Failed to read source file: " + sourceFile, e);
        }
        return compile(lines);
    }
}
