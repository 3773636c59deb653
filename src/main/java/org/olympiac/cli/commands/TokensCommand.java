package org.olympiac.cli.commands;

import org.olympiac.cli.CommandLineInterface;
import org.olympiac.compiler.api.CompilationResult;
import org.olympiac.compiler.frontend.lexer.Token;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

@Command(name = "tokens", description = "Prints the tokens of an Olympiac source file.")
public class TokensCommand extends SourceCommand {

    @Override
    protected Integer report(CompilationResult result, PrintWriter out) {
        for (Token token : result.tokens()) {
            out.printf("%d:%d %s '%s'%n", token.line(), token.column(), token.type(), token.text());
        }
        out.println("Total tokens: " + result.tokens().size());
        printDiagnostics("Lexical errors", result.lexicalErrors(), out);
        return result.lexicalErrors().isEmpty() ? CommandLineInterface.EXIT_OK : CommandLineInterface.EXIT_DIAGNOSTICS;
    }
}
