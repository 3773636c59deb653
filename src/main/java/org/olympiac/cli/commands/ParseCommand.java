package org.olympiac.cli.commands;

import org.olympiac.cli.CommandLineInterface;
import org.olympiac.compiler.api.CompilationResult;
import org.olympiac.compiler.diagnostics.Diagnostic;
import org.olympiac.compiler.frontend.parser.ast.AstPrinter;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

@Command(name = "parse", description = "Prints the syntax tree of an Olympiac source file.")
public class ParseCommand extends SourceCommand {

    @Override
    protected Integer report(CompilationResult result, PrintWriter out) {
        AstPrinter.preorderLines(result.tree().root()).forEach(out::println);
        printDiagnostics("Lexical errors", result.lexicalErrors(), out);
        printDiagnostics("Syntax errors", result.tree().syntaxErrors(), out);
        boolean failed = !result.lexicalErrors().isEmpty()
                || result.tree().syntaxErrors().stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
        return failed ? CommandLineInterface.EXIT_DIAGNOSTICS : CommandLineInterface.EXIT_OK;
    }
}
