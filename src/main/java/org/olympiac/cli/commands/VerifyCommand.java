package org.olympiac.cli.commands;

import org.olympiac.cli.CommandLineInterface;
import org.olympiac.compiler.api.CompilationResult;
import org.olympiac.compiler.report.DecoratedTreePrinter;
import org.olympiac.compiler.report.ReportExporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;

@Command(name = "verify", description = "Verifies an Olympiac source file and prints the decorated tree.")
public class VerifyCommand extends SourceCommand {

    @Option(names = {"-j", "--json"}, paramLabel = "<out>", description = "Also write the report as JSON to this file.")
    private File json;

    @Override
    protected Integer report(CompilationResult result, PrintWriter out) {
        DecoratedTreePrinter.render(result.tree(), result.verification()).forEach(out::println);
        printDiagnostics("Lexical errors", result.lexicalErrors(), out);
        printDiagnostics("Syntax errors", result.tree().syntaxErrors(), out);
        if (json != null) {
            try {
                new ReportExporter().write(result, json.toPath());
            } catch (IOException e) {
                spec.commandLine().getErr().println("Error: failed to write report to " + json + ": " + e.getMessage());
                return CommandLineInterface.EXIT_FAILURE;
            }
            out.println("Report written to: " + json.getAbsolutePath());
        }
        return result.hasErrors() ? CommandLineInterface.EXIT_DIAGNOSTICS : CommandLineInterface.EXIT_OK;
    }
}
