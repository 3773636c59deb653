package org.olympiac.cli.commands;

import org.olympiac.cli.CommandLineInterface;
import org.olympiac.compiler.Compiler;
import org.olympiac.compiler.api.CompilationException;
import org.olympiac.compiler.api.CompilationResult;
import org.olympiac.compiler.api.FrontendOptions;
import org.olympiac.compiler.diagnostics.Diagnostic;
import picocli.CommandLine;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * The shared part of the subcommands that read one source file.
 */
abstract class SourceCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "<file>", description = "The Olympiac source file.")
    protected File file;

    @ParentCommand
    protected CommandLineInterface parent;

    @CommandLine.Spec
    protected CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        FrontendOptions options = FrontendOptions.fromConfig(parent.getConfig());
        CompilationResult result;
        try {
            result = new Compiler(options).compile(file.toPath());
        } catch (CompilationException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return CommandLineInterface.EXIT_FAILURE;
        }
        return report(result, spec.commandLine().getOut());
    }

    /**
     * Prints the part of the result this command is about.
     * @param result The compilation result.
     * @param out The standard output of the command.
     * @return The exit code.
     * @throws Exception if writing an output file fails.
     */
    protected abstract Integer report(CompilationResult result, PrintWriter out) throws Exception;

    protected static void printDiagnostics(String title, List<Diagnostic> diagnostics, PrintWriter out) {
        if (diagnostics.isEmpty()) {
            return;
        }
        out.println(title + ":");
        for (Diagnostic diagnostic : diagnostics) {
            out.println("  " + diagnostic);
        }
    }
}
