package org.olympiac.compiler.api;

import java.nio.file.Path;
import java.util.List;

/**
 * The public interface of the Olympiac front end.
 */
public interface ICompiler {

    /**
     * Scans, parses and verifies a program. Never throws for defects in the program.
     * @param sourceLines The lines of source code, without line terminators.
     * @return The tokens, tree, decorations and all diagnostics.
     */
    CompilationResult compile(List<String> sourceLines);

    /**
     * Reads a source file as UTF-8 and compiles it.
     * @param sourceFile The file to compile.
     * @return The compilation result.
     * @throws CompilationException if the file cannot be read.
     */
    CompilationResult compile(Path sourceFile) throws CompilationException;
}
