package org.olympiac.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur while a program is scanned, parsed or verified.
 * <p>
 * This decouples error reporting from the actual front end logic (parser, verifier).
 * A deduplicating engine drops any report whose (message, line, column) triple was
 * already recorded, so repeated failures at one recovery point are reported once.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Set<Key> seen = new HashSet<>();
    private final boolean deduplicate;

    private record Key(String message, int line, int column) {}

    /**
     * Creates an engine that keeps every report.
     */
    public DiagnosticsEngine() {
        this(false);
    }

    /**
     * Creates an engine.
     * @param deduplicate {@code true} to drop reports with an already seen (message, line, column).
     */
    public DiagnosticsEngine(boolean deduplicate) {
        this.deduplicate = deduplicate;
    }

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param line    The line of the error.
     * @param column  The column of the error.
     */
    public void reportError(String message, int line, int column) {
        report(Diagnostic.Type.ERROR, message, line, column);
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param line    The line of the warning.
     * @param column  The column of the warning.
     */
    public void reportWarning(String message, int line, int column) {
        report(Diagnostic.Type.WARNING, message, line, column);
    }

    private void report(Diagnostic.Type type, String message, int line, int column) {
        if (deduplicate && !seen.add(new Key(message, line, column))) {
            return;
        }
        diagnostics.add(new Diagnostic(type, message, line, column));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics, in report order.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
