package org.olympiac.compiler.diagnostics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents a single diagnostic message (error, warning, info)
 * produced while scanning, parsing or verifying a program.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param line The line number of the issue (1-based, 0 if unknown).
 * @param column The column number of the issue (1-based, 0 if unknown).
 */
public record Diagnostic(
        Type type,
        String message,
        int line,
        int column
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** A defect in the program. Never stops parsing or verification. */
        ERROR,
        /** A suspicious construct that is kept as written. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * Converts this diagnostic into the serializable record shape
     * {@code {message, line, column, severity}}.
     * @return An ordered map view of this diagnostic.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("message", message);
        out.put("line", line);
        out.put("column", column);
        out.put("severity", type.name());
        return out;
    }

    @Override
    public String toString() {
        return String.format("[%s] %d:%d - %s", type, line, column, message);
    }
}
