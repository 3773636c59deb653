package org.olympiac.compiler.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.olympiac.compiler.api.CompilationResult;
import org.olympiac.compiler.diagnostics.Diagnostic;
import org.olympiac.compiler.frontend.semantics.TableSnapshot;
import org.olympiac.compiler.frontend.semantics.VerificationResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports the decorated-tree report of a compilation as pretty-printed JSON:
 * <pre>{@code
 * {
 *   "syntaxErrors":   [ {message, line, column, severity}, ... ],
 *   "semanticErrors": [ ... ],
 *   "lexicalErrors":  [ ... ],
 *   "decorations":    { "<node id>": {type, ...}, ... },
 *   "symbolTable":    { "scope_0": { "<name>": {name, type, line, scopeLevel} } },
 *   "snapshots":      [ {node, line, table}, ... ]
 * }
 * }</pre>
 */
public class ReportExporter {

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    /**
     * Builds the report structure.
     * @param result The compilation to report on.
     * @return An insertion-ordered map of plain values.
     */
    public Map<String, Object> toReport(CompilationResult result) {
        VerificationResult verification = result.verification();
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("syntaxErrors", diagnostics(result.tree().syntaxErrors()));
        report.put("semanticErrors", diagnostics(verification.errors()));
        report.put("lexicalErrors", diagnostics(result.lexicalErrors()));
        report.put("decorations", verification.decorations().toMap());
        report.put("symbolTable", verification.table().snapshot());
        List<Map<String, Object>> snapshots = new ArrayList<>();
        for (TableSnapshot snapshot : verification.snapshots()) {
            snapshots.add(snapshot.toMap());
        }
        report.put("snapshots", snapshots);
        return report;
    }

    public String toJson(CompilationResult result) {
        return gson.toJson(toReport(result));
    }

    /**
     * Writes the report as UTF-8 JSON, replacing the file if it exists.
     * @param result The compilation to report on.
     * @param target The output file.
     * @throws IOException if the file cannot be written.
     */
    public void write(CompilationResult result, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            gson.toJson(toReport(result), writer);
        }
    }

    private static List<Map<String, Object>> diagnostics(List<Diagnostic> diagnostics) {
        List<Map<String, Object>> out = new ArrayList<>(diagnostics.size());
        for (Diagnostic diagnostic : diagnostics) {
            out.add(diagnostic.toMap());
        }
        return out;
    }
}
