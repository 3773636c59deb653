package org.olympiac.compiler.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Contains unit tests for the {@link DiagnosticsEngine}.
 */
public class DiagnosticsEngineTest {

    @Test
    @Tag("unit")
    void testCollectsInReportOrder() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.reportWarning("w", 1, 1);
        engine.reportError("e", 2, 3);

        assertThat(engine.getDiagnostics()).extracting(Diagnostic::message).containsExactly("w", "e");
        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.summary()).isEqualTo("[WARNING] 1:1 - w\n[ERROR] 2:3 - e");
    }

    @Test
    @Tag("unit")
    void testWarningsAloneAreNotErrors() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.reportWarning("w", 1, 1);

        assertThat(engine.hasErrors()).isFalse();
    }

    /**
     * Verifies that a deduplicating engine keeps only the first report of each (message, line, column).
     */
    @Test
    @Tag("unit")
    void testDeduplication() {
        DiagnosticsEngine engine = new DiagnosticsEngine(true);

        engine.reportError("Expected 'entonces' but found '{'", 4, 7);
        engine.reportError("Expected 'entonces' but found '{'", 4, 7);
        engine.reportError("Expected 'entonces' but found '{'", 5, 7);

        assertThat(engine.getDiagnostics()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void testNoDeduplicationByDefault() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.reportError("same", 1, 1);
        engine.reportError("same", 1, 1);

        assertThat(engine.getDiagnostics()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void testRecordShape() {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.ERROR, "msg", 3, 9);

        assertThat(diagnostic.toMap()).containsExactly(
                entry("message", "msg"),
                entry("line", 3),
                entry("column", 9),
                entry("severity", "ERROR"));
    }
}
