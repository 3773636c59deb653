package org.olympiac.compiler.report;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.olympiac.compiler.api.CompilationResult;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.junit.extensions.logging.LogWatchExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.olympiac.testutils.Sources.compile;
import static org.olympiac.testutils.Sources.findFirst;

/**
 * Tests the JSON report of the {@link ReportExporter}.
 */
@ExtendWith(LogWatchExtension.class)
public class ReportExporterTest {

    @Test
    @Tag("unit")
    void testReportStructure() {
        // Arrange
        CompilationResult result = compile("Deportista A 1 2 3 Futbol P", "narrar(A)", "narrar(Z)");
        AstNode narrate = findFirst(result.tree().root(), NodeKind.NARRATE);

        // Act
        JsonObject report = JsonParser.parseString(new ReportExporter().toJson(result)).getAsJsonObject();

        // Assert
        assertThat(report.keySet()).containsExactly(
                "syntaxErrors", "semanticErrors", "lexicalErrors", "decorations", "symbolTable", "snapshots");
        JsonArray semantic = report.getAsJsonArray("semanticErrors");
        assertThat(semantic).hasSize(1);
        JsonObject error = semantic.get(0).getAsJsonObject();
        assertThat(error.get("message").getAsString()).isEqualTo("identifier 'Z' used before being declared");
        assertThat(error.get("line").getAsInt()).isEqualTo(3);
        assertThat(error.get("severity").getAsString()).isEqualTo("ERROR");

        JsonObject decoration = report.getAsJsonObject("decorations").getAsJsonObject(String.valueOf(narrate.id()));
        assertThat(decoration.get("type").getAsString()).isEqualTo("void");
        assertThat(decoration.getAsJsonArray("argTypes").get(0).getAsString()).isEqualTo("entity:Deportista");

        JsonObject symbol = report.getAsJsonObject("symbolTable").getAsJsonObject("scope_0").getAsJsonObject("A");
        assertThat(symbol.get("type").getAsString()).isEqualTo("entity:Deportista");
        assertThat(report.getAsJsonArray("snapshots")).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testNullsAndQuotesAreWrittenAsIs() {
        CompilationResult result = compile("narrar(\"<hola>\")", "Foo");

        String json = new ReportExporter().toJson(result);

        assertThat(json).contains("\"ref\": null");
        assertThat(json).contains("<hola>");
    }

    @Test
    @Tag("unit")
    void testWriteCreatesParentDirectories(@TempDir Path dir) throws IOException {
        CompilationResult result = compile("Deportista A 1 2 3 Futbol P");
        Path target = dir.resolve("out/report.json");

        new ReportExporter().write(result, target);

        String written = Files.readString(target, StandardCharsets.UTF_8);
        assertThat(JsonParser.parseString(written).getAsJsonObject().has("decorations")).isTrue();
    }
}
