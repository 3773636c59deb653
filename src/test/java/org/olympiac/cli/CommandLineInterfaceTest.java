package org.olympiac.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.olympiac.junit.extensions.logging.AllowLog;
import org.olympiac.junit.extensions.logging.LogLevel;
import org.olympiac.junit.extensions.logging.LogWatchExtension;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the {@code olympiac} command line against temporary source files and checks output and exit codes.
 */
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.INFO, loggerPattern = ".*CommandLineInterface")
public class CommandLineInterfaceTest {

    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cli = CommandLineInterface.createCommandLine();
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
    }

    private Path source(String name, String... lines) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, List.of(lines), StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @Tag("unit")
    void testCommandName() {
        assertThat(cli.getCommandName()).isEqualTo("olympiac");
        assertThat(cli.getSubcommands()).containsKeys("tokens", "parse", "verify", "help");
    }

    @Test
    @Tag("unit")
    void testTokens() throws IOException {
        Path file = source("a.oly", "narrar(A)");

        int exitCode = cli.execute("tokens", file.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString())
                .contains("1:1 FUNCTION_INVOCATION 'narrar('")
                .contains("1:8 IDENTIFIER 'A'")
                .contains("Total tokens: 3");
    }

    @Test
    @Tag("unit")
    void testTokensWithLexicalError() throws IOException {
        Path file = source("a.oly", "A # B");

        int exitCode = cli.execute("tokens", file.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_DIAGNOSTICS);
        assertThat(out.toString()).contains("Lexical errors:").contains("Unrecognized character '#'");
    }

    @Test
    @Tag("unit")
    void testParsePrintsTree() throws IOException {
        Path file = source("a.oly", "Deportista A 1 2 3 Futbol P");

        int exitCode = cli.execute("parse", file.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).contains("<\"Program\", \"root\", {}>").contains("<\"AthleteDecl\", \"A\"");
    }

    /**
     * Verifies that semantic errors do not fail {@code parse} but do fail {@code verify}.
     */
    @Test
    @Tag("unit")
    void testExitCodesFollowThePhase() throws IOException {
        Path file = source("a.oly", "narrar(X)");

        int parseExit = cli.execute("parse", file.toString());
        int verifyExit = CommandLineInterface.createCommandLine().setOut(new PrintWriter(new StringWriter()))
                .execute("verify", file.toString());

        assertThat(parseExit).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(verifyExit).isEqualTo(CommandLineInterface.EXIT_DIAGNOSTICS);
    }

    @Test
    @Tag("unit")
    void testVerifyPrintsDecoratedTree() throws IOException {
        Path file = source("a.oly", "Deportista A 1 2 3 Futbol P", "narrar(A)");

        int exitCode = cli.execute("verify", file.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString())
                .contains("decorated: {type=entity:Deportista, definition=A}")
                .contains("No semantic errors.");
    }

    /**
     * Verifies that settings from a file given with {@code --config} reach the verifier and
     * that the JSON report is written.
     */
    @Test
    @Tag("unit")
    void testVerifyWithConfigAndJson() throws IOException {
        // Arrange
        Path file = source("a.oly", "Deportista A 1 2 3 Futbol P");
        Path conf = dir.resolve("custom.conf");
        Files.writeString(conf, "olympiac.frontend.verifier.record-snapshots = false\n", StandardCharsets.UTF_8);
        Path json = dir.resolve("report/out.json");

        // Act
        int exitCode = cli.execute("--config", conf.toString(), "verify", "--json", json.toString(), file.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).contains("Report written to: ");
        JsonObject report = JsonParser.parseString(Files.readString(json, StandardCharsets.UTF_8)).getAsJsonObject();
        assertThat(report.getAsJsonArray("snapshots")).isEmpty();
        assertThat(report.getAsJsonObject("symbolTable").getAsJsonObject("scope_0").has("A")).isTrue();
    }

    @Test
    @Tag("unit")
    void testMissingSourceFile() {
        int exitCode = cli.execute("verify", dir.resolve("nada.oly").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_FAILURE);
        assertThat(err.toString()).contains("Error: Failed to read source file: ");
    }

    @Test
    @Tag("unit")
    void testMissingConfigFile() throws IOException {
        Path file = source("a.oly", "Deportista A 1 2 3 Futbol P");

        int exitCode = cli.execute("--config", dir.resolve("nada.conf").toString(), "parse", file.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_FAILURE);
        assertThat(err.toString()).contains("Error: Configuration file specified via --config was not found: ");
    }
}
