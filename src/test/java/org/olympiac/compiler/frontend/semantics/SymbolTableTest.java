package org.olympiac.compiler.frontend.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeArena;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.junit.extensions.logging.LogWatchExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link SymbolTable}.
 */
@ExtendWith(LogWatchExtension.class)
public class SymbolTableTest {

    private final NodeArena arena = new NodeArena();

    private AstNode node(String name, int line) {
        return arena.create(NodeKind.ATHLETE_DECL, name, line, 1);
    }

    @Test
    @Tag("unit")
    void testDeclareAndLookup() {
        SymbolTable table = new SymbolTable();

        Optional<String> error = table.declare("A", TypeTag.entity("Deportista"), node("A", 1), 1);

        assertThat(error).isEmpty();
        Optional<SymbolEntry> entry = table.lookup("A");
        assertThat(entry).isPresent();
        assertThat(entry.get().type().toString()).isEqualTo("entity:Deportista");
        assertThat(entry.get().scopeLevel()).isZero();
        assertThat(table.lookup("B")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testDuplicateInSameScopeIsRejected() {
        SymbolTable table = new SymbolTable();
        table.declare("A", TypeTag.entity("Deportista"), node("A", 1), 1);

        Optional<String> error = table.declare("A", TypeTag.list("Pais"), node("A", 2), 2);

        assertThat(error).contains("duplicate declaration: 'A' already exists in the current scope (level 0)");
        assertThat(table.lookup("A").get().line()).isEqualTo(1);
    }

    /**
     * Verifies that an inner scope may shadow an outer name and that the outer entry is visible
     * again once the inner scope is left.
     */
    @Test
    @Tag("unit")
    void testShadowingAndScopeExit() {
        // Arrange
        SymbolTable table = new SymbolTable();
        table.declare("A", TypeTag.entity("Deportista"), node("A", 1), 1);

        // Act
        int level = table.enterScope();
        Optional<String> error = table.declare("A", TypeTag.INT, node("A", 3), 3);
        TypeTag inner = table.lookup("A").get().type();
        table.declare("B", TypeTag.STRING, node("B", 4), 4);
        table.exitScope();

        // Assert
        assertThat(level).isEqualTo(1);
        assertThat(error).isEmpty();
        assertThat(inner).isEqualTo(TypeTag.INT);
        assertThat(table.lookup("A").get().type()).isEqualTo(TypeTag.entity("Deportista"));
        assertThat(table.lookup("B")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testGlobalScopeCannotBeExited() {
        SymbolTable table = new SymbolTable();
        table.declare("A", TypeTag.BOOL, node("A", 1), 1);

        assertThat(table.exitScope()).isZero();
        assertThat(table.currentLevel()).isZero();
        assertThat(table.lookup("A")).isPresent();
        assertThat(table.globalEntries()).extracting(SymbolEntry::name).containsExactly("A");
    }

    /**
     * Verifies that a snapshot lists every open scope in order and is not affected by later declarations.
     */
    @Test
    @Tag("unit")
    void testSnapshotIsDetached() {
        // Arrange
        SymbolTable table = new SymbolTable();
        table.declare("A", TypeTag.entity("Deportista"), node("A", 1), 1);
        table.enterScope();
        table.declare("L", TypeTag.list("Pais"), node("L", 2), 2);

        // Act
        Map<String, Map<String, Map<String, Object>>> snapshot = table.snapshot();
        table.declare("Z", TypeTag.INT, node("Z", 3), 3);

        // Assert
        assertThat(snapshot).containsOnlyKeys("scope_0", "scope_1");
        assertThat(snapshot.get("scope_0").get("A"))
                .containsEntry("name", "A")
                .containsEntry("type", "entity:Deportista")
                .containsEntry("line", 1)
                .containsEntry("scopeLevel", 0);
        assertThat(snapshot.get("scope_1")).containsOnlyKeys("L");
        assertThat(snapshot.get("scope_1").get("L")).containsEntry("type", "list:Pais");
    }

    @Test
    @Tag("unit")
    void testToStringListsScopes() {
        SymbolTable table = new SymbolTable();
        table.declare("A", TypeTag.INT, node("A", 1), 1);
        table.enterScope();

        assertThat(table.toString()).isEqualTo("scope 0: A=int\nscope 1:");
    }
}
