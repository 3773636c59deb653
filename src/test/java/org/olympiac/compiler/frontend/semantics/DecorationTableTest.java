package org.olympiac.compiler.frontend.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeArena;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link DecorationTable} and the {@link TypeTag} rendering.
 */
public class DecorationTableTest {

    @Test
    @Tag("unit")
    void testDecorateOnce() {
        NodeArena arena = new NodeArena();
        AstNode number = arena.create(NodeKind.NUMBER, "3", 1, 1);
        AstNode text = arena.create(NodeKind.TEXT, "\"a\"", 1, 5);
        DecorationTable table = new DecorationTable(arena.size());

        table.decorate(number, Decoration.builder(TypeTag.INT).with("value", 3).build());

        assertThat(table.typeOf(number)).isEqualTo(TypeTag.INT);
        assertThat(table.typeOf(text)).isEqualTo(TypeTag.UNKNOWN);
        assertThat(table.get(text)).isEmpty();
        assertThat(table.size()).isEqualTo(2);
        assertThat(table.decoratedCount()).isEqualTo(1);
        assertThat(table.toMap()).containsOnlyKeys("0");
        assertThat(table.toMap().get("0")).isEqualTo(Map.of("type", "int", "value", 3));
    }

    /**
     * Verifies that decorations are write-once.
     */
    @Test
    @Tag("unit")
    void testSecondDecorationIsRejected() {
        NodeArena arena = new NodeArena();
        AstNode node = arena.create(NodeKind.NAME, "x", 1, 1);
        DecorationTable table = new DecorationTable(arena.size());
        table.decorate(node, Decoration.of(TypeTag.INT));

        assertThatThrownBy(() -> table.decorate(node, Decoration.of(TypeTag.STRING)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Node 0 (Name) is already decorated");
        assertThat(table.typeOf(node)).isEqualTo(TypeTag.INT);
    }

    @Test
    @Tag("unit")
    void testNodeOfAnotherTreeIsRejected() {
        NodeArena arena = new NodeArena();
        arena.create(NodeKind.PROGRAM, "root", 0, 0);
        AstNode second = arena.create(NodeKind.NAME, "x", 1, 1);
        DecorationTable table = new DecorationTable(1);

        assertThatThrownBy(() -> table.decorate(second, Decoration.of(TypeTag.INT)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void testNullFieldsAreKept() {
        Decoration decoration = Decoration.builder(TypeTag.UNKNOWN).with("ref", null).build();

        assertThat(decoration.toMap()).containsEntry("type", "unknown").containsEntry("ref", null);
    }

    @Test
    @Tag("unit")
    void testTypeTagRendering() {
        assertThat(TypeTag.entity("Deportista").toString()).isEqualTo("entity:Deportista");
        assertThat(TypeTag.list("Pais").toString()).isEqualTo("list:Pais");
        assertThat(TypeTag.list(null).toString()).isEqualTo("list:unknown");
        assertThat(TypeTag.VOID.toString()).isEqualTo("void");
        assertThat(TypeTag.entity("Deportista").isEntity()).isTrue();
        assertThat(TypeTag.list("Pais").isList()).isTrue();
        assertThat(TypeTag.UNKNOWN.isUnknown()).isTrue();
    }
}
