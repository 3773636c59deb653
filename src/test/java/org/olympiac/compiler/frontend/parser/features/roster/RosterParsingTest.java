package org.olympiac.compiler.frontend.parser.features.roster;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.compiler.frontend.parser.ast.SyntaxTree;
import org.olympiac.junit.extensions.logging.LogWatchExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.olympiac.testutils.Sources.findAll;
import static org.olympiac.testutils.Sources.findFirst;
import static org.olympiac.testutils.Sources.messages;
import static org.olympiac.testutils.Sources.parse;

/**
 * Tests the two forms of {@code Lista}: simple list declarations and athlete bulk loads.
 */
@ExtendWith(LogWatchExtension.class)
public class RosterParsingTest {

    @Test
    @Tag("unit")
    void testSimpleListDeclaration() {
        SyntaxTree tree = parse("Lista Pais Paises");

        assertThat(tree.syntaxErrors()).isEmpty();
        AstNode list = tree.root().getChildren().get(0);
        assertThat(list.kind()).isEqualTo(NodeKind.LIST_DECL);
        assertThat(list.stringAttribute("type")).isEqualTo("Pais");
        assertThat(list.stringAttribute("name")).isEqualTo("Paises");
    }

    /**
     * Verifies that {@code Lista Deportista <name>} without statistics after the name is a simple declaration.
     */
    @Test
    @Tag("unit")
    void testAthleteListWithoutStatisticsIsSimpleDeclaration() {
        SyntaxTree tree = parse("Lista Deportista Atletas", "narrar(Atletas)");

        assertThat(tree.syntaxErrors()).isEmpty();
        AstNode list = tree.root().getChildren().get(0);
        assertThat(list.kind()).isEqualTo(NodeKind.LIST_DECL);
        assertThat(list.stringAttribute("type")).isEqualTo("Deportista");
        assertThat(list.content()).isEqualTo("Atletas");
    }

    /**
     * Verifies that three integers after the candidate name select the bulk load and that every
     * complete tuple is kept in order.
     */
    @Test
    @Tag("unit")
    @SuppressWarnings("unchecked")
    void testBulkLoad() {
        // Act
        SyntaxTree tree = parse(
                "Lista Deportista",
                "Ana 1 2 3 Atletismo Chile",
                "Luis 4 5 6 Natacion Peru");

        // Assert
        assertThat(tree.syntaxErrors()).isEmpty();
        AstNode bulk = tree.root().getChildren().get(0);
        assertThat(bulk.kind()).isEqualTo(NodeKind.BULK_LOAD);
        assertThat(bulk.attribute("count")).isEqualTo(2);
        List<Map<String, Object>> athletes = (List<Map<String, Object>>) bulk.attribute("athletes");
        assertThat(athletes.stream().map(a -> a.get("name")).toList()).containsExactly("Ana", "Luis");
        assertThat(athletes.get(1).get("stats")).isEqualTo(List.of(4, 5, 6));
        assertThat(athletes.get(1).get("country")).isEqualTo("Peru");
        assertThat(athletes.get(1).get("line")).isEqualTo(3);
    }

    /**
     * Verifies that only two integers after the name are not enough to select the bulk load.
     */
    @Test
    @Tag("unit")
    void testTwoIntegersAreNotABulkLoad() {
        SyntaxTree tree = parse("Lista Deportista Atletas 1 2", "narrar(Atletas)");

        assertThat(findAll(tree.root(), NodeKind.BULK_LOAD)).isEmpty();
        assertThat(findFirst(tree.root(), NodeKind.LIST_DECL).stringAttribute("name")).isEqualTo("Atletas");
        assertThat(findAll(tree.root(), NodeKind.NARRATE)).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testIncompleteTupleIsRolledBack() {
        SyntaxTree tree = parse(
                "Lista Deportista",
                "Ana 1 2 3 Atletismo Chile",
                "Luis 4 5",
                "narrar(Ana)");

        AstNode bulk = tree.root().getChildren().get(0);
        assertThat(bulk.kind()).isEqualTo(NodeKind.BULK_LOAD);
        assertThat(bulk.attribute("count")).isEqualTo(1);
        AstNode luis = tree.root().getChildren().get(1);
        assertThat(luis.kind()).isEqualTo(NodeKind.IDENTIFIER);
        assertThat(luis.content()).isEqualTo("Luis");
        assertThat(findAll(tree.root(), NodeKind.NARRATE)).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testMissingElementType() {
        SyntaxTree tree = parse("Lista 5");

        assertThat(messages(tree.syntaxErrors())).containsExactly("Expected list element type but found '5'");
        assertThat(tree.root().getChildren().get(0).attributes()).containsEntry("type", null);
    }

    @Test
    @Tag("unit")
    void testMissingListName() {
        SyntaxTree tree = parse("Lista Pais");

        assertThat(messages(tree.syntaxErrors())).containsExactly("Expected list name but reached end of input");
        AstNode list = tree.root().getChildren().get(0);
        assertThat(list.stringAttribute("type")).isEqualTo("Pais");
        assertThat(list.attributes()).containsEntry("name", null);
    }
}
