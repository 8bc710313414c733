package org.syntree.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.syntree.api.SyntreeErrorCode;
import org.syntree.api.TreeSerializationException;
import org.syntree.tree.AssertNode;
import org.syntree.tree.AssignNode;
import org.syntree.tree.AstNode;
import org.syntree.tree.AttributeNode;
import org.syntree.tree.ClassDefNode;
import org.syntree.tree.ConstantNode;
import org.syntree.tree.ExceptHandlerNode;
import org.syntree.tree.ExprContext;
import org.syntree.tree.ForNode;
import org.syntree.tree.ImportFromNode;
import org.syntree.tree.ImportNode;
import org.syntree.tree.NameNode;
import org.syntree.tree.OpaqueNode;
import org.syntree.tree.PassNode;
import org.syntree.tree.Position;
import org.syntree.tree.ProgramNode;
import org.syntree.tree.RaiseNode;
import org.syntree.tree.TryNode;
import org.syntree.tree.WithNode;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.syntree.tree.Trees.*;

/**
 * Tests the JSON form of trees and the
 * {@link SyntreeErrorCode#JSON_MALFORMED} reports for input that is not a tree.
 */
@Tag("unit")
class NodeJsonCodecTest {

    private final NodeJsonCodec codec = new NodeJsonCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void treeSurvivesJson() throws Exception {
        ProgramNode tree = program(
                new ImportNode(List.of(new ImportNode.Alias("os.path", "p"), new ImportNode.Alias("sys", null))),
                new ClassDefNode("Box", List.of(name("Base")), List.of(
                        def("get", params("self"), ret(new AttributeNode(name("self"), "value", ExprContext.LOAD))))),
                new ForNode(store("i"), call("range", constant(3)),
                        List.of(expr(call("print", binOp(name("i"), "**", constant(2.5))))),
                        List.of(new PassNode())),
                ifNode(unary("not", constant(null)), block(new RaiseNode(call("Error", constant("bad")))), block()),
                assign("flag", constant(true)));

        String json = codec.toJson(tree);

        assertThat(codec.fromJson(json)).isEqualTo(tree);
    }

    @Test
    void statementKindsWithHandlersAndContextsSurviveJson() throws Exception {
        // from ..pkg import a as b
        // with open(p) as f, lock:
        //     try:
        //         assert f, "empty"
        //     except (ValueError) as err:
        //         raise
        //     except:
        //         pass
        //     finally:
        //         pass
        ProgramNode tree = program(
                new ImportFromNode("pkg", List.of(new ImportNode.Alias("a", "b")), 2),
                new WithNode(
                        List.of(new WithNode.Item(call("open", name("p")), store("f")), new WithNode.Item(name("lock"), null)),
                        List.of(new TryNode(
                                List.of(new AssertNode(name("f"), constant("empty"))),
                                List.of(new ExceptHandlerNode(name("ValueError"), "err", List.of(new RaiseNode(null))),
                                        new ExceptHandlerNode(null, null, List.of(new PassNode()))),
                                List.of(),
                                List.of(new PassNode())))));

        String json = codec.toJson(tree);

        assertThat(codec.fromJson(json)).isEqualTo(tree);
        assertThat(mapper.readTree(json).get("body").get(1).get("body").get(0).get("handlers").get(0)
                .get("exc_type").get("id").asText()).isEqualTo("ValueError");
    }

    @Test
    void positionsAreWrittenAndReadBack() throws Exception {
        ProgramNode tree = new ProgramNode(List.of(
                new AssignNode(List.of(new NameNode("x", ExprContext.STORE, new Position(1, 0, 0))),
                        new ConstantNode(1L, new Position(1, 4, 4)), new Position(1, 0, 0))),
                new Position(1, 0, 0));

        String json = codec.toJson(tree);
        AstNode read = codec.fromJson(json);

        assertThat(read).isEqualTo(tree);
        assertThat(((ProgramNode) read).body().get(0).getChildren().get(1).position()).isEqualTo(new Position(1, 4, 4));
        assertThat(mapper.readTree(json).get("position").get("line").asInt()).isEqualTo(1);
        assertThat(codec.toJsonTree(name("y")).has("position")).isFalse();
    }

    @Test
    void invalidPositionIsMalformed() {
        String json = "{\"type\":\"Pass\",\"position\":{\"line\":0,\"column\":0,\"offset\":0}}";

        assertThatThrownBy(() -> codec.fromJson(json))
                .isInstanceOfSatisfying(TreeSerializationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(SyntreeErrorCode.JSON_MALFORMED));
    }

    @Test
    void nonFiniteFloatsSurviveJson() throws Exception {
        ProgramNode tree = program(
                assign("a", constant(Double.POSITIVE_INFINITY)),
                assign("b", constant(Double.NEGATIVE_INFINITY)),
                assign("c", constant(Double.NaN)));

        AstNode read = codec.fromJson(codec.toJson(tree));

        assertThat(read).isEqualTo(tree);
        assertThat(((ConstantNode) ((ProgramNode) read).body().get(2).getChildren().get(1)).value())
                .isInstanceOf(Double.class);
    }

    @Test
    void textualFloatThatIsNoNumberIsMalformed() {
        assertThatThrownBy(() -> codec.fromJson("{\"type\":\"Constant\",\"value\":\"lots\",\"kind\":\"float\"}"))
                .isInstanceOfSatisfying(TreeSerializationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(SyntreeErrorCode.JSON_MALFORMED));
    }

    @Test
    void stringConstantsThatLookLikeFloatsStayStrings() throws Exception {
        AstNode node = codec.fromJson("{\"type\":\"Constant\",\"value\":\"NaN\",\"kind\":\"str\"}");

        assertThat(node).isEqualTo(new ConstantNode("NaN"));
    }

    @Test
    void nullEntriesAndMissingNamesAreMalformed() {
        String nullStatement = "{\"type\":\"Program\",\"body\":[null]}";
        String namelessAlias = "{\"type\":\"ImportFrom\",\"module\":\"m\",\"names\":[{\"asname\":\"y\"}]}";
        String nullHandlerBody = "{\"type\":\"ExceptHandler\",\"body\":null}";

        for (String json : List.of(nullStatement, namelessAlias, nullHandlerBody)) {
            assertThatThrownBy(() -> codec.fromJson(json))
                    .isInstanceOfSatisfying(TreeSerializationException.class,
                            e -> assertThat(e.getCode()).isEqualTo(SyntreeErrorCode.JSON_MALFORMED))
                    .hasMessageStartingWith("Malformed tree at $");
        }
    }

    @Test
    void writesTagsAndFieldNames() throws Exception {
        JsonNode json = mapper.readTree(codec.toJson(assign("x", binOp(name("y"), "+", constant(1)))));

        assertThat(json.get("type").asText()).isEqualTo("Assign");
        assertThat(json.get("targets").get(0).get("ctx").asText()).isEqualTo("Store");
        assertThat(json.get("value").get("type").asText()).isEqualTo("BinOp");
        assertThat(json.get("value").get("op").asText()).isEqualTo("+");
        assertThat(json.get("value").get("right").get("kind").asText()).isEqualTo("int");
    }

    @Test
    void floatKindIsKeptForIntegralValues() throws Exception {
        AstNode node = codec.fromJson("{\"type\":\"Constant\",\"value\":2,\"kind\":\"float\"}");

        assertThat(node).isEqualTo(new ConstantNode(2.0d));
    }

    @Test
    void integersAreReadAsLongs() throws Exception {
        AstNode node = codec.fromJson("{\"type\":\"Constant\",\"value\":7}");

        assertThat(((ConstantNode) node).value()).isEqualTo(7L);
    }

    @Test
    void missingContextDefaultsToLoad() throws Exception {
        AstNode node = codec.fromJson("{\"type\":\"Name\",\"id\":\"x\"}");

        assertThat(node).isEqualTo(new NameNode("x", ExprContext.LOAD));
    }

    @Test
    void unknownTypeBecomesOpaqueNode() throws Exception {
        String json = "{\"type\":\"Lambda\",\"fields\":{\"arity\":1,\"label\":\"f\"},"
                + "\"children\":[{\"type\":\"Name\",\"id\":\"x\",\"ctx\":\"Load\"}]}";

        AstNode node = codec.fromJson(json);

        assertThat(node).isInstanceOfSatisfying(OpaqueNode.class, opaque -> {
            assertThat(opaque.kindName()).isEqualTo("Lambda");
            assertThat(opaque.fields()).containsEntry("arity", 1).containsEntry("label", "f");
            assertThat(opaque.children()).containsExactly(name("x"));
        });
        assertThat(codec.fromJson(codec.toJson(node))).isEqualTo(node);
    }

    @Test
    void opaqueNodeWritesItsOwnTag() throws Exception {
        OpaqueNode node = new OpaqueNode("Yield", Map.of("mode", "from"), List.of(name("g")));

        JsonNode json = codec.toJsonTree(node);

        assertThat(json.get("type").asText()).isEqualTo("Yield");
        assertThat(json.get("fields").get("mode").asText()).isEqualTo("from");
    }

    @Test
    void invalidJsonIsMalformed() {
        assertThatThrownBy(() -> codec.fromJson("{\"type\": "))
                .isInstanceOfSatisfying(TreeSerializationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(SyntreeErrorCode.JSON_MALFORMED));
    }

    @Test
    void missingFieldReportsPath() {
        String json = "{\"type\":\"Program\",\"body\":[{\"type\":\"Expr\"}]}";

        assertThatThrownBy(() -> codec.fromJson(json))
                .isInstanceOf(TreeSerializationException.class)
                .hasMessageContaining("$.body[0]")
                .hasMessageContaining("value");
    }

    @Test
    void unknownContextIsMalformed() {
        assertThatThrownBy(() -> codec.fromJson("{\"type\":\"Name\",\"id\":\"x\",\"ctx\":\"Sideways\"}"))
                .isInstanceOfSatisfying(TreeSerializationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(SyntreeErrorCode.JSON_MALFORMED));
    }

    @Test
    void treesDeeperThanTheLimitAreRejected() {
        NodeJsonCodec shallow = new NodeJsonCodec(3);
        String json = "{\"type\":\"UnaryOp\",\"op\":\"-\",\"operand\":"
                + "{\"type\":\"UnaryOp\",\"op\":\"-\",\"operand\":"
                + "{\"type\":\"UnaryOp\",\"op\":\"-\",\"operand\":"
                + "{\"type\":\"UnaryOp\",\"op\":\"-\",\"operand\":"
                + "{\"type\":\"Constant\",\"value\":1}}}}}";

        assertThatThrownBy(() -> shallow.fromJson(json))
                .isInstanceOfSatisfying(TreeSerializationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(SyntreeErrorCode.JSON_MALFORMED));
    }
}
