package org.syntree.serialization;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.syntree.api.StructuralInvariantViolationException;
import org.syntree.api.SyntreeErrorCode;
import org.syntree.api.TreeSerializationException;
import org.syntree.tree.AssertNode;
import org.syntree.tree.AssignNode;
import org.syntree.tree.AstNode;
import org.syntree.tree.AttributeNode;
import org.syntree.tree.BinOpNode;
import org.syntree.tree.BreakNode;
import org.syntree.tree.CallNode;
import org.syntree.tree.ClassDefNode;
import org.syntree.tree.ConstantNode;
import org.syntree.tree.ContinueNode;
import org.syntree.tree.ExceptHandlerNode;
import org.syntree.tree.ExprContext;
import org.syntree.tree.ExprNode;
import org.syntree.tree.ForNode;
import org.syntree.tree.FunctionDefNode;
import org.syntree.tree.IfNode;
import org.syntree.tree.ImportFromNode;
import org.syntree.tree.ImportNode;
import org.syntree.tree.NameNode;
import org.syntree.tree.NodeKind;
import org.syntree.tree.OpaqueNode;
import org.syntree.tree.PassNode;
import org.syntree.tree.Position;
import org.syntree.tree.ProgramNode;
import org.syntree.tree.RaiseNode;
import org.syntree.tree.ReturnNode;
import org.syntree.tree.TreeWalker;
import org.syntree.tree.TryNode;
import org.syntree.tree.UnaryOpNode;
import org.syntree.tree.WhileNode;
import org.syntree.tree.WithNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts trees to and from JSON.
 * <p>
 * Every node becomes an object whose {@code type} member holds the kind tag, e.g.
 * {@code {"type":"Name","id":"x","ctx":"Load"}}. Statement blocks are arrays, absent optional
 * children are {@code null}. Extension nodes are written as
 * {@code {"type":<tag>,"fields":{...},"children":[...]}}, and any unknown tag is read back as an
 * {@link OpaqueNode} in the same shape. A node parsed from source carries a
 * {@code "position":{"line":..,"column":..,"offset":..}} member; synthesized nodes omit it.
 * Non-finite floats are written as the strings {@code "NaN"}, {@code "Infinity"} and
 * {@code "-Infinity"} next to {@code "kind":"float"}.
 * Reading a written tree yields a structurally equal tree.
 */
public class NodeJsonCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final int maxDepth;

    public NodeJsonCodec() {
        this(TreeWalker.DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth The maximum tree depth to read or write.
     */
    public NodeJsonCodec(int maxDepth) {
        this.maxDepth = maxDepth;
        // A tree level costs up to three JSON nesting levels when it passes through a with item.
        int nesting = maxDepth * 3 + 2;
        JsonFactory factory = JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(nesting).build())
                .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(nesting).build())
                .build();
        this.objectMapper = new ObjectMapper(factory);
    }

    /**
     * Writes a tree as compact JSON.
     * @param node The root node.
     * @return The JSON text.
     * @throws TreeSerializationException if the tree cannot be written.
     */
    public String toJson(AstNode node) throws TreeSerializationException {
        return toJson(node, false);
    }

    /**
     * Writes a tree as JSON.
     * @param node The root node.
     * @param pretty Whether to indent the output.
     * @return The JSON text.
     * @throws TreeSerializationException if the tree cannot be written.
     */
    public String toJson(AstNode node, boolean pretty) throws TreeSerializationException {
        try {
            ObjectNode tree = toJsonTree(node);
            return pretty
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree)
                    : objectMapper.writeValueAsString(tree);
        } catch (JsonProcessingException | IllegalArgumentException | StructuralInvariantViolationException e) {
            throw new TreeSerializationException(SyntreeErrorCode.JSON_WRITE_FAILED,
                    "Failed to write tree as JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Converts a tree into the Jackson tree model.
     * @param node The root node.
     * @return The JSON object of the root.
     */
    public ObjectNode toJsonTree(AstNode node) {
        return write(node, 0);
    }

    /**
     * Reads a tree from JSON text.
     * @param json The JSON text.
     * @return The root node.
     * @throws TreeSerializationException with {@link SyntreeErrorCode#JSON_MALFORMED} if the text is not a valid tree.
     */
    public AstNode fromJson(String json) throws TreeSerializationException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TreeSerializationException(SyntreeErrorCode.JSON_MALFORMED,
                    "Invalid JSON: " + e.getOriginalMessage(), e);
        }
        return fromJsonTree(root);
    }

    /**
     * Reads a tree from the Jackson tree model.
     * @param root The JSON object of the root node.
     * @return The root node.
     * @throws TreeSerializationException with {@link SyntreeErrorCode#JSON_MALFORMED} if the JSON is not a valid tree.
     */
    public AstNode fromJsonTree(JsonNode root) throws TreeSerializationException {
        try {
            return read(root, "$", 0);
        } catch (IllegalArgumentException | StructuralInvariantViolationException e) {
            throw new TreeSerializationException(SyntreeErrorCode.JSON_MALFORMED, e.getMessage(), e);
        }
    }

    // region Writing

    private ObjectNode write(AstNode node, int depth) {
        checkDepth(depth);
        ObjectNode json = objectMapper.createObjectNode();
        json.put("type", tagOf(node));
        if (node.position() != null) {
            ObjectNode position = json.putObject("position");
            position.put("line", node.position().line());
            position.put("column", node.position().column());
            position.put("offset", node.position().offset());
        }
        if (node instanceof ProgramNode n) {
            json.set("body", writeBlock(n.body(), depth));
        } else if (node instanceof FunctionDefNode n) {
            json.put("name", n.name());
            ArrayNode args = json.putArray("args");
            n.args().forEach(args::add);
            json.set("body", writeBlock(n.body(), depth));
        } else if (node instanceof ClassDefNode n) {
            json.put("name", n.name());
            json.set("bases", writeBlock(n.bases(), depth));
            json.set("body", writeBlock(n.body(), depth));
        } else if (node instanceof AssignNode n) {
            json.set("targets", writeBlock(n.targets(), depth));
            json.set("value", write(n.value(), depth + 1));
        } else if (node instanceof ReturnNode n) {
            json.set("value", writeOptional(n.value(), depth));
        } else if (node instanceof IfNode n) {
            json.set("test", write(n.test(), depth + 1));
            json.set("body", writeBlock(n.body(), depth));
            json.set("orelse", writeBlock(n.orElse(), depth));
        } else if (node instanceof ForNode n) {
            json.set("target", write(n.target(), depth + 1));
            json.set("iter", write(n.iter(), depth + 1));
            json.set("body", writeBlock(n.body(), depth));
            json.set("orelse", writeBlock(n.orElse(), depth));
        } else if (node instanceof WhileNode n) {
            json.set("test", write(n.test(), depth + 1));
            json.set("body", writeBlock(n.body(), depth));
            json.set("orelse", writeBlock(n.orElse(), depth));
        } else if (node instanceof BinOpNode n) {
            json.set("left", write(n.left(), depth + 1));
            json.put("op", n.op());
            json.set("right", write(n.right(), depth + 1));
        } else if (node instanceof UnaryOpNode n) {
            json.put("op", n.op());
            json.set("operand", write(n.operand(), depth + 1));
        } else if (node instanceof CallNode n) {
            json.set("func", write(n.func(), depth + 1));
            json.set("args", writeBlock(n.args(), depth));
        } else if (node instanceof NameNode n) {
            json.put("id", n.id());
            json.put("ctx", n.ctx().tag());
        } else if (node instanceof AttributeNode n) {
            json.set("value", write(n.value(), depth + 1));
            json.put("attr", n.attr());
            json.put("ctx", n.ctx().tag());
        } else if (node instanceof ConstantNode n) {
            json.set("value", objectMapper.valueToTree(n.value()));
            json.put("kind", n.literalKind());
        } else if (node instanceof ImportNode n) {
            writeAliases(json, n.names());
        } else if (node instanceof ImportFromNode n) {
            json.put("module", n.module());
            writeAliases(json, n.names());
            json.put("level", n.level());
        } else if (node instanceof ExprNode n) {
            json.set("value", write(n.value(), depth + 1));
        } else if (node instanceof RaiseNode n) {
            json.set("exc", writeOptional(n.exc(), depth));
        } else if (node instanceof AssertNode n) {
            json.set("test", write(n.test(), depth + 1));
            json.set("msg", writeOptional(n.msg(), depth));
        } else if (node instanceof TryNode n) {
            json.set("body", writeBlock(n.body(), depth));
            json.set("handlers", writeBlock(n.handlers(), depth));
            json.set("orelse", writeBlock(n.orElse(), depth));
            json.set("finalbody", writeBlock(n.finalBody(), depth));
        } else if (node instanceof ExceptHandlerNode n) {
            // "type" holds the node tag, so the caught type goes under its own key
            json.set("exc_type", writeOptional(n.type(), depth));
            json.put("name", n.name());
            json.set("body", writeBlock(n.body(), depth));
        } else if (node instanceof WithNode n) {
            ArrayNode items = json.putArray("items");
            for (WithNode.Item item : n.items()) {
                ObjectNode i = items.addObject();
                i.set("context_expr", write(item.contextExpr(), depth + 1));
                i.set("optional_vars", writeOptional(item.optionalVars(), depth));
            }
            json.set("body", writeBlock(n.body(), depth));
        } else if (node instanceof OpaqueNode n) {
            json.set("fields", objectMapper.valueToTree(n.fields()));
            json.set("children", writeBlock(n.children(), depth));
        }
        // Pass, Break and Continue carry nothing but their tag.
        return json;
    }

    private ArrayNode writeBlock(List<AstNode> nodes, int depth) {
        ArrayNode array = objectMapper.createArrayNode();
        for (AstNode node : nodes) {
            array.add(write(node, depth + 1));
        }
        return array;
    }

    private static void writeAliases(ObjectNode json, List<ImportNode.Alias> aliases) {
        ArrayNode names = json.putArray("names");
        for (ImportNode.Alias alias : aliases) {
            ObjectNode a = names.addObject();
            a.put("name", alias.name());
            a.put("asname", alias.asName());
        }
    }

    private JsonNode writeOptional(AstNode node, int depth) {
        return node == null ? objectMapper.nullNode() : write(node, depth + 1);
    }

    private static String tagOf(AstNode node) {
        return node instanceof OpaqueNode opaque ? opaque.kindName() : node.kind().tag();
    }

    // endregion

    // region Reading

    private AstNode read(JsonNode json, String path, int depth) throws TreeSerializationException {
        checkDepth(depth);
        if (json == null || !json.isObject()) {
            throw malformed(path, "expected a node object");
        }
        String type = text(json, "type", path);
        Position position = position(json, path);
        Optional<NodeKind> kind = NodeKind.fromTag(type);
        if (kind.isEmpty()) {
            Map<String, Object> fields = json.hasNonNull("fields")
                    ? objectMapper.convertValue(json.get("fields"), FIELDS_TYPE)
                    : Map.of();
            return new OpaqueNode(type, fields, readOptionalBlock(json, "children", path, depth), position);
        }
        switch (kind.get()) {
            case PROGRAM:
                return new ProgramNode(readBlock(json, "body", path, depth), position);
            case FUNCTION_DEF: {
                List<String> args = new ArrayList<>();
                for (JsonNode arg : array(json, "args", path)) {
                    if (!arg.isTextual()) {
                        throw malformed(path + ".args", "expected parameter names");
                    }
                    args.add(arg.asText());
                }
                return new FunctionDefNode(text(json, "name", path), args, readBlock(json, "body", path, depth), position);
            }
            case CLASS_DEF:
                return new ClassDefNode(text(json, "name", path),
                        readOptionalBlock(json, "bases", path, depth), readBlock(json, "body", path, depth), position);
            case ASSIGN:
                return new AssignNode(readBlock(json, "targets", path, depth), readChild(json, "value", path, depth),
                        position);
            case RETURN:
                return new ReturnNode(readOptionalChild(json, "value", path, depth), position);
            case IF:
                return new IfNode(readChild(json, "test", path, depth),
                        readBlock(json, "body", path, depth), readOptionalBlock(json, "orelse", path, depth), position);
            case FOR:
                return new ForNode(readChild(json, "target", path, depth), readChild(json, "iter", path, depth),
                        readBlock(json, "body", path, depth), readOptionalBlock(json, "orelse", path, depth), position);
            case WHILE:
                return new WhileNode(readChild(json, "test", path, depth),
                        readBlock(json, "body", path, depth), readOptionalBlock(json, "orelse", path, depth), position);
            case BIN_OP:
                return new BinOpNode(readChild(json, "left", path, depth), text(json, "op", path),
                        readChild(json, "right", path, depth), position);
            case UNARY_OP:
                return new UnaryOpNode(text(json, "op", path), readChild(json, "operand", path, depth), position);
            case CALL:
                return new CallNode(readChild(json, "func", path, depth), readOptionalBlock(json, "args", path, depth),
                        position);
            case NAME:
                return new NameNode(text(json, "id", path), context(json, path), position);
            case ATTRIBUTE:
                return new AttributeNode(readChild(json, "value", path, depth), text(json, "attr", path),
                        context(json, path), position);
            case CONSTANT:
                return new ConstantNode(constant(json, path), position);
            case IMPORT:
                return new ImportNode(aliases(json, path), position);
            case IMPORT_FROM: {
                JsonNode level = json.get("level");
                if (level != null && !level.isNull() && !level.canConvertToInt()) {
                    throw malformed(path, "field 'level' must be an integer");
                }
                return new ImportFromNode(optionalText(json, "module", path), aliases(json, path),
                        level == null || level.isNull() ? 0 : level.intValue(), position);
            }
            case EXPR:
                return new ExprNode(readChild(json, "value", path, depth), position);
            case RAISE:
                return new RaiseNode(readOptionalChild(json, "exc", path, depth), position);
            case ASSERT:
                return new AssertNode(readChild(json, "test", path, depth), readOptionalChild(json, "msg", path, depth),
                        position);
            case TRY:
                return new TryNode(readBlock(json, "body", path, depth), readOptionalBlock(json, "handlers", path, depth),
                        readOptionalBlock(json, "orelse", path, depth), readOptionalBlock(json, "finalbody", path, depth),
                        position);
            case EXCEPT_HANDLER:
                return new ExceptHandlerNode(readOptionalChild(json, "exc_type", path, depth),
                        optionalText(json, "name", path), readBlock(json, "body", path, depth), position);
            case WITH: {
                List<WithNode.Item> items = new ArrayList<>();
                int i = 0;
                for (JsonNode item : array(json, "items", path)) {
                    String itemPath = path + ".items[" + i++ + "]";
                    if (!item.isObject()) {
                        throw malformed(itemPath, "expected a with item object");
                    }
                    items.add(new WithNode.Item(readChild(item, "context_expr", itemPath, depth),
                            readOptionalChild(item, "optional_vars", itemPath, depth)));
                }
                return new WithNode(items, readBlock(json, "body", path, depth), position);
            }
            case PASS:
                return new PassNode(position);
            case BREAK:
                return new BreakNode(position);
            case CONTINUE:
                return new ContinueNode(position);
            default:
                throw malformed(path, "unsupported node type '" + type + "'");
        }
    }

    private AstNode readChild(JsonNode json, String field, String path, int depth) throws TreeSerializationException {
        JsonNode child = json.get(field);
        if (child == null || child.isNull()) {
            throw malformed(path, "missing field '" + field + "'");
        }
        return read(child, path + "." + field, depth + 1);
    }

    private AstNode readOptionalChild(JsonNode json, String field, String path, int depth) throws TreeSerializationException {
        JsonNode child = json.get(field);
        return child == null || child.isNull() ? null : read(child, path + "." + field, depth + 1);
    }

    private List<AstNode> readBlock(JsonNode json, String field, String path, int depth) throws TreeSerializationException {
        List<AstNode> nodes = new ArrayList<>();
        int i = 0;
        for (JsonNode element : array(json, field, path)) {
            nodes.add(read(element, path + "." + field + "[" + i++ + "]", depth + 1));
        }
        return nodes;
    }

    private List<AstNode> readOptionalBlock(JsonNode json, String field, String path, int depth) throws TreeSerializationException {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? List.of() : readBlock(json, field, path, depth);
    }

    private static List<ImportNode.Alias> aliases(JsonNode json, String path) throws TreeSerializationException {
        List<ImportNode.Alias> names = new ArrayList<>();
        for (JsonNode alias : array(json, "names", path)) {
            if (!alias.isObject()) {
                throw malformed(path + ".names", "expected an alias object");
            }
            names.add(new ImportNode.Alias(text(alias, "name", path + ".names"),
                    optionalText(alias, "asname", path + ".names")));
        }
        return names;
    }

    private static Position position(JsonNode json, String path) throws TreeSerializationException {
        JsonNode position = json.get("position");
        if (position == null || position.isNull()) {
            return null;
        }
        if (!position.isObject()) {
            throw malformed(path, "field 'position' must be an object");
        }
        return new Position(integer(position, "line", path + ".position"),
                integer(position, "column", path + ".position"),
                integer(position, "offset", path + ".position"));
    }

    private static int integer(JsonNode json, String field, String path) throws TreeSerializationException {
        JsonNode value = json.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            throw malformed(path, "field '" + field + "' must be an integer");
        }
        return value.intValue();
    }

    private static JsonNode array(JsonNode json, String field, String path) throws TreeSerializationException {
        JsonNode value = json.get(field);
        if (value == null || !value.isArray()) {
            throw malformed(path, "field '" + field + "' must be an array");
        }
        return value;
    }

    private static String text(JsonNode json, String field, String path) throws TreeSerializationException {
        JsonNode value = json.get(field);
        if (value == null || !value.isTextual()) {
            throw malformed(path, "field '" + field + "' must be a string");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode json, String field, String path) throws TreeSerializationException {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw malformed(path, "field '" + field + "' must be a string or null");
        }
        return value.asText();
    }

    private static ExprContext context(JsonNode json, String path) throws TreeSerializationException {
        JsonNode ctx = json.get("ctx");
        if (ctx == null || ctx.isNull()) {
            return ExprContext.LOAD;
        }
        try {
            return ExprContext.fromTag(ctx.asText());
        } catch (IllegalArgumentException e) {
            throw malformed(path, e.getMessage());
        }
    }

    private static Object constant(JsonNode json, String path) throws TreeSerializationException {
        JsonNode value = json.get("value");
        String kind = json.hasNonNull("kind") ? json.get("kind").asText() : null;
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            if ("float".equals(kind)) {
                return nonFinite(value.textValue(), path);
            }
            return value.textValue();
        }
        if (value.isNumber()) {
            if ("float".equals(kind) || value.isFloatingPointNumber()) {
                return value.doubleValue();
            }
            if (!value.canConvertToLong()) {
                throw malformed(path, "integer constant out of range: " + value.asText());
            }
            return value.longValue();
        }
        throw malformed(path, "unsupported constant value " + value);
    }

    private static Double nonFinite(String text, String path) throws TreeSerializationException {
        switch (text) {
            case "NaN":
                return Double.NaN;
            case "Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                throw malformed(path, "float constant '" + text + "' is not a number");
        }
    }

    private static TreeSerializationException malformed(String path, String message) {
        return new TreeSerializationException(SyntreeErrorCode.JSON_MALFORMED, "Malformed tree at " + path + ": " + message, null);
    }

    // endregion

    private void checkDepth(int depth) {
        if (depth > maxDepth) {
            throw new StructuralInvariantViolationException(SyntreeErrorCode.TREE_TOO_DEEP,
                    "Tree is nested deeper than the traversal limit of " + maxDepth);
        }
    }
}
