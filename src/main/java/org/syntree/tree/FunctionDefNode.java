package org.syntree.tree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A function definition.
 *
 * @param name The function name.
 * @param args The positional parameter names.
 * @param body The statements of the function body.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record FunctionDefNode(String name, List<String> args, List<AstNode> body, Position position) implements AstNode {

    public FunctionDefNode {
        Objects.requireNonNull(name, "name");
        args = args == null ? List.of() : List.copyOf(args);
        body = Children.copy(body);
    }

    public FunctionDefNode(String name, List<String> args, List<AstNode> body) {
        this(name, args, body, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_DEF;
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", name);
        fields.put("args", args);
        return fields;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new FunctionDefNode(name, args, newChildren, position);
    }
}
