package org.syntree.tree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One {@code except} clause of a {@link TryNode}.
 *
 * @param type     The caught exception expression, or {@code null} for a bare {@code except:}.
 * @param name     The name bound to the exception, or {@code null}.
 * @param body     The handler statements.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record ExceptHandlerNode(AstNode type, String name, List<AstNode> body, Position position)
        implements AstNode {

    public ExceptHandlerNode {
        body = Children.copy(body);
    }

    public ExceptHandlerNode(AstNode type, String name, List<AstNode> body) {
        this(type, name, body, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXCEPT_HANDLER;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(type, body);
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", name);
        return fields;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        int offset = type == null ? 0 : 1;
        Children.requireSize(newChildren, offset + body.size(), kind());
        return new ExceptHandlerNode(type == null ? null : newChildren.get(0), name,
                Children.slice(newChildren, offset, newChildren.size()), position);
    }
}
