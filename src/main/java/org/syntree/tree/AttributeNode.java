package org.syntree.tree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An attribute access, e.g. {@code os.path}.
 *
 * @param value The object expression.
 * @param attr  The attribute name.
 * @param ctx   Whether the attribute is read, bound or deleted here.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record AttributeNode(AstNode value, String attr, ExprContext ctx, Position position) implements AstNode {

    public AttributeNode {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(attr, "attr");
        Objects.requireNonNull(ctx, "ctx");
    }

    public AttributeNode(AstNode value, String attr, ExprContext ctx) {
        this(value, attr, ctx, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ATTRIBUTE;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("attr", attr);
        fields.put("ctx", ctx.tag());
        return fields;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 1, kind());
        return new AttributeNode(newChildren.get(0), attr, ctx, position);
    }
}
