package org.syntree.tree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An identifier.
 *
 * @param id  The identifier text.
 * @param ctx Whether the identifier is read, bound or deleted here.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record NameNode(String id, ExprContext ctx, Position position) implements AstNode {

    public NameNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ctx, "ctx");
    }

    public NameNode(String id, ExprContext ctx) {
        this(id, ctx, null);
    }

    /**
     * Creates a name that is read.
     * @param id The identifier.
     * @return A new name node with {@link ExprContext#LOAD}.
     */
    public static NameNode load(String id) {
        return new NameNode(id, ExprContext.LOAD);
    }

    /**
     * Creates a name that is bound.
     * @param id The identifier.
     * @return A new name node with {@link ExprContext#STORE}.
     */
    public static NameNode store(String id) {
        return new NameNode(id, ExprContext.STORE);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NAME;
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("ctx", ctx.tag());
        return fields;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 0, kind());
        return new NameNode(id, ctx, position);
    }
}
