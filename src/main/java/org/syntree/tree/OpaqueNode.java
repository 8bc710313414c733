package org.syntree.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of a kind this library does not know, e.g. one contributed by an extended front end.
 * <p>
 * The node is a leaf for generic traversal: {@link #getChildren()} is empty, so walkers, the
 * matcher, the symbol table builder and the passes never look inside it. Its own nodes are kept
 * in {@link #children()} and travel with it unchanged.
 *
 * @param kindName The kind tag as given by its producer.
 * @param fields   An untyped bag of scalar fields.
 * @param children The nodes owned by the extension construct.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record OpaqueNode(String kindName, Map<String, Object> fields, List<AstNode> children,
                         Position position) implements AstNode {

    public OpaqueNode {
        Objects.requireNonNull(kindName, "kindName");
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        children = Children.copy(children);
    }

    public OpaqueNode(String kindName, Map<String, Object> fields, List<AstNode> children) {
        this(kindName, fields, children, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXTENSION;
    }

    @Override
    public Map<String, Object> fields() {
        return fields;
    }

    /**
     * Rebuilds the node. Since it exposes no children, the rebuilt node holds fresh copies of
     * its own nodes, which keeps deep copies free of shared instances.
     */
    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 0, kind());
        List<AstNode> copies = new ArrayList<>(children.size());
        for (AstNode child : children) {
            copies.add(AstNodes.deepCopy(child));
        }
        return new OpaqueNode(kindName, fields, copies, position);
    }
}
