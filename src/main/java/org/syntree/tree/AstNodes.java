package org.syntree.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static helpers over trees.
 */
public final class AstNodes {

    private static final TreeWalker WALKER = new TreeWalker();

    private AstNodes() {}

    /**
     * Counts all nodes of a tree, the root included.
     * @param root The root node.
     * @return The number of nodes.
     */
    public static int countNodes(AstNode root) {
        int[] count = {0};
        WALKER.visit(root, (node, depth) -> count[0]++);
        return count[0];
    }

    /**
     * Checks whether any node of the subtree has the given kind.
     * @param root The subtree root.
     * @param kind The kind to look for.
     * @return {@code true} if at least one node has that kind.
     */
    public static boolean containsKind(AstNode root, NodeKind kind) {
        if (root.kind() == kind) {
            return true;
        }
        for (AstNode child : root.getChildren()) {
            if (containsKind(child, kind)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether evaluating the subtree could have an effect beyond its value. Calls may, and
     * so may extension nodes, since their contents are never inspected.
     * @param root The subtree root.
     * @return {@code false} only if the subtree is known to be free of effects.
     */
    public static boolean mayHaveSideEffects(AstNode root) {
        return containsKind(root, NodeKind.CALL) || containsKind(root, NodeKind.EXTENSION);
    }

    /**
     * Creates a structurally equal copy in which every node is a fresh instance.
     * @param node The subtree root.
     * @return The copy.
     */
    public static AstNode deepCopy(AstNode node) {
        List<AstNode> children = node.getChildren();
        List<AstNode> copies = new ArrayList<>(children.size());
        for (AstNode child : children) {
            copies.add(deepCopy(child));
        }
        return node.reconstructWithChildren(copies);
    }

    /**
     * Resolves the identifier a call targets: the id of a {@link NameNode} callee, or the dotted
     * path of an {@link AttributeNode} chain that ends in a name, e.g. {@code os.path.join}.
     * @param call The call.
     * @return The callee identifier, or empty if the callee is any other expression.
     */
    public static Optional<String> calleeName(CallNode call) {
        return dottedPath(call.func());
    }

    /**
     * Renders the dotted path of a name or attribute chain.
     * @param node The expression.
     * @return The path, or empty if the expression is not a pure name/attribute chain.
     */
    public static Optional<String> dottedPath(AstNode node) {
        if (node instanceof NameNode name) {
            return Optional.of(name.id());
        }
        if (node instanceof AttributeNode attribute) {
            return dottedPath(attribute.value()).map(prefix -> prefix + "." + attribute.attr());
        }
        return Optional.empty();
    }

    /**
     * Renders an indented outline of the tree, one node per line, for logs and debugging.
     * @param root The root node.
     * @return The outline.
     */
    public static String dump(AstNode root) {
        StringBuilder sb = new StringBuilder();
        WALKER.visit(root, (node, depth) -> {
            sb.append("  ".repeat(depth)).append(tagOf(node));
            String label = label(node);
            if (!label.isEmpty()) {
                sb.append('(').append(label).append(')');
            }
            sb.append('\n');
        });
        return sb.toString();
    }

    /**
     * Returns the serialized kind tag, which for extension nodes is their own kind name.
     * @param node The node.
     * @return The tag.
     */
    public static String tagOf(AstNode node) {
        return node instanceof OpaqueNode opaque ? opaque.kindName() : node.kind().tag();
    }

    private static String label(AstNode node) {
        Map<String, Object> fields = node.fields();
        for (String key : List.of("name", "id", "op", "attr")) {
            if (fields.get(key) != null) {
                return String.valueOf(fields.get(key));
            }
        }
        if (node instanceof ConstantNode constant) {
            return constant.value() instanceof String s ? "'" + s + "'" : String.valueOf(constant.value());
        }
        return "";
    }
}
