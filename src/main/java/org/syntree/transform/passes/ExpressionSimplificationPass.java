package org.syntree.transform.passes;

import org.syntree.transform.TransformPass;
import org.syntree.tree.AstNode;
import org.syntree.tree.AstNodes;
import org.syntree.tree.BinOpNode;
import org.syntree.tree.ConstantNode;
import org.syntree.tree.TreeWalker;
import org.syntree.tree.UnaryOpNode;

/**
 * Applies algebraic identities bottom-up:
 * <ul>
 *     <li>{@code x + 0}, {@code 0 + x}, {@code x - 0}, {@code x * 1}, {@code 1 * x} become {@code x}</li>
 *     <li>{@code x * 0} and {@code 0 * x} become {@code 0} unless {@code x} may have side effects</li>
 *     <li>{@code -(-x)} and {@code ~(~x)} become {@code x}</li>
 * </ul>
 * Only integer literals act as identity elements. {@code not not x} is kept, since it converts
 * {@code x} to a boolean.
 */
public class ExpressionSimplificationPass implements TransformPass {

    public static final String NAME = "expression_simplification";

    private final TreeWalker walker;

    public ExpressionSimplificationPass() {
        this(new TreeWalker());
    }

    public ExpressionSimplificationPass(TreeWalker walker) {
        this.walker = walker;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AstNode transform(AstNode tree) {
        return walker.rewriteBottomUp(tree, this::simplify);
    }

    private AstNode simplify(AstNode node) {
        if (node instanceof BinOpNode bin) {
            return simplifyBinary(bin);
        }
        if (node instanceof UnaryOpNode outer && outer.operand() instanceof UnaryOpNode inner
                && outer.op().equals(inner.op()) && (outer.op().equals("-") || outer.op().equals("~"))) {
            return inner.operand();
        }
        return node;
    }

    private AstNode simplifyBinary(BinOpNode bin) {
        AstNode left = bin.left();
        AstNode right = bin.right();
        switch (bin.op()) {
            case "+":
                if (isInteger(right, 0)) return left;
                if (isInteger(left, 0)) return right;
                break;
            case "-":
                if (isInteger(right, 0)) return left;
                break;
            case "*":
                if (isInteger(right, 1)) return left;
                if (isInteger(left, 1)) return right;
                if (isInteger(right, 0) && !AstNodes.mayHaveSideEffects(left)) return new ConstantNode(0L, bin.position());
                if (isInteger(left, 0) && !AstNodes.mayHaveSideEffects(right)) return new ConstantNode(0L, bin.position());
                break;
            default:
                break;
        }
        return bin;
    }

    private static boolean isInteger(AstNode node, long value) {
        return node instanceof ConstantNode c && c.value() instanceof Long l && l == value;
    }
}
