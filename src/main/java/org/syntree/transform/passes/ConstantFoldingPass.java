package org.syntree.transform.passes;

import org.syntree.transform.TransformPass;
import org.syntree.tree.AstNode;
import org.syntree.tree.BinOpNode;
import org.syntree.tree.ConstantNode;
import org.syntree.tree.TreeWalker;
import org.syntree.tree.UnaryOpNode;

import java.util.Optional;

/**
 * Evaluates operations whose operands are all literals, bottom-up in a single traversal,
 * so {@code 1 + 2 * 3} becomes {@code 7}.
 * <p>
 * Arithmetic follows the source language: {@code /} always yields a float, {@code //} and
 * {@code %} round towards negative infinity. Anything whose result would differ from running the
 * program is left alone: division or modulo by zero, integer overflow, non-finite float results, negative integer exponents,
 * booleans used as numbers and unknown operators.
 */
public class ConstantFoldingPass implements TransformPass {

    public static final String NAME = "constant_folding";

    private final TreeWalker walker;

    public ConstantFoldingPass() {
        this(new TreeWalker());
    }

    public ConstantFoldingPass(TreeWalker walker) {
        this.walker = walker;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AstNode transform(AstNode tree) {
        return walker.rewriteBottomUp(tree, this::fold);
    }

    private AstNode fold(AstNode node) {
        Optional<Object> folded = Optional.empty();
        if (node instanceof BinOpNode bin
                && bin.left() instanceof ConstantNode left && bin.right() instanceof ConstantNode right) {
            folded = foldBinary(left.value(), bin.op(), right.value());
        } else if (node instanceof UnaryOpNode unary && unary.operand() instanceof ConstantNode operand) {
            folded = foldUnary(unary.op(), operand);
        }
        return folded.<AstNode>map(value -> new ConstantNode(value, node.position())).orElse(node);
    }

    private static Optional<Object> foldUnary(String op, ConstantNode operand) {
        Object value = operand.value();
        switch (op) {
            case "not":
                return Optional.of(!operand.isTruthy());
            case "-":
                if (value instanceof Long l) {
                    return l == Long.MIN_VALUE ? Optional.empty() : Optional.of(-l);
                }
                if (value instanceof Double d) {
                    return Optional.of(-d);
                }
                return Optional.empty();
            case "+":
                return operand.isNumeric() ? Optional.of(value) : Optional.empty();
            default:
                return Optional.empty();
        }
    }

    private static Optional<Object> foldBinary(Object left, String op, Object right) {
        if (left instanceof String l && right instanceof String r) {
            return "+".equals(op) ? Optional.of(l + r) : Optional.empty();
        }
        if (left instanceof Long l && right instanceof Long r) {
            return foldLong(l, op, r);
        }
        if (isNumber(left) && isNumber(right)) {
            return foldDouble(((Number) left).doubleValue(), op, ((Number) right).doubleValue())
                    .filter(v -> !(v instanceof Double d) || Double.isFinite(d));
        }
        return Optional.empty();
    }

    private static boolean isNumber(Object value) {
        return value instanceof Long || value instanceof Double;
    }

    private static Optional<Object> foldLong(long l, String op, long r) {
        try {
            switch (op) {
                case "+": return Optional.of(Math.addExact(l, r));
                case "-": return Optional.of(Math.subtractExact(l, r));
                case "*": return Optional.of(Math.multiplyExact(l, r));
                case "/": return r == 0 ? Optional.empty() : Optional.of((double) l / (double) r);
                case "//":
                    if (r == 0 || (l == Long.MIN_VALUE && r == -1)) return Optional.empty();
                    return Optional.of(Math.floorDiv(l, r));
                case "%": return r == 0 ? Optional.empty() : Optional.of(Math.floorMod(l, r));
                case "**": return power(l, r);
                default: return compare(Long.compare(l, r), op);
            }
        } catch (ArithmeticException e) {
            // Overflow: the runtime would produce a big integer, which a literal here cannot hold.
            return Optional.empty();
        }
    }

    private static Optional<Object> power(long base, long exponent) {
        if (exponent < 0) {
            return Optional.empty();
        }
        if (base == 0 || base == 1) {
            return Optional.of(exponent == 0 ? 1L : base);
        }
        if (base == -1) {
            return Optional.of(exponent % 2 == 0 ? 1L : -1L);
        }
        // |base| >= 2 overflows within 63 multiplications.
        long result = 1;
        for (long i = 0; i < exponent; i++) {
            result = Math.multiplyExact(result, base);
        }
        return Optional.of(result);
    }

    private static Optional<Object> foldDouble(double l, String op, double r) {
        switch (op) {
            case "+": return Optional.of(l + r);
            case "-": return Optional.of(l - r);
            case "*": return Optional.of(l * r);
            case "/": return r == 0.0 ? Optional.empty() : Optional.of(l / r);
            case "//": return r == 0.0 ? Optional.empty() : Optional.of(Math.floor(l / r));
            case "%":
                if (r == 0.0) return Optional.empty();
                double mod = l % r;
                if (mod != 0.0 && (mod < 0) != (r < 0)) {
                    mod += r;
                }
                return Optional.of(mod);
            case "**":
                return Optional.of(Math.pow(l, r));
            case "==": return Optional.of(l == r);
            case "!=": return Optional.of(l != r);
            case "<": return Optional.of(l < r);
            case "<=": return Optional.of(l <= r);
            case ">": return Optional.of(l > r);
            case ">=": return Optional.of(l >= r);
            default: return Optional.empty();
        }
    }

    private static Optional<Object> compare(int comparison, String op) {
        switch (op) {
            case "==": return Optional.of(comparison == 0);
            case "!=": return Optional.of(comparison != 0);
            case "<": return Optional.of(comparison < 0);
            case "<=": return Optional.of(comparison <= 0);
            case ">": return Optional.of(comparison > 0);
            case ">=": return Optional.of(comparison >= 0);
            default: return Optional.empty();
        }
    }
}
