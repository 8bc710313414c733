package org.syntree.transform.passes;

import org.syntree.transform.TransformPass;
import org.syntree.tree.AstNode;
import org.syntree.tree.BreakNode;
import org.syntree.tree.ConstantNode;
import org.syntree.tree.ContinueNode;
import org.syntree.tree.IfNode;
import org.syntree.tree.PassNode;
import org.syntree.tree.RaiseNode;
import org.syntree.tree.ReturnNode;
import org.syntree.tree.TreeWalker;
import org.syntree.tree.WhileNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes statements that can never execute.
 * <ul>
 *     <li>Statements following a {@code return}, {@code raise}, {@code break} or {@code continue}
 *     in the same block are dropped.</li>
 *     <li>An {@code if} with a literal test is replaced by the statements of the branch taken.</li>
 *     <li>A {@code while} with a false literal test is replaced by its {@code else} block.</li>
 * </ul>
 * A function, class, loop or {@code if} body left empty receives a single {@code pass}.
 */
public class DeadCodeEliminationPass implements TransformPass {

    public static final String NAME = "dead_code_elimination";

    private final TreeWalker walker;

    public DeadCodeEliminationPass() {
        this(new TreeWalker());
    }

    public DeadCodeEliminationPass(TreeWalker walker) {
        this.walker = walker;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AstNode transform(AstNode tree) {
        return walker.rewriteBottomUp(tree, node -> StatementBlocks.rewrite(node, this::block));
    }

    /**
     * Cleans one statement block.
     * @param statements The block, whose nested blocks are already clean.
     * @param required Whether the block must keep at least one statement.
     * @return The same list instance if nothing changed, otherwise the new block.
     */
    private List<AstNode> block(List<AstNode> statements, boolean required) {
        List<AstNode> result = new ArrayList<>(statements.size());
        scan:
        for (AstNode statement : statements) {
            List<AstNode> replacement = splice(statement);
            for (AstNode s : replacement == null ? List.of(statement) : replacement) {
                result.add(s);
                if (isTerminator(s)) {
                    break scan;
                }
            }
        }
        if (required && result.isEmpty() && !statements.isEmpty()) {
            result.add(new PassNode());
        }
        return StatementBlocks.unchangedOr(statements, result);
    }

    /**
     * @return The statements replacing a statement with a literal condition, or {@code null} if it stays.
     */
    private static List<AstNode> splice(AstNode statement) {
        if (statement instanceof IfNode ifNode && ifNode.test() instanceof ConstantNode test) {
            return test.isTruthy() ? ifNode.body() : ifNode.orElse();
        }
        if (statement instanceof WhileNode loop && loop.test() instanceof ConstantNode test && !test.isTruthy()) {
            return loop.orElse();
        }
        return null;
    }

    private static boolean isTerminator(AstNode statement) {
        return statement instanceof ReturnNode || statement instanceof RaiseNode
                || statement instanceof BreakNode || statement instanceof ContinueNode;
    }
}
