package org.syntree.transform.passes;

import org.syntree.tree.AstNode;
import org.syntree.tree.ClassDefNode;
import org.syntree.tree.ExceptHandlerNode;
import org.syntree.tree.ForNode;
import org.syntree.tree.FunctionDefNode;
import org.syntree.tree.IfNode;
import org.syntree.tree.ProgramNode;
import org.syntree.tree.TryNode;
import org.syntree.tree.WhileNode;
import org.syntree.tree.WithNode;

import java.util.List;

/**
 * Rewrites the statement blocks of the node kinds that own them.
 */
final class StatementBlocks {

    /**
     * Rewrites one block.
     */
    @FunctionalInterface
    interface BlockRewrite {
        /**
         * @param statements The block.
         * @param required Whether the block must keep at least one statement to stay valid
         *                 (every body except the module body, {@code else} blocks and most
         *                 {@code finally} blocks).
         * @return The same list instance if nothing changed, otherwise the new block.
         */
        List<AstNode> apply(List<AstNode> statements, boolean required);
    }

    private StatementBlocks() {}

    /**
     * Applies the rewrite to every block owned directly by the node.
     * @param node Any node; nodes without blocks are returned unchanged.
     * @param rewrite The block rewrite.
     * @return The node itself if no block changed, otherwise a rebuilt node.
     */
    static AstNode rewrite(AstNode node, BlockRewrite rewrite) {
        if (node instanceof ProgramNode program) {
            List<AstNode> body = rewrite.apply(program.body(), false);
            return body == program.body() ? node : new ProgramNode(body, program.position());
        }
        if (node instanceof FunctionDefNode function) {
            List<AstNode> body = rewrite.apply(function.body(), true);
            return body == function.body() ? node : new FunctionDefNode(function.name(), function.args(), body,
                    function.position());
        }
        if (node instanceof ClassDefNode classDef) {
            List<AstNode> body = rewrite.apply(classDef.body(), true);
            return body == classDef.body() ? node : new ClassDefNode(classDef.name(), classDef.bases(), body,
                    classDef.position());
        }
        if (node instanceof IfNode ifNode) {
            List<AstNode> body = rewrite.apply(ifNode.body(), true);
            List<AstNode> orElse = rewrite.apply(ifNode.orElse(), false);
            if (body == ifNode.body() && orElse == ifNode.orElse()) {
                return node;
            }
            return new IfNode(ifNode.test(), body, orElse, ifNode.position());
        }
        if (node instanceof ForNode loop) {
            List<AstNode> body = rewrite.apply(loop.body(), true);
            List<AstNode> orElse = rewrite.apply(loop.orElse(), false);
            if (body == loop.body() && orElse == loop.orElse()) {
                return node;
            }
            return new ForNode(loop.target(), loop.iter(), body, orElse, loop.position());
        }
        if (node instanceof WhileNode loop) {
            List<AstNode> body = rewrite.apply(loop.body(), true);
            List<AstNode> orElse = rewrite.apply(loop.orElse(), false);
            if (body == loop.body() && orElse == loop.orElse()) {
                return node;
            }
            return new WhileNode(loop.test(), body, orElse, loop.position());
        }
        if (node instanceof TryNode tryNode) {
            List<AstNode> body = rewrite.apply(tryNode.body(), true);
            List<AstNode> orElse = rewrite.apply(tryNode.orElse(), false);
            // without handlers the finally block is what makes the statement valid
            boolean finallyRequired = tryNode.handlers().isEmpty() && !tryNode.finalBody().isEmpty();
            List<AstNode> finalBody = rewrite.apply(tryNode.finalBody(), finallyRequired);
            if (body == tryNode.body() && orElse == tryNode.orElse() && finalBody == tryNode.finalBody()) {
                return node;
            }
            return new TryNode(body, tryNode.handlers(), orElse, finalBody, tryNode.position());
        }
        if (node instanceof ExceptHandlerNode handler) {
            List<AstNode> body = rewrite.apply(handler.body(), true);
            return body == handler.body() ? node
                    : new ExceptHandlerNode(handler.type(), handler.name(), body, handler.position());
        }
        if (node instanceof WithNode with) {
            List<AstNode> body = rewrite.apply(with.body(), true);
            return body == with.body() ? node : new WithNode(with.items(), body, with.position());
        }
        return node;
    }

    /**
     * Returns the original block if the rewritten one holds the same instances, so that
     * unchanged subtrees are not rebuilt.
     */
    static List<AstNode> unchangedOr(List<AstNode> original, List<AstNode> rewritten) {
        if (original.size() == rewritten.size()) {
            boolean same = true;
            for (int i = 0; i < original.size() && same; i++) {
                same = original.get(i) == rewritten.get(i);
            }
            if (same) {
                return original;
            }
        }
        return List.copyOf(rewritten);
    }
}
