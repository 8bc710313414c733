package org.syntree.semantics.analysis;

import org.syntree.tree.AstNode;
import org.syntree.tree.ForNode;

/**
 * Reads the iterated expression before the loop target is bound.
 */
public class ForAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        ForNode loop = (ForNode) node;
        context.walk(loop.iter());
        context.walk(loop.target());
        context.walkAll(loop.body());
        context.walkAll(loop.orElse());
    }
}
