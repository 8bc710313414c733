package org.syntree.semantics.analysis;

import org.syntree.tree.AssignNode;
import org.syntree.tree.AstNode;

/**
 * Analyses the assigned value before the targets, so that {@code x = x + 1} reads the
 * previous binding of {@code x}. Name targets in store context declare locals.
 */
public class AssignAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        AssignNode assign = (AssignNode) node;
        context.walk(assign.value());
        context.walkAll(assign.targets());
    }
}
