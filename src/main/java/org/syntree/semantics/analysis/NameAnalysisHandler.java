package org.syntree.semantics.analysis;

import org.syntree.semantics.Symbol;
import org.syntree.tree.AstNode;
import org.syntree.tree.ExprContext;
import org.syntree.tree.NameNode;

/**
 * A stored name declares a local in the current scope; a read or deleted name is resolved
 * through the scope chain.
 */
public class NameAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        NameNode name = (NameNode) node;
        if (name.ctx() == ExprContext.STORE) {
            context.symbolTable().define(name.id(), Symbol.Kind.LOCAL, name);
        } else {
            context.reference(name);
        }
    }
}
