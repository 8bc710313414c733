package org.syntree.semantics.analysis;

import org.syntree.semantics.Symbol;
import org.syntree.tree.AstNode;
import org.syntree.tree.ExceptHandlerNode;

/**
 * Reads the caught type, then binds the exception name in the enclosing scope before the handler body.
 */
public class ExceptHandlerAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        ExceptHandlerNode handler = (ExceptHandlerNode) node;
        if (handler.type() != null) {
            context.walk(handler.type());
        }
        if (handler.name() != null) {
            context.symbolTable().define(handler.name(), Symbol.Kind.LOCAL, handler);
        }
        context.walkAll(handler.body());
    }
}
