package org.syntree.semantics.analysis;

import org.syntree.semantics.Symbol;
import org.syntree.semantics.SymbolTable;
import org.syntree.tree.AstNode;
import org.syntree.tree.FunctionDefNode;

/**
 * Declares a function in the enclosing scope and analyses its body in a new scope
 * seeded with one symbol per parameter.
 */
public class FunctionDefAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        FunctionDefNode function = (FunctionDefNode) node;
        SymbolTable table = context.symbolTable();
        table.define(function.name(), Symbol.Kind.FUNCTION, function);

        table.enterScope(SymbolTable.ScopeKind.FUNCTION, function.name(), function);
        for (String parameter : function.args()) {
            table.define(parameter, Symbol.Kind.PARAMETER, function);
        }
        context.walkAll(function.body());
        table.leaveScope();
    }
}
