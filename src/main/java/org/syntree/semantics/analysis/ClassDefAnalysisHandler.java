package org.syntree.semantics.analysis;

import org.syntree.semantics.Symbol;
import org.syntree.semantics.SymbolTable;
import org.syntree.tree.AstNode;
import org.syntree.tree.ClassDefNode;

/**
 * Declares a class in the enclosing scope, reads its bases there and analyses the body
 * in a new scope without implicit bindings.
 */
public class ClassDefAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        ClassDefNode classDef = (ClassDefNode) node;
        SymbolTable table = context.symbolTable();
        table.define(classDef.name(), Symbol.Kind.CLASS, classDef);
        context.walkAll(classDef.bases());

        table.enterScope(SymbolTable.ScopeKind.CLASS, classDef.name(), classDef);
        context.walkAll(classDef.body());
        table.leaveScope();
    }
}
