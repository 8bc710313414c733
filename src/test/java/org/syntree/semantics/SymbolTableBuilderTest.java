package org.syntree.semantics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.syntree.junit.extensions.logging.LogWatchExtension;
import org.syntree.tree.AstNode;
import org.syntree.tree.AstNodes;
import org.syntree.tree.CallNode;
import org.syntree.tree.ClassDefNode;
import org.syntree.tree.ExceptHandlerNode;
import org.syntree.tree.ForNode;
import org.syntree.tree.FunctionDefNode;
import org.syntree.tree.ImportFromNode;
import org.syntree.tree.ImportNode;
import org.syntree.tree.NameNode;
import org.syntree.tree.OpaqueNode;
import org.syntree.tree.PassNode;
import org.syntree.tree.ProgramNode;
import org.syntree.tree.TryNode;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.syntree.tree.Trees.*;

/**
 * Tests scope construction, name binding and the unused/undefined reports of {@link SymbolTableBuilder}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class SymbolTableBuilderTest {

    private SymbolTableBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new SymbolTableBuilder();
    }

    @Test
    void unreadParameterIsUnusedAndUndeclaredReadIsUndefined() {
        // Arrange: def f(a, b): return a
        //          f(undefined_name)
        ProgramNode tree = program(
                def("f", params("a", "b"), ret(name("a"))),
                expr(call("f", name("undefined_name"))));

        // Act
        SymbolTable table = builder.analyze(tree);

        // Assert
        assertThat(table.getUnusedVariables()).extracting(Symbol::getName).containsExactly("b");
        assertThat(table.getUnusedVariables().get(0).getKind()).isEqualTo(Symbol.Kind.PARAMETER);
        assertThat(table.getUndefinedVariables()).containsExactly("undefined_name");
    }

    @Test
    void functionOpensScopeSeededWithParameters() {
        FunctionDefNode function = def("f", params("x"), ret(name("x")));
        ProgramNode tree = program(function);

        SymbolTable table = builder.analyze(tree);

        SymbolTable.Scope scope = table.scopeFor(function).orElseThrow();
        assertThat(scope.getKind()).isEqualTo(SymbolTable.ScopeKind.FUNCTION);
        assertThat(scope.getParent()).contains(table.getModuleScope());
        assertThat(scope.lookupLocal("x")).hasValueSatisfying(s -> {
            assertThat(s.getKind()).isEqualTo(Symbol.Kind.PARAMETER);
            assertThat(s.getUseCount()).isEqualTo(1);
        });
        assertThat(table.scopeFor(tree)).contains(table.getModuleScope());
        assertThat(table.getModuleScope().lookupLocal("f")).map(Symbol::getKind).contains(Symbol.Kind.FUNCTION);
    }

    @Test
    void innerScopeShadowsOuterDeclaration() {
        // x = 1
        // def f(): x = 2; return x
        NameNode innerRead = name("x");
        ProgramNode tree = program(
                assign("x", constant(1)),
                def("f", params(), assign("x", constant(2)), ret(innerRead)));

        SymbolTable table = builder.analyze(tree);

        Symbol outer = table.getModuleScope().lookupLocal("x").orElseThrow();
        Symbol inner = table.getScopes().get(1).lookupLocal("x").orElseThrow();
        assertThat(inner.isUsedAt(innerRead)).isTrue();
        assertThat(outer.isUsed()).isFalse();
        assertThat(table.getUnusedVariables()).containsExactly(outer);
    }

    @Test
    void assignmentReadsValueBeforeBindingTarget() {
        // x = 0
        // x = x + 1
        NameNode read = name("x");
        ProgramNode tree = program(assign("x", constant(0)), assign("x", binOp(read, "+", constant(1))));

        SymbolTable table = builder.analyze(tree);

        Symbol x = table.getModuleScope().lookupLocal("x").orElseThrow();
        assertThat(x.getDeclarations()).hasSize(2);
        assertThat(x.getUseSites()).containsExactly(read);
        assertThat(x.isDefinedBeforeUse()).isTrue();
    }

    @Test
    void forwardReferenceResolvesAfterWalk() {
        // def main(): return helper()
        // def helper(): return 1
        NameNode callee = name("helper");
        ProgramNode tree = program(
                def("main", params(), ret(new CallNode(callee, List.of()))),
                def("helper", params(), ret(constant(1))));

        SymbolTable table = builder.analyze(tree);

        Symbol helper = table.getModuleScope().lookupLocal("helper").orElseThrow();
        assertThat(helper.isUsedAt(callee)).isTrue();
        assertThat(helper.isDefinedBeforeUse()).isFalse();
        assertThat(table.getUndefinedVariables()).isEmpty();
    }

    @Test
    void classBodyHasOwnScopeAndBasesAreReadOutside() {
        // class Base: pass
        // class Child(Base): size = 3
        ClassDefNode child = new ClassDefNode("Child", List.of(name("Base")), List.of(assign("size", constant(3))));
        ProgramNode tree = program(new ClassDefNode("Base", List.of(), List.of(new PassNode())), child);

        SymbolTable table = builder.analyze(tree);

        SymbolTable.Scope classScope = table.scopeFor(child).orElseThrow();
        assertThat(classScope.getKind()).isEqualTo(SymbolTable.ScopeKind.CLASS);
        assertThat(classScope.lookupLocal("size")).isPresent();
        assertThat(table.getModuleScope().lookupLocal("Base").orElseThrow().getUseCount()).isEqualTo(1);
        // Module level classes count as exported; the class attribute is never read.
        assertThat(table.getUnusedVariables()).extracting(Symbol::getName).containsExactly("size");
    }

    @Test
    void importsAndLoopTargetsDeclareSymbols() {
        // import os.path, numpy as np
        // for item in np.items(): print(item, os)
        ForNode loop = new ForNode(store("item"), call("np_items"),
                List.of(expr(call("print", name("item"), name("os")))), List.of());
        ProgramNode tree = program(
                new ImportNode(List.of(new ImportNode.Alias("os.path", null), new ImportNode.Alias("numpy", "np"))),
                loop);

        SymbolTable table = new SymbolTableBuilder(Set.of("print"), 100).analyze(tree);

        assertThat(table.getModuleScope().getSymbols().keySet()).containsExactly("os", "np", "item");
        assertThat(table.getModuleScope().lookupLocal("os").orElseThrow().getKind()).isEqualTo(Symbol.Kind.IMPORT);
        assertThat(table.getModuleScope().lookupLocal("item").orElseThrow().isUsed()).isTrue();
        assertThat(table.getUndefinedVariables()).containsExactly("np_items");
    }

    @Test
    void undefinedNamesAreDeduplicatedInFirstSeenOrder() {
        ProgramNode tree = program(expr(name("b")), expr(name("a")), expr(name("b")));

        SymbolTable table = builder.analyze(tree);

        assertThat(table.getUndefinedVariables()).containsExactly("b", "a");
    }

    @Test
    void builtinsAreNeverUndefined() {
        ProgramNode tree = program(expr(call("print", call("len", name("data")))));

        SymbolTable table = new SymbolTableBuilder(Set.of("print", "len"), 100).analyze(tree);

        assertThat(table.getUndefinedVariables()).containsExactly("data");
    }

    @Test
    void extensionNodesAreNotLookedInto() {
        AstNode lambda = new OpaqueNode("Lambda", Map.of(), List.of(name("captured"), name("missing")));
        ProgramNode tree = program(assign("captured", constant(1)), expr(lambda));

        SymbolTable table = builder.analyze(tree);

        assertThat(table.getUnusedVariables()).extracting(Symbol::getName).containsExactly("captured");
        assertThat(table.getUndefinedVariables()).isEmpty();
    }

    @Test
    void fromImportBindsImportedNames() {
        // Arrange: from m import y
        //          from os import path as p, *
        //          y(p)
        ProgramNode tree = program(
                new ImportFromNode("m", List.of(new ImportNode.Alias("y", null)), 0),
                new ImportFromNode("os", List.of(new ImportNode.Alias("path", "p"), new ImportNode.Alias("*", null)), 0),
                expr(call("y", name("p"))));

        // Act
        SymbolTable table = builder.analyze(tree);

        // Assert
        assertThat(table.getUndefinedVariables()).isEmpty();
        assertThat(table.toExportView().get(0))
                .containsEntry("y", new SymbolSummary(Symbol.Kind.IMPORT, 1))
                .containsEntry("p", new SymbolSummary(Symbol.Kind.IMPORT, 1))
                .doesNotContainKey("*")
                .doesNotContainKey("path");
    }

    @Test
    void exceptClauseBindsExceptionName() {
        // try:
        //     risky()
        // except ValueError as err:
        //     log(err)
        ProgramNode tree = program(new TryNode(
                List.of(expr(call("risky"))),
                List.of(new ExceptHandlerNode(name("ValueError"), "err", List.of(expr(call("log", name("err")))))),
                List.of(), List.of()));

        SymbolTable table = new SymbolTableBuilder(Set.of("risky", "log", "ValueError"), 100).analyze(tree);

        assertThat(table.getUndefinedVariables()).isEmpty();
        assertThat(table.getUnusedVariables()).isEmpty();
    }

    @Test
    void analysisLeavesTreeUntouchedAndIsRepeatable() {
        ProgramNode tree = program(def("f", params("a"), ret(name("a"))), expr(call("f", constant(1))));
        AstNode copy = AstNodes.deepCopy(tree);

        Map<Integer, Map<String, SymbolSummary>> first = builder.analyze(tree).toExportView();
        Map<Integer, Map<String, SymbolSummary>> second = builder.analyze(tree).toExportView();

        assertThat(tree).isEqualTo(copy);
        assertThat(first).isEqualTo(second);
        assertThat(first.get(0)).containsEntry("f", new SymbolSummary(Symbol.Kind.FUNCTION, 1));
        assertThat(first.get(1)).containsEntry("a", new SymbolSummary(Symbol.Kind.PARAMETER, 1));
    }

    @Test
    void customHandlerReplacesDefault() {
        ProgramNode tree = program(expr(name("ignored")));
        builder.registerHandler(NameNode.class, (node, context) -> { });

        SymbolTable table = builder.analyze(tree);

        assertThat(table.getUndefinedVariables()).isEmpty();
    }

    @Test
    void visibleNamesIncludeEnclosingScopes() {
        FunctionDefNode inner = def("inner", params("p"), assign("local", name("p")), ret(name("local")));
        ProgramNode tree = program(assign("top", constant(1)), inner);

        SymbolTable table = builder.analyze(tree);

        SymbolTable.Scope scope = table.scopeFor(inner).orElseThrow();
        assertThat(table.visibleNames(scope)).containsExactlyInAnyOrder("p", "local", "top", "inner");
        assertThat(table.visibleNames(table.getModuleScope())).containsExactlyInAnyOrder("top", "inner");
    }
}
