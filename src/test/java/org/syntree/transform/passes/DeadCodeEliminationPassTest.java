package org.syntree.transform.passes;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.syntree.tree.AstNode;
import org.syntree.tree.BreakNode;
import org.syntree.tree.ContinueNode;
import org.syntree.tree.ExceptHandlerNode;
import org.syntree.tree.PassNode;
import org.syntree.tree.ProgramNode;
import org.syntree.tree.RaiseNode;
import org.syntree.tree.TreeValidator;
import org.syntree.tree.TryNode;
import org.syntree.tree.WhileNode;
import org.syntree.tree.WithNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.syntree.tree.Trees.*;

/**
 * Tests removal of unreachable statements and of branches decided by literal conditions.
 */
@Tag("unit")
class DeadCodeEliminationPassTest {

    private final DeadCodeEliminationPass pass = new DeadCodeEliminationPass();

    @Test
    void dropsStatementsAfterReturn() {
        ProgramNode tree = program(def("f", params(), ret(constant(1)), expr(call("never")), assign("x", constant(2))));

        AstNode result = pass.transform(tree);

        assertThat(result).isEqualTo(program(def("f", params(), ret(constant(1)))));
    }

    @Test
    void dropsStatementsAfterRaiseBreakAndContinue() {
        ProgramNode tree = program(
                new WhileNode(name("running"), List.of(new BreakNode(), expr(call("a"))), List.of()),
                new WhileNode(name("running"), List.of(new ContinueNode(), expr(call("b"))), List.of()),
                def("g", params(), new RaiseNode(call("Error")), ret(constant(0))));

        AstNode result = pass.transform(tree);

        assertThat(result).isEqualTo(program(
                new WhileNode(name("running"), List.of(new BreakNode()), List.of()),
                new WhileNode(name("running"), List.of(new ContinueNode()), List.of()),
                def("g", params(), new RaiseNode(call("Error")))));
    }

    @Test
    void splicesTakenBranchOfConstantIf() {
        ProgramNode tree = program(
                ifNode(constant(true), block(expr(call("a")), expr(call("b"))), block(expr(call("c")))),
                ifNode(constant(0), block(expr(call("d"))), block(expr(call("e")))),
                expr(call("f")));

        AstNode result = pass.transform(tree);

        assertThat(result).isEqualTo(program(
                expr(call("a")), expr(call("b")), expr(call("e")), expr(call("f"))));
    }

    @Test
    void terminatorInsideSplicedBranchEndsBlock() {
        ProgramNode tree = program(def("f", params(),
                ifNode(constant("yes"), block(ret(constant(1))), block()),
                ret(constant(2))));

        AstNode result = pass.transform(tree);

        assertThat(result).isEqualTo(program(def("f", params(), ret(constant(1)))));
    }

    @Test
    void whileFalseIsReplacedByElseBlock() {
        ProgramNode tree = program(
                new WhileNode(constant(false), List.of(expr(call("loop"))), List.of(expr(call("done")))),
                new WhileNode(constant(true), List.of(new BreakNode()), List.of()));

        AstNode result = pass.transform(tree);

        assertThat(result).isEqualTo(program(
                expr(call("done")),
                new WhileNode(constant(true), List.of(new BreakNode()), List.of())));
    }

    @Test
    void emptiedFunctionBodyReceivesPass() {
        ProgramNode tree = program(def("f", params(), ifNode(constant(null), block(expr(call("a"))), block())));

        AstNode result = pass.transform(tree);

        assertThat(result).isEqualTo(program(def("f", params(), new PassNode())));
        assertThat(new TreeValidator().isValid(result)).isTrue();
    }

    @Test
    void leavesLiveCodeUntouched() {
        ProgramNode tree = program(
                def("f", params("a"), ifNode(name("a"), block(ret(constant(1))), block()), ret(constant(2))),
                expr(call("f", constant(3))));

        assertThat(pass.transform(tree)).isSameAs(tree);
    }

    @Test
    void isIdempotent() {
        ProgramNode tree = program(
                ifNode(constant(1), block(ret(name("x")), expr(name("y"))), block()),
                expr(name("z")));

        AstNode once = pass.transform(tree);

        assertThat(pass.transform(once)).isSameAs(once);
        assertThat(once).isEqualTo(program(ret(name("x"))));
    }

    @Test
    void cleansTryHandlerAndWithBlocks() {
        // try:
        //     return 1; a()
        // except:
        //     raise; b()
        // finally:
        //     with lock: return 2; c()
        TryNode tryNode = new TryNode(
                List.of(ret(constant(1)), expr(call("a"))),
                List.of(new ExceptHandlerNode(null, null, List.of(new RaiseNode(null), expr(call("b"))))),
                List.of(),
                List.of(new WithNode(List.of(new WithNode.Item(name("lock"), null)),
                        List.of(ret(constant(2)), expr(call("c"))))));
        ProgramNode tree = program(def("f", params(), tryNode));

        AstNode result = pass.transform(tree);

        assertThat(result).isEqualTo(program(def("f", params(), new TryNode(
                List.of(ret(constant(1))),
                List.of(new ExceptHandlerNode(null, null, List.of(new RaiseNode(null)))),
                List.of(),
                List.of(new WithNode(List.of(new WithNode.Item(name("lock"), null)), List.of(ret(constant(2)))))))));
        assertThat(new TreeValidator().isValid(result)).isTrue();
    }
}
