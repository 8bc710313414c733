package org.syntree.transform.passes;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.syntree.tree.AstNode;
import org.syntree.tree.ExprNode;
import org.syntree.tree.NameNode;
import org.syntree.tree.ProgramNode;
import org.syntree.tree.TreeValidator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.syntree.tree.Trees.*;

/**
 * Tests the algebraic identities applied to integer operands.
 */
@Tag("unit")
class ExpressionSimplificationPassTest {

    private final ExpressionSimplificationPass pass = new ExpressionSimplificationPass();

    @Test
    void multiplicationByZeroBecomesZero() {
        AstNode result = pass.transform(expr(binOp(name("x"), "*", constant(0))));

        assertThat(result).isEqualTo(expr(constant(0)));
    }

    @Test
    void additionOfZeroYieldsOperand() {
        NameNode x = name("x");

        AstNode result = pass.transform(expr(binOp(x, "+", constant(0))));

        assertThat(result).isEqualTo(expr(name("x")));
        assertThat(((ExprNode) result).value()).isSameAs(x);
    }

    @Test
    void appliesAllIdentities() {
        assertThat(pass.transform(expr(binOp(constant(0), "+", name("a"))))).isEqualTo(expr(name("a")));
        assertThat(pass.transform(expr(binOp(name("a"), "-", constant(0))))).isEqualTo(expr(name("a")));
        assertThat(pass.transform(expr(binOp(name("a"), "*", constant(1))))).isEqualTo(expr(name("a")));
        assertThat(pass.transform(expr(binOp(constant(1), "*", name("a"))))).isEqualTo(expr(name("a")));
        assertThat(pass.transform(expr(binOp(constant(0), "*", name("a"))))).isEqualTo(expr(constant(0)));
        assertThat(pass.transform(expr(unary("-", unary("-", name("a")))))).isEqualTo(expr(name("a")));
        assertThat(pass.transform(expr(unary("~", unary("~", name("a")))))).isEqualTo(expr(name("a")));
    }

    @Test
    void simplifiesBottomUp() {
        // (a * 1) + 0  ->  a
        AstNode result = pass.transform(expr(binOp(binOp(name("a"), "*", constant(1)), "+", constant(0))));

        assertThat(result).isEqualTo(expr(name("a")));
    }

    @Test
    void keepsMultiplicationByZeroWithCall() {
        AstNode tree = expr(binOp(call("side_effect"), "*", constant(0)));

        assertThat(pass.transform(tree)).isSameAs(tree);
    }

    @Test
    void leavesNonIntegerIdentitiesAndDoubleNegationAlone() {
        AstNode floatZero = expr(binOp(name("a"), "+", constant(0.0)));
        AstNode boolOne = expr(binOp(name("a"), "*", constant(true)));
        AstNode subtractFromZero = expr(binOp(constant(0), "-", name("a")));
        AstNode doubleNot = expr(unary("not", unary("not", name("a"))));
        AstNode mixed = expr(unary("-", unary("~", name("a"))));

        for (AstNode tree : new AstNode[]{floatZero, boolOne, subtractFromZero, doubleNot, mixed}) {
            assertThat(pass.transform(tree)).isSameAs(tree);
        }
    }

    @Test
    void resultIsValidTree() {
        ProgramNode tree = program(
                assign("a", binOp(name("b"), "+", constant(0))),
                assign("c", binOp(binOp(name("d"), "*", constant(0)), "+", name("e"))));

        AstNode result = pass.transform(tree);

        assertThat(new TreeValidator().isValid(result)).isTrue();
        assertThat(result).isEqualTo(program(
                assign("a", name("b")),
                assign("c", name("e"))));
    }
}
