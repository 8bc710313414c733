package org.syntree.tree;

import java.util.Arrays;
import java.util.List;

/**
 * Short factories for building trees in tests.
 */
public final class Trees {

    private Trees() {}

    public static ProgramNode program(AstNode... body) {
        return new ProgramNode(List.of(body));
    }

    public static NameNode name(String id) {
        return NameNode.load(id);
    }

    public static NameNode store(String id) {
        return NameNode.store(id);
    }

    public static ConstantNode constant(Object value) {
        return new ConstantNode(value);
    }

    public static BinOpNode binOp(AstNode left, String op, AstNode right) {
        return new BinOpNode(left, op, right);
    }

    public static UnaryOpNode unary(String op, AstNode operand) {
        return new UnaryOpNode(op, operand);
    }

    public static AssignNode assign(String target, AstNode value) {
        return new AssignNode(List.of(store(target)), value);
    }

    public static CallNode call(String function, AstNode... args) {
        return new CallNode(name(function), List.of(args));
    }

    public static ExprNode expr(AstNode value) {
        return new ExprNode(value);
    }

    public static ReturnNode ret(AstNode value) {
        return new ReturnNode(value);
    }

    public static FunctionDefNode def(String name, List<String> args, AstNode... body) {
        return new FunctionDefNode(name, args, List.of(body));
    }

    public static List<String> params(String... names) {
        return Arrays.asList(names);
    }

    public static IfNode ifNode(AstNode test, List<AstNode> body, List<AstNode> orElse) {
        return new IfNode(test, body, orElse);
    }

    public static List<AstNode> block(AstNode... statements) {
        return List.of(statements);
    }
}
