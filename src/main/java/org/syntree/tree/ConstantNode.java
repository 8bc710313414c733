package org.syntree.tree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A literal value.
 * <p>
 * Integral numbers are stored as {@link Long} and floating point numbers as {@link Double},
 * so that equal literals always compare equal regardless of how they were created.
 *
 * @param value A {@link Long}, {@link Double}, {@link String}, {@link Boolean} or {@code null}.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record ConstantNode(Object value, Position position) implements AstNode {

    public ConstantNode {
        value = normalize(value);
    }

    public ConstantNode(Object value) {
        this(value, null);
    }

    private static Object normalize(Object value) {
        if (value == null || value instanceof Long || value instanceof Double
                || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof Character c) {
            return String.valueOf(c);
        }
        throw new IllegalArgumentException("Unsupported constant type: " + value.getClass().getName());
    }

    /**
     * Returns the literal kind name as used in the serialized form.
     * @return One of {@code int}, {@code float}, {@code str}, {@code bool}, {@code None}.
     */
    public String literalKind() {
        if (value == null) return "None";
        if (value instanceof Long) return "int";
        if (value instanceof Double) return "float";
        if (value instanceof Boolean) return "bool";
        return "str";
    }

    /**
     * @return {@code true} if the value is a {@link Long} or a {@link Double}.
     */
    public boolean isNumeric() {
        return value instanceof Long || value instanceof Double;
    }

    /**
     * Evaluates the truthiness of the literal: {@code None}, {@code False}, zero and the empty string are false.
     * @return The truth value.
     */
    public boolean isTruthy() {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Long l) return l != 0L;
        if (value instanceof Double d) return d != 0.0d;
        return !((String) value).isEmpty();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONSTANT;
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("value", value);
        fields.put("kind", literalKind());
        return fields;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 0, kind());
        return new ConstantNode(value, position);
    }
}
