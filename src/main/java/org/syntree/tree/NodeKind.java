package org.syntree.tree;

import java.util.Optional;

/**
 * Defines the stable kind tags of the built-in node types.
 * The tag strings are part of the serialized form and must not change.
 */
public enum NodeKind {
    /** The root of a module. */
    PROGRAM("Program"),
    /** A function definition. */
    FUNCTION_DEF("FunctionDef"),
    /** A class definition. */
    CLASS_DEF("ClassDef"),
    /** An assignment statement. */
    ASSIGN("Assign"),
    /** A return statement. */
    RETURN("Return"),
    /** A conditional statement. */
    IF("If"),
    /** A for loop. */
    FOR("For"),
    /** A while loop. */
    WHILE("While"),
    /** A binary operation. */
    BIN_OP("BinOp"),
    /** A unary operation. */
    UNARY_OP("UnaryOp"),
    /** A call expression. */
    CALL("Call"),
    /** An identifier reference. */
    NAME("Name"),
    /** An attribute access, e.g. {@code a.b}. */
    ATTRIBUTE("Attribute"),
    /** A literal value. */
    CONSTANT("Constant"),
    /** An import statement. */
    IMPORT("Import"),
    /** A relative or absolute {@code from ... import} statement. */
    IMPORT_FROM("ImportFrom"),
    /** An expression used as a statement. */
    EXPR("Expr"),
    /** A raise statement. */
    RAISE("Raise"),
    /** An assert statement. */
    ASSERT("Assert"),
    /** A try statement with its handlers. */
    TRY("Try"),
    /** One except clause of a try statement. */
    EXCEPT_HANDLER("ExceptHandler"),
    /** A with statement. */
    WITH("With"),
    /** A no-op statement. */
    PASS("Pass"),
    /** A loop break. */
    BREAK("Break"),
    /** A loop continue. */
    CONTINUE("Continue"),
    /** Any kind not built into the library. */
    EXTENSION("Extension");

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    /**
     * @return The serialized tag of this kind.
     */
    public String tag() {
        return tag;
    }

    /**
     * Looks up a built-in kind by its tag.
     * @param tag The tag, e.g. {@code "BinOp"}.
     * @return The kind, or empty for tags this library does not know.
     */
    public static Optional<NodeKind> fromTag(String tag) {
        for (NodeKind kind : values()) {
            if (kind != EXTENSION && kind.tag.equals(tag)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
