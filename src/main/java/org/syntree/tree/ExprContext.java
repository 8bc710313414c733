package org.syntree.tree;

/**
 * How an identifier or attribute is used at its position in the tree.
 */
public enum ExprContext {
    /** The value is read. */
    LOAD("Load"),
    /** The value is bound. */
    STORE("Store"),
    /** The binding is deleted. */
    DEL("Del");

    private final String tag;

    ExprContext(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Parses a context tag, case-insensitively.
     * @param tag The tag, e.g. {@code "Load"} or {@code "store"}.
     * @return The context.
     * @throws IllegalArgumentException if the tag is unknown.
     */
    public static ExprContext fromTag(String tag) {
        for (ExprContext ctx : values()) {
            if (ctx.tag.equalsIgnoreCase(tag)) {
                return ctx;
            }
        }
        throw new IllegalArgumentException("Unknown expression context: " + tag);
    }
}
