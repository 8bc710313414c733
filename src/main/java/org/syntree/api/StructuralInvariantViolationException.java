package org.syntree.api;

/**
 * Thrown when a tree violates the structural invariants of the node model:
 * it must be acyclic, every node must have a single owner and nesting must stay within the traversal limit.
 * <p>
 * This is fatal for the operation that detected it. Trees are never repaired silently.
 */
public class StructuralInvariantViolationException extends RuntimeException {

    private final SyntreeErrorCode code;

    /**
     * Constructs a new violation.
     * @param code The error code.
     * @param message The detail message.
     */
    public StructuralInvariantViolationException(SyntreeErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * Constructs a new violation that wraps an earlier one with additional context.
     * @param message The detail message.
     * @param cause The violation being wrapped.
     */
    public StructuralInvariantViolationException(String message, StructuralInvariantViolationException cause) {
        super(message, cause);
        this.code = cause.getCode();
    }

    public SyntreeErrorCode getCode() {
        return code;
    }
}
