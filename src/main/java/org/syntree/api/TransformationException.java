package org.syntree.api;

/**
 * Thrown when the transformation pipeline cannot complete, e.g. because a pass failed
 * unexpectedly or a requested pass is not registered.
 */
public class TransformationException extends RuntimeException {

    private final SyntreeErrorCode code;
    private final String passName;

    /**
     * Constructs a new transformation exception.
     * @param code The error code.
     * @param passName The name of the pass involved.
     * @param message The detail message.
     * @param cause The cause, may be {@code null}.
     */
    public TransformationException(SyntreeErrorCode code, String passName, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.passName = passName;
    }

    public SyntreeErrorCode getCode() {
        return code;
    }

    public String getPassName() {
        return passName;
    }
}
