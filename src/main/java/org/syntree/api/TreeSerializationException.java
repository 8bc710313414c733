package org.syntree.api;

/**
 * Thrown when a tree cannot be written to or read from its JSON form.
 */
public class TreeSerializationException extends Exception {

    private final SyntreeErrorCode code;

    /**
     * Constructs a new serialization exception.
     * @param code The error code.
     * @param message The detail message.
     * @param cause The cause, may be {@code null}.
     */
    public TreeSerializationException(SyntreeErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public SyntreeErrorCode getCode() {
        return code;
    }
}
