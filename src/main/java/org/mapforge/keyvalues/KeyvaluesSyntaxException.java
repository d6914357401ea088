package org.mapforge.keyvalues;

/**
 * Thrown when a key/value document cannot be parsed.
 * The message holds the formatted summary of all diagnostics.
 */
public class KeyvaluesSyntaxException extends Exception {

    /**
     * Constructs a new exception with the specified detail message.
     * @param message the detail message.
     */
    public KeyvaluesSyntaxException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message the detail message.
     * @param cause the cause.
     */
    public KeyvaluesSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
