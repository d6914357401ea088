package org.mapforge.conditions;

/**
 * A configuration error in a rule set, raised instead of a warning when strict checking is on.
 */
public class InvalidConditionException extends RuntimeException {

    private final String source;

    public InvalidConditionException(String source, String message) {
        super(source.isEmpty() ? message : message + " (in " + source + ")");
        this.source = source;
    }

    public InvalidConditionException(String source, String message, Throwable cause) {
        this(source, message);
        initCause(cause);
    }

    /**
     * @return where the offending condition was declared, possibly empty.
     */
    public String getSource() {
        return source;
    }
}
