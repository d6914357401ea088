package org.mapforge.conditions;

/**
 * A rule handler failed unexpectedly. The run is aborted; whatever the document already contains
 * is left as it is.
 */
public class ConditionFailedException extends Exception {

    private final String source;

    public ConditionFailedException(String source, Throwable cause) {
        super("Condition " + (source.isEmpty() ? "<unknown>" : source) + " failed: " + cause.getMessage(), cause);
        this.source = source;
    }

    /**
     * @return the provenance of the failing condition, possibly empty.
     */
    public String getSource() {
        return source;
    }
}
