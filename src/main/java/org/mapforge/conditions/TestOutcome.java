package org.mapforge.conditions;

/**
 * What a test reports for one instance.
 */
public enum TestOutcome {
    PASS,
    FAIL,
    /**
     * No instance of the document can ever pass. Only honoured from the first test of a condition
     * without an else branch, where it skips the condition for every remaining instance; anywhere
     * else it counts as {@link #FAIL}.
     */
    UNSATISFIABLE;

    public static TestOutcome of(boolean passed) {
        return passed ? PASS : FAIL;
    }

    public boolean passed() {
        return this == PASS;
    }
}
