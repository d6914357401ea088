package org.mapforge.conditions;

/**
 * The control signal returned by a result.
 */
public enum ActionOutcome {
    /** Carry on with the next result. */
    CONTINUE,
    /** Remove this result from its list; it never runs again in this run. */
    EXHAUSTED,
    /** Skip the remaining results for this instance. */
    NEXT_INSTANCE,
    /** Skip the remaining results and stop evaluating the condition against further instances. */
    END_CONDITION
}
