package org.mapforge.conditions;

/**
 * Statistics of one engine run.
 *
 * @param conditionsTotal The number of conditions, metas included.
 * @param conditionsSkipped Conditions skipped because their first test was unsatisfiable.
 * @param conditionsExhausted Conditions left with no results to run.
 */
public record RunReport(int conditionsTotal, int conditionsSkipped, int conditionsExhausted) {
}
