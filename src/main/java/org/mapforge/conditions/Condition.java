package org.mapforge.conditions;

import org.mapforge.map.Entity;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A parsed rule: tests, then-results, else-results and a priority.
 * <p>
 * The only state that changes while the engine runs is the result lists, which lose the results
 * that report {@link ActionOutcome#EXHAUSTED}. Meta-conditions have no tests and a single result;
 * run-once metas are invoked a single time per document without an instance.
 */
public class Condition {

    /**
     * How the evaluation against one instance ended.
     */
    public enum Outcome {
        /** Every applicable result ran. */
        COMPLETED,
        /** A result asked to skip to the next instance. */
        NEXT_INSTANCE,
        /** A result asked to stop evaluating this condition. */
        END_CONDITION,
        /** The first test reported that no instance can pass. */
        UNSATISFIABLE
    }

    private final List<BoundTest> tests;
    private final List<BoundResult> results;
    private final List<BoundResult> elseResults;
    private final BigDecimal priority;
    private final String source;
    private final boolean meta;
    private final boolean onlyOnce;

    public Condition(List<BoundTest> tests, List<BoundResult> results, List<BoundResult> elseResults,
                     BigDecimal priority, String source) {
        this(tests, results, elseResults, priority, source, false, false);
    }

    private Condition(List<BoundTest> tests, List<BoundResult> results, List<BoundResult> elseResults,
                      BigDecimal priority, String source, boolean meta, boolean onlyOnce) {
        this.tests = List.copyOf(tests);
        this.results = new ArrayList<>(results);
        this.elseResults = new ArrayList<>(elseResults);
        this.priority = priority;
        this.source = source;
        this.meta = meta;
        this.onlyOnce = onlyOnce;
    }

    static Condition meta(String name, BigDecimal priority, BoundResult result, boolean onlyOnce) {
        return new Condition(List.of(), List.of(result), List.of(), priority, "meta \"" + name + "\"", true, onlyOnce);
    }

    /**
     * Evaluates the condition against one instance.
     *
     * @param run the per-run values.
     * @param instance the instance.
     * @param canSkip whether an unsatisfiable first test may skip the whole condition; nested
     *                conditions pass {@code false}.
     * @return how the evaluation ended.
     */
    public Outcome evaluate(RuleContext run, Entity instance, boolean canSkip) {
        boolean success = true;
        for (int i = 0; i < tests.size(); i++) {
            TestOutcome outcome = tests.get(i).evaluate(run, instance);
            if (outcome == TestOutcome.UNSATISFIABLE && i == 0 && canSkip && elseResults.isEmpty()) {
                return Outcome.UNSATISFIABLE;
            }
            if (outcome != TestOutcome.PASS) {
                success = false;
                break;
            }
        }
        return runResults(success ? results : elseResults, run, instance);
    }

    private static Outcome runResults(List<BoundResult> list, RuleContext run, Entity instance) {
        Iterator<BoundResult> it = list.iterator();
        while (it.hasNext()) {
            BoundResult result = it.next();
            switch (result.apply(run, instance)) {
                case CONTINUE -> {
                }
                case EXHAUSTED -> it.remove();
                case NEXT_INSTANCE -> {
                    return Outcome.NEXT_INSTANCE;
                }
                case END_CONDITION -> {
                    return Outcome.END_CONDITION;
                }
            }
        }
        return Outcome.COMPLETED;
    }

    /**
     * @return {@code true} once both result lists are empty; the condition has no further effect.
     */
    public boolean isEmpty() {
        return results.isEmpty() && elseResults.isEmpty();
    }

    public List<BoundTest> tests() {
        return tests;
    }

    public List<BoundResult> results() {
        return Collections.unmodifiableList(results);
    }

    public List<BoundResult> elseResults() {
        return Collections.unmodifiableList(elseResults);
    }

    public BigDecimal priority() {
        return priority;
    }

    public String source() {
        return source;
    }

    public boolean isMeta() {
        return meta;
    }

    public boolean isOnlyOnce() {
        return onlyOnce;
    }

    @Override
    public String toString() {
        return "Condition[" + (source.isEmpty() ? "?" : source) + ", priority=" + priority.toPlainString()
                + ", tests=" + tests + ", results=" + results + ", else=" + elseResults + "]";
    }
}
