package org.mapforge.conditions;

import org.mapforge.map.Entity;

/**
 * A test bound to its configuration. An inverted test passes where the handler fails; an
 * unsatisfiable handler result makes it pass.
 */
public final class BoundTest {

    private final String name;
    private final BoundRule<TestOutcome> rule;
    private final boolean inverted;

    BoundTest(String name, BoundRule<TestOutcome> rule, boolean inverted) {
        this.name = name;
        this.rule = rule;
        this.inverted = inverted;
    }

    /**
     * @param run the per-run values.
     * @param instance the instance, may be {@code null} inside run-once contexts.
     * @return the outcome, already inverted if the test is.
     */
    public TestOutcome evaluate(RuleContext run, Entity instance) {
        TestOutcome outcome = rule.invoke(run, instance);
        if (!inverted) {
            return outcome;
        }
        return outcome == TestOutcome.PASS ? TestOutcome.FAIL : TestOutcome.PASS;
    }

    public String name() {
        return name;
    }

    public boolean inverted() {
        return inverted;
    }

    @Override
    public String toString() {
        return (inverted ? "!" : "") + name;
    }
}
