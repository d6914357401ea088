package org.mapforge.conditions;

import org.mapforge.map.Entity;

/**
 * A result bound to its configuration and setup data.
 */
public final class BoundResult {

    private final String name;
    private final BoundRule<ActionOutcome> rule;

    BoundResult(String name, BoundRule<ActionOutcome> rule) {
        this.name = name;
        this.rule = rule;
    }

    public ActionOutcome apply(RuleContext run, Entity instance) {
        ActionOutcome outcome = rule.invoke(run, instance);
        return outcome == null ? ActionOutcome.CONTINUE : outcome;
    }

    public String name() {
        return name;
    }

    public RuleConfig config() {
        return rule.config();
    }

    @Override
    public String toString() {
        return name;
    }
}
