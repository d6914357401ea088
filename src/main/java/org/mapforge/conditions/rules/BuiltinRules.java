package org.mapforge.conditions.rules;

import org.mapforge.conditions.RuleModule;

import java.util.List;

/**
 * The rule modules shipped with the compiler.
 */
public final class BuiltinRules {

    private BuiltinRules() {
        // Static utility
    }

    /**
     * @return a fresh instance of every built-in module, in registration order.
     */
    public static List<RuleModule> all() {
        return List.of(
                new CoreRules(),
                new LogicRules(),
                new InstanceRules(),
                new GlobalRules(),
                new BrushRules());
    }
}
