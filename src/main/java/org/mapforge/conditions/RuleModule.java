package org.mapforge.conditions;

/**
 * A set of built-in tests, results and metas, registered together at startup.
 */
public interface RuleModule {

    /**
     * @return the group name shown in the rule documentation.
     */
    String group();

    /**
     * Registers the module's rules.
     * @param registry the registry being initialised.
     */
    void register(ConditionRegistry registry);
}
