package org.mapforge.conditions;

import org.mapforge.keyvalues.Keyvalues;

/**
 * Digests the configuration block of a result once, at parse time.
 */
@FunctionalInterface
public interface SetupHandler {

    /**
     * @param parser the parser, for setups that parse nested tests, results or conditions.
     * @param conf the configuration block.
     * @return the setup data handed to the result as {@link RuleConfig#setupData()}, or {@code null}
     * to drop the result.
     */
    Object setup(ConditionParser parser, Keyvalues conf);
}
