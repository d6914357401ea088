package org.mapforge.conditions;

import org.mapforge.keyvalues.Keyvalues;

/**
 * The configuration handed to a rule: the block it was written as, and the value its setup
 * handler produced, if it has one.
 *
 * @param kv The configuration block or leaf.
 * @param setupData The setup result, or {@code null}.
 */
public record RuleConfig(Keyvalues kv, Object setupData) {

    public static RuleConfig of(Keyvalues kv) {
        return new RuleConfig(kv, null);
    }

    /**
     * @return the value of a leaf configuration, or an empty string for blocks.
     */
    public String value() {
        return kv.isBlock() ? "" : kv.value();
    }

    /**
     * @param type the expected type of the setup data.
     * @param <T> that type.
     * @return the setup data.
     * @throws IllegalStateException if the rule has no setup data of that type.
     */
    public <T> T setup(Class<T> type) {
        if (!type.isInstance(setupData)) {
            throw new IllegalStateException("Rule '" + kv.realName() + "' has no setup data of type " + type.getSimpleName());
        }
        return type.cast(setupData);
    }
}
