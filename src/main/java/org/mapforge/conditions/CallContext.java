package org.mapforge.conditions;

import org.mapforge.map.Entity;

/**
 * Everything a single rule invocation can draw from.
 *
 * @param run The per-run values.
 * @param instance The instance, or {@code null} for run-once metas and staged factories.
 * @param config The configuration of the rule.
 */
public record CallContext(RuleContext run, Entity instance, RuleConfig config) {
}
