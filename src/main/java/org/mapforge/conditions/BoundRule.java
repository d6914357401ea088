package org.mapforge.conditions;

import org.mapforge.map.Entity;

import java.util.function.Function;

/**
 * A rule handler bound to one configuration block. This is the call site that caches the
 * per-instance function of a staged handler.
 *
 * @param <R> the result type.
 */
final class BoundRule<R> {

    private final RuleCall<R> call;
    private final RuleConfig config;
    private Function<Entity, R> cached;

    BoundRule(RuleCall<R> call, RuleConfig config) {
        this.call = call;
        this.config = config;
    }

    R invoke(RuleContext run, Entity instance) {
        if (call instanceof RuleCall.DirectCall<R> direct) {
            return direct.fn().apply(new CallContext(run, instance, config));
        }
        if (cached != null) {
            return cached.apply(instance);
        }
        RuleCall.FactoryCall<R> factory = (RuleCall.FactoryCall<R>) call;
        StageResult<R> stage = factory.factory().apply(new CallContext(run, null, config));
        if (stage instanceof StageResult.PerInstance<R> perInstance) {
            cached = perInstance.fn();
            return cached.apply(instance);
        }
        return ((StageResult.Done<R>) stage).value();
    }

    RuleConfig config() {
        return config;
    }

    boolean isCached() {
        return cached != null;
    }
}
