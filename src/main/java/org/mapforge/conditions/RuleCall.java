package org.mapforge.conditions;

import java.util.Set;
import java.util.function.Function;

/**
 * A registered rule handler with the argument adaptation already fixed.
 *
 * @param <R> the result type, {@link TestOutcome} for tests and {@link ActionOutcome} for results.
 */
public sealed interface RuleCall<R> permits RuleCall.DirectCall, RuleCall.FactoryCall {

    /**
     * @return the context kinds the handler asked for.
     */
    Set<ContextKind> kinds();

    default boolean needsInstance() {
        return kinds().contains(ContextKind.INSTANCE);
    }

    /**
     * A handler invoked with the full context every time.
     * @param kinds The context kinds the handler asked for.
     * @param fn The adapted handler.
     */
    record DirectCall<R>(Set<ContextKind> kinds, Function<CallContext, R> fn) implements RuleCall<R> {
    }

    /**
     * A handler whose first stage runs without an instance and may return a per-instance function
     * that is then cached for the configuration block it was bound to.
     * @param kinds The context kinds the first stage asked for; never contains {@link ContextKind#INSTANCE}.
     * @param factory The adapted first stage.
     */
    record FactoryCall<R>(Set<ContextKind> kinds, Function<CallContext, StageResult<R>> factory) implements RuleCall<R> {
    }
}
