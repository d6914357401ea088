package org.mapforge.conditions;

import org.mapforge.map.Entity;

import java.util.function.Function;

/**
 * What the first stage of a staged handler returns.
 *
 * @param <R> the handler's result type.
 */
public sealed interface StageResult<R> {

    /**
     * A plain result. The factory is invoked again on the next call.
     * @param value The result.
     */
    record Done<R>(R value) implements StageResult<R> {
    }

    /**
     * A per-instance function, cached for the call site and invoked for every following instance.
     * @param fn The function.
     */
    record PerInstance<R>(Function<Entity, R> fn) implements StageResult<R> {
    }

    static <R> StageResult<R> done(R value) {
        return new Done<>(value);
    }

    static <R> StageResult<R> perInstance(Function<Entity, R> fn) {
        return new PerInstance<>(fn);
    }
}
