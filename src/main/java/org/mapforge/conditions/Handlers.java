package org.mapforge.conditions;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Builds {@link RuleCall}s from lambdas that declare which context values they need.
 * <p>
 * Keys may be given in any order; the lambda receives the values in that same order. The
 * permutation is captured once here, so each call only pays for the key lookups. A key given
 * twice is rejected.
 * <pre>
 * registry.registerTest("instVar", Handlers.of(ContextKey.INSTANCE, ContextKey.CONFIG,
 *         (inst, conf) -> TestOutcome.of(...)));
 * </pre>
 * The {@code staged} variants build two-stage handlers: the first stage may not ask for the
 * instance and returns either a plain result or a per-instance function that is cached for the
 * configuration block.
 */
public final class Handlers {

    private Handlers() {
    }

    @FunctionalInterface
    public interface Fn3<A, B, C, R> {
        R apply(A a, B b, C c);
    }

    @FunctionalInterface
    public interface Fn4<A, B, C, D, R> {
        R apply(A a, B b, C c, D d);
    }

    @FunctionalInterface
    public interface Fn5<A, B, C, D, E, R> {
        R apply(A a, B b, C c, D d, E e);
    }

    public static <R> RuleCall<R> of(Supplier<R> fn) {
        return direct(kinds(), ctx -> fn.get());
    }

    public static <A, R> RuleCall<R> of(ContextKey<A> a, Function<A, R> fn) {
        return direct(kinds(a), ctx -> fn.apply(a.from(ctx)));
    }

    public static <A, B, R> RuleCall<R> of(ContextKey<A> a, ContextKey<B> b, BiFunction<A, B, R> fn) {
        return direct(kinds(a, b), ctx -> fn.apply(a.from(ctx), b.from(ctx)));
    }

    public static <A, B, C, R> RuleCall<R> of(ContextKey<A> a, ContextKey<B> b, ContextKey<C> c,
                                              Fn3<A, B, C, R> fn) {
        return direct(kinds(a, b, c), ctx -> fn.apply(a.from(ctx), b.from(ctx), c.from(ctx)));
    }

    public static <A, B, C, D, R> RuleCall<R> of(ContextKey<A> a, ContextKey<B> b, ContextKey<C> c,
                                                 ContextKey<D> d, Fn4<A, B, C, D, R> fn) {
        return direct(kinds(a, b, c, d), ctx -> fn.apply(a.from(ctx), b.from(ctx), c.from(ctx), d.from(ctx)));
    }

    public static <A, B, C, D, E, R> RuleCall<R> of(ContextKey<A> a, ContextKey<B> b, ContextKey<C> c,
                                                    ContextKey<D> d, ContextKey<E> e, Fn5<A, B, C, D, E, R> fn) {
        return direct(kinds(a, b, c, d, e),
                ctx -> fn.apply(a.from(ctx), b.from(ctx), c.from(ctx), d.from(ctx), e.from(ctx)));
    }

    public static <R> RuleCall<R> staged(Supplier<StageResult<R>> fn) {
        return factory(kinds(), ctx -> fn.get());
    }

    public static <A, R> RuleCall<R> staged(ContextKey<A> a, Function<A, StageResult<R>> fn) {
        return factory(kinds(a), ctx -> fn.apply(a.from(ctx)));
    }

    public static <A, B, R> RuleCall<R> staged(ContextKey<A> a, ContextKey<B> b,
                                               BiFunction<A, B, StageResult<R>> fn) {
        return factory(kinds(a, b), ctx -> fn.apply(a.from(ctx), b.from(ctx)));
    }

    public static <A, B, C, R> RuleCall<R> staged(ContextKey<A> a, ContextKey<B> b, ContextKey<C> c,
                                                  Fn3<A, B, C, StageResult<R>> fn) {
        return factory(kinds(a, b, c), ctx -> fn.apply(a.from(ctx), b.from(ctx), c.from(ctx)));
    }

    public static <A, B, C, D, R> RuleCall<R> staged(ContextKey<A> a, ContextKey<B> b, ContextKey<C> c,
                                                     ContextKey<D> d, Fn4<A, B, C, D, StageResult<R>> fn) {
        return factory(kinds(a, b, c, d), ctx -> fn.apply(a.from(ctx), b.from(ctx), c.from(ctx), d.from(ctx)));
    }

    private static <R> RuleCall<R> direct(Set<ContextKind> kinds, Function<CallContext, R> fn) {
        return new RuleCall.DirectCall<>(kinds, fn);
    }

    private static <R> RuleCall<R> factory(Set<ContextKind> kinds, Function<CallContext, StageResult<R>> fn) {
        if (kinds.contains(ContextKind.INSTANCE)) {
            throw new IllegalArgumentException("The first stage of a staged handler cannot take the instance");
        }
        return new RuleCall.FactoryCall<>(kinds, fn);
    }

    private static Set<ContextKind> kinds(ContextKey<?>... keys) {
        Set<ContextKind> kinds = EnumSet.noneOf(ContextKind.class);
        for (ContextKey<?> key : keys) {
            if (!kinds.add(key.kind())) {
                throw new IllegalArgumentException("Context " + key.kind() + " requested twice");
            }
        }
        return Set.copyOf(kinds);
    }
}
