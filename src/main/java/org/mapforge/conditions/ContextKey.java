package org.mapforge.conditions;

import org.mapforge.index.FaceIndex;
import org.mapforge.map.Entity;
import org.mapforge.map.MapDocument;

import java.util.function.Function;

/**
 * A typed selector for one {@link ContextKind}. Handlers declare the keys they need when they are
 * built with {@link Handlers}; the compiler checks that the handler lambda takes matching types.
 *
 * @param <T> the type of the selected value.
 */
public final class ContextKey<T> {

    public static final ContextKey<MapDocument> MAP = new ContextKey<>(ContextKind.MAP, ctx -> ctx.run().map());
    public static final ContextKey<FaceIndex> INDEX = new ContextKey<>(ContextKind.INDEX, ctx -> ctx.run().index());
    public static final ContextKey<MapInfo> INFO = new ContextKey<>(ContextKind.MAP_INFO, ctx -> ctx.run().info());
    public static final ContextKey<Entity> INSTANCE = new ContextKey<>(ContextKind.INSTANCE, CallContext::instance);
    public static final ContextKey<RuleConfig> CONFIG = new ContextKey<>(ContextKind.CONFIG, CallContext::config);

    private final ContextKind kind;
    private final Function<CallContext, T> extractor;

    private ContextKey(ContextKind kind, Function<CallContext, T> extractor) {
        this.kind = kind;
        this.extractor = extractor;
    }

    public ContextKind kind() {
        return kind;
    }

    T from(CallContext ctx) {
        return extractor.apply(ctx);
    }

    @Override
    public String toString() {
        return "ContextKey[" + kind + "]";
    }
}
