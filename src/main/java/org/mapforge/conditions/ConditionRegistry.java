package org.mapforge.conditions;

import org.mapforge.keyvalues.Keyvalues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The name → handler tables for tests, results, result setups and meta-conditions.
 * <p>
 * A registry is built once by {@link #initialize(EngineOptions, List)}, which hands it to every
 * rule module, and then passed to the engines that use it. Names and aliases are case-insensitive
 * and must be unique within their table.
 */
public class ConditionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionRegistry.class);

    /**
     * One registered meta-condition.
     *
     * @param name The meta name.
     * @param priority Where it sorts among the conditions.
     * @param call The handler.
     * @param onlyOnce Whether it runs once per document instead of once per instance.
     */
    public record MetaRule(String name, BigDecimal priority, RuleCall<ActionOutcome> call, boolean onlyOnce) {
    }

    /**
     * A documentation entry.
     *
     * @param kind {@code test}, {@code result} or {@code meta}.
     * @param name The name as registered.
     * @param aliases Further names.
     * @param staged Whether the handler is a staged one.
     * @param kinds The context the handler asked for.
     */
    public record RuleDoc(String kind, String name, List<String> aliases, boolean staged, List<ContextKind> kinds) {
    }

    private final EngineOptions options;
    private final Map<String, RuleCall<TestOutcome>> tests = new LinkedHashMap<>();
    private final Map<String, RuleCall<ActionOutcome>> results = new LinkedHashMap<>();
    private final Map<String, SetupHandler> setups = new LinkedHashMap<>();
    private final List<MetaRule> metas = new ArrayList<>();
    private final Map<String, List<RuleDoc>> groups = new LinkedHashMap<>();
    private String currentGroup = "";
    private ConditionParser parser;

    public ConditionRegistry(EngineOptions options) {
        this.options = options;
    }

    /**
     * Builds a registry and lets every module register into it.
     * @param options the engine options.
     * @param modules the rule modules, in registration order.
     * @return the populated registry.
     * @throws IllegalArgumentException if two rules share a name.
     */
    public static ConditionRegistry initialize(EngineOptions options, List<? extends RuleModule> modules) {
        ConditionRegistry registry = new ConditionRegistry(options);
        for (RuleModule module : modules) {
            registry.currentGroup = module.group();
            module.register(registry);
        }
        registry.currentGroup = "";
        LOG.debug("Registered {} tests, {} results and {} metas from {} modules",
                registry.tests.size(), registry.results.size(), registry.metas.size(), modules.size());
        return registry;
    }

    public EngineOptions options() {
        return options;
    }

    /**
     * @return the parser bound to this registry.
     */
    public ConditionParser parser() {
        if (parser == null) {
            parser = new ConditionParser(this);
        }
        return parser;
    }

    public void registerTest(String name, RuleCall<TestOutcome> call, String... aliases) {
        register(tests, "test", name, call, aliases);
    }

    public void registerResult(String name, RuleCall<ActionOutcome> call, String... aliases) {
        register(results, "result", name, call, aliases);
    }

    /**
     * Registers the parse-time setup of a result. The result itself must be registered separately.
     * @param name the result name.
     * @param handler the setup.
     */
    public void registerSetup(String name, SetupHandler handler) {
        String key = Keyvalues.fold(name);
        if (setups.putIfAbsent(key, handler) != null) {
            throw new IllegalArgumentException("Duplicate setup for result '" + name + "'");
        }
    }

    /**
     * Adds a meta-condition.
     * @param name the meta name.
     * @param priority where it sorts.
     * @param call the handler.
     * @param onlyOnce whether it runs once per document; such a handler cannot take the instance.
     */
    public void addMeta(String name, BigDecimal priority, RuleCall<ActionOutcome> call, boolean onlyOnce) {
        if (onlyOnce && call.needsInstance()) {
            throw new IllegalArgumentException("Run-once meta '" + name + "' cannot take the instance");
        }
        for (MetaRule meta : metas) {
            if (meta.name().equalsIgnoreCase(name)) {
                throw new IllegalArgumentException("Duplicate meta '" + name + "'");
            }
        }
        metas.add(new MetaRule(name, priority, call, onlyOnce));
        document("meta", name, List.of(), call);
    }

    private <R> void register(Map<String, RuleCall<R>> table, String kind, String name, RuleCall<R> call,
                              String... aliases) {
        List<String> names = new ArrayList<>();
        names.add(name);
        Collections.addAll(names, aliases);
        Set<String> folded = new HashSet<>();
        for (String n : names) {
            if (!folded.add(Keyvalues.fold(n))) {
                throw new IllegalArgumentException("Name '" + n + "' is given twice for " + kind + " '" + name + "'");
            }
            if (table.containsKey(Keyvalues.fold(n))) {
                throw new IllegalArgumentException("Duplicate " + kind + " name '" + n + "'");
            }
        }
        for (String n : folded) {
            table.put(n, call);
        }
        document(kind, name, List.of(aliases), call);
    }

    private void document(String kind, String name, List<String> aliases, RuleCall<?> call) {
        List<ContextKind> kinds = new ArrayList<>(call.kinds());
        Collections.sort(kinds);
        groups.computeIfAbsent(currentGroup, g -> new ArrayList<>())
                .add(new RuleDoc(kind, name, aliases, call instanceof RuleCall.FactoryCall, kinds));
    }

    public Optional<RuleCall<TestOutcome>> test(String name) {
        return Optional.ofNullable(tests.get(Keyvalues.fold(name)));
    }

    public Optional<RuleCall<ActionOutcome>> result(String name) {
        return Optional.ofNullable(results.get(Keyvalues.fold(name)));
    }

    public Optional<SetupHandler> setup(String name) {
        return Optional.ofNullable(setups.get(Keyvalues.fold(name)));
    }

    /**
     * @return the meta-conditions in registration order.
     */
    public List<MetaRule> metas() {
        return Collections.unmodifiableList(metas);
    }

    /**
     * @return documentation entries per module group, in registration order.
     */
    public Map<String, List<RuleDoc>> groups() {
        return Collections.unmodifiableMap(groups);
    }
}
