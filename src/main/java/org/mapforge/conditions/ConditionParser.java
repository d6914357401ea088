package org.mapforge.conditions;

import org.mapforge.keyvalues.Keyvalues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns configuration blocks into {@link Condition}s, tests and results.
 * <p>
 * Configuration errors are logged and the offending part is degraded: an unknown test never
 * passes, an unknown or broken result is dropped, a malformed priority is ignored. With strict
 * checking they throw {@link InvalidConditionException} instead.
 */
public class ConditionParser {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionParser.class);

    private static final RuleCall<TestOutcome> ALWAYS_FAIL = Handlers.of(() -> TestOutcome.FAIL);

    private final ConditionRegistry registry;

    ConditionParser(ConditionRegistry registry) {
        this.registry = registry;
    }

    public ConditionRegistry registry() {
        return registry;
    }

    /**
     * Parses a condition block.
     * <pre>
     * "condition"
     * {
     *     "priority" "5.5"
     *     "instance" "instances/button.vmf"
     *     "!instVar" "$disabled"
     *     "result" { "setInstVar" "$state 1" }
     *     "else" { ... }
     *     "condition" { ... }
     * }
     * </pre>
     *
     * @param block the block.
     * @param toplevel whether the condition sits directly in the rule set; only those honour
     *                 {@code priority}.
     * @return the condition.
     */
    public Condition parse(Keyvalues block, boolean toplevel) {
        String source = block.get("__src__", "");
        List<BoundTest> tests = new ArrayList<>();
        List<BoundResult> results = new ArrayList<>();
        List<BoundResult> elseResults = new ArrayList<>();
        BigDecimal priority = BigDecimal.ZERO;

        for (Keyvalues child : block) {
            switch (child.name()) {
                case "__src__" -> {
                }
                case "result" -> parseResults(child, source, results);
                case "else" -> parseResults(child, source, elseResults);
                case "condition", "switch" -> parseResult(child, source).ifPresent(results::add);
                case "elsecondition", "elseswitch" -> {
                    Keyvalues renamed = child.copy();
                    renamed.setName(child.name().substring(4));
                    parseResult(renamed, source).ifPresent(elseResults::add);
                }
                case "priority" -> {
                    if (!toplevel) {
                        LOG.warn("Priority has no effect in nested conditions ({})", describe(source));
                    } else {
                        priority = parsePriority(child, source, priority);
                    }
                }
                default -> tests.add(parseTest(child, source));
            }
        }
        return new Condition(tests, results, elseResults, priority, source);
    }

    private void parseResults(Keyvalues block, String source, List<BoundResult> into) {
        if (!block.isBlock()) {
            configError(source, "'" + block.realName() + "' must be a block");
            return;
        }
        for (Keyvalues child : block) {
            parseResult(child, source).ifPresent(into::add);
        }
    }

    private BigDecimal parsePriority(Keyvalues kv, String source, BigDecimal current) {
        if (kv.isBlock()) {
            configError(source, "Priority must be a number, not a block");
            return current;
        }
        try {
            return new BigDecimal(kv.value().trim());
        } catch (NumberFormatException e) {
            configError(source, "Invalid priority '" + kv.value() + "'");
            return current;
        }
    }

    /**
     * Parses one test. A leading {@code !} inverts it.
     * @param kv the test configuration.
     * @param source the provenance, for messages.
     * @return the bound test.
     */
    public BoundTest parseTest(Keyvalues kv, String source) {
        String name = kv.name();
        boolean inverted = name.startsWith("!");
        if (inverted) {
            name = name.substring(1);
        }
        Optional<RuleCall<TestOutcome>> call = registry.test(name);
        if (call.isEmpty()) {
            configError(source, "Unknown test '" + kv.realName() + "'");
            return new BoundTest(name, new BoundRule<>(ALWAYS_FAIL, RuleConfig.of(kv)), false);
        }
        return new BoundTest(name, new BoundRule<>(call.get(), RuleConfig.of(kv)), inverted);
    }

    public BoundTest parseTest(Keyvalues kv) {
        return parseTest(kv, "");
    }

    /**
     * Parses one result, running its setup if it has one.
     * @param kv the result configuration.
     * @param source the provenance, for messages.
     * @return the bound result, or empty if it is unknown or its setup failed.
     */
    public Optional<BoundResult> parseResult(Keyvalues kv, String source) {
        Optional<RuleCall<ActionOutcome>> call = registry.result(kv.name());
        if (call.isEmpty()) {
            configError(source, "Unknown result '" + kv.realName() + "'");
            return Optional.empty();
        }
        Object setupData = null;
        Optional<SetupHandler> setup = registry.setup(kv.name());
        if (setup.isPresent()) {
            try {
                setupData = setup.get().setup(this, kv);
            } catch (InvalidConditionException e) {
                throw e;
            } catch (RuntimeException e) {
                if (registry.options().strict()) {
                    throw new InvalidConditionException(source, "Setup of result '" + kv.realName() + "' failed", e);
                }
                LOG.warn("Setup of result '{}' failed, result removed ({}): {}", kv.realName(), describe(source), e.getMessage());
                return Optional.empty();
            }
            if (setupData == null) {
                configError(source, "Result '" + kv.realName() + "' has an invalid configuration");
                return Optional.empty();
            }
        }
        return Optional.of(new BoundResult(kv.name(), new BoundRule<>(call.get(), new RuleConfig(kv, setupData))));
    }

    public Optional<BoundResult> parseResult(Keyvalues kv) {
        return parseResult(kv, "");
    }

    private void configError(String source, String message) {
        if (registry.options().strict()) {
            throw new InvalidConditionException(source, message);
        }
        LOG.warn("{} ({})", message, describe(source));
    }

    private static String describe(String source) {
        return source.isEmpty() ? "unknown source" : source;
    }
}
