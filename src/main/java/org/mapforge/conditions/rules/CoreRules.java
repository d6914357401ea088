package org.mapforge.conditions.rules;

import org.mapforge.conditions.ActionOutcome;
import org.mapforge.conditions.BoundResult;
import org.mapforge.conditions.BoundTest;
import org.mapforge.conditions.Condition;
import org.mapforge.conditions.ConditionParser;
import org.mapforge.conditions.ConditionRegistry;
import org.mapforge.conditions.ContextKey;
import org.mapforge.conditions.Handlers;
import org.mapforge.conditions.RuleContext;
import org.mapforge.conditions.RuleModule;
import org.mapforge.conditions.TestOutcome;
import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.map.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Control flow: nested conditions, switches, the control signals, no-ops and debugging, plus the
 * metas that drop blank instances and report global instances.
 */
public class CoreRules implements RuleModule {

    private static final Logger LOG = LoggerFactory.getLogger(CoreRules.class);

    enum SwitchMethod {
        FIRST, LAST, RANDOM, ALL;

        static SwitchMethod parse(String text) {
            try {
                return valueOf(text.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                LOG.warn("Unknown switch method '{}', using 'first'", text);
                return FIRST;
            }
        }
    }

    /**
     * @param test The case test, or {@code null} for a case that always matches.
     * @param results The results of the case.
     */
    record SwitchCase(BoundTest test, List<BoundResult> results) {
    }

    record SwitchConfig(SwitchMethod method, String seed, List<SwitchCase> cases, List<BoundResult> defaults) {
    }

    @Override
    public String group() {
        return "Main";
    }

    @Override
    public void register(ConditionRegistry registry) {
        registry.registerSetup("condition", (parser, kv) -> kv.isBlock() ? parser.parse(kv, false) : null);
        registry.registerResult("condition", Handlers.of(
                ContextKey.MAP, ContextKey.INDEX, ContextKey.INFO, ContextKey.INSTANCE, ContextKey.CONFIG,
                (map, index, info, inst, conf) -> {
                    Condition nested = conf.setup(Condition.class);
                    return switch (nested.evaluate(new RuleContext(map, index, info), inst, false)) {
                        case NEXT_INSTANCE -> ActionOutcome.NEXT_INSTANCE;
                        case END_CONDITION -> ActionOutcome.END_CONDITION;
                        default -> nested.isEmpty() ? ActionOutcome.EXHAUSTED : ActionOutcome.CONTINUE;
                    };
                }));

        registry.registerSetup("switch", CoreRules::setupSwitch);
        registry.registerResult("switch", Handlers.of(
                ContextKey.MAP, ContextKey.INDEX, ContextKey.INFO, ContextKey.INSTANCE, ContextKey.CONFIG,
                (map, index, info, inst, conf) -> {
                    SwitchConfig sw = conf.setup(SwitchConfig.class);
                    RuleContext run = new RuleContext(map, index, info);
                    List<SwitchCase> cases = sw.cases();
                    if (sw.method() == SwitchMethod.RANDOM) {
                        cases = new ArrayList<>(cases);
                        Collections.shuffle(cases, info.random().seed("switch", sw.seed(), inst.targetname(), inst.origin()));
                    }
                    return runSwitch(sw, cases, run, inst);
                }));

        registry.registerResult("nextInstance", Handlers.of(() -> ActionOutcome.NEXT_INSTANCE));
        registry.registerResult("endCondition", Handlers.of(() -> ActionOutcome.END_CONDITION), "nextCondition");
        registry.registerResult("dummy", Handlers.of(() -> ActionOutcome.CONTINUE), "nop", "do_nothing");

        registry.registerTest("debug", Handlers.of(ContextKey.INSTANCE, ContextKey.CONFIG, (inst, conf) -> {
            LOG.info("Debug test on {}: {}", inst, inst.fixup().substitute(conf.value()));
            return TestOutcome.PASS;
        }));
        registry.registerResult("debug", Handlers.of(ContextKey.INSTANCE, ContextKey.CONFIG, (inst, conf) -> {
            LOG.info("Debug result on {}: {} ({})", inst, inst.fixup().substitute(conf.value()), inst.fixup());
            return ActionOutcome.CONTINUE;
        }));

        registry.addMeta("RemoveBlankInstances", new BigDecimal(1000), Handlers.of(
                ContextKey.MAP, ContextKey.INSTANCE, (map, inst) -> {
                    String file = inst.file();
                    if (file.isEmpty() || file.equals(".vmf")) {
                        LOG.debug("Removing blank instance {}", inst);
                        map.removeEntity(inst);
                    }
                    return ActionOutcome.CONTINUE;
                }), false);
        registry.addMeta("LogGlobalInstances", new BigDecimal(10000), Handlers.of(ContextKey.INFO, info -> {
            LOG.info("Global instances: {}", info.globalInstances().size());
            for (Entity inst : info.globalInstances()) {
                LOG.debug(" - {} at {}", inst.file(), inst.origin());
            }
            return ActionOutcome.CONTINUE;
        }), true);
    }

    /*
     * "switch"
     * {
     *     "flag" "instVar"
     *     "method" "first"
     *     "$a 1" { "setInstVar" "$b 2" }
     *     "<default>" { ... }
     * }
     */
    private static SwitchConfig setupSwitch(ConditionParser parser, Keyvalues kv) {
        if (!kv.isBlock()) {
            return null;
        }
        String flag = "";
        SwitchMethod method = SwitchMethod.FIRST;
        String seed = "";
        List<Keyvalues> rawCases = new ArrayList<>();
        List<BoundResult> defaults = new ArrayList<>();
        for (Keyvalues child : kv) {
            if (child.isBlock()) {
                if (child.name().equals("<default>")) {
                    child.forEach(res -> parser.parseResult(res).ifPresent(defaults::add));
                } else {
                    rawCases.add(child);
                }
                continue;
            }
            switch (child.name()) {
                case "flag" -> flag = child.value();
                case "method" -> method = SwitchMethod.parse(child.value());
                case "seed" -> seed = child.value();
                default -> LOG.warn("Unknown switch option '{}'", child.realName());
            }
        }
        if (method == SwitchMethod.LAST) {
            Collections.reverse(rawCases);
        }
        List<SwitchCase> cases = new ArrayList<>(rawCases.size());
        for (Keyvalues raw : rawCases) {
            BoundTest test = flag.isEmpty() ? null : parser.parseTest(Keyvalues.leaf(flag, raw.realName()));
            List<BoundResult> results = new ArrayList<>();
            raw.forEach(res -> parser.parseResult(res).ifPresent(results::add));
            cases.add(new SwitchCase(test, List.copyOf(results)));
        }
        return new SwitchConfig(method, seed, List.copyOf(cases), List.copyOf(defaults));
    }

    private static ActionOutcome runSwitch(SwitchConfig sw, List<SwitchCase> cases, RuleContext run, Entity inst) {
        boolean matched = false;
        for (SwitchCase c : cases) {
            if (c.test() != null && !c.test().evaluate(run, inst).passed()) {
                continue;
            }
            matched = true;
            ActionOutcome outcome = runAll(c.results(), run, inst);
            if (outcome != ActionOutcome.CONTINUE) {
                return outcome;
            }
            if (sw.method() != SwitchMethod.ALL) {
                break;
            }
        }
        if (!matched) {
            return runAll(sw.defaults(), run, inst);
        }
        return ActionOutcome.CONTINUE;
    }

    // Exhaustion is ignored inside switches, the case lists are shared by every instance.
    private static ActionOutcome runAll(List<BoundResult> results, RuleContext run, Entity inst) {
        for (BoundResult result : results) {
            ActionOutcome outcome = result.apply(run, inst);
            if (outcome == ActionOutcome.NEXT_INSTANCE || outcome == ActionOutcome.END_CONDITION) {
                return outcome;
            }
        }
        return ActionOutcome.CONTINUE;
    }
}
