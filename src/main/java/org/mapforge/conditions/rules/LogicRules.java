package org.mapforge.conditions.rules;

import org.mapforge.conditions.BoundTest;
import org.mapforge.conditions.ConditionParser;
import org.mapforge.conditions.ConditionRegistry;
import org.mapforge.conditions.ContextKey;
import org.mapforge.conditions.Handlers;
import org.mapforge.conditions.RuleCall;
import org.mapforge.conditions.RuleConfig;
import org.mapforge.conditions.RuleContext;
import org.mapforge.conditions.RuleModule;
import org.mapforge.conditions.StageResult;
import org.mapforge.conditions.TestOutcome;
import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.map.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Boolean combinations of other tests, random chance and constants.
 */
public class LogicRules implements RuleModule {

    private static final Logger LOG = LoggerFactory.getLogger(LogicRules.class);

    @Override
    public String group() {
        return "Logic";
    }

    @Override
    public void register(ConditionRegistry registry) {
        ConditionParser parser = registry.parser();
        registry.registerTest("AND", combine(parser, subs -> subs.allMatch(TestOutcome::passed)));
        registry.registerTest("OR", combine(parser, subs -> subs.anyMatch(TestOutcome::passed)));
        registry.registerTest("NAND", combine(parser, subs -> !subs.allMatch(TestOutcome::passed)));
        registry.registerTest("NOR", combine(parser, subs -> subs.noneMatch(TestOutcome::passed)));

        registry.registerTest("NOT", Handlers.staged(
                ContextKey.MAP, ContextKey.INDEX, ContextKey.INFO, ContextKey.CONFIG,
                (map, index, info, conf) -> {
                    List<Keyvalues> children = conf.kv().children();
                    if (children.size() != 1) {
                        LOG.warn("NOT needs exactly one test, not {}; it will never pass", children.size());
                        return StageResult.perInstance(inst -> TestOutcome.FAIL);
                    }
                    BoundTest sub = parser.parseTest(children.get(0));
                    RuleContext run = new RuleContext(map, index, info);
                    return StageResult.perInstance(inst -> TestOutcome.of(!sub.evaluate(run, inst).passed()));
                }));

        registry.registerTest("chance", Handlers.of(ContextKey.INFO, ContextKey.INSTANCE, ContextKey.CONFIG,
                (info, inst, conf) -> {
                    double chance = parsePercent(inst.fixup().substitute(conf.value()));
                    Random rand = info.random().seed("chance", inst.targetname(), inst.file(), inst.origin(), conf.value());
                    return TestOutcome.of(rand.nextDouble() * 100.0 < chance);
                }));

        registry.registerTest("true", Handlers.of(() -> TestOutcome.PASS));
        registry.registerTest("false", Handlers.of(() -> TestOutcome.FAIL));
    }

    private static RuleCall<TestOutcome> combine(ConditionParser parser, Predicate<Stream<TestOutcome>> rule) {
        return Handlers.staged(ContextKey.MAP, ContextKey.INDEX, ContextKey.INFO, ContextKey.CONFIG,
                (map, index, info, conf) -> {
                    List<BoundTest> subs = parseChildren(parser, conf);
                    RuleContext run = new RuleContext(map, index, info);
                    return StageResult.perInstance(inst -> TestOutcome.of(rule.test(evaluateLazily(subs, run, inst))));
                });
    }

    private static List<BoundTest> parseChildren(ConditionParser parser, RuleConfig conf) {
        List<BoundTest> subs = new ArrayList<>();
        for (Keyvalues child : conf.kv()) {
            subs.add(parser.parseTest(child));
        }
        return subs;
    }

    /*
     * Sub-tests run in order and only until the outcome is decided; later ones may have side effects.
     */
    private static Stream<TestOutcome> evaluateLazily(List<BoundTest> subs, RuleContext run, Entity inst) {
        return subs.stream().map(sub -> sub.evaluate(run, inst));
    }

    static double parsePercent(String text) {
        String trimmed = text.trim();
        if (trimmed.endsWith("%")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            LOG.warn("Invalid chance '{}', using 100%", text);
            return 100.0;
        }
    }
}
