package org.mapforge.conditions.rules;

import org.mapforge.conditions.ActionOutcome;
import org.mapforge.conditions.ConditionRegistry;
import org.mapforge.conditions.ContextKey;
import org.mapforge.conditions.Handlers;
import org.mapforge.conditions.RuleModule;
import org.mapforge.conditions.TestOutcome;
import org.mapforge.keyvalues.Keyvalues;

/**
 * Map-wide style variables and attributes.
 */
public class GlobalRules implements RuleModule {

    @Override
    public String group() {
        return "Global";
    }

    @Override
    public void register(ConditionRegistry registry) {
        registry.registerTest("styleVar", Handlers.of(ContextKey.INFO, ContextKey.CONFIG,
                (info, conf) -> TestOutcome.of(Keyvalues.parseBool(info.styleVar(conf.value().trim()).orElse("0"), false))));
        registry.registerTest("has", Handlers.of(ContextKey.INFO, ContextKey.CONFIG,
                (info, conf) -> TestOutcome.of(info.hasAttr(conf.value().trim()))), "hasAttr");

        // "setStyleVar" { "setTrue" "name" "setFalse" "other" } or "setStyleVar" "name value"
        registry.registerResult("setStyleVar", Handlers.of(ContextKey.INFO, ContextKey.CONFIG, (info, conf) -> {
            Keyvalues kv = conf.kv();
            if (kv.isBlock()) {
                for (Keyvalues opt : kv) {
                    switch (opt.name()) {
                        case "settrue" -> info.setStyleVar(opt.value(), "1");
                        case "setfalse" -> info.setStyleVar(opt.value(), "0");
                        default -> info.setStyleVar(opt.realName(), opt.value());
                    }
                }
            } else {
                String text = kv.value().trim();
                int space = text.indexOf(' ');
                if (space < 0) {
                    info.setStyleVar(text, "1");
                } else {
                    info.setStyleVar(text.substring(0, space), text.substring(space + 1).trim());
                }
            }
            return ActionOutcome.EXHAUSTED;
        }));
        registry.registerResult("setAttr", Handlers.of(ContextKey.INFO, ContextKey.CONFIG, (info, conf) -> {
            Keyvalues kv = conf.kv();
            if (kv.isBlock()) {
                kv.forEach(opt -> info.setAttr(opt.name()));
            } else {
                info.setAttr(kv.value().trim());
            }
            return ActionOutcome.EXHAUSTED;
        }));
    }
}
