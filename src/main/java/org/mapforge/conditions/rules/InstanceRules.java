package org.mapforge.conditions.rules;

import org.mapforge.conditions.ActionOutcome;
import org.mapforge.conditions.ConditionRegistry;
import org.mapforge.conditions.ContextKey;
import org.mapforge.conditions.Handlers;
import org.mapforge.conditions.MapInfo;
import org.mapforge.conditions.RuleConfig;
import org.mapforge.conditions.RuleModule;
import org.mapforge.conditions.StageResult;
import org.mapforge.conditions.TestOutcome;
import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.map.Entity;
import org.mapforge.map.Instances;
import org.mapforge.map.MapDocument;
import org.mapforge.map.Output;
import org.mapforge.math.Vec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Tests and results reading or changing the instance being processed: its file, its fixup
 * variables, its outputs. Also adds global instances.
 */
public class InstanceRules implements RuleModule {

    private static final Logger LOG = LoggerFactory.getLogger(InstanceRules.class);

    @Override
    public String group() {
        return "Instances";
    }

    @Override
    public void register(ConditionRegistry registry) {
        registry.registerTest("instance", Handlers.staged(ContextKey.INFO, ContextKey.CONFIG, (info, conf) -> {
            Set<String> files = parseFiles(conf.value());
            return StageResult.perInstance(inst -> {
                // Checked on every call: rules may add matching instances later in the run.
                if (Collections.disjoint(files, info.allInstances())) {
                    return TestOutcome.UNSATISFIABLE;
                }
                return TestOutcome.of(files.contains(inst.file()));
            });
        }), "instFile");
        registry.registerTest("instFlag", Handlers.of(ContextKey.INSTANCE, ContextKey.CONFIG,
                (inst, conf) -> TestOutcome.of(inst.file().contains(Keyvalues.fold(conf.value().trim())))), "instPart");
        registry.registerTest("hasInst", Handlers.staged(ContextKey.INFO, ContextKey.CONFIG, (info, conf) -> {
            Set<String> files = parseFiles(conf.value());
            return StageResult.perInstance(inst -> TestOutcome.of(!Collections.disjoint(files, info.allInstances())));
        }));
        registry.registerTest("instVar", Handlers.of(ContextKey.INSTANCE, ContextKey.CONFIG,
                (inst, conf) -> TestOutcome.of(compareInstVar(inst, conf.value()))));

        registry.registerResult("setInstVar", Handlers.of(ContextKey.INSTANCE, ContextKey.CONFIG, (inst, conf) -> {
            String text = conf.value().trim();
            int space = text.indexOf(' ');
            String var = space < 0 ? text : text.substring(0, space);
            String value = space < 0 ? "" : inst.fixup().substitute(text.substring(space + 1));
            if (var.isEmpty()) {
                LOG.warn("setInstVar needs a variable name ({})", inst);
            } else {
                inst.fixup().put(var, value);
            }
            return ActionOutcome.CONTINUE;
        }), "assign", "setFixupVar");
        registry.registerResult("removeInstVar", Handlers.of(ContextKey.INSTANCE, ContextKey.CONFIG, (inst, conf) -> {
            inst.fixup().remove(conf.value().trim());
            return ActionOutcome.CONTINUE;
        }), "removeFixup");

        registry.registerResult("changeInstance", Handlers.of(ContextKey.INFO, ContextKey.INSTANCE, ContextKey.CONFIG,
                (info, inst, conf) -> {
                    String file = inst.fixup().substitute(conf.value().trim());
                    inst.put("file", file);
                    info.recordInstance(file);
                    return ActionOutcome.CONTINUE;
                }), "rename");
        registry.registerResult("suffix", Handlers.of(ContextKey.INFO, ContextKey.INSTANCE, ContextKey.CONFIG,
                (info, inst, conf) -> {
                    String suffix = inst.fixup().substitute(conf.value().trim());
                    if (!suffix.isEmpty()) {
                        addSuffix(info, inst, suffix);
                    }
                    return ActionOutcome.CONTINUE;
                }), "instSuffix");

        registry.registerResult("addGlobal", Handlers.of(ContextKey.MAP, ContextKey.INFO, ContextKey.INSTANCE, ContextKey.CONFIG,
                InstanceRules::addGlobal));
        registry.registerResult("deleteInstance", Handlers.of(ContextKey.MAP, ContextKey.INSTANCE, (map, inst) -> {
            map.removeEntity(inst);
            return ActionOutcome.CONTINUE;
        }));
        registry.registerResult("clearOutputs", Handlers.of(ContextKey.INSTANCE, inst -> {
            inst.outputs().clear();
            return ActionOutcome.CONTINUE;
        }), "clearOutput");

        registry.registerResult("addOutput", Handlers.staged(ContextKey.CONFIG, conf -> {
            Keyvalues kv = conf.kv();
            String output = kv.get("output");
            String input = kv.get("input");
            String target = kv.get("target");
            String parm = kv.get("parm");
            double delay = kv.getDouble("delay", 0);
            int times = kv.getInt("times", -1);
            if (output.isEmpty() || input.isEmpty()) {
                LOG.warn("addOutput needs both an output and an input, ignored");
                return StageResult.done(ActionOutcome.EXHAUSTED);
            }
            return StageResult.perInstance(inst -> {
                String resolved = target.isEmpty()
                        ? inst.targetname()
                        : Instances.localName(inst, inst.fixup().substitute(target));
                inst.addOutput(new Output(output, resolved, input, inst.fixup().substitute(parm), delay, times));
                return ActionOutcome.CONTINUE;
            });
        }));

        registry.registerResult("localTarget", Handlers.of(ContextKey.INSTANCE, ContextKey.CONFIG, (inst, conf) -> {
            Keyvalues kv = conf.kv();
            String local = kv.get("name");
            String name = local.isEmpty() ? inst.targetname() : inst.targetname() + "-" + local;
            String var = kv.get("resultVar");
            if (var.isEmpty()) {
                LOG.warn("localTarget needs a resultVar ({})", inst);
            } else {
                inst.fixup().put(var, kv.get("prefix") + name + kv.get("suffix"));
            }
            return ActionOutcome.CONTINUE;
        }));
    }

    /*
     * "addGlobal" "instances/global.vmf"
     * or
     * "addGlobal" { "file" "..." "name" "..." "position" "0 0 0" "angles" "0 0 0" "allow_multiple" "0" }
     */
    private static ActionOutcome addGlobal(MapDocument map, MapInfo info, Entity inst, RuleConfig conf) {
        Keyvalues kv = conf.kv();
        String rawFile = kv.isBlock() ? kv.get("file") : kv.value();
        String file = inst.fixup().substitute(rawFile.trim());
        if (file.isEmpty()) {
            LOG.warn("addGlobal without a file ({})", inst);
            return ActionOutcome.EXHAUSTED;
        }
        boolean allowMultiple = kv.getBool("allow_multiple", false);
        String folded = Keyvalues.fold(file).replace('\\', '/');
        boolean added = info.globalInstances().stream().anyMatch(g -> g.file().equals(folded));
        if (allowMultiple || !added) {
            Entity global = map.createInstance(
                    file,
                    inst.fixup().substitute(kv.get("name")),
                    Vec.parse(inst.fixup().substitute(kv.get("position", "0 0 0")), Vec.ZERO),
                    inst.fixup().substitute(kv.get("angles", "0 0 0")));
            global.put("fixup_style", kv.get("fixup_style", "0"));
            if (global.targetname().isEmpty()) {
                global.put("targetname", "inst_" + global.id());
            }
            info.addGlobalInstance(global);
            info.recordInstance(file);
            LOG.debug("Added global instance {}", global);
        }
        return allowMultiple ? ActionOutcome.CONTINUE : ActionOutcome.EXHAUSTED;
    }

    static Set<String> parseFiles(String value) {
        Set<String> files = new LinkedHashSet<>();
        for (String part : value.trim().split("[\\s,]+")) {
            if (!part.isEmpty()) {
                files.add(Keyvalues.fold(part).replace('\\', '/'));
            }
        }
        return files;
    }

    static void addSuffix(MapInfo info, Entity inst, String suffix) {
        String file = inst.get("file");
        int dot = Keyvalues.fold(file).endsWith(".vmf") ? file.length() - 4 : file.length();
        String renamed = file.substring(0, dot) + "_" + suffix + file.substring(dot);
        inst.put("file", renamed);
        info.recordInstance(renamed);
    }

    /*
     * "$var == value", "$var value" (equality), "$var <" (compare with ""), or "$var" alone as a
     * boolean. Numbers compare numerically.
     */
    static boolean compareInstVar(Entity inst, String text) {
        String[] parts = text.trim().split(" ", 3);
        String a;
        String b;
        String op;
        if (parts.length == 3) {
            a = parts[0];
            op = inst.fixup().substitute(parts[1]);
            b = parts[2];
        } else if (parts.length == 2) {
            a = parts[0];
            if (comparison(parts[1]) != null) {
                op = parts[1];
                b = "";
            } else {
                op = "==";
                b = parts[1];
            }
        } else {
            return Keyvalues.parseBool(inst.fixup().resolve(parts[0]), false);
        }
        if (a.indexOf('$') < 0 && b.indexOf('$') < 0) {
            LOG.warn("Comparison '{}' has no $variable, treating the first value as one", text);
            a = "$" + a;
        }
        IntPredicate check = comparison(op);
        if (check == null) {
            check = comparison("==");
        }
        String valA = inst.fixup().resolve(a);
        String valB = inst.fixup().resolve(b);
        return check.test(compareValues(valA, valB));
    }

    private static IntPredicate comparison(String op) {
        return switch (op) {
            case "=", "==" -> c -> c == 0;
            case "!=", "<>", "=/=" -> c -> c != 0;
            case "<" -> c -> c < 0;
            case ">" -> c -> c > 0;
            case "<=", "=<" -> c -> c <= 0;
            case ">=", "=>" -> c -> c >= 0;
            default -> null;
        };
    }

    private static int compareValues(String a, String b) {
        try {
            return Double.compare(Double.parseDouble(a.trim()), Double.parseDouble(b.trim()));
        } catch (NumberFormatException e) {
            return a.compareTo(b);
        }
    }
}
