package org.mapforge.conditions;

import org.mapforge.index.FaceIndex;
import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.map.Entity;
import org.mapforge.map.MapDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Runs a rule set over one document.
 * <p>
 * Conditions run in ascending priority; equal priorities keep their declaration order, with the
 * registry's metas declared first. Each condition is evaluated against the instances of the
 * document in document order, taken as a snapshot when the condition starts; instances removed
 * in the meantime are skipped. An engine runs once.
 */
public class ConditionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionEngine.class);

    private final ConditionRegistry registry;
    private final List<Condition> conditions = new ArrayList<>();
    private boolean ran;

    public ConditionEngine(ConditionRegistry registry) {
        this.registry = registry;
        for (ConditionRegistry.MetaRule meta : registry.metas()) {
            BoundResult result = new BoundResult(meta.name(),
                    new BoundRule<>(meta.call(), RuleConfig.of(Keyvalues.leaf(meta.name(), ""))));
            conditions.add(Condition.meta(meta.name(), meta.priority(), result, meta.onlyOnce()));
        }
    }

    public ConditionRegistry registry() {
        return registry;
    }

    public void add(Condition condition) {
        conditions.add(condition);
    }

    /**
     * Parses and adds a top-level condition block.
     * @param block the block.
     * @return the condition.
     * @throws InvalidConditionException on configuration errors in strict mode.
     */
    public Condition add(Keyvalues block) {
        Condition condition = registry.parser().parse(block, true);
        conditions.add(condition);
        return condition;
    }

    /**
     * Adds every condition of a rule set: {@code condition} blocks at the top level or inside
     * {@code conditions} blocks.
     *
     * @param root the parsed rule file.
     * @return the number of conditions added.
     */
    public int addAll(Keyvalues root) {
        int added = 0;
        for (Keyvalues child : root) {
            if (child.name().equals("conditions")) {
                added += addAll(child);
            } else if (child.name().equals("condition") && child.isBlock()) {
                add(child);
                added++;
            } else {
                LOG.warn("Ignoring unexpected '{}' in rule set", child.realName());
            }
        }
        return added;
    }

    /**
     * @return every condition in execution order.
     */
    public List<Condition> conditions() {
        List<Condition> ordered = new ArrayList<>(conditions);
        ordered.sort(Comparator.comparing(Condition::priority));
        return Collections.unmodifiableList(ordered);
    }

    /**
     * Runs every condition.
     *
     * @param map the document.
     * @param index the face index of the document.
     * @param info map-wide information.
     * @return run statistics.
     * @throws ConditionFailedException if a handler threw; the document keeps the changes made so far.
     * @throws IllegalStateException if the engine already ran.
     */
    public RunReport run(MapDocument map, FaceIndex index, MapInfo info) throws ConditionFailedException {
        if (ran) {
            throw new IllegalStateException("A condition engine runs once per document");
        }
        ran = true;
        RuleContext run = new RuleContext(map, index, info);
        List<Condition> ordered = conditions();
        int skipped = 0;

        for (Condition condition : ordered) {
            if (condition.isEmpty()) {
                continue;
            }
            try {
                if (condition.isOnlyOnce()) {
                    condition.evaluate(run, null, false);
                } else if (runAgainstInstances(condition, run, map)) {
                    skipped++;
                }
            } catch (RuntimeException e) {
                LOG.error("Error while running condition {}", condition.source(), e);
                throw new ConditionFailedException(condition.source(), e);
            }
        }

        int exhausted = (int) ordered.stream().filter(Condition::isEmpty).count();
        LOG.info("Conditions executed, {}/{} skipped", skipped, ordered.size());
        return new RunReport(ordered.size(), skipped, exhausted);
    }

    // Returns true if the condition was skipped as unsatisfiable.
    private static boolean runAgainstInstances(Condition condition, RuleContext run, MapDocument map) {
        for (Entity inst : map.instances()) {
            if (inst.isRemoved()) {
                continue;
            }
            Condition.Outcome outcome = condition.evaluate(run, inst, true);
            if (outcome == Condition.Outcome.UNSATISFIABLE) {
                LOG.debug("Skipping unsatisfiable condition {}", condition.source());
                return true;
            }
            if (outcome == Condition.Outcome.END_CONDITION || condition.isEmpty()) {
                break;
            }
        }
        return false;
    }
}
