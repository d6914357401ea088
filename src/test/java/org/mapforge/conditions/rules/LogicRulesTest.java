package org.mapforge.conditions.rules;

import org.mapforge.conditions.RuleHarness;
import org.mapforge.junit.extensions.logging.ExpectLog;
import org.mapforge.junit.extensions.logging.LogLevel;
import org.mapforge.junit.extensions.logging.LogWatchExtension;
import org.mapforge.map.Entity;
import org.mapforge.map.MapDocument;
import org.mapforge.map.Solid;
import org.mapforge.math.Vec;
import org.mapforge.texturing.Materials;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LogicRulesTest {

    private MapDocument map;
    private Entity inst;

    @BeforeEach
    void setUp() {
        map = new MapDocument();
        inst = map.createInstance("instances/logic.vmf", "logic", Vec.ZERO, "0 0 0");
        inst.fixup().put("$on", "1");
    }

    private boolean passes(String test) throws Exception {
        new RuleHarness(map).run("""
                "condition"
                    {
                    %s
                    "result" { "setInstVar" "$passed 1" }
                    "else" { "setInstVar" "$passed 0" }
                    }
                """.formatted(test));
        return inst.fixup().getBool("$passed", false);
    }

    @Test
    @DisplayName("Boolean combinations")
    void combinations() throws Exception {
        assertThat(passes("\"AND\" { \"true\" \"\" \"instVar\" \"$on\" }")).isTrue();
        assertThat(passes("\"AND\" { \"true\" \"\" \"false\" \"\" }")).isFalse();
        assertThat(passes("\"OR\" { \"false\" \"\" \"instVar\" \"$on\" }")).isTrue();
        assertThat(passes("\"NAND\" { \"true\" \"\" \"true\" \"\" }")).isFalse();
        assertThat(passes("\"NOR\" { \"false\" \"\" \"false\" \"\" }")).isTrue();
        assertThat(passes("\"NOT\" { \"instVar\" \"$on\" }")).isFalse();
        assertThat(passes("\"!OR\" { \"false\" \"\" }")).isTrue();
    }

    @Test
    @DisplayName("Combinations stop evaluating once the outcome is decided")
    void combinationsShortCircuit() throws Exception {
        Solid floor = Solid.box(map, new Vec(-64, -64, -128), new Vec(64, 64, 0), Materials.WHITE_FLOOR);
        map.addBrush(floor);

        assertThat(passes("\"AND\" { \"false\" \"\" \"posIsSolid\" { \"removeBrush\" \"1\" } }")).isFalse();
        assertThat(passes("\"OR\" { \"true\" \"\" \"posIsSolid\" { \"removeBrush\" \"1\" } }")).isTrue();
        assertThat(passes("\"NAND\" { \"false\" \"\" \"posIsSolid\" { \"removeBrush\" \"1\" } }")).isTrue();
        assertThat(passes("\"NOR\" { \"true\" \"\" \"posIsSolid\" { \"removeBrush\" \"1\" } }")).isFalse();
        assertThat(map.solid(floor.id())).isPresent();

        assertThat(passes("\"AND\" { \"true\" \"\" \"posIsSolid\" { \"removeBrush\" \"1\" } }")).isTrue();
        assertThat(map.solid(floor.id())).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "NOT needs exactly one test, not 2; it will never pass")
    @DisplayName("NOT with several tests never passes")
    void malformedNot() throws Exception {
        assertThat(passes("\"NOT\" { \"false\" \"\" \"false\" \"\" }")).isFalse();
    }

    @Test
    @DisplayName("Chance is 0 or 100 at the extremes and repeatable in between")
    void chance() throws Exception {
        assertThat(passes("\"chance\" \"0\"")).isFalse();
        assertThat(passes("\"chance\" \"100%\"")).isTrue();

        List<Boolean> first = IntStream.range(0, 3).mapToObj(i -> attempt()).toList();
        assertThat(first).containsOnly(first.get(0));
    }

    private boolean attempt() {
        try {
            return passes("\"chance\" \"50%\"");
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Invalid chance 'lots', using 100%")
    @DisplayName("Percentages accept a trailing percent sign")
    void parsePercent() {
        assertThat(LogicRules.parsePercent(" 25% ")).isCloseTo(25.0, within(1e-9));
        assertThat(LogicRules.parsePercent("12.5")).isCloseTo(12.5, within(1e-9));
        assertThat(LogicRules.parsePercent("lots")).isEqualTo(100.0);
    }
}
