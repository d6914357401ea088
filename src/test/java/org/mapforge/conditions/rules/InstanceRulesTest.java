package org.mapforge.conditions.rules;

import org.mapforge.conditions.RuleHarness;
import org.mapforge.conditions.RunReport;
import org.mapforge.junit.extensions.logging.ExpectLog;
import org.mapforge.junit.extensions.logging.LogLevel;
import org.mapforge.junit.extensions.logging.LogWatchExtension;
import org.mapforge.map.Entity;
import org.mapforge.map.MapDocument;
import org.mapforge.map.Output;
import org.mapforge.math.Vec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class InstanceRulesTest {

    private MapDocument map;
    private Entity door;
    private Entity button;

    @BeforeEach
    void setUp() {
        map = new MapDocument();
        door = map.createInstance("Instances\\Door.vmf", "door", new Vec(0, 0, 64), "0 90 0");
        door.fixup().put("$size", "4");
        door.fixup().put("$color", "white");
        button = map.createInstance("instances/button_floor.vmf", "button", new Vec(256, 0, 64), "0 0 0");
        button.fixup().put("$size", "2");
        button.fixup().put("$color", "black");
    }

    @Test
    @DisplayName("Instance file tests are case-insensitive and accept lists")
    void instanceFiles() throws Exception {
        new RuleHarness(map).run("""
                "condition" { "instance" "instances/door.vmf" "result" { "setInstVar" "$door 1" } }
                "condition" { "instance" "instances/x.vmf, INSTANCES/BUTTON_FLOOR.VMF" "result" { "setInstVar" "$listed 1" } }
                "condition" { "instFlag" "button_" "result" { "setInstVar" "$partial 1" } }
                "condition" { "hasInst" "instances/button_floor.vmf" "result" { "setInstVar" "$any 1" } }
                """);

        assertThat(door.fixup().contains("$door")).isTrue();
        assertThat(button.fixup().contains("$door")).isFalse();
        assertThat(button.fixup().contains("$listed")).isTrue();
        assertThat(button.fixup().contains("$partial")).isTrue();
        assertThat(door.fixup().contains("$partial")).isFalse();
        assertThat(door.fixup().contains("$any")).isTrue();
    }

    @Test
    @DisplayName("Conditions on instances absent from the map are skipped")
    void absentInstanceSkips() throws Exception {
        RunReport report = new RuleHarness(map).run("""
                "condition" { "instance" "instances/missing.vmf" "result" { "setInstVar" "$x 1" } }
                "condition" { "!instance" "instances/missing.vmf" "result" { "setInstVar" "$y 1" } }
                """);

        assertThat(report.conditionsSkipped()).isEqualTo(1);
        assertThat(door.fixup().contains("$x")).isFalse();
        assertThat(door.fixup().contains("$y")).isTrue();
    }

    @Test
    @DisplayName("instVar compares numerically where it can")
    void instVarComparisons() throws Exception {
        new RuleHarness(map).run("""
                "condition" { "instVar" "$size > 3" "result" { "setInstVar" "$big 1" } }
                "condition" { "instVar" "$size <= 2" "result" { "setInstVar" "$small 1" } }
                "condition" { "instVar" "$color white" "result" { "setInstVar" "$white 1" } }
                "condition" { "instVar" "$color != white" "result" { "setInstVar" "$notWhite 1" } }
                """);

        assertThat(door.fixup().contains("$big")).isTrue();
        assertThat(button.fixup().contains("$big")).isFalse();
        assertThat(button.fixup().contains("$small")).isTrue();
        assertThat(door.fixup().contains("$white")).isTrue();
        assertThat(button.fixup().contains("$notWhite")).isTrue();
        assertThat(door.fixup().contains("$notWhite")).isFalse();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Comparison 'size 4' has no \\$variable, treating the first value as one", occurrences = 2)
    @DisplayName("A comparison without variables treats the first value as one")
    void comparisonWithoutVariable() throws Exception {
        new RuleHarness(map).run("""
                "condition" { "instVar" "size 4" "result" { "setInstVar" "$four 1" } }
                """);

        assertThat(door.fixup().contains("$four")).isTrue();
        assertThat(button.fixup().contains("$four")).isFalse();
    }

    @Test
    @DisplayName("Fixup variables can be set from other variables and removed")
    void setAndRemoveVariables() throws Exception {
        new RuleHarness(map).run("""
                "condition" { "result" { "setInstVar" "$label $color-$size" "removeInstVar" "$size" } }
                """);

        assertThat(door.fixup().get("$label")).contains("white-4");
        assertThat(door.fixup().contains("$size")).isFalse();
    }

    @Test
    @DisplayName("Instance files can be replaced or suffixed")
    void changeFiles() throws Exception {
        RuleHarness harness = new RuleHarness(map);
        harness.run("""
                "condition" { "instance" "instances/door.vmf" "result" { "suffix" "$color" } }
                "condition" { "instance" "instances/button_floor.vmf" "result" { "changeInstance" "instances/button_$color.vmf" } }
                """);

        assertThat(door.file()).isEqualTo("instances/door_white.vmf");
        assertThat(button.file()).isEqualTo("instances/button_black.vmf");
        assertThat(harness.info().allInstances())
                .contains("instances/door.vmf", "instances/door_white.vmf", "instances/button_black.vmf");
    }

    @Test
    @DisplayName("Global instances are added once unless multiples are allowed")
    void addGlobal() throws Exception {
        RuleHarness harness = new RuleHarness(map);
        harness.run("""
                "condition" { "result" { "addGlobal" "instances/global.vmf" } }
                "condition"
                    {
                    "priority" "-1"
                    "result" { "addGlobal" { "file" "instances/per_inst.vmf" "name" "$color_marker" "position" "1 2 3" "allow_multiple" "1" } }
                    }
                """);

        assertThat(map.instances()).extracting(Entity::file)
                .containsExactly("instances/door.vmf", "instances/button_floor.vmf",
                        "instances/per_inst.vmf", "instances/per_inst.vmf", "instances/global.vmf");
        Entity global = map.instances().get(4);
        assertThat(global.targetname()).isEqualTo("inst_" + global.id());
        assertThat(map.instances().get(2).targetname()).isEqualTo("white_marker");
        assertThat(map.instances().get(2).origin()).isEqualTo(new Vec(1, 2, 3));
        assertThat(harness.info().globalInstances()).hasSize(3);
    }

    @Test
    @DisplayName("Deleted instances are skipped by later conditions")
    void deleteInstance() throws Exception {
        new RuleHarness(map).run("""
                "condition" { "instance" "instances/door.vmf" "result" { "deleteInstance" "" } }
                "condition" { "result" { "setInstVar" "$seen 1" } }
                """);

        assertThat(door.isRemoved()).isTrue();
        assertThat(door.fixup().contains("$seen")).isFalse();
        assertThat(button.fixup().contains("$seen")).isTrue();
    }

    @Test
    @DisplayName("Outputs are added with local targets and can be cleared")
    void outputs() throws Exception {
        door.addOutput(new Output("OnOpen", "door-prop", "Skin", "1", 0, -1));

        new RuleHarness(map).run("""
                "condition"
                    {
                    "instance" "instances/door.vmf"
                    "result"
                        {
                        "clearOutputs" ""
                        "addOutput" { "output" "OnFullyOpen" "target" "relay" "input" "Trigger" "parm" "$size" "delay" "0.5" }
                        "addOutput" { "output" "OnUser1" "input" "FireUser2" "times" "1" }
                        "localTarget" { "name" "relay" "resultVar" "$relay" }
                        }
                    }
                """);

        assertThat(door.outputs()).containsExactly(
                new Output("OnFullyOpen", "door-relay", "Trigger", "4", 0.5, -1),
                new Output("OnUser1", "door", "FireUser2", "", 0, 1));
        assertThat(door.fixup().get("$relay")).contains("door-relay");
    }
}
