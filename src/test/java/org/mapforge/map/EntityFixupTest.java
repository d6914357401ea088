package org.mapforge.map;

import org.mapforge.junit.extensions.logging.ExpectLog;
import org.mapforge.junit.extensions.logging.LogLevel;
import org.mapforge.junit.extensions.logging.LogWatchExtension;
import org.mapforge.math.Vec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class EntityFixupTest {

    @Test
    @DisplayName("Variables are case-insensitive and keep their first spelling and position")
    void caseInsensitiveVariables() {
        EntityFixup fixup = new EntityFixup();
        fixup.put("$Color", "white");
        fixup.put("other", "1");
        fixup.put("COLOR", "black");

        assertThat(fixup.get("color")).contains("black");
        assertThat(fixup.entries()).extracting(EntityFixup.Entry::name).containsExactly("Color", "other");
    }

    @Test
    @DisplayName("Resolves $var and !$var, leaving literals alone")
    void resolve() {
        EntityFixup fixup = new EntityFixup();
        fixup.put("$flag", "1");

        assertThat(fixup.resolve("$flag")).isEqualTo("1");
        assertThat(fixup.resolve("!$flag")).isEqualTo("0");
        assertThat(fixup.resolve("literal")).isEqualTo("literal");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Unknown fixup variable '\\$missing'")
    @DisplayName("Unknown variables resolve to an empty string with a warning")
    void unknownVariable() {
        assertThat(new EntityFixup().resolve("$missing")).isEmpty();
    }

    @Test
    @DisplayName("Substitution picks the longest known variable name")
    void substituteLongestPrefix() {
        EntityFixup fixup = new EntityFixup();
        fixup.put("$side", "left");
        fixup.put("$side_b", "right");

        assertThat(fixup.substitute("$side_b and $side_x and $unknown")).isEqualTo("right and left_x and $unknown");
    }

    @Test
    @DisplayName("Local names follow the fixup style of the instance")
    void localNames() {
        MapDocument doc = new MapDocument();
        Entity inst = doc.createInstance("instances/a.vmf", "door", Vec.ZERO, "0 0 0");

        assertThat(Instances.localName(inst, "prop")).isEqualTo("door-prop");
        assertThat(Instances.localName(inst, "@global")).isEqualTo("@global");
        inst.put("fixup_style", "1");
        assertThat(Instances.localName(inst, "prop")).isEqualTo("prop-door");
        inst.put("fixup_style", "2");
        assertThat(Instances.localName(inst, "prop")).isEqualTo("prop");
    }

    @Test
    @DisplayName("Offsets and directions are rotated into world space")
    void resolveOffsetAndDirection() {
        MapDocument doc = new MapDocument();
        Entity inst = doc.createInstance("instances/a.vmf", "a", new Vec(256, 0, 64), "0 90 0");
        inst.fixup().put("$offset", "64 0 0");

        assertThat(Instances.resolveOffset(inst, "$offset")).isEqualTo(new Vec(256, 64, 64));
        assertThat(Instances.resolveDirection(inst, "1 0 0", Vec.ZERO)).isEqualTo(new Vec(0, 1, 0));
        assertThat(Instances.resolveDirection(inst, "", new Vec(0, 0, 1))).isEqualTo(new Vec(0, 0, 1));
    }
}
