package org.mapforge.math;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class OrientationTest {

    @Test
    @DisplayName("Yaw turns around the z axis")
    void yaw() {
        Orientation orient = Orientation.fromAngles("0 90 0");

        assertThat(orient.rotate(new Vec(1, 0, 0))).isEqualTo(new Vec(0, 1, 0));
        assertThat(orient.rotate(new Vec(0, 0, 1))).isEqualTo(new Vec(0, 0, 1));
    }

    @Test
    @DisplayName("Composed rotations apply the inner one first")
    void composition() {
        Orientation inner = Orientation.fromAngles("0 90 0");
        Orientation outer = Orientation.fromAngles("0 180 0");

        assertThat(inner.then(outer).rotate(new Vec(1, 0, 0))).isEqualTo(new Vec(0, -1, 0));
        assertThat(inner.inverse().rotate(inner.rotate(new Vec(3, 4, 5)))).isEqualTo(new Vec(3, 4, 5));
    }

    @Test
    @DisplayName("Malformed angles give the identity")
    void malformedAngles() {
        assertThat(Orientation.fromAngles("nonsense").rotate(new Vec(1, 2, 3))).isEqualTo(new Vec(1, 2, 3));
        assertThat(Vec.parse("1 2", Vec.ZERO)).isEqualTo(Vec.ZERO);
        assertThat(new Vec(1.5, -0.0, 2).toString()).isEqualTo("1.5 0 2");
    }
}
