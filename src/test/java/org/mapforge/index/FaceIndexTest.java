package org.mapforge.index;

import org.mapforge.junit.extensions.logging.ExpectLog;
import org.mapforge.junit.extensions.logging.LogLevel;
import org.mapforge.junit.extensions.logging.LogWatchExtension;
import org.mapforge.map.MapDocument;
import org.mapforge.map.Side;
import org.mapforge.map.Solid;
import org.mapforge.math.Vec;
import org.mapforge.texturing.Materials;
import org.mapforge.texturing.SurfaceColor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class FaceIndexTest {

    private static final Vec UP = new Vec(0, 0, 1);
    private static final FaceLoc TOP_OF_ORIGIN_CELL = new FaceLoc(new GridCell(0, 0, 0), UP);

    private MapDocument map;

    @BeforeEach
    void setUp() {
        map = new MapDocument();
    }

    /** A 128 cube whose top face has the given material and all other faces are nodraw. */
    private Solid block(Vec min, String topMaterial) {
        Solid solid = Solid.box(map, min, min.add(new Vec(128, 128, 128)), Materials.NODRAW);
        top(solid).setMaterial(topMaterial);
        map.addBrush(solid);
        return solid;
    }

    private static Side top(Solid solid) {
        return solid.sides().stream().filter(s -> s.normal().equals(UP)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("A face is keyed by the cell behind it and its outward normal")
    void keyIsCellBehindFace() {
        Solid solid = block(Vec.ZERO, Materials.WHITE_FLOOR);

        FaceIndex index = FaceIndex.build(map);

        assertThat(index.size()).isEqualTo(1);
        FaceRef ref = index.lookup(TOP_OF_ORIGIN_CELL).orElseThrow();
        assertThat(ref.face()).isSameAs(top(solid));
        assertThat(ref.solid()).isSameAs(solid);
        assertThat(ref.color()).isEqualTo(SurfaceColor.WHITE);
        assertThat(FaceLoc.at(new Vec(64, 64, 128), UP)).isEqualTo(TOP_OF_ORIGIN_CELL);
    }

    @Test
    @DisplayName("Goo is indexed, tool and unknown materials are not")
    void indexedMaterials() {
        block(Vec.ZERO, Materials.GOO);
        block(new Vec(128, 0, 0), "concrete/concrete_modular_floor001a");
        block(new Vec(256, 0, 0), Materials.BLACK_FLOOR);

        FaceIndex index = FaceIndex.build(map);

        assertThat(index.entries()).extracting(FaceRef::color).containsExactly(SurfaceColor.GOO, SurfaceColor.BLACK);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Overlapping faces at .*both set to nodraw")
    @DisplayName("Overlapping faces both become nodraw and block the key")
    void overlappingFaces() {
        Solid first = block(Vec.ZERO, Materials.WHITE_FLOOR);
        Solid second = block(Vec.ZERO, Materials.BLACK_FLOOR);

        FaceIndex index = FaceIndex.build(map);

        assertThat(index.lookup(TOP_OF_ORIGIN_CELL)).isEmpty();
        assertThat(top(first).material()).isEqualTo(Materials.NODRAW);
        assertThat(top(second).material()).isEqualTo(Materials.NODRAW);

        Solid third = block(Vec.ZERO, Materials.WHITE_FLOOR);
        assertThat(index.insert(TOP_OF_ORIGIN_CELL, top(third), third, SurfaceColor.WHITE)).isFalse();
        assertThat(top(third).material()).isEqualTo(Materials.NODRAW);
    }

    @Test
    @DisplayName("Pop and evict remove entries")
    void popAndEvict() {
        block(Vec.ZERO, Materials.WHITE_FLOOR);
        Solid other = block(new Vec(0, 0, 128), Materials.WHITE_FLOOR);
        FaceIndex index = FaceIndex.build(map);
        FaceLoc upper = new FaceLoc(new GridCell(0, 0, 1), UP);

        assertThat(index.pop(TOP_OF_ORIGIN_CELL)).isPresent();
        assertThat(index.lookup(TOP_OF_ORIGIN_CELL)).isEmpty();
        assertThat(index.locationOf(top(other).id())).contains(upper);

        index.evict(other);
        assertThat(index.lookup(upper)).isEmpty();
        assertThat(index.size()).isZero();
    }

    @Test
    @DisplayName("Entries of brushes removed from the document stop resolving")
    void staleEntriesDoNotResolve() {
        Solid solid = block(Vec.ZERO, Materials.WHITE_FLOOR);
        FaceIndex index = FaceIndex.build(map);

        map.removeBrush(solid);

        assertThat(index.lookup(TOP_OF_ORIGIN_CELL)).isEmpty();
        assertThat(index.entries()).isEmpty();
    }

    @Test
    @DisplayName("Template faces are remembered")
    void templateFaces() {
        FaceIndex index = new FaceIndex(map);
        index.markTemplateFace(42);

        assertThat(index.isTemplateFace(42)).isTrue();
        assertThat(index.isTemplateFace(43)).isFalse();
    }
}
