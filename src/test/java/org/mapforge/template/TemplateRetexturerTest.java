package org.mapforge.template;

import org.mapforge.index.FaceIndex;
import org.mapforge.index.FaceLoc;
import org.mapforge.junit.extensions.logging.LogWatchExtension;
import org.mapforge.keyvalues.KeyvaluesParser;
import org.mapforge.map.MapDocument;
import org.mapforge.map.Side;
import org.mapforge.map.Solid;
import org.mapforge.map.UVAxis;
import org.mapforge.math.Orientation;
import org.mapforge.math.Vec;
import org.mapforge.texturing.MapRandom;
import org.mapforge.texturing.Materials;
import org.mapforge.texturing.TextureSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mapforge.template.TemplateFixtures.UP;
import static org.mapforge.template.TemplateFixtures.side;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TemplateRetexturerTest {

    private static final List<Vec> NORMALS = List.of(
            new Vec(0, 0, 1), new Vec(0, 0, -1), new Vec(1, 0, 0), new Vec(-1, 0, 0), new Vec(0, 1, 0), new Vec(0, -1, 0));

    private TemplateFixtures fixtures;
    private TemplateImporter importer;
    private MapDocument map;
    private FaceIndex index;
    private TemplateRetexturer retexturer;

    @BeforeEach
    void setUp() throws Exception {
        fixtures = new TemplateFixtures();
        importer = new TemplateImporter(fixtures.library());
        map = new MapDocument();
        TextureSet textures = TextureSet.fromConfig(KeyvaluesParser.parse("""
                "white"
                    {
                    "wall" "tile/a"
                    "wall" "tile/b"
                    "wall" "tile/c"
                    "wall" "tile/d"
                    "wall" "tile/e"
                    "wall" "tile/f"
                    }
                """, "textures.cfg"));
        index = FaceIndex.build(map);
        retexturer = new TemplateRetexturer(index, textures, new MapRandom(new byte[]{9}));
    }

    private ImportedTemplate place(String name, Vec origin) {
        return importer.importTemplate(map, ImportRequest.of(name, origin, Orientation.IDENTITY));
    }

    private static Solid only(ImportedTemplate imported) {
        return imported.allSolids().get(0);
    }

    @Test
    @DisplayName("Templates in the same grid cell pick the same variant per side")
    void sameCellSameVariant() {
        ImportedTemplate first = place("panel", new Vec(0, 0, 0));
        ImportedTemplate second = place("panel", new Vec(32, 16, 0));

        retexturer.retexture(first, RetextureOptions.defaults());
        retexturer.retexture(second, RetextureOptions.defaults());

        for (Vec normal : NORMALS) {
            assertThat(side(only(second), normal).material()).isEqualTo(side(only(first), normal).material());
        }
        assertThat(side(only(first), UP).material()).isEqualTo(Materials.WHITE_FLOOR);
        assertThat(side(only(first), new Vec(1, 0, 0)).material()).startsWith("tile/");
        assertThat(only(first).sides()).allMatch(s -> index.isTemplateFace(s.id()));
    }

    @Test
    @DisplayName("Replacements win and may address a single face")
    void replacements() {
        ImportedTemplate byMaterial = place("panel", Vec.ZERO);
        ImportedTemplate byFace = place("panel", new Vec(512, 0, 0));
        int templateTop = side(fixtures.panel, UP).id();

        retexturer.retexture(byMaterial, RetextureOptions.defaults()
                .withReplacements(Map.of(Materials.WHITE_WALL.toUpperCase(), List.of("custom/a"))));
        retexturer.retexture(byFace, RetextureOptions.defaults()
                .withReplacements(Map.of("#" + templateTop, List.of("<special.glass>"))));

        assertThat(only(byMaterial).sides()).extracting(Side::material).containsOnly("custom/a");
        assertThat(side(only(byFace), UP).material()).isEqualTo("glass/glasswindow007a_less_shiny");
        assertThat(side(only(byFace), new Vec(0, 0, -1)).material()).isEqualTo(Materials.WHITE_4X4);
    }

    @Test
    @DisplayName("A face replacement key may list several faces")
    void replacementForSeveralFaces() {
        ImportedTemplate imported = place("panel", Vec.ZERO);
        int templateTop = side(fixtures.panel, UP).id();
        int templateBottom = side(fixtures.panel, new Vec(0, 0, -1)).id();
        Map<String, List<String>> replacements = new LinkedHashMap<>();
        replacements.put("#" + templateTop + " " + templateBottom, List.of("custom/b"));
        replacements.put("#" + templateBottom, List.of("custom/b"));

        retexturer.retexture(imported, RetextureOptions.defaults().withReplacements(replacements));

        assertThat(side(only(imported), UP).material()).isEqualTo("custom/b");
        assertThat(side(only(imported), new Vec(0, 0, -1)).material()).isEqualTo("custom/b");
        assertThat(side(only(imported), new Vec(1, 0, 0)).material()).isNotEqualTo("custom/b");
    }

    @Test
    @DisplayName("A blank overlay replacement removes the overlay")
    void blankOverlayReplacement() {
        ImportedTemplate imported = place("panel", Vec.ZERO);

        retexturer.retexture(imported, RetextureOptions.defaults()
                .withReplacements(Map.of("overlays/sign", List.of(""))));

        assertThat(imported.overlays().get(0).isRemoved()).isTrue();
        assertThat(map.overlays()).isEmpty();
    }

    @Test
    @DisplayName("Colour overrides change panel colours")
    void colorOverride() {
        ImportedTemplate imported = place("panel", Vec.ZERO);

        retexturer.retexture(imported, RetextureOptions.defaults().withColorOverride(ColorOverride.BLACK));

        assertThat(side(only(imported), UP).material()).isEqualTo(Materials.BLACK_FLOOR);
        assertThat(side(only(imported), new Vec(1, 0, 0)).material()).isEqualTo(Materials.BLACK_WALL);
    }

    @Test
    @DisplayName("In clumping mode panels are handed to the wall texturing pass")
    void clumpingHandsOverPanels() {
        ImportedTemplate imported = place("panel", Vec.ZERO);

        retexturer.retexture(imported, RetextureOptions.defaults().withClumping(true));

        Side top = side(only(imported), UP);
        assertThat(top.material()).isEqualTo(Materials.WHITE_FLOOR);
        assertThat(side(only(imported), new Vec(1, 0, 0)).material()).isEqualTo(Materials.WHITE_WALL);
        assertThat(index.size()).isEqualTo(6);
        assertThat(index.lookup(FaceLoc.of(top))).isPresent();
        assertThat(index.isTemplateFace(top.id())).isFalse();
    }

    @Test
    @DisplayName("Colour pickers copy the colour of the surface they sample")
    void colorPicker() {
        Solid floor = Solid.box(map, new Vec(0, 0, -128), new Vec(128, 128, 0), Materials.BLACK_FLOOR);
        map.addBrush(floor);
        Side floorTop = side(floor, UP);
        FaceIndex floorIndex = FaceIndex.build(map);
        TemplateRetexturer withFloor = new TemplateRetexturer(floorIndex, TextureSet.defaults(), new MapRandom(new byte[]{9}));

        ImportedTemplate imported = place("picker", new Vec(64, 64, 0));
        withFloor.retexture(imported, RetextureOptions.defaults());

        assertThat(side(only(imported), UP).material()).isEqualTo(Materials.BLACK_FLOOR);
        assertThat(side(only(imported), new Vec(1, 0, 0)).material()).isEqualTo(Materials.BLACK_WALL);
        assertThat(floorTop.material()).isEqualTo(Materials.NODRAW);
        assertThat(floorIndex.lookup(FaceLoc.of(floorTop))).isEmpty();
    }

    @Test
    @DisplayName("Colour pickers in a visgroup only apply when that visgroup is imported")
    void colorPickerVisgroup() {
        Solid floor = Solid.box(map, new Vec(0, 0, -128), new Vec(128, 128, 0), Materials.BLACK_FLOOR);
        map.addBrush(floor);
        TemplateRetexturer withFloor = new TemplateRetexturer(FaceIndex.build(map), TextureSet.defaults(), new MapRandom(new byte[]{9}));
        withFloor.retexture(place("picker", new Vec(64, 64, 0)), RetextureOptions.defaults());

        assertThat(map.solid(floor.id())).isPresent();
        assertThat(side(floor, UP).material()).isEqualTo(Materials.NODRAW);

        MapDocument sealedMap = new MapDocument();
        Solid sealedFloor = Solid.box(sealedMap, new Vec(0, 0, -128), new Vec(128, 128, 0), Materials.BLACK_FLOOR);
        sealedMap.addBrush(sealedFloor);
        ImportedTemplate sealed = importer.importTemplate(sealedMap,
                ImportRequest.of("picker", new Vec(64, 64, 0), Orientation.IDENTITY).withVisgroups(Set.of("sealed")));
        new TemplateRetexturer(FaceIndex.build(sealedMap), TextureSet.defaults(), new MapRandom(new byte[]{9}))
                .retexture(sealed, RetextureOptions.defaults());

        assertThat(sealed.visgroups()).contains("sealed");
        assertThat(sealedMap.solid(sealedFloor.id())).isEmpty();
        assertThat(side(only(sealed), UP).material()).isEqualTo(Materials.BLACK_FLOOR);
    }

    @Test
    @DisplayName("Vertical faces turn their texture until V runs down the wall")
    void makeUpright() {
        Solid box = Solid.box(map, Vec.ZERO, new Vec(128, 128, 128), Materials.WHITE_WALL);
        Side wall = side(box, new Vec(1, 0, 0));
        wall.setUVAxes(new UVAxis(new Vec(0, 0, 1), 8, 0.25), new UVAxis(new Vec(0, 1, 0), 16, 0.25));

        TemplateRetexturer.makeUpright(wall);

        assertThat(wall.uaxis()).isEqualTo(new UVAxis(new Vec(0, 1, 0), 16, 0.25));
        assertThat(wall.vaxis()).isEqualTo(new UVAxis(new Vec(0, 0, -1), 8, 0.25));
    }

    @Test
    @DisplayName("Vertical faces lying flat keep their texture axes")
    void makeUprightOnFloor() {
        Solid box = Solid.box(map, Vec.ZERO, new Vec(128, 128, 128), Materials.WHITE_WALL);
        Side top = side(box, UP);
        UVAxis u = top.uaxis();
        UVAxis v = top.vaxis();

        TemplateRetexturer.makeUpright(top);

        assertThat(top.uaxis()).isEqualTo(u);
        assertThat(top.vaxis()).isEqualTo(v);
    }
}
