package org.mapforge;

import org.mapforge.MapCompiler.CompileResult;
import org.mapforge.conditions.EngineOptions;
import org.mapforge.junit.extensions.logging.LogWatchExtension;
import org.mapforge.map.Entity;
import org.mapforge.map.MapDocument;
import org.mapforge.map.MapDocumentReader;
import org.mapforge.map.MapDocumentWriter;
import org.mapforge.map.Side;
import org.mapforge.map.Solid;
import org.mapforge.math.Vec;
import org.mapforge.texturing.Materials;
import org.mapforge.texturing.TexturingOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class MapCompilerTest {

    private static final Vec UP = new Vec(0, 0, 1);

    @TempDir
    Path tempDir;

    static Path fixture(String name) throws URISyntaxException {
        return Path.of(MapCompilerTest.class.getResource("/fixtures/" + name).toURI());
    }

    private static CompileResult compile() throws Exception {
        MapCompiler compiler = new MapCompiler(EngineOptions.defaults(), TexturingOptions.defaults());
        return compiler.compile(fixture("level.vmf"), fixture("rules.cfg"), fixture("templates.vmf"), null);
    }

    private static Side top(Solid solid) {
        return solid.sides().stream().filter(s -> s.normal().equals(UP)).findFirst().orElseThrow();
    }

    private static Entity instance(MapDocument map, String name) {
        return map.instances().stream().filter(i -> i.targetname().equals(name)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("Runs rules, imports templates and textures walls over a level")
    void compilesLevel() throws Exception {
        CompileResult result = compile();
        MapDocument map = result.map();

        assertThat(map.instances()).extracting(Entity::targetname).containsExactlyInAnyOrder("tile_a", "tile_b");
        Entity onWhite = instance(map, "tile_a");
        Entity onBlack = instance(map, "tile_b");
        assertThat(onWhite.file()).isEqualTo("instances/tile_white.vmf");
        assertThat(onWhite.fixup().contains("$on_black")).isFalse();
        assertThat(onBlack.file()).isEqualTo("instances/tile.vmf");
        assertThat(onBlack.fixup().get("$on_black")).contains("1");
        assertThat(onBlack.fixup().get("$surface")).contains("black");

        assertThat(map.brushes()).hasSize(3);
        Solid marker = map.brushes().stream()
                .filter(s -> s.bboxMin().equals(new Vec(48, 48, 128)))
                .findFirst().orElseThrow();
        assertThat(top(marker).material()).isEqualTo(Materials.WHITE_FLOOR);
        assertThat(top(map.solid(2).orElseThrow()).material()).isEqualTo(Materials.WHITE_FLOOR);
        assertThat(top(map.solid(3).orElseThrow()).material()).isEqualTo(Materials.BLACK_FLOOR);

        assertThat(result.indexedFaces()).isEqualTo(2);
        assertThat(result.texturedPanels()).isEqualTo(2);
        assertThat(result.report().conditionsSkipped()).isZero();
    }

    @Test
    @DisplayName("Compiling the same level twice writes identical output")
    void outputIsDeterministic() throws Exception {
        Path first = tempDir.resolve("first.vmf");
        Path second = tempDir.resolve("second.vmf");

        MapDocumentWriter.write(compile().map(), first);
        MapDocumentWriter.write(compile().map(), second);

        assertThat(Files.readString(first)).isEqualTo(Files.readString(second));
        MapDocument reread = MapDocumentReader.read(first);
        assertThat(reread.brushes()).hasSize(3);
        assertThat(reread.instances()).hasSize(2);
    }
}
