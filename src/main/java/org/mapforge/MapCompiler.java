package org.mapforge;

import org.mapforge.conditions.ConditionEngine;
import org.mapforge.conditions.ConditionFailedException;
import org.mapforge.conditions.ConditionRegistry;
import org.mapforge.conditions.EngineOptions;
import org.mapforge.conditions.MapInfo;
import org.mapforge.conditions.RunReport;
import org.mapforge.conditions.rules.BuiltinRules;
import org.mapforge.index.FaceIndex;
import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.keyvalues.KeyvaluesParser;
import org.mapforge.keyvalues.KeyvaluesSyntaxException;
import org.mapforge.map.MapDocument;
import org.mapforge.map.MapDocumentReader;
import org.mapforge.map.MapFormatException;
import org.mapforge.template.TemplateLibrary;
import org.mapforge.texturing.TextureSet;
import org.mapforge.texturing.TexturingOptions;
import org.mapforge.texturing.WallTexturer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs the whole compile of one level: face indexing, the rule set, and wall texturing. It is not
 * thread-safe and each instance compiles any number of levels one after the other.
 */
public class MapCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(MapCompiler.class);

    /**
     * The outcome of a compile.
     *
     * @param map The transformed document.
     * @param report Counters of the rule run.
     * @param indexedFaces Faces in the face index after the rules ran.
     * @param texturedPanels Panels textured by the wall texturing pass.
     */
    public record CompileResult(MapDocument map, RunReport report, int indexedFaces, int texturedPanels) {
    }

    private final EngineOptions engineOptions;
    private final TexturingOptions texturingOptions;

    public MapCompiler(EngineOptions engineOptions, TexturingOptions texturingOptions) {
        this.engineOptions = engineOptions;
        this.texturingOptions = texturingOptions;
    }

    /**
     * Compiles files from disk.
     *
     * @param mapFile the level document.
     * @param conditionsFile the rule set.
     * @param templatesFile the template document, or {@code null} for none.
     * @param texturesFile a file holding a {@code textures} block, or {@code null} for the defaults.
     * @return the result; the caller writes the document.
     * @throws IOException if a file cannot be read.
     * @throws MapFormatException if a document is malformed.
     * @throws KeyvaluesSyntaxException if the rule set or textures file is malformed.
     * @throws ConditionFailedException if a rule fails.
     */
    public CompileResult compile(Path mapFile, Path conditionsFile, Path templatesFile, Path texturesFile)
            throws IOException, MapFormatException, KeyvaluesSyntaxException, ConditionFailedException {
        MapDocument map = MapDocumentReader.read(mapFile);
        Keyvalues conditions = KeyvaluesParser.parse(conditionsFile);
        TemplateLibrary templates = templatesFile != null ? TemplateLibrary.load(templatesFile) : TemplateLibrary.empty();
        TextureSet textures = texturesFile != null
                ? TextureSet.fromConfig(KeyvaluesParser.parse(texturesFile).findBlock("textures"))
                : TextureSet.defaults();
        return compile(map, conditions, templates, textures);
    }

    /**
     * Compiles an already loaded document in place.
     *
     * @param map the level document; it is modified.
     * @param conditions the rule set root.
     * @param templates the template library.
     * @param textures the texture set.
     * @return the result.
     * @throws ConditionFailedException if a rule fails.
     */
    public CompileResult compile(MapDocument map, Keyvalues conditions, TemplateLibrary templates, TextureSet textures)
            throws ConditionFailedException {
        // Phase 1: Spatial face index
        FaceIndex index = FaceIndex.build(map);

        // Phase 2: Rule set
        ConditionRegistry registry = ConditionRegistry.initialize(engineOptions, BuiltinRules.all());
        ConditionEngine engine = new ConditionEngine(registry);
        int added = engine.addAll(conditions);
        LOG.debug("Loaded {} conditions", added);
        MapInfo info = MapInfo.forDocument(map, textures, templates, texturingOptions.clumping());
        RunReport report = engine.run(map, index, info);

        // Phase 3: Wall texturing
        WallTexturer texturer = new WallTexturer(textures, info.random(), texturingOptions);
        int textured = texturer.apply(index, info.presetClumps());

        LOG.info("Compiled {}: {} conditions, {} indexed faces, {} panels textured",
                map, report.conditionsTotal(), index.size(), textured);
        return new CompileResult(map, report, index.size(), textured);
    }
}
