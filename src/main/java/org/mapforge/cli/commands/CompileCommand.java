package org.mapforge.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.mapforge.MapCompiler;
import org.mapforge.MapCompiler.CompileResult;
import org.mapforge.cli.CommandLineInterface;
import org.mapforge.conditions.ConditionFailedException;
import org.mapforge.conditions.EngineOptions;
import org.mapforge.conditions.InvalidConditionException;
import org.mapforge.keyvalues.KeyvaluesSyntaxException;
import org.mapforge.map.MapDocumentWriter;
import org.mapforge.map.MapFormatException;
import org.mapforge.template.InvalidTemplateNameException;
import org.mapforge.texturing.TexturingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "compile", description = "Runs a rule set over a level and writes the transformed level.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-m", "--map"}, required = true, description = "The level document to compile.")
    private Path map;

    @Option(names = {"-r", "--conditions"}, required = true, description = "The rule set.")
    private Path conditions;

    @Option(names = {"-t", "--templates"}, description = "The template document.")
    private Path templates;

    @Option(names = {"--textures"}, description = "A file with a 'textures' block overriding the default materials.")
    private Path textures;

    @Option(names = {"-o", "--out"}, required = true, description = "Where to write the compiled level.")
    private Path out;

    @Option(names = {"--strict"}, description = "Treat rule configuration errors as fatal.")
    private boolean strict;

    @Option(names = {"--clumping"}, description = "Texture walls in clumps (overrides the configuration).")
    private Boolean clumping;

    @Option(names = {"--report"}, description = "Print a JSON summary of the compile.")
    private boolean report;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        EngineOptions engineOptions = EngineOptions.fromConfig(config);
        if (strict) {
            engineOptions = engineOptions.withStrict(true);
        }
        PrintWriter err = spec.commandLine().getErr();
        TexturingOptions texturingOptions;
        try {
            texturingOptions = TexturingOptions.fromConfig(config);
        } catch (ConfigException e) {
            err.println("Configuration error: " + e.getMessage());
            return 4;
        }
        if (clumping != null) {
            texturingOptions = texturingOptions.withClumping(clumping);
        }

        CompileResult result;
        try {
            result = new MapCompiler(engineOptions, texturingOptions).compile(map, conditions, templates, textures);
            Path dir = out.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            MapDocumentWriter.write(result.map(), out);
        } catch (IOException e) {
            LOG.error("I/O error: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 2;
        } catch (MapFormatException | KeyvaluesSyntaxException e) {
            err.println("Error: " + e.getMessage());
            return 3;
        } catch (InvalidConditionException | InvalidTemplateNameException e) {
            err.println("Configuration error: " + e.getMessage());
            return 4;
        } catch (ConditionFailedException e) {
            err.println(e.getMessage());
            // strict mode reports rule configuration errors through the run
            return e.getCause() instanceof InvalidTemplateNameException
                    || e.getCause() instanceof InvalidConditionException ? 4 : 5;
        }

        if (report) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("map", map.toString());
            summary.put("out", out.toString());
            summary.put("conditions", result.report().conditionsTotal());
            summary.put("skipped", result.report().conditionsSkipped());
            summary.put("exhausted", result.report().conditionsExhausted());
            summary.put("indexedFaces", result.indexedFaces());
            summary.put("texturedPanels", result.texturedPanels());
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            spec.commandLine().getOut().println(gson.toJson(summary));
        }
        return 0;
    }
}
