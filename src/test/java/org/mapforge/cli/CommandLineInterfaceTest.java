package org.mapforge.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.mapforge.config.LoggingConfigurator;
import org.mapforge.junit.extensions.logging.ExpectLog;
import org.mapforge.junit.extensions.logging.LogLevel;
import org.mapforge.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine cmd;
    private Level rootLevel;

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static String fixture(String name) throws URISyntaxException {
        return Path.of(CommandLineInterfaceTest.class.getResource("/fixtures/" + name).toURI()).toString();
    }

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        rootLevel = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        cmd = CommandLineInterface.createCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context().getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
    }

    @Test
    @DisplayName("The command is called mapforge")
    void commandName() {
        assertThat(cmd.getCommandName()).isEqualTo("mapforge");
        assertThat(cmd.getSubcommands()).containsKeys("compile", "dump-conditions");
    }

    @Test
    @DisplayName("compile writes the level and a JSON report")
    void compileWithReport() throws Exception {
        Path target = tempDir.resolve("out/level.vmf");

        int exit = cmd.execute("compile",
                "-m", fixture("level.vmf"),
                "-r", fixture("rules.cfg"),
                "-t", fixture("templates.vmf"),
                "-o", target.toString(),
                "--report");

        assertThat(exit).isZero();
        assertThat(target).exists();
        assertThat(Files.readString(target)).contains("instances/tile_white.vmf");
        JsonObject report = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(report.get("out").getAsString()).isEqualTo(target.toString());
        assertThat(report.get("indexedFaces").getAsInt()).isEqualTo(2);
        assertThat(report.get("texturedPanels").getAsInt()).isEqualTo(2);
        assertThat(report.get("skipped").getAsInt()).isZero();
    }

    @Test
    @DisplayName("compile without its required options is a usage error")
    void missingOptions() {
        int exit = cmd.execute("compile", "-m", "level.vmf");

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString()).contains("Missing required option");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "I/O error: .*")
    @DisplayName("An unreadable level exits with code 2")
    void missingLevel() throws Exception {
        int exit = cmd.execute("compile",
                "-m", tempDir.resolve("absent.vmf").toString(),
                "-r", fixture("rules.cfg"),
                "-o", tempDir.resolve("out.vmf").toString());

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString()).startsWith("Error: ");
    }

    @Test
    @DisplayName("A malformed rule set exits with code 3")
    void malformedRules() throws Exception {
        Path rules = tempDir.resolve("rules.cfg");
        Files.writeString(rules, "\"condition\" {\n");

        int exit = cmd.execute("compile",
                "-m", fixture("level.vmf"),
                "-r", rules.toString(),
                "-o", tempDir.resolve("out.vmf").toString());

        assertThat(exit).isEqualTo(3);
    }

    @Test
    @DisplayName("A clump setting below 1 is a configuration error")
    void badClumpSetting() throws Exception {
        Path conf = tempDir.resolve("mapforge.conf");
        Files.writeString(conf, "mapforge.texturing.clump-size = 0\n");

        int exit = cmd.execute("-c", conf.toString(), "compile",
                "-m", fixture("level.vmf"),
                "-r", fixture("rules.cfg"),
                "-o", tempDir.resolve("out.vmf").toString());

        assertThat(exit).isEqualTo(4);
        assertThat(err.toString()).contains("Configuration error").contains("clump-size");
        assertThat(tempDir.resolve("out.vmf")).doesNotExist();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Error while running condition .*")
    @DisplayName("In strict mode an unknown template is a configuration error")
    void strictUnknownTemplate() throws Exception {
        Path rules = tempDir.resolve("rules.cfg");
        Files.writeString(rules, "\"condition\" { \"result\" { \"templateBrush\" \"nope\" } }\n");

        int exit = cmd.execute("compile",
                "-m", fixture("level.vmf"),
                "-r", rules.toString(),
                "-o", tempDir.resolve("out.vmf").toString(),
                "--strict");

        assertThat(exit).isEqualTo(4);
        assertThat(err.toString()).contains("nope");
        assertThat(tempDir.resolve("out.vmf")).doesNotExist();
    }

    @Test
    @DisplayName("dump-conditions lists the registered rules by group")
    void dumpConditions() {
        int exit = cmd.execute("dump-conditions");

        assertThat(exit).isZero();
        assertThat(out.toString())
                .contains("# Brushes")
                .contains("- posIsSolid")
                .contains("- templateBrush")
                .contains("# Instances");
    }
}
