package org.mapforge.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.mapforge.junit.extensions.logging.ExpectLog;
import org.mapforge.junit.extensions.logging.LogLevel;
import org.mapforge.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String SAMPLE = "org.mapforge.sample";

    private Level rootLevel;
    private Level sampleLevel;

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        rootLevel = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        sampleLevel = context().getLogger(SAMPLE).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context().getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context().getLogger(SAMPLE).setLevel(sampleLevel);
    }

    @Test
    @DisplayName("Default and per-logger levels are applied")
    void appliesLevels() {
        Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.mapforge.sample" = "TRACE"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertThat(context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context().getLogger(SAMPLE).getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    @DisplayName("Only the first configuration is applied")
    void configuresOnce() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.mapforge.sample\" = \"WARN\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.mapforge.sample\" = \"TRACE\" }"));

        assertThat(context().getLogger(SAMPLE).getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Unknown log level 'LOUD' for logger 'org.mapforge.sample', ignored")
    @DisplayName("Unknown level names are skipped")
    void unknownLevel() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.mapforge.sample\" = \"LOUD\" }"));

        assertThat(context().getLogger(SAMPLE).getLevel()).isEqualTo(sampleLevel);
    }

    @Test
    @DisplayName("Without a logging section nothing changes")
    void noLoggingSection() {
        LoggingConfigurator.configure(ConfigFactory.parseString("mapforge.conditions.strict = true"));

        assertThat(context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(rootLevel);
    }

    @Test
    @DisplayName("The root level can be overridden directly")
    void setRootLevel() {
        LoggingConfigurator.setRootLevel("DEBUG");

        assertThat(context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.DEBUG);
    }
}
