package org.kaleido.compiler.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains tests for the {@link LoggingConfigurator}.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.kaleido.sample").setLevel(null);
        context.getLogger("org.kaleido.other").setLevel(null);
        LoggingConfigurator.reset();
    }

    /**
     * Verifies that the default level and the specific levels are applied.
     */
    @Test
    void shouldApplyConfiguredLevels() {
        // Arrange
        String hocon = "logging { default-level = \"ERROR\", levels { \"org.kaleido.sample\" = \"DEBUG\" } }";

        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString(hocon));

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.kaleido.sample").getLevel()).isEqualTo(Level.DEBUG);
    }

    /**
     * Verifies that a second call has no effect until the configurator is reset.
     */
    @Test
    void shouldBeIdempotent() {
        // Arrange
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.kaleido.sample\" = \"WARN\" }"));

        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.kaleido.sample\" = \"TRACE\" }"));

        // Assert
        assertThat(context.getLogger("org.kaleido.sample").getLevel()).isEqualTo(Level.WARN);
    }

    /**
     * Verifies that an unknown level name is skipped while the other levels still apply.
     */
    @Test
    void shouldSkipUnknownLevels() {
        // Arrange
        String hocon = "logging.levels { \"org.kaleido.sample\" = \"LOUD\", \"org.kaleido.other\" = \"ERROR\" }";

        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString(hocon));

        // Assert
        assertThat(context.getLogger("org.kaleido.sample").getLevel()).isNull();
        assertThat(context.getLogger("org.kaleido.other").getLevel()).isEqualTo(Level.ERROR);
    }
}
