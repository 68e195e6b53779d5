package org.kaleido.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains tests for the {@link ConfigLoader}, verifying the precedence of the configuration layers.
 */
@Tag("unit")
class ConfigLoaderTest {

    private static final String TEST_RESOURCE = "org/kaleido/compiler/test-frontend.conf";

    @BeforeEach
    void setUp() {
        System.clearProperty("test.priority");
        System.clearProperty("kaleido.frontend.max-errors");
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.priority");
        System.clearProperty("kaleido.frontend.max-errors");
        ConfigFactory.invalidateCaches();
    }

    /**
     * Verifies that without a configuration file the defaults from reference.conf apply.
     */
    @Test
    void shouldLoadDefaultsFromReferenceConf() {
        // Act
        Config config = ConfigLoader.load();

        // Assert
        assertThat(config.getBoolean("kaleido.frontend.recover")).isTrue();
        assertThat(config.getInt("kaleido.frontend.max-errors")).isEqualTo(20);
        assertThat(config.getInt("kaleido.frontend.default-binary-precedence")).isEqualTo(30);
        assertThat(config.getInt("kaleido.frontend.max-nesting-depth")).isEqualTo(256);
        assertThat(config.getString("logging.default-level")).isEqualTo("INFO");
    }

    /**
     * Verifies that the file layer overrides reference.conf and keeps the keys it does not set.
     */
    @Test
    void shouldOverrideDefaultsWithFile() {
        // Act
        Config config = ConfigLoader.load(TEST_RESOURCE);

        // Assert
        assertThat(config.getBoolean("kaleido.frontend.recover")).isFalse();
        assertThat(config.getInt("kaleido.frontend.max-errors")).isEqualTo(5);
        assertThat(config.getInt("kaleido.frontend.default-binary-precedence")).isEqualTo(30);
        assertThat(config.getString("test.value")).isEqualTo("file-value");
    }

    /**
     * Verifies that system properties override the file layer.
     */
    @Test
    void shouldOverrideFileWithSystemProperties() {
        // Arrange
        System.setProperty("test.priority", "property-priority");
        System.setProperty("kaleido.frontend.max-errors", "7");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(TEST_RESOURCE);

        // Assert
        assertThat(config.getString("test.priority")).isEqualTo("property-priority");
        assertThat(config.getInt("kaleido.frontend.max-errors")).isEqualTo(7);
        assertThat(FrontEndOptions.fromConfig(config)).isEqualTo(new FrontEndOptions(false, 7, 30, 256));
    }
}
