package org.kaleido.compiler.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class FrontEndOptionsTest {

    @Test
    void missingSectionGivesDefaults() {
        assertThat(FrontEndOptions.fromConfig(ConfigFactory.empty())).isEqualTo(FrontEndOptions.defaults());
        assertThat(FrontEndOptions.defaults()).isEqualTo(new FrontEndOptions(true, 20, 30, 256));
    }

    @Test
    void missingKeysFallBackToDefaults() {
        FrontEndOptions options = FrontEndOptions.fromConfig(ConfigFactory.parseString("kaleido.frontend.max-errors = 3"));

        assertThat(options).isEqualTo(new FrontEndOptions(true, 3, 30, 256));
    }

    @Test
    void readsNestingDepth() {
        FrontEndOptions options = FrontEndOptions.fromConfig(ConfigFactory.parseString("kaleido.frontend.max-nesting-depth = 64"));

        assertThat(options.maxNestingDepth()).isEqualTo(64);
    }

    @Test
    void rejectsValuesOutOfRange() {
        assertThatThrownBy(() -> FrontEndOptions.fromConfig(ConfigFactory.parseString("kaleido.frontend.max-errors = 0")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FrontEndOptions(true, 20, 101, 256))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("default-binary-precedence");
        assertThatThrownBy(() -> FrontEndOptions.fromConfig(ConfigFactory.parseString("kaleido.frontend.max-nesting-depth = 0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-nesting-depth");
    }

    @Test
    void rejectsWrongType() {
        assertThatThrownBy(() -> FrontEndOptions.fromConfig(ConfigFactory.parseString("kaleido.frontend.recover = sometimes")))
                .isInstanceOf(ConfigException.WrongType.class);
    }
}
