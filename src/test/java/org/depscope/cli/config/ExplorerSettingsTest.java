package org.depscope.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ExplorerSettingsTest {

    private static Config withReference(String hocon) {
        return ConfigFactory.parseString(hocon)
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    @Test
    void readsReferenceDefaults() {
        ExplorerSettings settings = ExplorerSettings.from(withReference(""));

        assertThat(settings.maxDepth()).isEqualTo(3);
        assertThat(settings.filter()).isEmpty();
        assertThat(settings.manifestFileName()).isEqualTo("Cargo.toml");
        assertThat(settings.testGraphFile()).isEqualTo("test-graph.txt");
        assertThat(settings.registryTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.userAgent()).startsWith("depscope/");
    }

    @Test
    void userValuesWin() {
        ExplorerSettings settings = ExplorerSettings.from(withReference(
                "depscope { max-depth = 5, filter = \"-sys\", registry.timeout = 2s }"));

        assertThat(settings.maxDepth()).isEqualTo(5);
        assertThat(settings.filter()).isEqualTo("-sys");
        assertThat(settings.registryTimeout()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void commandLineOverridesApplyOnlyWhenGiven() {
        ExplorerSettings base = ExplorerSettings.from(withReference(""));

        assertThat(base.withOverrides(null, null)).isEqualTo(base);
        ExplorerSettings overridden = base.withOverrides(8, "test");
        assertThat(overridden.maxDepth()).isEqualTo(8);
        assertThat(overridden.filter()).isEqualTo("test");
        assertThat(overridden.registryBaseUrl()).isEqualTo(base.registryBaseUrl());
    }

    @Test
    void nonPositiveDepthIsRejected() {
        assertThatThrownBy(() -> ExplorerSettings.from(withReference("depscope.max-depth = 0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-depth");
    }

    @Test
    void wrongTypeIsAConfigError() {
        assertThatThrownBy(() -> ExplorerSettings.from(withReference("depscope.max-depth = deep")))
                .isInstanceOf(ConfigException.WrongType.class);
    }
}
