package org.resilience.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.resilience.runtime.ModelParameters;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Unit tests for {@link ConfigLoader}: layering order and the model and run blocks it hands out.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("resilience.model.height");
        System.clearProperty("resilience.simulation.ticks");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("File values sit between system properties and reference defaults")
    void load_mergesFileOverDefaults() {
        Config config = ConfigLoader.load(testResource("test-config.conf"));

        assertThat(config.getString("test.value")).isEqualTo("file-value");
        assertThat(config.getString("test.nested.setting")).isEqualTo("file-nested");

        ModelParameters params = ConfigLoader.modelParameters(config);
        assertThat(params.width()).isEqualTo(8);
        assertThat(params.height()).isEqualTo(6);
        assertThat(params.agentCount()).isEqualTo(5);
        assertThat(params.neededEnergy()).isEqualTo(10.0);
        assertThat(params.totalEnergy()).isEqualTo(6000.0);
    }

    @Test
    @DisplayName("System properties override the file")
    void load_systemPropertyOverridesFile() {
        System.setProperty("test.value", "system-value");
        System.setProperty("resilience.model.height", "9");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(testResource("test-config.conf"));

        assertThat(config.getString("test.value")).isEqualTo("system-value");
        assertThat(config.getString("test.priority")).isEqualTo("file-priority");
        assertThat(ConfigLoader.modelParameters(config).height()).isEqualTo(9);
    }

    @Test
    @DisplayName("Without a file only reference.conf applies")
    void load_withoutFileUsesReferenceConf() {
        Config config = ConfigLoader.load(null);

        assertThat(ConfigLoader.modelParameters(config)).isEqualTo(ModelParameters.defaults());
        assertThat(ConfigLoader.runSettings(config)).isEqualTo(new RunSettings(42L, 1000L, 100));
        assertThat(config.getString("logging.format")).isEqualTo("PLAIN");
    }

    @Test
    @DisplayName("Run settings honour overrides and reject bad values")
    void runSettings_validatesAndOverrides() {
        System.setProperty("resilience.simulation.ticks", "-5");
        ConfigFactory.invalidateCaches();
        Config config = ConfigLoader.load(null);

        assertThatThrownBy(() -> ConfigLoader.runSettings(config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ticks must be >= 0");

        RunSettings settings = new RunSettings(1L, 10L, 5).withOverrides(null, 20L, null);
        assertThat(settings).isEqualTo(new RunSettings(1L, 20L, 5));
        assertThatThrownBy(() -> settings.withOverrides(null, null, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("report-interval");
    }

    @Test
    @DisplayName("A configuration without the model or run block is rejected")
    void blocks_missingBlockIsRejected() {
        Config empty = ConfigFactory.empty();

        assertThatThrownBy(() -> ConfigLoader.modelParameters(empty))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(ModelParameters.CONFIG_PATH);
        assertThatThrownBy(() -> ConfigLoader.runSettings(empty))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(ConfigLoader.SIMULATION_PATH);
    }

    @Test
    @DisplayName("resolve uses an explicit file and reports it")
    void resolve_usesExplicitFile() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
            (level, message) -> messages.add(level + ":" + message));

        assertThat(config.getInt("resilience.model.width")).isEqualTo(8);
        assertThat(messages).singleElement().asString().startsWith("INFO:").contains("--config");
    }

    @Test
    @DisplayName("resolve rejects a missing explicit file")
    void resolve_rejectsMissingExplicitFile() {
        File missing = new File("does-not-exist/resilience.conf");

        assertThatThrownBy(() -> ConfigLoader.resolve(missing, (level, message) -> { }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not found");
    }

    private static File testResource(String name) {
        URL url = ConfigLoaderTest.class.getClassLoader().getResource(name);
        assertThat(url).as("test resource %s", name).isNotNull();
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
