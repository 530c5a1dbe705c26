package org.metalineage.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.metalineage.pipeline.api.errors.ConfigurationException;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Unit tests for {@link ConfigLoader} to verify the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Environment Variables</li>
 *   <li>Configuration File</li>
 *   <li>Default reference configuration (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("test.nested.setting");
        System.clearProperty("metalineage.limiter.max-candidates");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should load configuration file with defaults when no overrides present")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertThat(config.getString("test.value")).isEqualTo("file-value");
        assertThat(config.getString("test.priority")).isEqualTo("file-priority");
        assertThat(config.getString("test.nested.setting")).isEqualTo("file-nested");
        assertThat(config.getInt("metalineage.limiter.max-candidates")).isEqualTo(250);
        assertThat(config.getBoolean("metalineage.limiter.dedupe")).isTrue();
        assertThat(config.getString("metalineage.selection.initial-threshold")).isEqualTo("0.90");
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("metalineage.limiter.max-candidates", "100");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertThat(config.getString("test.value")).isEqualTo("system-value");
        assertThat(config.getString("test.priority")).isEqualTo("file-priority");
        assertThat(config.getInt("metalineage.limiter.max-candidates")).isEqualTo(100);
    }

    @Test
    @DisplayName("System property should override nested configuration values")
    void loadFromFile_systemPropertyShouldOverrideNestedConfig() {
        System.setProperty("test.nested.setting", "system-nested");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertThat(config.getString("test.nested.setting")).isEqualTo("system-nested");
        assertThat(config.getString("test.value")).isEqualTo("file-value");
    }

    @Test
    void loadDefaults_shouldExposeReferenceConfiguration() {
        Config config = ConfigLoader.loadDefaults();

        assertThat(config.getInt("metalineage.limiter.max-candidates")).isEqualTo(5000);
        assertThat(config.getDouble("metalineage.consensus.margin")).isEqualTo(0.10);
        assertThat(config.getBoolean("metalineage.profile.renormalize")).isFalse();
        assertThat(config.getString("logging.format")).isEqualTo("COLOR");
    }

    @Test
    void resolve_explicitFileShouldWinAndBeReported() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
                (level, message) -> messages.add(level + " " + message));

        assertThat(config.getInt("metalineage.limiter.max-candidates")).isEqualTo(250);
        assertThat(messages).singleElement().asString().startsWith("INFO Using configuration file");
    }

    @Test
    void resolve_missingExplicitFileShouldFail() {
        File missing = tempDir.resolve("missing.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.resolve(missing, (level, message) -> { }))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void resolve_missingConfigFilePropertyTargetShouldFail() {
        System.setProperty("config.file", tempDir.resolve("missing.conf").toString());

        assertThatThrownBy(() -> ConfigLoader.resolve(null, (level, message) -> { }))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("-Dconfig.file");
    }

    @Test
    void loadFromFile_invalidSyntaxShouldBeAConfigurationError() throws IOException {
        Path broken = Files.writeString(tempDir.resolve("broken.conf"), "metalineage { limiter = [ \n");

        assertThatThrownBy(() -> ConfigLoader.loadFromFile(broken.toFile()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid configuration");
    }

    private File testResource(String name) {
        URL url = getClass().getClassLoader().getResource(name);
        assertThat(url).as("test resource %s", name).isNotNull();
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
