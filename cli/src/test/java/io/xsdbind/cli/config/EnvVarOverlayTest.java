package io.xsdbind.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.xsdbind.core.model.ValidationMode;
import io.xsdbind.core.model.XsdVersion;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Environment variable overlay on {@link ConfigLoader}.
 *
 * <p>Variables win over YAML values. A variable counts as set only if it is defined and its trimmed
 * value is non-empty. The lookup is a map so the real environment is never consulted.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path minimalConfigPath;
    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        minimalConfigPath = ConfigLoaderTest.fixture("minimal-config.yaml");
        fullConfigPath = ConfigLoaderTest.fixture("full-config.yaml");
        envVars.clear();
    }

    @Nested
    @DisplayName("string and enum overrides")
    class StringOverrides {

        @Test
        void modesAndVersion() {
            envVars.put("XSDBIND_SCHEMA_MODE", "skip");
            envVars.put("XSDBIND_SCHEMA_VERSION", "1.1");
            envVars.put("XSDBIND_INSTANCE_MODE", " LAX ");

            CliConfig config = ConfigLoader.load(minimalConfigPath, envLookup());

            assertThat(config.schemaMode()).isEqualTo(ValidationMode.SKIP);
            assertThat(config.xsdVersion()).isEqualTo(XsdVersion.V1_1);
            assertThat(config.instanceMode()).isEqualTo(ValidationMode.LAX);
        }

        @Test
        void converterKeys() {
            envVars.put("XSDBIND_ATTR_PREFIX", "_");
            envVars.put("XSDBIND_TEXT_KEY", "value");
            envVars.put("XSDBIND_CDATA_PREFIX", "~");

            CliConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.attrPrefix()).isEqualTo("_");
            assertThat(config.textKey()).isEqualTo("value");
            assertThat(config.cdataPrefix()).isEqualTo("~");
        }

        @Test
        void logging() {
            envVars.put("XSDBIND_LOG_FORMAT", "text");
            envVars.put("XSDBIND_LOG_LEVEL", "TRACE");

            CliConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("TRACE");
        }
    }

    @Nested
    @DisplayName("integer overrides")
    class IntegerOverrides {

        @Test
        void depthLimits() {
            envVars.put("XSDBIND_MAX_MODEL_DEPTH", "4");
            envVars.put("XSDBIND_MAX_DEPTH", "32");

            CliConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.maxModelDepth()).isEqualTo(4);
            assertThat(config.maxDepth()).isEqualTo(32);
        }

        @Test
        void nonNumericValueIsAConfigurationError() {
            envVars.put("XSDBIND_MAX_DEPTH", "deep");

            assertThatThrownBy(() -> ConfigLoader.load(minimalConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("XSDBIND_MAX_DEPTH must be an integer, got 'deep'");
        }

        @Test
        void nonPositiveDepthIsRejected() {
            envVars.put("XSDBIND_MAX_MODEL_DEPTH", "0");

            assertThatThrownBy(() -> ConfigLoader.load(minimalConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("depth limits must be positive");
        }
    }

    @Nested
    @DisplayName("boolean overrides")
    class BooleanOverrides {

        @Test
        void flagsTurnedOff() {
            envVars.put("XSDBIND_UNORDERED", "false");
            envVars.put("XSDBIND_FORCE_LIST", "false");
            envVars.put("XSDBIND_PRESERVE_ROOT", "false");

            CliConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.unordered()).isFalse();
            assertThat(config.forceList()).isFalse();
            assertThat(config.preserveRoot()).isFalse();
        }

        @Test
        void flagsTurnedOn() {
            envVars.put("XSDBIND_FILL_DEFAULTS", "true");
            envVars.put("XSDBIND_OUTPUT_INDENT", "TRUE");

            CliConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.fillDefaults()).isTrue();
            assertThat(config.indent()).isTrue();
        }
    }

    @Nested
    @DisplayName("unset variables")
    class Unset {

        @Test
        @DisplayName("empty and blank values leave the YAML value in place")
        void blankValuesAreIgnored() {
            envVars.put("XSDBIND_INSTANCE_MODE", "");
            envVars.put("XSDBIND_MAX_DEPTH", "   ");

            CliConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.instanceMode()).isEqualTo(ValidationMode.SKIP);
            assertThat(config.maxDepth()).isEqualTo(64);
        }

        @Test
        void unrelatedVariablesAreIgnored() {
            envVars.put("MAX_DEPTH", "1");
            envVars.put("XSD_BIND_MAX_DEPTH", "1");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).maxDepth()).isEqualTo(64);
        }
    }
}
