package io.xsdbind.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.xsdbind.core.converter.ConverterOptions;
import io.xsdbind.core.model.ValidationMode;
import io.xsdbind.core.model.XsdVersion;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** YAML parsing of the command line configuration, without environment overrides. */
@DisplayName("YAML config loader")
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource("config/" + name).toURI());
    }

    @Nested
    @DisplayName("minimal config")
    class MinimalConfig {

        @Test
        @DisplayName("explicit key is read, everything else takes its default")
        void explicitValueAndDefaults() throws Exception {
            CliConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), NO_ENV);

            assertThat(config.instanceMode()).isEqualTo(ValidationMode.STRICT);

            assertThat(config.schemaMode()).isEqualTo(ValidationMode.STRICT);
            assertThat(config.xsdVersion()).isEqualTo(XsdVersion.V1_0);
            assertThat(config.maxModelDepth()).isEqualTo(15);
            assertThat(config.maxDepth()).isEqualTo(9999);
            assertThat(config.fillDefaults()).isTrue();
            assertThat(config.unordered()).isFalse();
            assertThat(config.attrPrefix()).isEqualTo("@");
            assertThat(config.textKey()).isEqualTo("$");
            assertThat(config.cdataPrefix()).isNull();
            assertThat(config.namespaces()).isEmpty();
            assertThat(config.indent()).isTrue();
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        void emptyFileMeansDefaults() throws Exception {
            assertThat(ConfigLoader.load(fixture("empty.yaml"), NO_ENV)).isEqualTo(CliConfig.builder().build());
        }
    }

    @Nested
    @DisplayName("full config")
    class FullConfig {

        @Test
        void everyKeyIsMapped() throws Exception {
            CliConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV);

            assertThat(config.schemaMode()).isEqualTo(ValidationMode.LAX);
            assertThat(config.xsdVersion()).isEqualTo(XsdVersion.V1_1);
            assertThat(config.maxModelDepth()).isEqualTo(8);
            assertThat(config.instanceMode()).isEqualTo(ValidationMode.SKIP);
            assertThat(config.maxDepth()).isEqualTo(64);
            assertThat(config.fillDefaults()).isFalse();
            assertThat(config.unordered()).isTrue();
            assertThat(config.attrPrefix()).isEqualTo("-");
            assertThat(config.textKey()).isEqualTo("#text");
            assertThat(config.cdataPrefix()).isEqualTo("#");
            assertThat(config.forceList()).isTrue();
            assertThat(config.preserveRoot()).isTrue();
            assertThat(config.namespaces()).containsExactly(Map.entry("po", "urn:po"), Map.entry("ext", "urn:ext"));
            assertThat(config.indent()).isFalse();
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        @DisplayName("derived core options carry the configured values")
        void coreOptions() throws Exception {
            CliConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV);

            assertThat(config.buildOptions().mode()).isEqualTo(ValidationMode.LAX);
            assertThat(config.buildOptions().maxModelDepth()).isEqualTo(8);
            assertThat(config.decodeOptions().fillDefaults()).isFalse();
            assertThat(config.encodeOptions().unordered()).isTrue();

            ConverterOptions converter = config.converterOptions("urn:po");
            assertThat(converter.attrPrefix()).isEqualTo("-");
            assertThat(converter.namespaces()).doesNotContainKey("");
        }

        @Test
        @DisplayName("target namespace becomes the default prefix when none is configured")
        void targetNamespaceAsDefault() {
            ConverterOptions converter = CliConfig.builder().build().converterOptions("urn:po");

            assertThat(converter.namespaces()).containsExactly(Map.entry("", "urn:po"));
            assertThat(CliConfig.builder().build().converterOptions("").namespaces()).isEmpty();
        }

        @Test
        void nullValueClearsAPrefix() throws Exception {
            assertThat(ConfigLoader.load(fixture("null-attributes.yaml"), NO_ENV).attrPrefix()).isNull();
        }
    }

    @Nested
    @DisplayName("error handling")
    class ErrorHandling {

        @Test
        void missingFile() {
            assertThatThrownBy(() -> ConfigLoader.load(Path.of("does/not/exist.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found");
        }

        @Test
        void malformedYaml() throws Exception {
            Path broken = fixture("broken.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(broken, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML configuration")
                    .hasCauseInstanceOf(java.io.IOException.class);
        }

        @Test
        void rootMustBeAMapping() throws Exception {
            Path list = fixture("list-root.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(list, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration root must be a mapping");
        }

        @Test
        void invalidValueNamesTheSource() throws Exception {
            Path bad = fixture("bad-mode.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(bad, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Invalid configuration (" + bad + ")")
                    .hasMessageContaining("Unknown validation mode 'sloppy'");
        }

        @Test
        void configFlagWithoutPath() {
            assertThatThrownBy(() -> ConfigLoader.explicitConfigPath(new String[] {"validate", "--config"}))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("--config requires a file path argument");
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        void explicitConfigWins() throws Exception {
            String path = fixture("full-config.yaml").toString();

            CliConfig config = ConfigLoader.resolve(new String[] {"--config", path, "validate", "s.yaml", "a.xml"}, NO_ENV);

            assertThat(config.instanceMode()).isEqualTo(ValidationMode.SKIP);
        }

        @Test
        void explicitConfigMustExist() {
            assertThatThrownBy(() -> ConfigLoader.resolve(new String[] {"--config", "nowhere.yaml"}, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class);
        }

        @Test
        void noConfigFlagFallsBackToDefaultsWithOverrides() {
            CliConfig config = ConfigLoader.resolve(
                    new String[] {"validate", "s.yaml", "a.xml"}, Map.of("XSDBIND_LOG_LEVEL", "ERROR")::get);

            assertThat(config.loggingLevel()).isEqualTo("ERROR");
            assertThat(config.instanceMode()).isEqualTo(ValidationMode.LAX);
        }
    }
}
