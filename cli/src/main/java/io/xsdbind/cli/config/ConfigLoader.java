package io.xsdbind.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.xsdbind.core.model.ValidationMode;
import io.xsdbind.core.model.XsdVersion;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link CliConfig} from a YAML file with an environment variable overlay.
 *
 * <p>The file is {@code xsd-bind.yaml} in the current directory, or the path given with
 * {@code --config}. A missing default file means built-in defaults; a missing explicit file is an
 * error.
 *
 * <p>Every scalar key can be overridden by an {@code XSDBIND_*} environment variable. A variable
 * counts as set only if it is defined and non-blank after trimming.
 *
 * <pre>
 * schema:    { mode: strict, version: "1.0", max-model-depth: 15 }
 * instance:  { mode: lax, max-depth: 9999, fill-defaults: true, unordered: false }
 * converter: { attr-prefix: "@", text-key: "$", cdata-prefix: ~, force-list: false,
 *              preserve-root: false, namespaces: { p: "urn:example" } }
 * output:    { indent: true }
 * logging:   { format: text, level: WARN }
 * </pre>
 */
public final class ConfigLoader {

    static final String DEFAULT_CONFIG_FILE = "xsd-bind.yaml";
    static final String ENV_PREFIX = "XSDBIND_";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a configuration file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a configuration file, applying overrides from the supplied lookup. The lookup returns
     * {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = MissingNode.getInstance();
        } else if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }
        return mapToConfig(root, envLookup, configPath.toString());
    }

    /**
     * Resolves the configuration for a command line: the {@code --config} file if given, else the
     * default file if present, else the built-in defaults. Overrides are applied in every case.
     *
     * @throws ConfigLoadException if {@code --config} has no argument or the configuration is invalid
     */
    public static CliConfig resolve(String[] args, Function<String, String> envLookup) {
        Path explicit = explicitConfigPath(args);
        if (explicit != null) {
            return load(explicit, envLookup);
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.exists(fallback)) {
            return load(fallback, envLookup);
        }
        return mapToConfig(MissingNode.getInstance(), envLookup, "defaults");
    }

    /** Returns the {@code --config} argument, or {@code null} if there is none. */
    static Path explicitConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new ConfigLoadException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return null;
    }

    private static CliConfig mapToConfig(JsonNode root, Function<String, String> envLookup, String source) {
        try {
            CliConfig.Builder builder = CliConfig.builder();

            JsonNode schema = root.path("schema");
            if (schema.has("mode")) builder.schemaMode(ValidationMode.fromString(schema.get("mode").asText()));
            if (schema.has("version")) builder.xsdVersion(XsdVersion.fromLabel(schema.get("version").asText()));
            if (schema.has("max-model-depth")) builder.maxModelDepth(schema.get("max-model-depth").asInt());

            JsonNode instance = root.path("instance");
            if (instance.has("mode")) builder.instanceMode(ValidationMode.fromString(instance.get("mode").asText()));
            if (instance.has("max-depth")) builder.maxDepth(instance.get("max-depth").asInt());
            if (instance.has("fill-defaults")) builder.fillDefaults(instance.get("fill-defaults").asBoolean());
            if (instance.has("unordered")) builder.unordered(instance.get("unordered").asBoolean());

            JsonNode converter = root.path("converter");
            if (converter.has("attr-prefix")) builder.attrPrefix(textOrNull(converter, "attr-prefix"));
            if (converter.has("text-key")) builder.textKey(textOrNull(converter, "text-key"));
            if (converter.has("cdata-prefix")) builder.cdataPrefix(textOrNull(converter, "cdata-prefix"));
            if (converter.has("force-list")) builder.forceList(converter.get("force-list").asBoolean());
            if (converter.has("preserve-root")) builder.preserveRoot(converter.get("preserve-root").asBoolean());
            JsonNode namespaces = converter.path("namespaces");
            if (namespaces.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> it = namespaces.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> entry = it.next();
                    builder.namespace(entry.getKey(), entry.getValue().asText());
                }
            }

            JsonNode output = root.path("output");
            if (output.has("indent")) builder.indent(output.get("indent").asBoolean());

            JsonNode logging = root.path("logging");
            if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
            if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

            applyEnvOverrides(builder, envLookup);
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration (" + source + "): " + e.getMessage(), e);
        }
    }

    private static void applyEnvOverrides(CliConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "SCHEMA_MODE", v -> builder.schemaMode(ValidationMode.fromString(v)));
        envString(envLookup, "SCHEMA_VERSION", v -> builder.xsdVersion(XsdVersion.fromLabel(v)));
        envInt(envLookup, "MAX_MODEL_DEPTH", builder::maxModelDepth);

        envString(envLookup, "INSTANCE_MODE", v -> builder.instanceMode(ValidationMode.fromString(v)));
        envInt(envLookup, "MAX_DEPTH", builder::maxDepth);
        envBool(envLookup, "FILL_DEFAULTS", builder::fillDefaults);
        envBool(envLookup, "UNORDERED", builder::unordered);

        envString(envLookup, "ATTR_PREFIX", builder::attrPrefix);
        envString(envLookup, "TEXT_KEY", builder::textKey);
        envString(envLookup, "CDATA_PREFIX", builder::cdataPrefix);
        envBool(envLookup, "FORCE_LIST", builder::forceList);
        envBool(envLookup, "PRESERVE_ROOT", builder::preserveRoot);

        envBool(envLookup, "OUTPUT_INDENT", builder::indent);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String name) {
        String value = envLookup.apply(ENV_PREFIX + name);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String name, Consumer<String> setter) {
        if (isSet(envLookup, name)) {
            setter.accept(envLookup.apply(ENV_PREFIX + name).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String name, IntConsumer setter) {
        if (isSet(envLookup, name)) {
            String raw = envLookup.apply(ENV_PREFIX + name).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(ENV_PREFIX + name + " must be an integer, got '" + raw + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String name, Consumer<Boolean> setter) {
        if (isSet(envLookup, name)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(ENV_PREFIX + name).trim()));
        }
    }

    // --- YAML helpers ---

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
