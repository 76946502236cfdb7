package io.xsdbind.cli.config;

import io.xsdbind.core.converter.ConverterOptions;
import io.xsdbind.core.model.BuildOptions;
import io.xsdbind.core.model.DecodeOptions;
import io.xsdbind.core.model.EncodeOptions;
import io.xsdbind.core.model.ValidationMode;
import io.xsdbind.core.model.XsdVersion;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of the {@code xsd-bind} command line tool.
 *
 * <p>Every field has a default; use {@link #builder()} to construct instances. The core option
 * records are derived on demand with {@link #buildOptions()}, {@link #decodeOptions()},
 * {@link #encodeOptions()} and {@link #converterOptions(String)}.
 *
 * @param schemaMode    build-time mode for schema documents
 * @param xsdVersion    default schema language version, a document's own {@code version} wins
 * @param maxModelDepth maximum nesting of model groups
 * @param instanceMode  mode for decoding and encoding instances
 * @param maxDepth      maximum element nesting depth of instances
 * @param fillDefaults  fill absent attributes and empty elements with default/fixed values
 * @param unordered     encode children in value order without content model checks
 * @param attrPrefix    attribute key prefix, {@code null} drops attributes
 * @param textKey       key of element text next to attributes or children
 * @param cdataPrefix   mixed content key prefix, {@code null} drops mixed text
 * @param forceList     put every child value in a list
 * @param preserveRoot  wrap the decoded root in a map keyed by its name
 * @param namespaces    prefix to namespace URI map for key rendering
 * @param indent        indent XML output
 * @param loggingFormat json or text
 * @param loggingLevel  root log level
 */
public record CliConfig(
        ValidationMode schemaMode,
        XsdVersion xsdVersion,
        int maxModelDepth,
        ValidationMode instanceMode,
        int maxDepth,
        boolean fillDefaults,
        boolean unordered,
        String attrPrefix,
        String textKey,
        String cdataPrefix,
        boolean forceList,
        boolean preserveRoot,
        Map<String, String> namespaces,
        boolean indent,
        String loggingFormat,
        String loggingLevel) {

    public CliConfig {
        Objects.requireNonNull(schemaMode, "schemaMode must not be null");
        Objects.requireNonNull(xsdVersion, "xsdVersion must not be null");
        Objects.requireNonNull(instanceMode, "instanceMode must not be null");
        if (maxModelDepth <= 0 || maxDepth <= 0) {
            throw new IllegalArgumentException(
                    "depth limits must be positive, got max-model-depth=" + maxModelDepth + ", max-depth=" + maxDepth);
        }
        namespaces = namespaces == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(namespaces));
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    public BuildOptions buildOptions() {
        return new BuildOptions(schemaMode, xsdVersion, maxModelDepth);
    }

    public DecodeOptions decodeOptions() {
        return new DecodeOptions(maxDepth, fillDefaults);
    }

    public EncodeOptions encodeOptions() {
        return new EncodeOptions(unordered, maxDepth);
    }

    /**
     * Converter options for a schema. Without configured namespaces the target namespace becomes
     * the default (unprefixed) namespace, so keys of the schema's own elements carry no prefix.
     */
    public ConverterOptions converterOptions(String targetNamespace) {
        Map<String, String> ns = new LinkedHashMap<>(namespaces);
        if (!ns.containsKey("") && targetNamespace != null && !targetNamespace.isEmpty()) {
            ns.put("", targetNamespace);
        }
        return ConverterOptions.builder()
                .attrPrefix(attrPrefix)
                .textKey(textKey)
                .cdataPrefix(cdataPrefix)
                .forceList(forceList)
                .preserveRoot(preserveRoot)
                .namespaces(ns)
                .build();
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {
        private ValidationMode schemaMode = ValidationMode.STRICT;
        private XsdVersion xsdVersion = XsdVersion.V1_0;
        private int maxModelDepth = 15;
        private ValidationMode instanceMode = ValidationMode.LAX;
        private int maxDepth = 9999;
        private boolean fillDefaults = true;
        private boolean unordered;
        private String attrPrefix = "@";
        private String textKey = "$";
        private String cdataPrefix;
        private boolean forceList;
        private boolean preserveRoot;
        private Map<String, String> namespaces = new LinkedHashMap<>();
        private boolean indent = true;
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        Builder() {}

        public Builder schemaMode(ValidationMode schemaMode) {
            this.schemaMode = schemaMode;
            return this;
        }

        public Builder xsdVersion(XsdVersion xsdVersion) {
            this.xsdVersion = xsdVersion;
            return this;
        }

        public Builder maxModelDepth(int maxModelDepth) {
            this.maxModelDepth = maxModelDepth;
            return this;
        }

        public Builder instanceMode(ValidationMode instanceMode) {
            this.instanceMode = instanceMode;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder fillDefaults(boolean fillDefaults) {
            this.fillDefaults = fillDefaults;
            return this;
        }

        public Builder unordered(boolean unordered) {
            this.unordered = unordered;
            return this;
        }

        public Builder attrPrefix(String attrPrefix) {
            this.attrPrefix = attrPrefix;
            return this;
        }

        public Builder textKey(String textKey) {
            this.textKey = textKey;
            return this;
        }

        public Builder cdataPrefix(String cdataPrefix) {
            this.cdataPrefix = cdataPrefix;
            return this;
        }

        public Builder forceList(boolean forceList) {
            this.forceList = forceList;
            return this;
        }

        public Builder preserveRoot(boolean preserveRoot) {
            this.preserveRoot = preserveRoot;
            return this;
        }

        public Builder namespace(String prefix, String uri) {
            this.namespaces.put(prefix, uri);
            return this;
        }

        public Builder indent(boolean indent) {
            this.indent = indent;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CliConfig build() {
            return new CliConfig(
                    schemaMode,
                    xsdVersion,
                    maxModelDepth,
                    instanceMode,
                    maxDepth,
                    fillDefaults,
                    unordered,
                    attrPrefix,
                    textKey,
                    cdataPrefix,
                    forceList,
                    preserveRoot,
                    namespaces,
                    indent,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
