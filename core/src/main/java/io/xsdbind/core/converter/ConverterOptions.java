package io.xsdbind.core.converter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Options of the {@link DefaultConverter}.
 *
 * @param attrPrefix   key prefix of attributes, {@code null} to drop attributes on decode
 * @param textKey      key of the element text when the element also has attributes or children
 * @param cdataPrefix  key prefix of mixed character data, {@code null} to drop it
 * @param mapSupplier  container for element maps (unique keys)
 * @param listSupplier container for repeated children
 * @param namespaces   prefix to namespace URI map used to render and parse names; the empty
 *                     prefix maps the default namespace
 * @param forceList    put every child value in a list, repeatable or not
 * @param preserveRoot wrap the root value in a single-entry map keyed by the root name
 */
public record ConverterOptions(
        String attrPrefix,
        String textKey,
        String cdataPrefix,
        Supplier<Map<String, Object>> mapSupplier,
        Supplier<List<Object>> listSupplier,
        Map<String, String> namespaces,
        boolean forceList,
        boolean preserveRoot) {

    public static final ConverterOptions DEFAULT = builder().build();

    public ConverterOptions {
        Objects.requireNonNull(textKey, "textKey must not be null");
        Objects.requireNonNull(mapSupplier, "mapSupplier must not be null");
        Objects.requireNonNull(listSupplier, "listSupplier must not be null");
        namespaces = namespaces == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(namespaces));
        if (textKey.isEmpty()) {
            throw new IllegalArgumentException("textKey must not be empty");
        }
        if (attrPrefix != null && cdataPrefix != null && attrPrefix.equals(cdataPrefix)) {
            throw new IllegalArgumentException("attrPrefix and cdataPrefix must differ, both are '" + attrPrefix + "'");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .attrPrefix(attrPrefix)
                .textKey(textKey)
                .cdataPrefix(cdataPrefix)
                .mapSupplier(mapSupplier)
                .listSupplier(listSupplier)
                .namespaces(namespaces)
                .forceList(forceList)
                .preserveRoot(preserveRoot);
    }

    /** Builder for {@link ConverterOptions}; defaults: {@code @} attributes, {@code $} text, no cdata. */
    public static final class Builder {

        private String attrPrefix = "@";
        private String textKey = "$";
        private String cdataPrefix;
        private Supplier<Map<String, Object>> mapSupplier = LinkedHashMap::new;
        private Supplier<List<Object>> listSupplier = ArrayList::new;
        private Map<String, String> namespaces = Map.of();
        private boolean forceList;
        private boolean preserveRoot;

        private Builder() {}

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

        public Builder mapSupplier(Supplier<Map<String, Object>> mapSupplier) {
            this.mapSupplier = mapSupplier;
            return this;
        }

        public Builder listSupplier(Supplier<List<Object>> listSupplier) {
            this.listSupplier = listSupplier;
            return this;
        }

        public Builder namespaces(Map<String, String> namespaces) {
            this.namespaces = namespaces;
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

        public ConverterOptions build() {
            return new ConverterOptions(
                    attrPrefix, textKey, cdataPrefix, mapSupplier, listSupplier, namespaces, forceList, preserveRoot);
        }
    }
}
