package io.xsdbind.core.converter;

import io.xsdbind.core.particle.ElementDecl;
import io.xsdbind.core.spi.ContentItem;
import io.xsdbind.core.spi.Converter;
import io.xsdbind.core.spi.ElementData;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.xml.namespace.QName;

/**
 * Map/list converter. An element with attributes or children becomes a map: attributes under
 * {@code attrPrefix + name}, the text under {@code textKey}, each child under its name (a list
 * when the child repeats), mixed character data under {@code cdataPrefix + index}. An element with
 * text only becomes its text value.
 *
 * <p>Names are rendered as {@code prefix:local} when the namespace has a prefix in
 * {@link ConverterOptions#namespaces()}, as the local part in the default namespace or without
 * namespace, and as {@code {uri}local} otherwise.
 */
public final class DefaultConverter implements Converter {

    private final ConverterOptions options;
    private final Map<String, String> prefixes = new LinkedHashMap<>();

    public DefaultConverter() {
        this(ConverterOptions.DEFAULT);
    }

    public DefaultConverter(ConverterOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        options.namespaces().forEach((prefix, uri) -> prefixes.putIfAbsent(uri, prefix));
    }

    public ConverterOptions options() {
        return options;
    }

    @Override
    public Object elementDecode(ElementData data, ElementDecl decl, int level) {
        Object value = decodeBody(data);
        if (level == 0 && options.preserveRoot()) {
            Map<String, Object> root = options.mapSupplier().get();
            root.put(render(data.tag()), value);
            return root;
        }
        return value;
    }

    private Object decodeBody(ElementData data) {
        boolean keepAttributes = options.attrPrefix() != null && !data.attributes().isEmpty();
        boolean hasChildren = data.content().stream().anyMatch(ContentItem.Child.class::isInstance);
        boolean keepCdata = options.cdataPrefix() != null
                && data.content().stream().anyMatch(ContentItem.CharData.class::isInstance);
        if (!keepAttributes && !hasChildren && !keepCdata) {
            return data.text();
        }
        Map<String, Object> map = options.mapSupplier().get();
        if (keepAttributes) {
            data.attributes().forEach((name, v) -> map.put(options.attrPrefix() + render(name), v));
        }
        if (data.text() != null) {
            map.put(options.textKey(), data.text());
        }
        for (ContentItem item : data.content()) {
            if (item instanceof ContentItem.Child child) {
                putChild(map, render(child.name()), child.value(), child.repeatable());
            } else if (item instanceof ContentItem.CharData cd && options.cdataPrefix() != null) {
                map.put(options.cdataPrefix() + cd.index(), cd.text());
            }
        }
        return map;
    }

    @SuppressWarnings("unchecked")
    private void putChild(Map<String, Object> map, String key, Object value, boolean repeatable) {
        Object existing = map.get(key);
        if (existing == null && !map.containsKey(key)) {
            if (repeatable || options.forceList()) {
                List<Object> list = options.listSupplier().get();
                list.add(value);
                map.put(key, list);
            } else {
                map.put(key, value);
            }
            return;
        }
        if (existing instanceof List<?> && (repeatable || options.forceList())) {
            ((List<Object>) existing).add(value);
            return;
        }
        // a name seen twice under a single particle: keep both values
        List<Object> list = options.listSupplier().get();
        list.add(existing);
        list.add(value);
        map.put(key, list);
    }

    @Override
    public ElementData elementEncode(Object value, ElementDecl decl, int level) {
        QName tag = decl != null ? decl.name() : new QName("");
        Object body = value;
        if (level == 0 && options.preserveRoot()) {
            if (!(value instanceof Map<?, ?> root) || root.size() != 1) {
                throw new IllegalArgumentException("a preserved root must be a map with a single entry");
            }
            body = root.values().iterator().next();
        }
        if (!(body instanceof Map<?, ?> map)) {
            return ElementData.ofText(tag, body);
        }
        Object text = null;
        Map<QName, Object> attributes = new LinkedHashMap<>();
        List<ContentItem> content = new ArrayList<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            String key = String.valueOf(e.getKey());
            if (key.equals(options.textKey())) {
                text = e.getValue();
            } else if (options.attrPrefix() != null && !options.attrPrefix().isEmpty() && key.startsWith(options.attrPrefix())) {
                attributes.put(parse(key.substring(options.attrPrefix().length()), false), e.getValue());
            } else if (options.cdataPrefix() != null && key.startsWith(options.cdataPrefix())) {
                content.add(new ContentItem.CharData(cdataIndex(key), String.valueOf(e.getValue())));
            } else {
                content.add(new ContentItem.Child(parse(key, true), e.getValue(), null, e.getValue() instanceof List));
            }
        }
        return new ElementData(tag, text, content, attributes);
    }

    /** Renders a qualified name as a map key. */
    public String render(QName name) {
        String uri = name.getNamespaceURI();
        if (uri.isEmpty()) {
            return name.getLocalPart();
        }
        String prefix = prefixes.get(uri);
        if (prefix == null) {
            return "{" + uri + "}" + name.getLocalPart();
        }
        return prefix.isEmpty() ? name.getLocalPart() : prefix + ":" + name.getLocalPart();
    }

    /**
     * Parses a map key into a qualified name. Unprefixed element names take the default
     * namespace, unprefixed attribute names have none.
     *
     * @throws IllegalArgumentException for an unknown prefix
     */
    public QName parse(String key, boolean element) {
        if (key.startsWith("{")) {
            int end = key.indexOf('}');
            if (end < 0) {
                throw new IllegalArgumentException("malformed name '" + key + "'");
            }
            return new QName(key.substring(1, end), key.substring(end + 1));
        }
        int colon = key.indexOf(':');
        if (colon < 0) {
            String defaultNs = element ? options.namespaces().get("") : null;
            return defaultNs == null ? new QName(key) : new QName(defaultNs, key);
        }
        String prefix = key.substring(0, colon);
        String uri = options.namespaces().get(prefix);
        if (uri == null) {
            throw new IllegalArgumentException("unknown namespace prefix '" + prefix + "' in '" + key + "'");
        }
        return new QName(uri, key.substring(colon + 1), prefix);
    }

    private int cdataIndex(String key) {
        String digits = key.substring(options.cdataPrefix().length());
        try {
            return digits.isEmpty() ? 0 : Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("malformed character data key '" + key + "'", e);
        }
    }
}
