package io.xsdbind.core.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.xml.namespace.QName;

/**
 * Intermediate representation of one element, passed to {@link Converter#elementDecode} and
 * returned by {@link Converter#elementEncode}.
 *
 * @param tag        element name
 * @param text       simple content value: decoded native value on decode, native value or
 *                   lexical string on encode; {@code null} when absent
 * @param content    ordered children and mixed character data
 * @param attributes attribute values keyed by name, in declaration order
 */
public record ElementData(QName tag, Object text, List<ContentItem> content, Map<QName, Object> attributes) {

    public ElementData {
        Objects.requireNonNull(tag, "tag must not be null");
        content = content == null ? List.of() : Collections.unmodifiableList(content);
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /** Element data with text only. */
    public static ElementData ofText(QName tag, Object text) {
        return new ElementData(tag, text, List.of(), Map.of());
    }
}
