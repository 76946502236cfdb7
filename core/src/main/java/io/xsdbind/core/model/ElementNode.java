package io.xsdbind.core.model;

import io.xsdbind.core.spi.MarkupNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.xml.namespace.QName;

/**
 * Immutable in-memory element. Produced by the encode pipeline and by the DOM reader; usable
 * anywhere a {@link MarkupNode} is expected.
 *
 * <p>Thread-safe.
 */
public final class ElementNode implements MarkupNode {

    private final QName tag;
    private final Map<QName, String> attributes;
    private final List<ElementNode> children;
    private final String text;
    private final String tail;

    private ElementNode(Builder builder) {
        this.tag = Objects.requireNonNull(builder.tag, "tag must not be null");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.children = List.copyOf(builder.children);
        this.text = builder.text;
        this.tail = builder.tail;
    }

    public static Builder builder(QName tag) {
        return new Builder(tag);
    }

    @Override
    public QName tag() {
        return tag;
    }

    @Override
    public Map<QName, String> attributes() {
        return attributes;
    }

    @Override
    public List<ElementNode> children() {
        return children;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public String tail() {
        return tail;
    }

    /** Returns a copy of this node carrying the given tail. */
    public ElementNode withTail(String newTail) {
        return toBuilder().tail(newTail).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(tag).text(text).tail(tail);
        b.attributes.putAll(attributes);
        b.children.addAll(children);
        return b;
    }

    /** Copies any markup node into an {@code ElementNode} tree. */
    public static ElementNode copyOf(MarkupNode node) {
        if (node instanceof ElementNode en) {
            return en;
        }
        Builder b = builder(node.tag()).text(node.text()).tail(node.tail());
        node.attributes().forEach(b::attribute);
        for (MarkupNode child : node.children()) {
            b.child(copyOf(child));
        }
        return b.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ElementNode other)) {
            return false;
        }
        return tag.equals(other.tag)
                && attributes.equals(other.attributes)
                && children.equals(other.children)
                && Objects.equals(text, other.text)
                && Objects.equals(tail, other.tail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, attributes, children, text, tail);
    }

    @Override
    public String toString() {
        return "ElementNode[" + tag + ", attributes=" + attributes + ", children=" + children.size()
                + (text != null ? ", text='" + text + "'" : "") + "]";
    }

    /** Builder for {@link ElementNode}. */
    public static final class Builder {

        private final QName tag;
        private final Map<QName, String> attributes = new LinkedHashMap<>();
        private final List<ElementNode> children = new ArrayList<>();
        private String text;
        private String tail;

        private Builder(QName tag) {
            this.tag = tag;
        }

        public Builder attribute(QName name, String value) {
            attributes.put(name, value);
            return this;
        }

        public Builder attribute(String localName, String value) {
            return attribute(new QName(localName), value);
        }

        public Builder child(ElementNode child) {
            children.add(Objects.requireNonNull(child, "child must not be null"));
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder tail(String tail) {
            this.tail = tail;
            return this;
        }

        public ElementNode build() {
            return new ElementNode(this);
        }
    }
}
