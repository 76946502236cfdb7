package io.xsdbind.core.spi;

import io.xsdbind.core.particle.ElementDecl;
import java.util.Objects;
import javax.xml.namespace.QName;

/** One entry of an element's ordered content, as exchanged with a {@link Converter}. */
public sealed interface ContentItem {

    /**
     * A child element and its converted value.
     *
     * @param name       the child's qualified name
     * @param value      decoded value (decode) or value to encode (encode)
     * @param decl       the declaration the child was matched to, or {@code null} for a
     *                   skip-wildcard match
     * @param repeatable {@code true} if the declaring particle admits more than one occurrence
     */
    record Child(QName name, Object value, ElementDecl decl, boolean repeatable) implements ContentItem {
        public Child {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * Character data found between children of a mixed element.
     *
     * @param index position of the chunk: 0 before the first child, n after the n-th child
     * @param text  the character data
     */
    record CharData(int index, String text) implements ContentItem {
        public CharData {
            Objects.requireNonNull(text, "text must not be null");
        }
    }
}
