package io.xsdbind.core.spi;

import java.util.List;
import java.util.Map;
import javax.xml.namespace.QName;

/**
 * Read-only view of one parsed markup element, as consumed by the decode pipeline. Text content
 * follows the tail convention: {@link #text()} is the character data before the first child and
 * each child's {@link #tail()} is the character data that follows it inside this element.
 */
public interface MarkupNode {

    /** Qualified tag name. */
    QName tag();

    /** Attributes in document order, namespace declarations excluded. */
    Map<QName, String> attributes();

    /** Child elements in document order. */
    List<? extends MarkupNode> children();

    /** Leading character data, or {@code null} if there is none. */
    String text();

    /** Character data following this element inside its parent, or {@code null}. */
    String tail();
}
