package io.xsdbind.core.dom;

import io.xsdbind.core.model.ElementNode;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.xml.XMLConstants;
import javax.xml.namespace.QName;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Reads XML into {@link ElementNode} trees with the JDK parser. Secure processing is on and
 * documents with a DOCTYPE are rejected, so no external entity or DTD is ever fetched. Comments
 * and processing instructions are dropped.
 */
public final class DomMarkupReader {

    private static final String DISALLOW_DOCTYPE = "http://apache.org/xml/features/disallow-doctype-decl";

    private final DocumentBuilderFactory factory;

    public DomMarkupReader() {
        factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature(DISALLOW_DOCTYPE, true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    public ElementNode read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return read(new InputSource(in), file.toString());
        } catch (IOException e) {
            throw new MarkupException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    public ElementNode read(InputStream in) {
        return read(new InputSource(in), "<stream>");
    }

    public ElementNode parse(String xml) {
        return read(new InputSource(new StringReader(xml)), "<string>");
    }

    private ElementNode read(InputSource source, String label) {
        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return toNode(builder.parse(source).getDocumentElement());
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new MarkupException("Failed to parse " + label + ": " + e.getMessage(), e);
        }
    }

    private static ElementNode toNode(Element element) {
        ElementNode.Builder b = ElementNode.builder(qname(element));
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            b.attribute(qname(attr), attr.getValue());
        }
        StringBuilder text = new StringBuilder();
        ElementNode pending = null;
        boolean seenChild = false;
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            switch (child.getNodeType()) {
                case Node.ELEMENT_NODE -> {
                    if (pending != null) {
                        b.child(withTail(pending, text));
                    } else if (text.length() > 0) {
                        b.text(text.toString());
                    }
                    text.setLength(0);
                    pending = toNode((Element) child);
                    seenChild = true;
                }
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> text.append(child.getNodeValue());
                default -> {
                    // comments and processing instructions carry no data
                }
            }
        }
        if (pending != null) {
            b.child(withTail(pending, text));
        } else if (!seenChild && text.length() > 0) {
            b.text(text.toString());
        }
        return b.build();
    }

    private static ElementNode withTail(ElementNode node, CharSequence tail) {
        return tail.length() == 0 ? node : node.withTail(tail.toString());
    }

    private static QName qname(Node node) {
        String ns = node.getNamespaceURI();
        String local = node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
        String prefix = node.getPrefix();
        return new QName(ns == null ? "" : ns, local, prefix == null ? "" : prefix);
    }
}
