package io.xsdbind.core.dom;

import io.xsdbind.core.model.ElementNode;
import io.xsdbind.core.type.XsdNames;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.namespace.QName;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Serializes {@link ElementNode} trees to XML text. Every namespace of the tree is declared on the
 * root; names without a prefix get a generated one ({@code ns0}, {@code ns1}, ...) unless the tree
 * has a single such namespace and no unqualified element, in which case it becomes the default
 * namespace.
 */
public final class MarkupWriter {

    private final boolean indent;

    public MarkupWriter() {
        this(false);
    }

    public MarkupWriter(boolean indent) {
        this.indent = indent;
    }

    public String write(ElementNode root) {
        Map<String, String> prefixes = assignPrefixes(root);
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(true);
            Document doc = dbf.newDocumentBuilder().newDocument();
            Element element = toElement(doc, root, prefixes);
            prefixes.forEach((uri, prefix) -> element.setAttributeNS(
                    XMLConstants.XMLNS_ATTRIBUTE_NS_URI,
                    prefix.isEmpty() ? XMLConstants.XMLNS_ATTRIBUTE : XMLConstants.XMLNS_ATTRIBUTE + ":" + prefix,
                    uri));
            doc.appendChild(element);

            TransformerFactory tf = TransformerFactory.newInstance();
            tf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            Transformer t = tf.newTransformer();
            t.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            t.setOutputProperty(OutputKeys.INDENT, indent ? "yes" : "no");
            StringWriter out = new StringWriter();
            t.transform(new DOMSource(doc), new StreamResult(out));
            return out.toString();
        } catch (ParserConfigurationException | TransformerException e) {
            throw new MarkupException("Failed to serialize <" + XsdNames.display(root.tag()) + ">: " + e.getMessage(), e);
        }
    }

    private static Element toElement(Document doc, ElementNode node, Map<String, String> prefixes) {
        Element element = doc.createElementNS(emptyToNull(node.tag().getNamespaceURI()), name(node.tag(), prefixes));
        node.attributes().forEach((name, value) -> {
            if (name.getNamespaceURI().isEmpty()) {
                element.setAttribute(name.getLocalPart(), value);
            } else {
                element.setAttributeNS(name.getNamespaceURI(), name(name, prefixes), value);
            }
        });
        if (node.text() != null) {
            element.appendChild(doc.createTextNode(node.text()));
        }
        for (ElementNode child : node.children()) {
            element.appendChild(toElement(doc, child, prefixes));
            if (child.tail() != null) {
                element.appendChild(doc.createTextNode(child.tail()));
            }
        }
        return element;
    }

    private static String name(QName qname, Map<String, String> prefixes) {
        String prefix = qname.getNamespaceURI().isEmpty() ? "" : prefixes.get(qname.getNamespaceURI());
        return prefix == null || prefix.isEmpty() ? qname.getLocalPart() : prefix + ":" + qname.getLocalPart();
    }

    /** Namespace URI to prefix, the empty prefix marking the default namespace. */
    static Map<String, String> assignPrefixes(ElementNode root) {
        Map<String, String> declared = new LinkedHashMap<>();
        Map<String, Boolean> unprefixed = new LinkedHashMap<>();
        boolean[] hasUnqualified = {false};
        collect(root, declared, unprefixed, hasUnqualified);

        Map<String, String> out = new LinkedHashMap<>(declared);
        int generated = 0;
        boolean defaultFree = !hasUnqualified[0] && unprefixed.size() == 1;
        for (String uri : unprefixed.keySet()) {
            if (out.containsKey(uri)) {
                continue;
            }
            if (defaultFree && Boolean.TRUE.equals(unprefixed.get(uri))) {
                out.put(uri, "");
                continue;
            }
            String prefix;
            do {
                prefix = "ns" + generated++;
            } while (out.containsValue(prefix));
            out.put(uri, prefix);
        }
        return out;
    }

    private static void collect(
            ElementNode node, Map<String, String> declared, Map<String, Boolean> unprefixed, boolean[] hasUnqualified) {
        note(node.tag(), declared, unprefixed, true, hasUnqualified);
        for (QName attr : node.attributes().keySet()) {
            note(attr, declared, unprefixed, false, hasUnqualified);
        }
        for (ElementNode child : node.children()) {
            collect(child, declared, unprefixed, hasUnqualified);
        }
    }

    private static void note(
            QName name, Map<String, String> declared, Map<String, Boolean> unprefixed, boolean element, boolean[] hasUnqualified) {
        String uri = name.getNamespaceURI();
        if (uri.isEmpty()) {
            hasUnqualified[0] |= element;
            return;
        }
        if (XsdNames.XSI_NAMESPACE.equals(uri)) {
            declared.putIfAbsent(uri, "xsi");
        } else if (!name.getPrefix().isEmpty()) {
            if (!declared.containsValue(name.getPrefix())) {
                declared.putIfAbsent(uri, name.getPrefix());
            }
        } else {
            // attributes in a namespace always need a prefix
            unprefixed.merge(uri, element, (a, b) -> a && b);
        }
    }

    private static String emptyToNull(String s) {
        return s.isEmpty() ? null : s;
    }
}
