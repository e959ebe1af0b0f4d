package org.l5xst.l5x;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
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
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import org.l5xst.ConversionException;
import org.l5xst.ErrorKind;

/**
 * Reading and writing L5X element trees, plus the small DOM helpers the loader and emitter share.
 */
public final class L5xDocuments {
    private L5xDocuments() {}

    public static Document read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(new InputSource(in), file.toString());
        }
    }

    public static Document parse(String xml) {
        try {
            return parse(new InputSource(new StringReader(xml)), "<string>");
        } catch (IOException e) {
            throw new IllegalStateException("reading from a string failed", e);
        }
    }

    private static Document parse(InputSource source, String origin) throws IOException {
        try {
            return builder().parse(source);
        } catch (SAXException e) {
            throw new ConversionException(
                ErrorKind.MALFORMED_SOURCE_TREE, origin,
                "not well-formed XML: " + e.getMessage(),
                "export the project again as L5X"
            );
        }
    }

    public static Document newDocument() {
        return builder().newDocument();
    }

    public static String write(Document doc) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.STANDALONE, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            var out = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(out));
            return out.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("cannot serialize L5X document", e);
        }
    }

    public static void write(Document doc, Path file) throws IOException {
        Files.writeString(file, write(doc), StandardCharsets.UTF_8);
    }

    private static DocumentBuilder builder() {
        try {
            var factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        }
    }

    // --- DOM helpers ---

    /** Direct child elements named {@code tag}. */
    public static List<Element> children(Element parent, String tag) {
        var found = new ArrayList<Element>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element e && e.getTagName().equals(tag)) {
                found.add(e);
            }
        }
        return found;
    }

    /** All direct child elements. */
    public static List<Element> children(Element parent) {
        var found = new ArrayList<Element>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element e) {
                found.add(e);
            }
        }
        return found;
    }

    public static Optional<Element> child(Element parent, String tag) {
        var all = children(parent, tag);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /** Children of the container {@code container} under {@code parent}, e.g. {@code Tags/Tag}. */
    public static List<Element> grandchildren(Element parent, String container, String tag) {
        return child(parent, container).map(c -> children(c, tag)).orElse(List.of());
    }

    public static Optional<Element> descendant(Element parent, String tag) {
        NodeList nodes = parent.getElementsByTagName(tag);
        return nodes.getLength() == 0 ? Optional.empty() : Optional.of((Element) nodes.item(0));
    }

    public static Optional<String> attr(Element e, String name) {
        return e.hasAttribute(name) ? Optional.of(e.getAttribute(name)) : Optional.empty();
    }

    public static Element append(Element parent, String tag, String... attrs) {
        Element e = parent.getOwnerDocument().createElement(tag);
        for (int i = 0; i + 1 < attrs.length; i += 2) {
            e.setAttribute(attrs[i], attrs[i + 1]);
        }
        parent.appendChild(e);
        return e;
    }

    public static Element appendCData(Element parent, String tag, String text, String... attrs) {
        Element e = append(parent, tag, attrs);
        e.appendChild(parent.getOwnerDocument().createCDATASection(text));
        return e;
    }
}
