package com.darinrandal.chromedata.api;

import java.io.IOException;
import java.io.StringReader;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Converts a SOAP envelope into a JSON tree keyed by local element names.
 * Attributes and child elements become properties, repeated children become
 * arrays, and text-only elements become strings. Text next to attributes is
 * kept under {@value #TEXT_KEY}.
 */
@NonNullByDefault
public final class SoapEnvelopeReader {

    public static final String TEXT_KEY = "value";

    private SoapEnvelopeReader() {
    }

    /**
     * Returns the content of the SOAP {@code Body}. An empty object is returned
     * when the document has no body.
     */
    public static JsonObject readBody(String xml) throws IOException {
        Element root = parse(xml).getDocumentElement();
        Element body = firstChild(root, "Body");
        if (body == null) {
            return new JsonObject();
        }
        JsonElement converted = toJson(body);
        return converted.isJsonObject() ? converted.getAsJsonObject() : new JsonObject();
    }

    static Document parse(String xml) throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        } catch (SAXException e) {
            throw new IOException("Malformed SOAP response: " + e.getMessage(), e);
        }
    }

    private static @Nullable Element firstChild(Element parent, String localName) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child instanceof Element && localName.equals(localName(child))) {
                return (Element) child;
            }
        }
        return null;
    }

    static JsonElement toJson(Element element) {
        JsonObject object = new JsonObject();
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())
                    || XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            object.addProperty(localName(attr), attr.getValue());
        }

        StringBuilder text = new StringBuilder();
        boolean hasChildElements = false;
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child instanceof Element) {
                hasChildElements = true;
                String name = localName(child);
                JsonElement value = toJson((Element) child);
                JsonElement existing = object.get(name);
                if (existing == null) {
                    object.add(name, value);
                } else if (existing.isJsonArray()) {
                    existing.getAsJsonArray().add(value);
                } else {
                    JsonArray array = new JsonArray();
                    array.add(existing);
                    array.add(value);
                    object.add(name, array);
                }
            } else if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(child.getNodeValue());
            }
        }

        String trimmed = text.toString().trim();
        if (!hasChildElements && object.size() == 0) {
            return new JsonPrimitive(trimmed);
        }
        if (!trimmed.isEmpty()) {
            object.addProperty(TEXT_KEY, trimmed);
        }
        return object;
    }

    private static String localName(Node node) {
        String local = node.getLocalName();
        return local != null ? local : node.getNodeName();
    }
}
