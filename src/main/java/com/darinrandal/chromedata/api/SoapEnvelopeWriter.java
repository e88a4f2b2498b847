package com.darinrandal.chromedata.api;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

import org.eclipse.jdt.annotation.NonNullByDefault;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Renders a request parameter tree as a SOAP 1.1 envelope. Objects become
 * nested elements, arrays become repeated elements and primitives become text
 * content. Children of {@code accountInfo} are written as attributes, which is
 * how the description service expects the credentials.
 */
@NonNullByDefault
public class SoapEnvelopeWriter {

    public static final String SOAP_ENV_NS = "http://schemas.xmlsoap.org/soap/envelope/";

    private static final String SOAP_PREFIX = "soapenv";
    private static final String REQUEST_PREFIX = "urn";

    private static final Set<String> ATTRIBUTE_CONTAINERS = Set.of("accountInfo");

    // Schema sequence of VehicleDescriptionRequest; unknown keys follow in insertion order.
    private static final List<String> ELEMENT_ORDER = List.of("accountInfo", "vin", "styleId", "acode",
            "modelYear", "makeName", "modelName", "reducingStyleId", "reducingAcode", "trimName",
            "manufacturerModelCode", "wheelBase", "OEMOptionCode", "exteriorColorName", "interiorColorName",
            "styleName", "switch", "vehicleProcessMode", "optionsProcessMode", "includeMediaGallery");

    private final String namespace;
    private final String requestElement;

    public SoapEnvelopeWriter(String namespace, String requestElement) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.requestElement = Objects.requireNonNull(requestElement, "requestElement");
    }

    public String write(JsonObject parameters) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter xml = XMLOutputFactory.newFactory().createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.setPrefix(SOAP_PREFIX, SOAP_ENV_NS);
            xml.setPrefix(REQUEST_PREFIX, namespace);
            xml.writeStartElement(SOAP_PREFIX, "Envelope", SOAP_ENV_NS);
            xml.writeNamespace(SOAP_PREFIX, SOAP_ENV_NS);
            xml.writeNamespace(REQUEST_PREFIX, namespace);
            xml.writeStartElement(SOAP_PREFIX, "Body", SOAP_ENV_NS);
            xml.writeStartElement(REQUEST_PREFIX, requestElement, namespace);
            for (String key : orderedKeys(parameters)) {
                writeValue(xml, key, Objects.requireNonNull(parameters.get(key)));
            }
            xml.writeEndElement();
            xml.writeEndElement();
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to write SOAP envelope", e);
        }
        return out.toString();
    }

    private List<String> orderedKeys(JsonObject parameters) {
        List<String> keys = new ArrayList<>();
        for (String known : ELEMENT_ORDER) {
            if (parameters.has(known)) {
                keys.add(known);
            }
        }
        for (String key : parameters.keySet()) {
            if (!keys.contains(key)) {
                keys.add(key);
            }
        }
        return keys;
    }

    private void writeValue(XMLStreamWriter xml, String name, JsonElement value) throws XMLStreamException {
        if (value.isJsonNull()) {
            return;
        }
        if (value.isJsonArray()) {
            JsonArray array = value.getAsJsonArray();
            for (JsonElement item : array) {
                writeValue(xml, name, Objects.requireNonNull(item));
            }
            return;
        }
        if (value.isJsonObject()) {
            JsonObject object = value.getAsJsonObject();
            boolean asAttributes = ATTRIBUTE_CONTAINERS.contains(name);
            if (asAttributes) {
                xml.writeEmptyElement(REQUEST_PREFIX, name, namespace);
            } else {
                xml.writeStartElement(REQUEST_PREFIX, name, namespace);
            }
            for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
                JsonElement child = Objects.requireNonNull(entry.getValue());
                if (asAttributes) {
                    if (child.isJsonPrimitive()) {
                        xml.writeAttribute(entry.getKey(), child.getAsString());
                    }
                } else {
                    writeValue(xml, entry.getKey(), child);
                }
            }
            if (!asAttributes) {
                xml.writeEndElement();
            }
            return;
        }
        xml.writeStartElement(REQUEST_PREFIX, name, namespace);
        xml.writeCharacters(value.getAsString());
        xml.writeEndElement();
    }
}
