/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.web.upnp;

import com.dirserve.upnp.cd.UpnpFault;
import com.dirserve.utils.XmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Minimal SOAP 1.1 codec for UPnP control requests.
 *
 * <p>Requests are parsed with the JDK DOM parser with DTDs disabled. Responses
 * and faults are written as strings.
 */
public final class SoapEnvelope {

    public static final String SOAP_ENV_NS = "http://schemas.xmlsoap.org/soap/envelope/";
    public static final String SOAP_ENCODING = "http://schemas.xmlsoap.org/soap/encoding/";
    public static final String CONTROL_NS = "urn:schemas-upnp-org:control-1-0";

    /**
     * A decoded action invocation.
     *
     * @param name      action name without namespace, e.g. {@code Browse}
     * @param arguments input arguments in document order
     */
    public record SoapAction(String name, Map<String, String> arguments) {

        public SoapAction {
            arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        }

        /** Argument value, or the empty string when absent. */
        public String argument(String argumentName) {
            return arguments.getOrDefault(argumentName, "");
        }

        /**
         * Unsigned integer argument, zero when absent.
         *
         * @throws UpnpFault 402 when the value is not a non-negative integer
         */
        public long unsignedArgument(String argumentName) {
            String value = argument(argumentName).trim();
            if (value.isEmpty()) {
                return 0;
            }
            try {
                long parsed = Long.parseLong(value);
                if (parsed < 0) {
                    throw UpnpFault.invalidArgs(argumentName + " must not be negative");
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw UpnpFault.invalidArgs(argumentName + " is not a number: " + value);
            }
        }
    }

    private SoapEnvelope() {
    }

    /**
     * Parses a control request.
     *
     * @param soapActionHeader the {@code SOAPACTION} header, e.g.
     *                         {@code "urn:schemas-upnp-org:service:ContentDirectory:1#Browse"}; may be null
     * @param body             the request body
     * @throws UpnpFault 402 if the body is not a SOAP envelope with an action element
     */
    public static SoapAction parse(String soapActionHeader, String body) {
        Document document;
        try {
            document = newBuilder().parse(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
        } catch (SAXException | IOException e) {
            throw UpnpFault.invalidArgs("malformed SOAP body: " + e.getMessage());
        }

        Element actionElement = actionElement(document);
        if (actionElement == null) {
            throw UpnpFault.invalidArgs("SOAP body has no action element");
        }

        String name = actionFromHeader(soapActionHeader);
        if (name == null) {
            name = actionElement.getLocalName() != null ? actionElement.getLocalName() : actionElement.getTagName();
        }

        Map<String, String> arguments = new LinkedHashMap<>();
        NodeList children = actionElement.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                String argumentName = child.getLocalName() != null ? child.getLocalName() : child.getNodeName();
                arguments.put(argumentName, child.getTextContent());
            }
        }
        return new SoapAction(name, arguments);
    }

    /**
     * Extracts the action name after {@code #}, ignoring surrounding quotes.
     * Returns null for a missing or empty header.
     */
    static String actionFromHeader(String header) {
        if (header == null) {
            return null;
        }
        String action = header.replace("\"", "").trim();
        int hash = action.lastIndexOf('#');
        if (hash >= 0) {
            action = action.substring(hash + 1);
        }
        return action.isEmpty() ? null : action;
    }

    /**
     * Builds an action response. Values are escaped.
     */
    public static String response(String serviceType, String action, Map<String, ?> outputs) {
        StringBuilder xml = new StringBuilder(256);
        xml.append("<?xml version=\"1.0\" encoding=\"utf-8\"?>")
            .append("<s:Envelope xmlns:s=\"").append(SOAP_ENV_NS)
            .append("\" s:encodingStyle=\"").append(SOAP_ENCODING).append("\">")
            .append("<s:Body>")
            .append("<u:").append(action).append("Response xmlns:u=\"").append(serviceType).append("\">");
        for (Map.Entry<String, ?> output : outputs.entrySet()) {
            xml.append('<').append(output.getKey()).append('>')
                .append(XmlUtils.escape(String.valueOf(output.getValue())))
                .append("</").append(output.getKey()).append('>');
        }
        xml.append("</u:").append(action).append("Response>")
            .append("</s:Body>")
            .append("</s:Envelope>");
        return xml.toString();
    }

    /**
     * Builds a SOAP fault carrying a UPnPError detail.
     */
    public static String fault(UpnpFault fault) {
        return "<?xml version=\"1.0\" encoding=\"utf-8\"?>"
            + "<s:Envelope xmlns:s=\"" + SOAP_ENV_NS + "\" s:encodingStyle=\"" + SOAP_ENCODING + "\">"
            + "<s:Body>"
            + "<s:Fault>"
            + "<faultcode>s:Client</faultcode>"
            + "<faultstring>UPnPError</faultstring>"
            + "<detail>"
            + "<UPnPError xmlns=\"" + CONTROL_NS + "\">"
            + "<errorCode>" + fault.getCode() + "</errorCode>"
            + "<errorDescription>" + XmlUtils.escape(fault.getDescription()) + "</errorDescription>"
            + "</UPnPError>"
            + "</detail>"
            + "</s:Fault>"
            + "</s:Body>"
            + "</s:Envelope>";
    }

    private static Element actionElement(Document document) {
        NodeList bodies = document.getElementsByTagNameNS(SOAP_ENV_NS, "Body");
        if (bodies.getLength() == 0) {
            return null;
        }
        NodeList children = bodies.item(0).getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i).getNodeType() == Node.ELEMENT_NODE) {
                return (Element) children.item(i);
            }
        }
        return null;
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        }
    }
}
