package uk.gegc.qbank.features.export.infra;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

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
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * DOM helpers for building package documents and re-reading them.
 * Parsing refuses DOCTYPE declarations and external entities. Serialization drops characters
 * that XML 1.0 cannot carry from text and attribute values.
 */
public final class XmlDocuments {

    private static final ErrorHandler RETHROWING_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            // warnings do not make a document unusable
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    private XmlDocuments() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static Document newDocument() {
        try {
            return newBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    /**
     * @throws SAXException if the bytes are not well-formed XML
     */
    public static Document parse(byte[] xml) throws SAXException {
        try {
            return newBuilder().parse(new ByteArrayInputStream(xml));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        } catch (IOException e) {
            throw new SAXException("Unreadable XML content", e);
        }
    }

    public static byte[] serialize(Document document) {
        stripInvalidChars(document.getDocumentElement());
        try {
            TransformerFactory tf = TransformerFactory.newInstance();
            tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = tf.newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            transformer.transform(new DOMSource(document), new StreamResult(out));
            return out.toByteArray();
        } catch (TransformerException e) {
            throw new IllegalStateException("Failed to serialize XML document", e);
        }
    }

    /**
     * Removes control characters other than tab, line feed and carriage return, plus unpaired
     * surrogates and the non-characters U+FFFE and U+FFFF.
     */
    public static String stripInvalidChars(String s) {
        if (s == null || s.isEmpty()) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        s.codePoints()
                .filter(XmlDocuments::isAllowed)
                .forEach(sb::appendCodePoint);
        return sb.length() == s.length() ? s : sb.toString();
    }

    private static boolean isAllowed(int c) {
        if (c == '\n' || c == '\r' || c == '\t') {
            return true;
        }
        if (Character.isISOControl(c)) {
            return false;
        }
        return !(c >= Character.MIN_SURROGATE && c <= Character.MAX_SURROGATE) && c != 0xFFFE && c != 0xFFFF;
    }

    private static void stripInvalidChars(Node node) {
        if (node == null) {
            return;
        }
        switch (node.getNodeType()) {
            case Node.TEXT_NODE, Node.CDATA_SECTION_NODE, Node.COMMENT_NODE ->
                    node.setNodeValue(stripInvalidChars(node.getNodeValue()));
            case Node.ELEMENT_NODE -> {
                NamedNodeMap attributes = ((Element) node).getAttributes();
                for (int i = 0; i < attributes.getLength(); i++) {
                    Attr attr = (Attr) attributes.item(i);
                    attr.setValue(stripInvalidChars(attr.getValue()));
                }
                NodeList children = node.getChildNodes();
                for (int i = 0; i < children.getLength(); i++) {
                    stripInvalidChars(children.item(i));
                }
            }
            default -> {
                // other node kinds carry no character data
            }
        }
    }

    private static DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        dbf.setValidating(false);
        dbf.setXIncludeAware(false);
        dbf.setExpandEntityReferences(false);
        dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        DocumentBuilder builder = dbf.newDocumentBuilder();
        // the default handler also prints fatal errors to stderr
        builder.setErrorHandler(RETHROWING_HANDLER);
        return builder;
    }
}
