import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Loads an L5X export into a DOM. Three tiers, each tried only when the previous one fails:
 * <ol>
 *   <li>strict parse of the raw bytes</li>
 *   <li>strict parse after stray {@code &}, stray {@code <} and characters XML cannot carry
 *       are repaired, so one bad description does not lose the rest of the document</li>
 *   <li>stream recovery of the repaired text, keeping every element read before the first
 *       remaining fatal error (truncated or mis-nested files)</li>
 * </ol>
 */
public class L5XDocumentLoader {

    private static final Logger logger = LoggerFactory.getLogger(L5XDocumentLoader.class);

    private final List<String> parseWarnings = new ArrayList<>();
    private boolean recovered;

    public Document load(Path path) throws L5XInputException {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new L5XInputException("L5X file could not be read: " + path + " (" + e.getMessage() + ")", e);
        }
        return parse(content, path.toString());
    }

    public Document parse(byte[] content, String sourceName) throws L5XInputException {
        parseWarnings.clear();
        recovered = false;

        try {
            return parseStrict(new InputSource(new ByteArrayInputStream(content)));
        } catch (SAXException e) {
            String warning = "Strict parse of " + sourceName + " failed: " + describe(e);
            parseWarnings.add(warning);
            logger.warn("{}; repairing stray markup characters", warning);
        } catch (IOException e) {
            throw new L5XInputException("L5X file could not be read: " + sourceName + " (" + e.getMessage() + ")", e);
        }

        recovered = true;
        // L5X exports are UTF-8; undecodable bytes become U+FFFD
        String repaired = repairMarkup(new String(content, StandardCharsets.UTF_8));
        try {
            Document document = parseStrict(new InputSource(new StringReader(repaired)));
            logger.warn("Parsed {} after repairing stray markup characters", sourceName);
            return document;
        } catch (SAXException e) {
            String warning = "Parse of repaired " + sourceName + " failed: " + describe(e);
            parseWarnings.add(warning);
            logger.warn("{}; recovering well-formed content", warning);
        } catch (IOException e) {
            throw new L5XInputException("L5X file could not be read: " + sourceName + " (" + e.getMessage() + ")", e);
        }

        return parseRecovering(repaired, sourceName);
    }

    // =====================================================================
    // STRICT PARSE
    // =====================================================================

    private Document parseStrict(InputSource source) throws SAXException, IOException, L5XInputException {
        DocumentBuilder builder = newDocumentBuilder();
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException e) {
                parseWarnings.add("Warning: " + describe(e));
            }

            @Override
            public void error(SAXParseException e) {
                parseWarnings.add("Error: " + describe(e));
            }

            @Override
            public void fatalError(SAXParseException e) throws SAXException {
                throw e;
            }
        });
        return builder.parse(source);
    }

    private DocumentBuilder newDocumentBuilder() throws L5XInputException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setExpandEntityReferences(false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new L5XInputException("XML parser unavailable: " + e.getMessage(), e);
        }
    }

    // =====================================================================
    // MARKUP REPAIR
    // =====================================================================

    private static final Pattern ENTITY_REFERENCE =
        Pattern.compile("&(?:amp|lt|gt|quot|apos|#[0-9]+|#x[0-9A-Fa-f]+);");

    /**
     * Escapes {@code &} that does not start a predefined or numeric reference, escapes
     * {@code <} that cannot open markup, and drops characters outside the XML 1.0 range.
     * CDATA sections, comments and processing instructions are copied as they are,
     * apart from the character filter. A leading byte order mark is removed.
     */
    static String repairMarkup(String text) {
        int n = text.length();
        StringBuilder sb = new StringBuilder(n + 64);
        int i = text.startsWith("\uFEFF") ? 1 : 0;
        while (i < n) {
            char c = text.charAt(i);
            if (c == '<') {
                String closing = text.startsWith("<![CDATA[", i) ? "]]>"
                    : text.startsWith("<!--", i) ? "-->"
                    : text.startsWith("<?", i) ? "?>"
                    : null;
                if (closing != null) {
                    int end = text.indexOf(closing, i);
                    int stop = end < 0 ? n : end + closing.length();
                    for (int k = i; k < stop; k++) {
                        appendXmlChar(sb, text.charAt(k));
                    }
                    i = stop;
                    continue;
                }
                char next = i + 1 < n ? text.charAt(i + 1) : ' ';
                if (next == '/' || next == '!' || next == '_' || next == ':' || Character.isLetter(next)) {
                    sb.append(c);
                } else {
                    sb.append("&lt;");
                }
            } else if (c == '&') {
                Matcher reference = ENTITY_REFERENCE.matcher(text).region(i, n);
                sb.append(reference.lookingAt() ? "&" : "&amp;");
            } else {
                appendXmlChar(sb, c);
            }
            i++;
        }
        return sb.toString();
    }

    private static void appendXmlChar(StringBuilder sb, char c) {
        if (c == '\t' || c == '\n' || c == '\r' || (c >= 0x20 && c <= 0xFFFD)) {
            sb.append(c);
        }
    }

    // =====================================================================
    // RECOVERING PARSE
    // =====================================================================

    private Document parseRecovering(String content, String sourceName) throws L5XInputException {
        Document document = newDocumentBuilder().newDocument();
        Deque<Element> open = new ArrayDeque<>();
        int elementsRead = 0;

        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);

        XMLStreamReader reader = null;
        try {
            reader = factory.createXMLStreamReader(new StringReader(content));
            while (reader.hasNext()) {
                int event = reader.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT:
                        Element element = document.createElement(qualifiedName(reader));
                        for (int i = 0; i < reader.getAttributeCount(); i++) {
                            String prefix = reader.getAttributePrefix(i);
                            String name = (prefix == null || prefix.isEmpty())
                                ? reader.getAttributeLocalName(i)
                                : prefix + ":" + reader.getAttributeLocalName(i);
                            element.setAttribute(name, reader.getAttributeValue(i));
                        }
                        appendNode(document, open, element);
                        open.push(element);
                        elementsRead++;
                        break;
                    case XMLStreamConstants.END_ELEMENT:
                        if (!open.isEmpty()) {
                            open.pop();
                        }
                        break;
                    case XMLStreamConstants.CHARACTERS:
                    case XMLStreamConstants.SPACE:
                        if (!open.isEmpty()) {
                            open.peek().appendChild(document.createTextNode(reader.getText()));
                        }
                        break;
                    case XMLStreamConstants.CDATA:
                        if (!open.isEmpty()) {
                            open.peek().appendChild(document.createCDATASection(reader.getText()));
                        }
                        break;
                    case XMLStreamConstants.COMMENT:
                        appendNode(document, open, document.createComment(reader.getText()));
                        break;
                    default:
                        break;
                }
            }
        } catch (XMLStreamException e) {
            String warning = "Recovery stopped at " + describe(e.getLocation()) + ": " + e.getMessage();
            parseWarnings.add(warning);
            logger.warn("{} ({} elements salvaged, {} left unclosed)", warning, elementsRead, open.size());
        } finally {
            closeQuietly(reader);
        }

        if (document.getDocumentElement() == null) {
            throw new L5XInputException("L5X file has no readable root element: " + sourceName);
        }
        logger.info("Recovered {} elements from {}", elementsRead, sourceName);
        return document;
    }

    private static void appendNode(Document document, Deque<Element> open, Node node) {
        if (!open.isEmpty()) {
            open.peek().appendChild(node);
        } else if (node instanceof Element && document.getDocumentElement() == null) {
            document.appendChild(node);
        } else if (!(node instanceof Element)) {
            document.appendChild(node);
        }
        // a second top-level element is dropped
    }

    private static String qualifiedName(XMLStreamReader reader) {
        String prefix = reader.getPrefix();
        return (prefix == null || prefix.isEmpty()) ? reader.getLocalName() : prefix + ":" + reader.getLocalName();
    }

    private static void closeQuietly(XMLStreamReader reader) {
        if (reader == null) return;
        try {
            reader.close();
        } catch (XMLStreamException e) {
            logger.debug("Closing stream reader failed: {}", e.getMessage());
        }
    }

    private static String describe(SAXException e) {
        if (e instanceof SAXParseException) {
            SAXParseException p = (SAXParseException) e;
            return "line " + p.getLineNumber() + ":" + p.getColumnNumber() + " - " + p.getMessage();
        }
        return e.getMessage();
    }

    private static String describe(Location location) {
        if (location == null) return "unknown location";
        return "line " + location.getLineNumber() + ":" + location.getColumnNumber();
    }

    // =====================================================================
    // GETTERS
    // =====================================================================

    public List<String> getParseWarnings() { return parseWarnings; }
    public boolean isRecovered() { return recovered; }
}
