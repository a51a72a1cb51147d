import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Walks an L5X document once and produces the read-only {@link ProgramIndex}:
 * tag types, base descriptions, declaration-level bit comments, CONTROL lengths,
 * message tags and every rung in document order.
 */
public class L5XProgramIndexBuilder {

    private static final Logger logger = LoggerFactory.getLogger(L5XProgramIndexBuilder.class);

    static final String CONTROL_TYPE = "CONTROL";
    static final String MESSAGE_TYPE = "MESSAGE";

    private final List<String> buildWarnings = new ArrayList<>();

    public ProgramIndex build(Document document) {
        return build(document, false);
    }

    public ProgramIndex build(Document document, boolean recovered) {
        buildWarnings.clear();
        Map<String, TagDeclaration> declarations = new LinkedHashMap<>();
        Map<String, String> bitComments = new LinkedHashMap<>();
        Map<String, List<MessageRequest>> messageTags = new LinkedHashMap<>();

        Element root = document.getDocumentElement();
        if (root != null) {
            for (Element tag : descendants(root, "Tag")) {
                indexTag(tag, declarations, bitComments, messageTags);
            }
        }
        List<RungContext> rungs = root == null ? Collections.emptyList() : collectRungs(root);

        logger.info("Indexed {} tags, {} bit comments, {} rungs, {} message tags",
            declarations.size(), bitComments.size(), rungs.size(), messageTags.size());
        return new ProgramIndex(declarations, bitComments, rungs, messageTags, recovered);
    }

    // =====================================================================
    // TAG DECLARATIONS
    // =====================================================================

    private void indexTag(Element tag, Map<String, TagDeclaration> declarations,
                          Map<String, String> bitComments, Map<String, List<MessageRequest>> messageTags) {
        String name = tag.getAttribute("Name");
        if (name == null || name.isEmpty()) {
            return;
        }

        String dataType = tag.getAttribute("DataType").toUpperCase(Locale.ROOT);
        String description = "";
        Element descriptionElement = firstChild(tag, "Description");
        if (descriptionElement != null) {
            description = textOf(descriptionElement);
        }

        Element comments = firstChild(tag, "Comments");
        if (comments != null) {
            for (Element comment : children(comments, "Comment")) {
                String operand = comment.getAttribute("Operand").trim();
                if (operand.isEmpty()) continue;
                String text = textOf(comment);
                if (text.isEmpty()) continue;
                String key = operand.startsWith("[") ? name + operand : operand;
                bitComments.put(key, text);
            }
        }

        Integer length = null;
        if (CONTROL_TYPE.equals(dataType)) {
            length = controlLength(tag, name);
        }

        if (MESSAGE_TYPE.equals(dataType)) {
            List<MessageRequest> requests = new ArrayList<>();
            for (Element parameters : descendants(tag, "MessageParameters")) {
                requests.add(toMessageRequest(parameters));
            }
            if (!requests.isEmpty()) {
                messageTags.put(name, requests);
            }
        }

        TagDeclaration previous = declarations.get(name);
        if (previous != null) {
            logger.debug("Tag {} declared more than once; keeping the last declaration", name);
        }
        declarations.put(name, new TagDeclaration(dataType, description, length));
    }

    private Integer controlLength(Element tag, String name) {
        for (Element member : descendants(tag, "DataValueMember")) {
            if (!"LEN".equals(member.getAttribute("Name"))) continue;
            String value = member.getAttribute("Value");
            try {
                return Integer.valueOf(value.trim());
            } catch (NumberFormatException e) {
                buildWarnings.add("CONTROL tag " + name + " has non-numeric LEN '" + value + "'");
                logger.debug("CONTROL tag {} has non-numeric LEN '{}'", name, value);
                return null;
            }
        }
        return null;
    }

    // =====================================================================
    // RUNGS
    // =====================================================================

    private List<RungContext> collectRungs(Element root) {
        List<RungContext> rungs = new ArrayList<>();
        for (Element rung : descendants(root, "Rung")) {
            String programName = ancestorName(rung, "Program", "AddOnInstructionDefinition");
            String routineName = ancestorName(rung, "Routine");
            Element textElement = firstChild(rung, "Text");
            String text = textElement == null ? "" : textElement.getTextContent().trim();

            List<OperandComment> operandComments = new ArrayList<>();
            for (Element element : descendants(rung, null)) {
                if (!element.hasAttribute("Operand")) continue;
                String operand = element.getAttribute("Operand").trim();
                if (operand.isEmpty()) continue;
                Element comment = firstChild(element, "Comment");
                if (comment == null) continue;
                String commentText = textOf(comment);
                if (!commentText.isEmpty()) {
                    operandComments.add(new OperandComment(operand, commentText));
                }
            }

            List<MessageRequest> messageRequests = new ArrayList<>();
            for (Element parameters : descendants(rung, "MessageParameters")) {
                messageRequests.add(toMessageRequest(parameters));
            }

            rungs.add(new RungContext(programName, routineName, rung.getAttribute("Number"), text,
                operandComments, messageRequests));
        }
        return rungs;
    }

    private static MessageRequest toMessageRequest(Element parameters) {
        return new MessageRequest(
            attributeOrNull(parameters, "LocalElement"),
            attributeOrNull(parameters, "LocalIndex"),
            attributeOrNull(parameters, "RemoteElement"),
            attributeOrNull(parameters, "RequestedLength"));
    }

    // =====================================================================
    // DOM HELPERS
    // =====================================================================

    private static String ancestorName(Element element, String... names) {
        Node current = element.getParentNode();
        while (current instanceof Element) {
            Element ancestor = (Element) current;
            for (String name : names) {
                if (name.equals(ancestor.getTagName())) {
                    return ancestor.getAttribute("Name");
                }
            }
            current = current.getParentNode();
        }
        return "";
    }

    /** Text attribute when present, otherwise element content; trimmed. */
    private static String textOf(Element element) {
        String text = element.getAttribute("Text");
        if (text == null || text.isEmpty()) {
            text = element.getTextContent();
        }
        return text == null ? "" : text.trim();
    }

    private static String attributeOrNull(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    static Element firstChild(Element parent, String name) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element && name.equals(((Element) child).getTagName())) {
                return (Element) child;
            }
        }
        return null;
    }

    static List<Element> children(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element && name.equals(((Element) child).getTagName())) {
                result.add((Element) child);
            }
        }
        return result;
    }

    /** Descendants in document order; a null name matches every element. */
    static List<Element> descendants(Element parent, String name) {
        NodeList nodes = parent.getElementsByTagName(name == null ? "*" : name);
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    public List<String> getBuildWarnings() { return buildWarnings; }
}
