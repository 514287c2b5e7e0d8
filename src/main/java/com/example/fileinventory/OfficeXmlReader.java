package com.example.fileinventory;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Reads the parts of Office Open XML containers needed for content hints. The container is opened as a ZIP
 * archive and its XML parts are parsed with JAXP.
 */
public class OfficeXmlReader {
    static final String WORD_NS = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    static final String PRESENTATION_NS = "http://schemas.openxmlformats.org/presentationml/2006/main";
    static final String DRAWING_NS = "http://schemas.openxmlformats.org/drawingml/2006/main";
    static final String RELATIONSHIP_NS = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    static final String PACKAGE_RELATIONSHIP_NS = "http://schemas.openxmlformats.org/package/2006/relationships";

    private static final String DOCUMENT_PART = "word/document.xml";
    private static final String PRESENTATION_PART = "ppt/presentation.xml";
    private static final String PRESENTATION_RELS_PART = "ppt/_rels/presentation.xml.rels";

    private final DocumentBuilderFactory factory;

    public OfficeXmlReader() {
        factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser does not support secure processing", ex);
        }
    }

    /**
     * Returns the text of each top-level body paragraph of a word-processing document, in document order.
     */
    public List<String> readParagraphs(Path path) throws IOException {
        try (ZipFile zip = new ZipFile(path.toFile())) {
            Document document = parsePart(zip, DOCUMENT_PART)
                    .orElseThrow(() -> new IOException("Missing " + DOCUMENT_PART + " in " + path));
            NodeList bodies = document.getElementsByTagNameNS(WORD_NS, "body");
            List<String> paragraphs = new ArrayList<>();
            if (bodies.getLength() == 0) {
                return paragraphs;
            }
            for (Node child = bodies.item(0).getFirstChild(); child != null; child = child.getNextSibling()) {
                if (isElement(child, WORD_NS, "p")) {
                    paragraphs.add(wordParagraphText((Element) child));
                }
            }
            return paragraphs;
        }
    }

    /**
     * Describes the first slide of a presentation: empty when the presentation has no slides, otherwise the
     * first slide with its title text if it carries a title placeholder.
     */
    public Optional<SlideSummary> readFirstSlide(Path path) throws IOException {
        try (ZipFile zip = new ZipFile(path.toFile())) {
            Document presentation = parsePart(zip, PRESENTATION_PART)
                    .orElseThrow(() -> new IOException("Missing " + PRESENTATION_PART + " in " + path));
            Optional<String> firstSlideId = firstSlideRelationshipId(presentation);
            if (firstSlideId.isEmpty()) {
                return Optional.empty();
            }
            Map<String, String> targets = relationshipTargets(zip);
            String target = targets.get(firstSlideId.get());
            if (target == null) {
                throw new IOException("Unresolved slide relationship " + firstSlideId.get() + " in " + path);
            }
            Document slide = parsePart(zip, resolvePresentationTarget(target))
                    .orElseThrow(() -> new IOException("Missing slide part " + target + " in " + path));
            return Optional.of(new SlideSummary(titleOf(slide)));
        }
    }

    private Optional<String> firstSlideRelationshipId(Document presentation) {
        NodeList slideIds = presentation.getElementsByTagNameNS(PRESENTATION_NS, "sldId");
        if (slideIds.getLength() == 0) {
            return Optional.empty();
        }
        String id = ((Element) slideIds.item(0)).getAttributeNS(RELATIONSHIP_NS, "id");
        return id.isEmpty() ? Optional.empty() : Optional.of(id);
    }

    private Map<String, String> relationshipTargets(ZipFile zip) throws IOException {
        Map<String, String> targets = new HashMap<>();
        Optional<Document> rels = parsePart(zip, PRESENTATION_RELS_PART);
        if (rels.isEmpty()) {
            return targets;
        }
        NodeList relationships = rels.get().getElementsByTagNameNS(PACKAGE_RELATIONSHIP_NS, "Relationship");
        for (int i = 0; i < relationships.getLength(); i++) {
            Element relationship = (Element) relationships.item(i);
            targets.put(relationship.getAttribute("Id"), relationship.getAttribute("Target"));
        }
        return targets;
    }

    private String resolvePresentationTarget(String target) {
        if (target.startsWith("/")) {
            return target.substring(1);
        }
        String resolved = "ppt/" + target;
        while (resolved.contains("/../")) {
            resolved = resolved.replaceFirst("[^/]+/\\.\\./", "");
        }
        return resolved;
    }

    private Optional<String> titleOf(Document slide) {
        NodeList shapes = slide.getElementsByTagNameNS(PRESENTATION_NS, "sp");
        for (int i = 0; i < shapes.getLength(); i++) {
            Element shape = (Element) shapes.item(i);
            NodeList placeholders = shape.getElementsByTagNameNS(PRESENTATION_NS, "ph");
            if (placeholders.getLength() == 0) {
                continue;
            }
            String type = ((Element) placeholders.item(0)).getAttribute("type");
            if ("title".equals(type) || "ctrTitle".equals(type)) {
                String text = drawingText(shape);
                return text.isBlank() ? Optional.empty() : Optional.of(text);
            }
        }
        return Optional.empty();
    }

    private String drawingText(Element shape) {
        NodeList paragraphs = shape.getElementsByTagNameNS(DRAWING_NS, "p");
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < paragraphs.getLength(); i++) {
            StringBuilder line = new StringBuilder();
            NodeList runs = ((Element) paragraphs.item(i)).getElementsByTagNameNS(DRAWING_NS, "t");
            for (int j = 0; j < runs.getLength(); j++) {
                line.append(runs.item(j).getTextContent());
            }
            lines.add(line.toString());
        }
        return String.join("\n", lines);
    }

    private String wordParagraphText(Element paragraph) {
        StringBuilder text = new StringBuilder();
        NodeList nodes = paragraph.getElementsByTagNameNS(WORD_NS, "*");
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            switch (node.getLocalName()) {
                case "t" -> text.append(node.getTextContent());
                case "tab" -> text.append('\t');
                case "br", "cr" -> text.append('\n');
                default -> {
                }
            }
        }
        return text.toString();
    }

    private Optional<Document> parsePart(ZipFile zip, String name) throws IOException {
        ZipEntry entry = zip.getEntry(name);
        if (entry == null) {
            return Optional.empty();
        }
        try (InputStream inputStream = zip.getInputStream(entry)) {
            DocumentBuilder builder = factory.newDocumentBuilder();
            return Optional.of(builder.parse(inputStream));
        } catch (ParserConfigurationException | SAXException ex) {
            throw new IOException("Failed to parse " + name, ex);
        }
    }

    private boolean isElement(Node node, String namespace, String localName) {
        return node.getNodeType() == Node.ELEMENT_NODE
                && namespace.equals(node.getNamespaceURI())
                && localName.equals(node.getLocalName());
    }

    /**
     * First slide of a presentation; {@code title} is empty when the slide has no titled placeholder.
     */
    public record SlideSummary(Optional<String> title) {
    }
}
