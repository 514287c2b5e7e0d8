package com.example.fileinventory;

import com.example.fileinventory.model.TopicTags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Derives the content hint and topic tags for a file. Failures never escape: they are turned into a
 * hint that describes the problem.
 */
public class ContentHintExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContentHintExtractor.class);

    static final String DOCX = ".docx";
    static final String PPTX = ".pptx";
    static final String NOT_APPLICABLE = "N/A";
    static final String SPREADSHEET = "Spreadsheet file.";
    static final String DOCX_NO_PARAGRAPHS = "DOCX: No paragraphs found.";
    static final String DOCX_UNREADABLE = "DOCX: Corrupt or unreadable.";
    static final String PPTX_NO_TITLE = "PPTX: First slide no title.";
    static final String PPTX_NO_SLIDES = "PPTX: No slides.";
    static final String PPTX_UNREADABLE = "PPTX: Corrupt or unreadable.";

    private static final int DOCX_HINT_LIMIT = 150;
    private static final int PPTX_HINT_LIMIT = 150;
    private static final int TEXT_HINT_LIMIT = 200;
    private static final int TEXT_HINT_LINES = 2;
    private static final String ELLIPSIS = "...";

    private final OfficeXmlReader officeReader;
    private final TopicClassifier topicClassifier;
    private final List<String> textExtensions;
    private final List<String> spreadsheetExtensions;

    public ContentHintExtractor(OfficeXmlReader officeReader,
                                TopicClassifier topicClassifier,
                                List<String> textExtensions,
                                List<String> spreadsheetExtensions) {
        this.officeReader = officeReader;
        this.topicClassifier = topicClassifier;
        this.textExtensions = List.copyOf(textExtensions);
        this.spreadsheetExtensions = List.copyOf(spreadsheetExtensions);
    }

    public static ContentHintExtractor from(InventoryConfig config) {
        return new ContentHintExtractor(
                new OfficeXmlReader(),
                new TopicClassifier(config.topicRules()),
                config.textExtensions(),
                config.spreadsheetExtensions()
        );
    }

    /**
     * Computes hint and topics together so a document is opened only once.
     */
    public ContentDescription describe(Path path, String extension) {
        String normalized = normalize(extension);
        if (!DOCX.equals(normalized)) {
            return new ContentDescription(hint(path, normalized), TopicTags.notApplicable());
        }
        List<String> paragraphs;
        try {
            paragraphs = officeReader.readParagraphs(path);
        } catch (IOException | RuntimeException ex) {
            LOGGER.debug("Could not open document {}", path, ex);
            return new ContentDescription(DOCX_UNREADABLE, TopicTags.marker(TopicTags.READ_ERROR));
        }
        return new ContentDescription(documentHint(paragraphs), documentTopics(paragraphs));
    }

    public String hint(Path path, String extension) {
        String normalized = normalize(extension);
        try {
            if (DOCX.equals(normalized)) {
                return docxHint(path);
            }
            if (PPTX.equals(normalized)) {
                return pptxHint(path);
            }
            if (textExtensions.contains(normalized)) {
                return textHint(path, normalized);
            }
            if (spreadsheetExtensions.contains(normalized)) {
                return SPREADSHEET;
            }
            return NOT_APPLICABLE;
        } catch (IOException | RuntimeException ex) {
            return "Hint Error for " + path.getFileName() + ": " + ex.getMessage();
        }
    }

    public TopicTags topics(Path path, String extension) {
        if (!DOCX.equals(normalize(extension))) {
            return TopicTags.notApplicable();
        }
        try {
            return documentTopics(officeReader.readParagraphs(path));
        } catch (IOException | RuntimeException ex) {
            LOGGER.debug("Could not read topics from {}", path, ex);
            return TopicTags.marker(TopicTags.READ_ERROR);
        }
    }

    private String docxHint(Path path) {
        try {
            return documentHint(officeReader.readParagraphs(path));
        } catch (IOException | RuntimeException ex) {
            LOGGER.debug("Could not open document {}", path, ex);
            return DOCX_UNREADABLE;
        }
    }

    private String documentHint(List<String> paragraphs) {
        for (String paragraph : paragraphs) {
            if (!paragraph.isBlank()) {
                return "First para: " + truncate(paragraph.strip(), DOCX_HINT_LIMIT) + ELLIPSIS;
            }
        }
        return DOCX_NO_PARAGRAPHS;
    }

    private TopicTags documentTopics(List<String> paragraphs) {
        String fullText = String.join("\n", paragraphs);
        if (fullText.isBlank()) {
            return TopicTags.marker(TopicTags.EMPTY_DOCUMENT);
        }
        return TopicTags.of(topicClassifier.classify(fullText));
    }

    private String pptxHint(Path path) {
        Optional<OfficeXmlReader.SlideSummary> firstSlide;
        try {
            firstSlide = officeReader.readFirstSlide(path);
        } catch (IOException | RuntimeException ex) {
            LOGGER.debug("Could not open presentation {}", path, ex);
            return PPTX_UNREADABLE;
        }
        if (firstSlide.isEmpty()) {
            return PPTX_NO_SLIDES;
        }
        return firstSlide.get().title()
                .map(title -> "First slide title: " + truncate(title, PPTX_HINT_LIMIT))
                .orElse(PPTX_NO_TITLE);
    }

    private String textHint(Path path, String extension) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        List<String> lines = new ArrayList<>(TEXT_HINT_LINES);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder))) {
            String line;
            while (lines.size() < TEXT_HINT_LINES && (line = reader.readLine()) != null) {
                lines.add(line.strip());
            }
        }
        String joined = String.join(" ", lines);
        if (joined.isEmpty()) {
            return extension.toUpperCase(Locale.ROOT) + ": Empty";
        }
        return "First 2 lines: " + truncate(joined, TEXT_HINT_LIMIT) + ELLIPSIS;
    }

    static String truncate(String value, int limit) {
        if (value.length() <= limit) {
            return value;
        }
        int end = Character.isHighSurrogate(value.charAt(limit - 1)) ? limit - 1 : limit;
        return value.substring(0, end);
    }

    private static String normalize(String extension) {
        return extension == null ? "" : extension.toLowerCase(Locale.ROOT);
    }

    /**
     * Hint and topic tags derived for one file.
     */
    public record ContentDescription(String hint, TopicTags topics) {
    }
}
