package com.framelint.core.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.framelint.core.model.DesignDocument;
import com.framelint.core.model.DesignNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads design documents from the design tool's JSON export.
 *
 * <p>Two shapes are accepted:</p>
 * <ul>
 *   <li>a file export: {@code {"name": ..., "version": ..., "lastModified": ..., "document": {...}}}</li>
 *   <li>a bare node: {@code {"id": ..., "name": ..., "type": ..., "children": [...]}}</li>
 * </ul>
 *
 * <p>Unknown properties are ignored. Unknown enum values map to the enum's default
 * ({@code NodeType.OTHER}, {@code LayoutMode.OTHER}, {@code LayoutWrap.NO_WRAP}) or to
 * null where the enum has none.</p>
 */
public final class DesignDocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DesignDocumentLoader.class);

    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
        .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL)
        .build();

    private DesignDocumentLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads a design document from a file.
     *
     * @param file JSON file
     * @return the document
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the content is not a design document
     */
    public static DesignDocument load(Path file) throws IOException {
        log.debug("Loading design document from: {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            DesignDocument document = read(in, file.toString());
            log.info("Loaded design document '{}' from {}", document.name(), file);
            return document;
        }
    }

    /**
     * Reads a design document from a stream.
     *
     * @param in JSON content, not closed by this method
     * @param source name of the source for error messages
     * @return the document
     * @throws IOException if the stream cannot be read
     * @throws IllegalArgumentException if the content is not a design document
     */
    public static DesignDocument read(InputStream in, String source) throws IOException {
        JsonNode tree;
        try {
            tree = JSON_MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
        return fromTree(tree, source);
    }

    /**
     * Reads a design document from a JSON string.
     *
     * @param json JSON content
     * @return the document
     * @throws IllegalArgumentException if the content is not a design document
     */
    public static DesignDocument read(String json) {
        try {
            return fromTree(JSON_MAPPER.readTree(json), "<string>");
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static DesignDocument fromTree(JsonNode tree, String source) {
        if (tree == null || !tree.isObject()) {
            throw new IllegalArgumentException("Design document must be a JSON object: " + source);
        }
        try {
            if (tree.path("document").isObject()) {
                return JSON_MAPPER.treeToValue(tree, DesignDocument.class);
            }
            if (tree.hasNonNull("id")) {
                return DesignDocument.of(JSON_MAPPER.treeToValue(tree, DesignNode.class));
            }
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed design document " + source + ": " + e.getOriginalMessage(), e);
        }
        throw new IllegalArgumentException(
            "Not a design document (expected a 'document' object or a node with an 'id'): " + source);
    }
}
