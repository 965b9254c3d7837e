package com.framelint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A design file as exported by the design tool: metadata plus the document root.
 *
 * @param name file name
 * @param version file version label, may be null
 * @param lastModified last modification timestamp as reported, may be null
 * @param document root node of the tree
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DesignDocument(
    String name,
    String version,
    String lastModified,
    DesignNode document
) {
    /**
     * Compact constructor with validation.
     */
    public DesignDocument {
        Objects.requireNonNull(document, "document must not be null");
        if (name == null || name.isBlank()) {
            name = document.name();
        }
    }

    /**
     * Wraps a bare root node.
     *
     * @param root root node
     * @return document named after its root
     */
    public static DesignDocument of(DesignNode root) {
        return new DesignDocument(root.name(), null, null, root);
    }
}
