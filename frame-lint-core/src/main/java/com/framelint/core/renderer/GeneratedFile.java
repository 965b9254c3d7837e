package com.framelint.core.renderer;

import java.util.Objects;

/**
 * One generated report file.
 *
 * @param relativePath path below the output directory, e.g. "framelint-report.md"
 * @param content file content
 * @param contentType MIME type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }
}
