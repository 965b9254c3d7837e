package com.framelint.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Report files produced for one analysis.
 *
 * @param files generated files, in generation order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
