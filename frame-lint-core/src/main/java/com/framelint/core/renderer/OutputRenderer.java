package com.framelint.core.renderer;

/**
 * Destination for generated report files.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI). The CLI picks
 * one by {@link #getId()}: the console for interactive runs, the filesystem when an output
 * directory is given.</p>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.framelint.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Lowercase, e.g. "console" or "filesystem".
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Writes the generated files to this renderer's destination.
     *
     * @param output the report files
     * @param context destination and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
