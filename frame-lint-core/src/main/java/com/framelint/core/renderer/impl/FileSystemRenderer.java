package com.framelint.core.renderer.impl;

import com.framelint.core.renderer.GeneratedFile;
import com.framelint.core.renderer.GeneratedOutput;
import com.framelint.core.renderer.OutputRenderer;
import com.framelint.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes report files below the context's output directory.
 *
 * <p>Creates the directory when missing and overwrites existing files. Paths that would
 * resolve outside the output directory are rejected.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory()).toAbsolutePath().normalize();
        logger.info("Writing {} report files to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }
        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path target = outputDir.resolve(file.relativePath()).normalize();
        if (!target.startsWith(outputDir)) {
            throw new IllegalStateException("Report path escapes output directory: " + file.relativePath());
        }
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            logger.info("Wrote {} ({} bytes)", target, file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
