package com.framelint.core.renderer.impl;

import com.framelint.core.renderer.GeneratedFile;
import com.framelint.core.renderer.GeneratedOutput;
import com.framelint.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withReports_writesEachFile() throws IOException {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("framelint-report.md", "# Design Lint Report: p", "text/markdown"),
            new GeneratedFile("framelint-report.json", "{\"projectId\":\"p\"}", "application/json")));

        // When
        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        // Then
        assertThat(Files.readString(tempDir.resolve("framelint-report.md"))).isEqualTo("# Design Lint Report: p");
        assertThat(Files.readString(tempDir.resolve("framelint-report.json"))).isEqualTo("{\"projectId\":\"p\"}");
    }

    @Test
    void render_missingOutputDirectory_createsIt() {
        // Given
        Path outputDir = tempDir.resolve("reports/nightly");
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("summary/framelint-report.txt", "Project p: score 100/100 [S]", "text/plain")));

        // When
        renderer.render(output, new RenderContext(outputDir.toString(), Map.of()));

        // Then
        assertThat(outputDir.resolve("summary/framelint-report.txt")).exists();
    }

    @Test
    void render_nonAsciiContent_writesUtf8() throws IOException {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("size.txt", "320px × 181px", "text/plain")));

        // When
        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        // Then
        assertThat(Files.readString(tempDir.resolve("size.txt"))).isEqualTo("320px × 181px");
    }

    @Test
    void render_pathEscapingOutputDirectory_throwsException() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("../outside.md", "nope", "text/markdown")));
        RenderContext context = new RenderContext(tempDir.resolve("out").toString(), Map.of());

        // When / Then
        assertThatThrownBy(() -> renderer.render(output, context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("escapes output directory");
        assertThat(tempDir.resolve("outside.md")).doesNotExist();
    }

    @Test
    void render_outputDirectoryIsAFile_throwsException() throws IOException {
        // Given
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("report.md", "content", "text/markdown")));

        // When / Then
        assertThatThrownBy(() -> renderer.render(output, new RenderContext(blocker.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasCauseInstanceOf(IOException.class);
    }
}
