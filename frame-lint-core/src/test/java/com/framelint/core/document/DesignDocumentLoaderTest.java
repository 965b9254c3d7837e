package com.framelint.core.document;

import com.framelint.core.DesignAnalyzer;
import com.framelint.core.engine.TreeIndex;
import com.framelint.core.model.AnalysisSummary;
import com.framelint.core.model.AxisSizingMode;
import com.framelint.core.model.DesignDocument;
import com.framelint.core.model.DesignNode;
import com.framelint.core.model.LayoutMode;
import com.framelint.core.model.NodeType;
import com.framelint.core.model.Violation;
import com.framelint.core.rule.RuleIds;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DesignDocumentLoader}.
 */
class DesignDocumentLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void read_fileExport_readsMetadataAndTree() throws IOException {
        DesignDocument document = readFixture();

        assertThat(document.name()).isEqualTo("Landing page");
        assertThat(document.version()).isEqualTo("42");
        assertThat(document.lastModified()).isEqualTo("2026-09-30T08:15:00Z");
        assertThat(document.document().type()).isEqualTo(NodeType.DOCUMENT);
        assertThat(TreeIndex.flatten(document.document())).hasSize(8);
    }

    @Test
    void read_fileExport_mapsLayoutProperties() throws IOException {
        Map<String, DesignNode> nodes = byId(readFixture());

        DesignNode hero = nodes.get("1:2");
        assertThat(hero.layoutMode()).isEqualTo(LayoutMode.VERTICAL);
        assertThat(hero.primaryAxisSizingMode()).isEqualTo(AxisSizingMode.AUTO);
        assertThat(hero.itemSpacing()).isEqualTo(16.0);
        assertThat(hero.paddingTop()).isEqualTo(24.0);
        assertThat(hero.childCount()).isEqualTo(3);

        DesignNode inner = nodes.get("1:5");
        assertThat(inner.absoluteBoundingBox().formatSize()).isEqualTo("320px × 181px");
        assertThat(inner.constraints().usesScale()).isTrue();
    }

    @Test
    void read_unknownEnumValues_mapToDefaults() throws IOException {
        Map<String, DesignNode> nodes = byId(readFixture());

        assertThat(nodes.get("1:6").type()).isEqualTo(NodeType.OTHER);
        assertThat(nodes.get("1:7").layoutMode()).isEqualTo(LayoutMode.OTHER);
        assertThat(nodes.get("1:7").hasAutoLayout()).isTrue();
        assertThat(nodes.get("1:7").visible()).isFalse();
        assertThat(nodes.get("1:7").locked()).isTrue();
    }

    @Test
    void read_gridLayoutMode_countsAsAutoLayout() {
        DesignDocument document = DesignDocumentLoader.read("""
            {"id": "7:1", "name": "section-gallery", "type": "FRAME", "layoutMode": "GRID"}
            """);

        AnalysisSummary summary = DesignAnalyzer.withBaselineRules().analyze(document, "gallery");

        assertThat(document.document().layoutMode()).isEqualTo(LayoutMode.GRID);
        assertThat(summary.violations()).extracting(Violation::ruleId)
            .doesNotContain(RuleIds.AUTO_LAYOUT_REQUIRED, RuleIds.ABSOLUTE_POSITIONING);
    }

    @Test
    void read_bareNode_wrapsItInDocument() {
        DesignDocument document = DesignDocumentLoader.read("""
            {"id": "5:1", "name": "header", "type": "FRAME", "children": [{"id": "5:2", "type": "TEXT"}]}
            """);

        assertThat(document.name()).isEqualTo("header");
        assertThat(document.document().id()).isEqualTo("5:1");
        assertThat(document.document().children()).extracting(DesignNode::id).containsExactly("5:2");
    }

    @Test
    void read_invalidJson_throwsException() {
        assertThatThrownBy(() -> DesignDocumentLoader.read("{\"id\": "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid JSON");
    }

    @Test
    void read_array_throwsException() {
        assertThatThrownBy(() -> DesignDocumentLoader.read("[1, 2]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("JSON object");
    }

    @Test
    void read_objectWithoutIdOrDocument_throwsException() {
        assertThatThrownBy(() -> DesignDocumentLoader.read("{\"name\": \"nothing\"}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Not a design document");
    }

    @Test
    void load_file_readsDocument() throws IOException {
        Path file = tempDir.resolve("design.json");
        Files.writeString(file, "{\"id\": \"9:9\", \"name\": \"footer\", \"type\": \"FRAME\"}");

        DesignDocument document = DesignDocumentLoader.load(file);

        assertThat(document.document().type()).isEqualTo(NodeType.FRAME);
    }

    @Test
    void load_missingFile_throwsIOException() {
        assertThatThrownBy(() -> DesignDocumentLoader.load(tempDir.resolve("missing.json")))
            .isInstanceOf(IOException.class);
    }

    private static DesignDocument readFixture() throws IOException {
        try (InputStream in = DesignDocumentLoaderTest.class.getResourceAsStream("/designs/landing-page.json")) {
            assertThat(in).isNotNull();
            return DesignDocumentLoader.read(in, "landing-page.json");
        }
    }

    private static Map<String, DesignNode> byId(DesignDocument document) {
        List<DesignNode> nodes = TreeIndex.flatten(document.document());
        return nodes.stream().collect(Collectors.toMap(DesignNode::id, Function.identity()));
    }
}
