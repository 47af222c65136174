package com.purchasingpower.hsn.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.hsn.core.HsnDocument;
import com.purchasingpower.hsn.exception.GraphBuildException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Document loader")
class DocumentLoaderTest {

    private final DocumentLoader loader = new DocumentLoader(new ObjectMapper());

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Loads the processed JSON file with snake_case metadata")
    void load_readsProcessedFile() throws IOException {
        // Given
        Path file = tempDir.resolve("processed.json");
        Files.writeString(file, """
                [{"document_id": "hsn_40111010",
                  "text": "HSN Code 40111010: radial car tyres",
                  "metadata": {"hsn_code": "40111010", "chapter": "40", "heading": "4011",
                               "subheading": "401110", "item_description": "radial car tyres",
                               "heading_description": "New pneumatic tyres, of rubber",
                               "extra_field": "ignored"}}]
                """);

        // When
        List<HsnDocument> documents = loader.load(file);

        // Then
        assertThat(documents).singleElement().satisfies(doc -> {
            assertThat(doc.getDocumentId()).isEqualTo("hsn_40111010");
            assertThat(doc.getMetadata().getSubheading()).isEqualTo("401110");
            assertThat(doc.getMetadata().getHeadingDescription()).isEqualTo("New pneumatic tyres, of rubber");
        });
    }

    @Test
    @DisplayName("Derives a missing document id from the code")
    void read_fillsMissingDocumentId() throws IOException {
        List<HsnDocument> documents = loader.read(json("""
                [{"text": "latex", "metadata": {"hsn_code": "40011010", "chapter": "40",
                  "heading": "4001", "subheading": "400110"}}]
                """));

        assertThat(documents.get(0).getDocumentId()).isEqualTo("hsn_40011010");
    }

    @Test
    @DisplayName("Rejects documents without a code")
    void read_rejectsMissingCode() {
        assertThatThrownBy(() -> loader.read(json("[{\"document_id\": \"x\", \"metadata\": {\"chapter\": \"40\"}}]")))
                .isInstanceOf(GraphBuildException.class)
                .hasMessageContaining("hsn_code");
    }

    @Test
    @DisplayName("Rejects an empty document list")
    void read_rejectsEmpty() {
        assertThatThrownBy(() -> loader.read(json("[]"))).isInstanceOf(GraphBuildException.class);
    }

    @Test
    @DisplayName("A missing file is a build error")
    void load_missingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.json")))
                .isInstanceOf(GraphBuildException.class)
                .hasMessageContaining("not found");
    }

    private static ByteArrayInputStream json(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
