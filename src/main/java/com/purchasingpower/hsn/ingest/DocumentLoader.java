package com.purchasingpower.hsn.ingest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.hsn.core.HsnDocument;
import com.purchasingpower.hsn.exception.GraphBuildException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the processed document file written by the ingestion pipeline: a JSON
 * array of {@code {document_id, text, metadata}} objects. The file is assumed
 * to be schema-valid; only missing codes are rejected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentLoader {

    private static final TypeReference<List<HsnDocument>> DOCUMENT_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public List<HsnDocument> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new GraphBuildException("Processed data file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            List<HsnDocument> documents = read(in);
            log.info("Loaded {} processed documents from {}", documents.size(), path);
            return documents;
        } catch (IOException e) {
            throw new GraphBuildException("Failed to read processed data from " + path, e);
        }
    }

    public List<HsnDocument> read(InputStream in) throws IOException {
        List<HsnDocument> documents = objectMapper.readValue(in, DOCUMENT_LIST);
        if (documents == null || documents.isEmpty()) {
            throw new GraphBuildException("Processed data contains no documents");
        }
        for (HsnDocument document : documents) {
            if (document.getMetadata() == null || document.getMetadata().getHsnCode() == null) {
                throw new GraphBuildException("Document without hsn_code: " + document.getDocumentId());
            }
            if (document.getDocumentId() == null) {
                document.setDocumentId(HsnDocument.documentIdFor(document.getMetadata().getHsnCode()));
            }
        }
        return documents;
    }
}
