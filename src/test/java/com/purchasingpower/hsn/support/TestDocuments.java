package com.purchasingpower.hsn.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.hsn.core.HsnDocument;
import com.purchasingpower.hsn.core.HsnMetadata;
import com.purchasingpower.hsn.core.RetrievedDocument;
import com.purchasingpower.hsn.ingest.DocumentLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Documents and retrieval results for tests.
 */
public final class TestDocuments {

    public static final String FIXTURE = "/fixtures/hsn_documents.json";

    private TestDocuments() {
    }

    /**
     * Six Chapter 40 codes: latex (two siblings), smoked sheets, conveyor belts,
     * car tyres and lorry tyres.
     */
    public static List<HsnDocument> chapter40() {
        try (InputStream in = TestDocuments.class.getResourceAsStream(FIXTURE)) {
            return new DocumentLoader(new ObjectMapper()).read(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static HsnDocument document(String code, String heading, String subheading, String item) {
        HsnMetadata metadata = HsnMetadata.builder()
                .hsnCode(code)
                .chapter(code.substring(0, 2))
                .heading(heading)
                .subheading(subheading)
                .itemDescription(item)
                .chapterDescription("Chapter " + code.substring(0, 2))
                .headingDescription("Heading " + heading)
                .subheadingDescription("Subheading " + subheading)
                .build();
        return HsnDocument.builder()
                .documentId(HsnDocument.documentIdFor(code))
                .text(item)
                .metadata(metadata)
                .build();
    }

    public static RetrievedDocument retrieved(String code, double score) {
        return RetrievedDocument.builder()
                .id(HsnDocument.documentIdFor(code))
                .text("Item " + code)
                .metadata(HsnMetadata.builder()
                        .hsnCode(code)
                        .chapter(code.substring(0, 2))
                        .heading(code.substring(0, 4))
                        .subheading(code.substring(0, 6))
                        .itemDescription("Item " + code)
                        .build())
                .score(score)
                .build();
    }
}
