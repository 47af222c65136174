package com.purchasingpower.hsn.support;

import com.purchasingpower.hsn.core.HsnDocument;
import com.purchasingpower.hsn.core.RetrievedDocument;
import com.purchasingpower.hsn.vector.VectorStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Vector store returning a fixed ranked list. Records the requested top-k.
 */
public class StubVectorStore implements VectorStore {

    private final List<RetrievedDocument> ranked;
    private final List<Integer> requestedTopK = new ArrayList<>();

    public StubVectorStore(List<RetrievedDocument> ranked) {
        this.ranked = List.copyOf(ranked);
    }

    @Override
    public void initialize(List<HsnDocument> documents) {
        throw new UnsupportedOperationException("stub");
    }

    @Override
    public List<RetrievedDocument> query(String text, int topK) {
        requestedTopK.add(topK);
        return ranked.subList(0, Math.min(topK, ranked.size()));
    }

    @Override
    public Optional<RetrievedDocument> findById(String documentId) {
        return ranked.stream().filter(doc -> doc.getId().equals(documentId)).findFirst();
    }

    public List<Integer> requestedTopK() {
        return requestedTopK;
    }
}
