package com.purchasingpower.hsn.retrieval.impl;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.google.common.base.Preconditions;
import com.purchasingpower.hsn.core.GraphEdge;
import com.purchasingpower.hsn.core.GraphNode;
import com.purchasingpower.hsn.core.NodeLabel;
import com.purchasingpower.hsn.core.RetrievedDocument;
import com.purchasingpower.hsn.knowledge.GraphCapability;
import com.purchasingpower.hsn.knowledge.GraphStore;
import com.purchasingpower.hsn.retrieval.RetrievalStrategy;
import com.purchasingpower.hsn.retrieval.RetrievalStrategyType;
import com.purchasingpower.hsn.vector.VectorStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decorates another strategy (normally {@link ReRankStrategy}) and attaches to
 * every result the description path from its Chapter down to its Subheading,
 * e.g. {@code "Chapter: Rubber. Heading: Tyres. Subheading: Radial"}.
 *
 * <p>Paths are immutable after a graph build, so they are cached per code in a
 * bounded Caffeine cache. Backends without direct traversal get a fixed
 * placeholder instead of a path.
 */
@Slf4j
public class GraphContextualStrategy implements RetrievalStrategy {

    public static final String CONTEXT_NOT_AVAILABLE = "Graph context not available for this backend.";
    public static final String CODE_NOT_IN_GRAPH = "HSN code not found in graph.";
    public static final int MIN_CACHE_SIZE = 128;

    private final RetrievalStrategy delegate;
    private final GraphStore graphStore;
    private final LoadingCache<String, String> contextCache;

    public GraphContextualStrategy(RetrievalStrategy delegate, GraphStore graphStore, int cacheSize) {
        Preconditions.checkArgument(cacheSize >= MIN_CACHE_SIZE,
                "Graph context cache must hold at least %s entries: %s", MIN_CACHE_SIZE, cacheSize);
        this.delegate = delegate;
        this.graphStore = graphStore;
        this.contextCache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .recordStats()
                .build(this::computeGraphContext);
    }

    @Override
    public List<RetrievedDocument> retrieve(String query, VectorStore vectorStore) {
        return delegate.retrieve(query, vectorStore).stream()
                .map(this::withGraphContext)
                .toList();
    }

    @Override
    public String name() {
        return RetrievalStrategyType.GRAPH_CONTEXTUAL.getConfigName();
    }

    /**
     * Ancestor path for a code, cached.
     */
    public String graphContext(String hsnCode) {
        return contextCache.get(hsnCode);
    }

    long cachedEntries() {
        contextCache.cleanUp();
        return contextCache.estimatedSize();
    }

    long cacheHits() {
        return contextCache.stats().hitCount();
    }

    private RetrievedDocument withGraphContext(RetrievedDocument document) {
        String hsnCode = document.getHsnCode();
        if (hsnCode == null) {
            return document;
        }
        return document.withGraphContext(graphContext(hsnCode));
    }

    private String computeGraphContext(String hsnCode) {
        if (!graphStore.supports(GraphCapability.DIRECT_TRAVERSAL)) {
            return CONTEXT_NOT_AVAILABLE;
        }

        Optional<GraphNode> codeNode = graphStore.findNode(NodeLabel.CODE.nodeId(hsnCode));
        if (codeNode.isEmpty()) {
            log.debug("Code {} not in graph", hsnCode);
            return CODE_NOT_IN_GRAPH;
        }

        Deque<GraphNode> path = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        GraphNode current = codeNode.get();
        while (current != null && visited.add(current.getId())) {
            path.addFirst(current);
            current = firstHierarchyParent(current.getId()).orElse(null);
        }

        return path.stream()
                .filter(node -> node.getLabel() != NodeLabel.CODE)
                .map(node -> node.getLabel().getDisplayName() + ": " + node.getDescription())
                .collect(Collectors.joining(". "));
    }

    private Optional<GraphNode> firstHierarchyParent(String nodeId) {
        return graphStore.incomingEdges(nodeId).stream()
                .filter(edge -> edge.getRelation().isHierarchy())
                .map(GraphEdge::getSourceId)
                .findFirst()
                .flatMap(graphStore::findNode);
    }
}
