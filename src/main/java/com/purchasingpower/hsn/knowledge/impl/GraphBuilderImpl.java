package com.purchasingpower.hsn.knowledge.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.purchasingpower.hsn.core.GraphEdge;
import com.purchasingpower.hsn.core.GraphNode;
import com.purchasingpower.hsn.core.HsnDocument;
import com.purchasingpower.hsn.core.HsnMetadata;
import com.purchasingpower.hsn.core.NodeLabel;
import com.purchasingpower.hsn.core.RelationType;
import com.purchasingpower.hsn.knowledge.BuildResult;
import com.purchasingpower.hsn.knowledge.GraphBuilder;
import com.purchasingpower.hsn.knowledge.GraphSnapshot;
import com.purchasingpower.hsn.knowledge.GraphStatistics;
import com.purchasingpower.hsn.knowledge.GraphStore;
import com.purchasingpower.hsn.knowledge.HierarchyDirection;
import com.purchasingpower.hsn.knowledge.IntegrityReport;
import com.purchasingpower.hsn.knowledge.RelationshipDirection;
import com.purchasingpower.hsn.vector.EmbeddingService;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Backend-agnostic builder of the HSN knowledge graph.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphBuilderImpl implements GraphBuilder {

    private final GraphStore graphStore;
    private final EmbeddingService embeddingService;

    @Override
    public BuildResult build(List<HsnDocument> documents) {
        Preconditions.checkArgument(documents != null && !documents.isEmpty(), "No documents to build the graph from");

        log.info("Building the hierarchical HSN knowledge graph from {} documents...", documents.size());
        Stopwatch stopwatch = Stopwatch.createStarted();

        int nodesCreated = 0;
        int edgesCreated = 0;
        for (HsnDocument document : documents) {
            HsnMetadata meta = document.getMetadata();
            String chapterId = NodeLabel.CHAPTER.nodeId(meta.getChapter());
            String headingId = NodeLabel.HEADING.nodeId(meta.getHeading());
            String subheadingId = NodeLabel.SUBHEADING.nodeId(meta.getSubheading());
            String codeId = NodeLabel.CODE.nodeId(meta.getHsnCode());

            nodesCreated += count(graphStore.addNode(GraphNode.of(chapterId, NodeLabel.CHAPTER, meta.getChapterDescription())));
            nodesCreated += count(graphStore.addNode(GraphNode.of(headingId, NodeLabel.HEADING, meta.getHeadingDescription())));
            nodesCreated += count(graphStore.addNode(GraphNode.of(subheadingId, NodeLabel.SUBHEADING, meta.getSubheadingDescription())));
            nodesCreated += count(graphStore.addNode(GraphNode.of(codeId, NodeLabel.CODE, meta.getItemDescription())));

            edgesCreated += count(graphStore.addEdge(GraphEdge.of(chapterId, headingId, RelationType.HAS_HEADING)));
            edgesCreated += count(graphStore.addEdge(GraphEdge.of(headingId, subheadingId, RelationType.HAS_SUBHEADING)));
            edgesCreated += count(graphStore.addEdge(GraphEdge.of(subheadingId, codeId, RelationType.HAS_CODE)));
        }

        log.info("Hierarchical graph construction complete: {} nodes, {} edges created ({} ms)",
                nodesCreated, edgesCreated, stopwatch.elapsed().toMillis());
        return new BuildResult(documents.size(), nodesCreated, edgesCreated);
    }

    @Override
    public int enrichSiblings() {
        Stopwatch stopwatch = Stopwatch.createStarted();
        Map<String, List<String>> codesBySubheading = new LinkedHashMap<>();
        for (GraphNode code : graphStore.nodesWithLabel(NodeLabel.CODE)) {
            graphStore.incomingEdges(code.getId()).stream()
                    .filter(edge -> edge.getRelation() == RelationType.HAS_CODE)
                    .findFirst()
                    .ifPresent(edge -> codesBySubheading
                            .computeIfAbsent(edge.getSourceId(), k -> new ArrayList<>())
                            .add(code.getId()));
        }

        // Sibling groups are small, so the pairwise pass stays cheap
        int created = 0;
        for (List<String> codes : codesBySubheading.values()) {
            for (int i = 0; i < codes.size(); i++) {
                for (int j = i + 1; j < codes.size(); j++) {
                    created += count(graphStore.addEdge(GraphEdge.of(codes.get(i), codes.get(j), RelationType.SIBLING_OF)));
                    created += count(graphStore.addEdge(GraphEdge.of(codes.get(j), codes.get(i), RelationType.SIBLING_OF)));
                }
            }
        }

        log.info("Added {} rule-based 'SIBLING_OF' relationships across {} subheadings ({} ms)",
                created, codesBySubheading.size(), stopwatch.elapsed().toMillis());
        return created;
    }

    @Override
    public int enrichSimilarity(double threshold) {
        Preconditions.checkArgument(threshold > 0 && threshold < 1, "Similarity threshold must be in (0, 1): %s", threshold);

        List<GraphNode> codes = graphStore.nodesWithLabel(NodeLabel.CODE);
        if (codes.isEmpty()) {
            log.warn("No code nodes found for similarity enrichment");
            return 0;
        }

        log.info("Starting similarity enrichment over {} code descriptions (threshold {})...", codes.size(), threshold);
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<Embedding> embeddings = embeddingService.embedAll(
                codes.stream().map(GraphNode::getDescription).toList());

        int created = 0;
        for (int i = 0; i < codes.size(); i++) {
            for (int j = i + 1; j < codes.size(); j++) {
                double similarity = CosineSimilarity.between(embeddings.get(i), embeddings.get(j));
                if (similarity > threshold) {
                    log.debug("Found similarity between {} and {}: {}", codes.get(i).getId(), codes.get(j).getId(), similarity);
                    GraphEdge edge = GraphEdge.builder()
                            .sourceId(codes.get(i).getId())
                            .targetId(codes.get(j).getId())
                            .relation(RelationType.SIMILAR_TO)
                            .properties(Map.of(GraphEdge.SCORE, similarity))
                            .build();
                    created += count(graphStore.addEdge(edge));
                }
            }
        }

        log.info("Similarity enrichment complete: {} 'SIMILAR_TO' edges ({} ms)", created, stopwatch.elapsed().toMillis());
        return created;
    }

    @Override
    public IntegrityReport validateIntegrity() {
        log.info("Validating graph integrity...");
        List<GraphNode> codes = graphStore.nodesWithLabel(NodeLabel.CODE);
        List<IntegrityReport.Violation> violations = new ArrayList<>();

        for (GraphNode code : codes) {
            List<GraphEdge> hierarchyParents = graphStore.incomingEdges(code.getId()).stream()
                    .filter(edge -> edge.getRelation().isHierarchy())
                    .toList();

            boolean hasSubheadingParent = hierarchyParents.stream()
                    .map(edge -> graphStore.findNode(edge.getSourceId()))
                    .flatMap(Optional::stream)
                    .anyMatch(parent -> parent.getLabel() == NodeLabel.SUBHEADING);

            if (!hasSubheadingParent) {
                log.warn("Integrity check failed: Node {} has no Subheading parent", code.getId());
                violations.add(new IntegrityReport.Violation(code.getId(), IntegrityReport.Kind.MISSING_PARENT,
                        "no incoming edge from a Subheading"));
            }
            if (hierarchyParents.size() > 1) {
                log.warn("Integrity check failed: Node {} has {} hierarchy parents", code.getId(), hierarchyParents.size());
                violations.add(new IntegrityReport.Violation(code.getId(), IntegrityReport.Kind.MULTIPLE_PARENTS,
                        hierarchyParents.size() + " incoming hierarchy edges"));
            }
        }

        IntegrityReport report = new IntegrityReport(codes.size(), violations);
        if (report.isValid()) {
            log.info("Graph integrity validation passed ({} codes checked)", codes.size());
        } else {
            log.warn("Graph integrity validation found {} violations", violations.size());
        }
        return report;
    }

    @Override
    public List<GraphNode> traverseHierarchy(String hsnCode, HierarchyDirection direction) {
        RelationshipDirection hop = direction == HierarchyDirection.UP
                ? RelationshipDirection.INCOMING
                : RelationshipDirection.OUTGOING;
        return graphStore.neighbors(NodeLabel.CODE.nodeId(hsnCode), hop);
    }

    @Override
    public GraphSnapshot contextSubgraph(String hsnCode, int depth) {
        return graphStore.subgraph(NodeLabel.CODE.nodeId(hsnCode), depth);
    }

    @Override
    public GraphStatistics statistics() {
        return graphStore.statistics();
    }

    private static int count(boolean created) {
        return created ? 1 : 0;
    }
}
