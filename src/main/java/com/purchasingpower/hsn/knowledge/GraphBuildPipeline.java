package com.purchasingpower.hsn.knowledge;

import com.google.common.base.Stopwatch;
import com.purchasingpower.hsn.configuration.GraphProperties;
import com.purchasingpower.hsn.configuration.HsnProperties;
import com.purchasingpower.hsn.core.HsnDocument;
import com.purchasingpower.hsn.exception.GraphBuildException;
import com.purchasingpower.hsn.ingest.DocumentLoader;
import com.purchasingpower.hsn.knowledge.export.GraphVisualizer;
import com.purchasingpower.hsn.vector.VectorStore;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds the knowledge base from the processed document file:
 * <pre>
 * load → build hierarchy → siblings → similarity (optional) → indexes
 *      → validate → statistics → GraphML → visualization → vector store (optional)
 * </pre>
 * The graph and the vector index are fed the same document list.
 *
 * <p>Both startup steps are on by default and run once all singletons exist,
 * before the web server accepts requests. {@code hsn.graph.build-on-startup}
 * runs the whole pipeline; {@code hsn.vector-store.initialize-on-startup} alone
 * only indexes the documents, for a graph that is already persisted (Neo4j).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphBuildPipeline implements SmartInitializingSingleton {

    private final HsnProperties properties;
    private final DocumentLoader documentLoader;
    private final GraphBuilder graphBuilder;
    private final GraphStore graphStore;
    private final GraphVisualizer graphVisualizer;
    private final VectorStore vectorStore;

    @Override
    public void afterSingletonsInstantiated() {
        boolean buildGraph = properties.getGraph().isBuildOnStartup();
        boolean initializeVectors = properties.getVectorStore().isInitializeOnStartup();
        if (!buildGraph && !initializeVectors) {
            log.warn("Startup build and vector initialization are both disabled; the knowledge base stays as-is");
            return;
        }
        List<HsnDocument> documents = documentLoader.load(Path.of(properties.getData().getProcessedFile()));
        if (buildGraph) {
            run(documents);
        } else {
            log.info("Graph build on startup disabled, initializing vector store only");
            initializeVectorStore(documents);
        }
    }

    public Report run() {
        return run(documentLoader.load(Path.of(properties.getData().getProcessedFile())));
    }

    public Report run(List<HsnDocument> documents) {
        GraphProperties graph = properties.getGraph();
        log.info("🚀 Starting knowledge graph build pipeline ({} documents)", documents.size());
        Stopwatch stopwatch = Stopwatch.createStarted();

        BuildResult build = graphBuilder.build(documents);
        int siblings = graphBuilder.enrichSiblings();
        int similar = 0;
        if (graph.isSimilarityEnabled()) {
            similar = graphBuilder.enrichSimilarity(graph.getSimilarityThreshold());
        } else {
            log.info("Similarity enrichment disabled, skipping");
        }
        graphStore.createIndexes();

        IntegrityReport integrity = graphBuilder.validateIntegrity();
        GraphStatistics statistics = graphBuilder.statistics();
        log.info("Graph statistics: {} nodes, {} edges, by label {}",
                statistics.getNodeCount(), statistics.getEdgeCount(), statistics.getNodesByLabel());

        if (graph.isExportEnabled()) {
            export(graph);
        }

        if (properties.getVectorStore().isInitializeOnStartup()) {
            initializeVectorStore(documents);
        }

        log.info("✅ Knowledge graph pipeline complete ({} ms)", stopwatch.elapsed().toMillis());
        return Report.builder()
                .buildResult(build)
                .siblingEdges(siblings)
                .similarityEdges(similar)
                .integrity(integrity)
                .statistics(statistics)
                .build();
    }

    public void initializeVectorStore(List<HsnDocument> documents) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        vectorStore.initialize(documents);
        log.info("Vector store initialized with {} documents ({} ms)", documents.size(), stopwatch.elapsed().toMillis());
    }

    private void export(GraphProperties graph) {
        Path outputDir = Path.of(properties.getData().getOutputDir());
        try {
            Path graphMl = outputDir.resolve(graph.getExportFile());
            graphStore.export(graphMl);
            log.info("Graph exported to {}", graphMl);
            graphVisualizer.write(graphStore.snapshot(), outputDir.resolve(graph.getVisualizationFile()));
        } catch (IOException e) {
            throw new GraphBuildException("Failed to write graph artifacts to " + outputDir, e);
        }
    }

    @Value
    @Builder
    public static class Report {
        BuildResult buildResult;
        int siblingEdges;
        int similarityEdges;
        IntegrityReport integrity;
        GraphStatistics statistics;
    }
}
