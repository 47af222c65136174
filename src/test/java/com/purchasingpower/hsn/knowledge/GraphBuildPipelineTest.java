package com.purchasingpower.hsn.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.hsn.configuration.HsnProperties;
import com.purchasingpower.hsn.ingest.DocumentLoader;
import com.purchasingpower.hsn.knowledge.export.GraphVisualizer;
import com.purchasingpower.hsn.knowledge.impl.GraphBuilderImpl;
import com.purchasingpower.hsn.knowledge.impl.InMemoryGraphStore;
import com.purchasingpower.hsn.support.HashingEmbeddingModel;
import com.purchasingpower.hsn.support.TestDocuments;
import com.purchasingpower.hsn.vector.EmbeddingService;
import com.purchasingpower.hsn.vector.impl.InMemoryVectorStore;
import com.purchasingpower.hsn.vector.impl.LangChain4jEmbeddingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("Graph build pipeline")
class GraphBuildPipelineTest {

    private static final String FIXTURE = "src/test/resources/fixtures/hsn_documents.json";

    @TempDir
    Path outputDir;

    private HsnProperties properties;
    private InMemoryGraphStore graphStore;
    private InMemoryVectorStore vectorStore;
    private GraphBuildPipeline pipeline;

    @BeforeEach
    void setUp() {
        properties = new HsnProperties();
        properties.getData().setOutputDir(outputDir.toString());
        properties.getVectorStore().setInitializeOnStartup(true);

        EmbeddingService embeddingService = new LangChain4jEmbeddingService(new HashingEmbeddingModel());
        graphStore = new InMemoryGraphStore();
        vectorStore = new InMemoryVectorStore(embeddingService);
        pipeline = new GraphBuildPipeline(properties,
                new DocumentLoader(new ObjectMapper()),
                new GraphBuilderImpl(graphStore, embeddingService),
                graphStore,
                new GraphVisualizer(new ObjectMapper()),
                vectorStore);
    }

    @Test
    @DisplayName("Builds, enriches, validates and exports from one document set")
    void run_buildsKnowledgeBase() {
        // When
        GraphBuildPipeline.Report report = pipeline.run(TestDocuments.chapter40());

        // Then
        assertThat(report.getBuildResult().nodesCreated()).isEqualTo(15);
        assertThat(report.getSiblingEdges()).isEqualTo(2);
        assertThat(report.getSimilarityEdges()).isZero();
        assertThat(report.getIntegrity().isValid()).isTrue();
        assertThat(report.getStatistics().getNodeCount()).isEqualTo(15);
        assertThat(outputDir.resolve("hsn_knowledge_graph.graphml")).isRegularFile();
        assertThat(outputDir.resolve("hsn_knowledge_graph.html")).isRegularFile();
        assertThat(vectorStore.findByHsnCode("40112010")).isPresent();
    }

    @Test
    @DisplayName("Similarity enrichment runs only when enabled")
    void run_withSimilarityEnabled() {
        // Given: the two latex codes share most of their wording
        properties.getGraph().setSimilarityEnabled(true);
        properties.getGraph().setSimilarityThreshold(0.5);
        properties.getGraph().setExportEnabled(false);

        // When
        GraphBuildPipeline.Report report = pipeline.run(TestDocuments.chapter40());

        // Then
        assertThat(report.getSimilarityEdges()).isPositive();
        assertThat(outputDir.resolve("hsn_knowledge_graph.graphml")).doesNotExist();
    }

    @Test
    @DisplayName("Running twice creates nothing new")
    void run_isIdempotent() {
        pipeline.run(TestDocuments.chapter40());

        GraphBuildPipeline.Report second = pipeline.run(TestDocuments.chapter40());

        assertThat(second.getBuildResult().nodesCreated()).isZero();
        assertThat(second.getBuildResult().edgesCreated()).isZero();
        assertThat(second.getSiblingEdges()).isZero();
        assertThat(second.getStatistics().getNodeCount()).isEqualTo(15);
    }

    @Test
    @DisplayName("Startup build and vector initialization are on by default")
    void defaults_enableStartupSteps() {
        HsnProperties defaults = new HsnProperties();

        assertThat(defaults.getGraph().isBuildOnStartup()).isTrue();
        assertThat(defaults.getVectorStore().isInitializeOnStartup()).isTrue();
    }

    @Test
    @DisplayName("Startup with defaults builds the graph and indexes the processed file")
    void startup_withDefaults_buildsEverything() {
        // Given
        properties.getData().setProcessedFile(FIXTURE);
        properties.getGraph().setExportEnabled(false);

        // When
        pipeline.afterSingletonsInstantiated();

        // Then
        assertThat(graphStore.snapshot().nodes()).isNotEmpty();
        assertThat(vectorStore.findByHsnCode("40011010")).isPresent();
    }

    @Test
    @DisplayName("Vector store is initialized on startup even when the graph build is off")
    void startup_initializesVectorsWithoutGraphBuild() {
        // Given
        properties.getData().setProcessedFile(FIXTURE);
        properties.getGraph().setBuildOnStartup(false);

        // When
        pipeline.afterSingletonsInstantiated();

        // Then
        assertThat(vectorStore.findByHsnCode("40011010")).isPresent();
        assertThat(graphStore.snapshot().nodes()).isEmpty();
        assertThat(outputDir.resolve("hsn_knowledge_graph.graphml")).doesNotExist();
    }

    @Test
    @DisplayName("Nothing is loaded on startup when both steps are off")
    void startup_withBothStepsDisabled_loadsNothing() {
        // Given: the data file does not exist
        properties.getData().setProcessedFile(outputDir.resolve("missing.json").toString());
        properties.getGraph().setBuildOnStartup(false);
        properties.getVectorStore().setInitializeOnStartup(false);

        // When / Then
        assertThatCode(() -> pipeline.afterSingletonsInstantiated()).doesNotThrowAnyException();
        assertThat(vectorStore.findByHsnCode("40011010")).isEmpty();
        assertThat(graphStore.snapshot().nodes()).isEmpty();
    }
}
