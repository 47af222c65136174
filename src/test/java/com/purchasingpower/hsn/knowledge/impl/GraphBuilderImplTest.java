package com.purchasingpower.hsn.knowledge.impl;

import com.purchasingpower.hsn.core.GraphEdge;
import com.purchasingpower.hsn.core.GraphNode;
import com.purchasingpower.hsn.core.HsnDocument;
import com.purchasingpower.hsn.core.NodeLabel;
import com.purchasingpower.hsn.core.RelationType;
import com.purchasingpower.hsn.knowledge.BuildResult;
import com.purchasingpower.hsn.knowledge.GraphStatistics;
import com.purchasingpower.hsn.knowledge.HierarchyDirection;
import com.purchasingpower.hsn.knowledge.IntegrityReport;
import com.purchasingpower.hsn.support.HashingEmbeddingModel;
import com.purchasingpower.hsn.support.TestDocuments;
import com.purchasingpower.hsn.vector.impl.LangChain4jEmbeddingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;

@DisplayName("Graph builder")
class GraphBuilderImplTest {

    private InMemoryGraphStore store;
    private GraphBuilderImpl builder;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        builder = new GraphBuilderImpl(store, new LangChain4jEmbeddingService(new HashingEmbeddingModel()));
    }

    @Test
    @DisplayName("Builds one node per distinct taxonomy id and one hierarchy edge per parent link")
    void build_createsHierarchy() {
        // Given: 6 codes under 1 chapter, 3 headings, 5 subheadings
        List<HsnDocument> documents = TestDocuments.chapter40();

        // When
        BuildResult result = builder.build(documents);

        // Then
        assertThat(result.recordsProcessed()).isEqualTo(6);
        assertThat(result.nodesCreated()).isEqualTo(1 + 3 + 5 + 6);
        assertThat(result.edgesCreated()).isEqualTo(3 + 5 + 6);
        assertThat(store.findNode("code_40111010")).get()
                .extracting(GraphNode::getLabel).isEqualTo(NodeLabel.CODE);
    }

    @Test
    @DisplayName("Building twice yields the same counts as building once")
    void build_isIdempotent() {
        // Given
        List<HsnDocument> documents = TestDocuments.chapter40();
        builder.build(documents);
        GraphStatistics once = builder.statistics();

        // When
        BuildResult second = builder.build(documents);

        // Then
        assertThat(second.nodesCreated()).isZero();
        assertThat(second.edgesCreated()).isZero();
        assertThat(builder.statistics()).isEqualTo(once);
    }

    @Test
    @DisplayName("Blank descriptions become 'not specified'")
    void build_defaultsBlankDescriptions() {
        HsnDocument document = TestDocuments.document("40011010", "4001", "400110", "Latex");
        document.getMetadata().setHeadingDescription(" ");

        builder.build(List.of(document));

        assertThat(store.findNode("head_4001")).get()
                .extracting(GraphNode::getDescription).isEqualTo(GraphNode.NOT_SPECIFIED);
    }

    @Test
    @DisplayName("Rejects an empty document list")
    void build_rejectsEmptyInput() {
        assertThatThrownBy(() -> builder.build(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Siblings are linked both ways within a subheading only")
    void enrichSiblings_linksCodesUnderSameSubheading() {
        // Given
        builder.build(TestDocuments.chapter40());

        // When
        int created = builder.enrichSiblings();

        // Then: only subheading 400110 has two codes
        assertThat(created).isEqualTo(2);
        assertThat(store.incomingEdges("code_40011020"))
                .extracting(GraphEdge::getRelation)
                .containsExactly(RelationType.HAS_CODE, RelationType.SIBLING_OF);
        assertThat(builder.enrichSiblings()).isZero();
    }

    @Test
    @DisplayName("Similarity edges carry the score and respect the threshold")
    void enrichSimilarity_addsScoredEdgesAboveThreshold() {
        // Given: two identical descriptions and one unrelated one
        builder.build(List.of(
                TestDocuments.document("40111010", "4011", "401110", "radial tyres for cars"),
                TestDocuments.document("40112010", "4011", "401120", "radial tyres for cars"),
                TestDocuments.document("40101100", "4010", "401011", "conveyor belting")));

        // When
        int created = builder.enrichSimilarity(0.99);

        // Then
        assertThat(created).isEqualTo(1);
        GraphEdge edge = store.incomingEdges("code_40112010").stream()
                .filter(e -> e.getRelation() == RelationType.SIMILAR_TO)
                .findFirst()
                .orElseThrow();
        assertThat(edge.getSourceId()).isEqualTo("code_40111010");
        assertThat((Double) edge.getProperties().get(GraphEdge.SCORE)).isGreaterThan(0.99);
    }

    @Test
    @DisplayName("A valid build has no integrity violations")
    void validateIntegrity_passesForValidBuild() {
        builder.build(TestDocuments.chapter40());
        builder.enrichSiblings();

        IntegrityReport report = builder.validateIntegrity();

        assertThat(report.isValid()).isTrue();
        assertThat(report.checkedCodes()).isEqualTo(6);
    }

    @Test
    @DisplayName("Reports orphan codes and codes with several hierarchy parents")
    void validateIntegrity_reportsViolations() {
        // Given
        builder.build(TestDocuments.chapter40());
        store.addNode(GraphNode.of("code_40999999", NodeLabel.CODE, "Orphan"));
        store.addEdge(GraphEdge.of("sub_401120", "code_40111010", RelationType.HAS_CODE));

        // When
        IntegrityReport report = builder.validateIntegrity();

        // Then
        assertThat(report.isValid()).isFalse();
        assertThat(report.violations())
                .extracting(IntegrityReport.Violation::nodeId, IntegrityReport.Violation::kind)
                .containsExactlyInAnyOrder(
                        tuple("code_40999999", IntegrityReport.Kind.MISSING_PARENT),
                        tuple("code_40111010", IntegrityReport.Kind.MULTIPLE_PARENTS));
    }

    @Test
    @DisplayName("traverseHierarchy returns the parent going up and nothing going down from a code")
    void traverseHierarchy() {
        builder.build(TestDocuments.chapter40());

        assertThat(builder.traverseHierarchy("40011010", HierarchyDirection.UP))
                .extracting(GraphNode::getId).containsExactly("sub_400110");
        assertThat(builder.traverseHierarchy("40011010", HierarchyDirection.DOWN)).isEmpty();
    }

    @Test
    @DisplayName("contextSubgraph reaches the chapter at depth 3")
    void contextSubgraph() {
        builder.build(TestDocuments.chapter40());

        assertThat(builder.contextSubgraph("40011010", 3).nodeIds())
                .contains("code_40011010", "sub_400110", "head_4001", "chap_40");
    }
}
