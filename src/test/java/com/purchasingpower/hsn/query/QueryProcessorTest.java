package com.purchasingpower.hsn.query;

import com.purchasingpower.hsn.configuration.HsnProperties;
import com.purchasingpower.hsn.conversation.ConversationState;
import com.purchasingpower.hsn.conversation.DialoguePhase;
import com.purchasingpower.hsn.core.DisambiguationOption;
import com.purchasingpower.hsn.core.NoResultReason;
import com.purchasingpower.hsn.core.QueryResponse;
import com.purchasingpower.hsn.core.ResponseType;
import com.purchasingpower.hsn.core.RetrievedDocument;
import com.purchasingpower.hsn.core.TopMatch;
import com.purchasingpower.hsn.exception.UpstreamFailureException;
import com.purchasingpower.hsn.support.TestDocuments;
import com.purchasingpower.hsn.util.ServiceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Query processor")
class QueryProcessorTest {

    @Mock
    private ClassificationService classificationService;

    private QueryProcessor processor;
    private ConversationState state;

    @BeforeEach
    void setUp() {
        processor = new QueryProcessor(classificationService, new IntentClassifier(), new HsnProperties());
        state = new ConversationState("session-1");
    }

    private static List<RetrievedDocument> ranked(double... scores) {
        String[] codes = {"40111010", "40112010", "40101100", "40011010"};
        RetrievedDocument[] documents = new RetrievedDocument[scores.length];
        for (int i = 0; i < scores.length; i++) {
            documents[i] = TestDocuments.retrieved(codes[i], scores[i]);
        }
        return List.of(documents);
    }

    private static QueryResponse generated(List<RetrievedDocument> documents) {
        return QueryResponse.builder()
                .type(ResponseType.CLASSIFICATION_RESULT)
                .summary("generated")
                .topMatches(documents.stream().map(TopMatch::from).toList())
                .confidence(QueryResponse.CONFIDENCE_HIGH)
                .tradePolicy(QueryResponse.TRADE_POLICY_FREE)
                .build();
    }

    @Test
    @DisplayName("Close top scores ask the user to choose")
    void processQuery_ambiguousResultsDisambiguate() {
        // Given: gap of 0.12 is under the 0.15 threshold
        when(classificationService.retrieve("rubber tyres")).thenReturn(ranked(0.91, 0.79));

        // When
        QueryResponse response = processor.processQuery("rubber tyres", state);

        // Then
        assertThat(response.getType()).isEqualTo(ResponseType.DISAMBIGUATION);
        assertThat(response.getOptions()).extracting(DisambiguationOption::position).containsExactly(1, 2);
        assertThat(response.getSummary())
                .contains("**Option 1: HSN Code 40111010**")
                .contains("**Option 2: HSN Code 40112010**")
                .endsWith("Please enter the option number (e.g., '1').");
        assertThat(state.getPhase()).isEqualTo(DialoguePhase.AWAITING_SELECTION);
        assertThat(state.getPendingOptions()).hasSize(2);
        verify(classificationService, never()).generate(anyString(), anyList());
    }

    @Test
    @DisplayName("A clear winner is summarized by the generation backend")
    void processQuery_clearWinnerGenerates() {
        // Given
        List<RetrievedDocument> documents = ranked(0.95, 0.60);
        when(classificationService.retrieve("car tyres")).thenReturn(documents);
        when(classificationService.generate("car tyres", documents)).thenReturn(generated(documents));

        // When
        QueryResponse response = processor.processQuery("car tyres", state);

        // Then
        assertThat(response.getType()).isEqualTo(ResponseType.CLASSIFICATION_RESULT);
        assertThat(response.getTopMatches()).extracting(TopMatch::getHsnCode).containsExactly("40111010", "40112010");
        assertThat(state.getPhase()).isEqualTo(DialoguePhase.IDLE);
    }

    @Test
    @DisplayName("A top score under the relevance threshold returns no result")
    void processQuery_lowConfidence() {
        when(classificationService.retrieve("1234 anything")).thenReturn(ranked(0.30, 0.29));

        QueryResponse response = processor.processQuery("1234 anything", state);

        assertThat(response.getType()).isEqualTo(ResponseType.NO_RESULT);
        assertThat(response.getNoResultReason()).isEqualTo(NoResultReason.LOW_CONFIDENCE);
        assertThat(response.getConfidence()).isEqualTo(QueryResponse.CONFIDENCE_VERY_LOW);
        assertThat(response.getSummary()).isEqualTo(QueryProcessor.NO_RELEVANT_CODES);
        assertThat(state.getPhase()).isEqualTo(DialoguePhase.IDLE);
    }

    @Test
    @DisplayName("No retrieved documents at all returns no result")
    void processQuery_nothingRetrieved() {
        when(classificationService.retrieve("moon rocks")).thenReturn(List.of());

        QueryResponse response = processor.processQuery("moon rocks", state);

        assertThat(response.isNoResult()).isTrue();
        assertThat(response.getNoResultReason()).isEqualTo(NoResultReason.LOW_CONFIDENCE);
    }

    @Test
    @DisplayName("Choosing an option confirms it and returns to idle")
    void processQuery_selectionConfirmsOption() {
        // Given
        when(classificationService.retrieve("rubber tyres")).thenReturn(ranked(0.91, 0.79, 0.78));
        processor.processQuery("rubber tyres", state);

        // When
        QueryResponse response = processor.processQuery("2", state);

        // Then
        assertThat(response.getType()).isEqualTo(ResponseType.CLASSIFICATION_RESULT);
        assertThat(response.getConfidence()).isEqualTo(QueryResponse.CONFIDENCE_USER_CONFIRMED);
        assertThat(response.getTopMatches()).singleElement()
                .extracting(TopMatch::getHsnCode).isEqualTo("40112010");
        assertThat(response.getSummary()).endsWith("the correct classification is HSN Code 40112010.");
        assertThat(state.getPhase()).isEqualTo(DialoguePhase.IDLE);
        assertThat(state.getPendingOptions()).isEmpty();
    }

    @Test
    @DisplayName("An out-of-range option keeps the pending choice")
    void processQuery_outOfRangeSelection() {
        // Given
        when(classificationService.retrieve("rubber tyres")).thenReturn(ranked(0.91, 0.79, 0.78));
        processor.processQuery("rubber tyres", state);

        // When
        QueryResponse response = processor.processQuery("9", state);

        // Then
        assertThat(response.getType()).isEqualTo(ResponseType.INVALID_SELECTION);
        assertThat(response.getSummary()).isEqualTo(QueryProcessor.INVALID_OPTION);
        assertThat(state.getPhase()).isEqualTo(DialoguePhase.AWAITING_SELECTION);
        assertThat(state.getPendingOptions()).hasSize(3);
    }

    @Test
    @DisplayName("A selection keyword without a number is not understood")
    void processQuery_selectionWithoutNumber() {
        when(classificationService.retrieve("rubber tyres")).thenReturn(ranked(0.91, 0.79));
        processor.processQuery("rubber tyres", state);

        QueryResponse response = processor.processQuery("the second option please", state);

        assertThat(response.getType()).isEqualTo(ResponseType.INVALID_SELECTION);
        assertThat(response.getSummary()).isEqualTo(QueryProcessor.UNPARSABLE_SELECTION);
        assertThat(state.getPhase()).isEqualTo(DialoguePhase.AWAITING_SELECTION);
    }

    @Test
    @DisplayName("A direct lookup never runs retrieval and clears a pending choice")
    void processQuery_directLookup() {
        // Given
        when(classificationService.retrieve("rubber tyres")).thenReturn(ranked(0.91, 0.79));
        processor.processQuery("rubber tyres", state);
        RetrievedDocument carTyres = TestDocuments.retrieved("40111010", 1.0);
        when(classificationService.lookup("40111010")).thenReturn(Optional.of(carTyres));

        // When
        QueryResponse response = processor.processQuery("Tell me about 40111010", state);

        // Then
        assertThat(response.getType()).isEqualTo(ResponseType.CLASSIFICATION_RESULT);
        assertThat(response.getSummary())
                .startsWith("**Information for HSN Code 40111010:**")
                .contains("- **Trade Status:** Free")
                .contains("- **Heading (4011):**");
        assertThat(state.getPhase()).isEqualTo(DialoguePhase.IDLE);
        verify(classificationService, never()).retrieve(eq("Tell me about 40111010"));
    }

    @Test
    @DisplayName("An unknown code returns a not-found result")
    void processQuery_directLookupNotFound() {
        when(classificationService.lookup("99999999")).thenReturn(Optional.empty());

        QueryResponse response = processor.processQuery("99999999", state);

        assertThat(response.getType()).isEqualTo(ResponseType.NO_RESULT);
        assertThat(response.getNoResultReason()).isEqualTo(NoResultReason.CODE_NOT_FOUND);
        assertThat(response.getSummary()).isEqualTo("HSN Code 99999999 was not found in our database.");
        verify(classificationService, never()).retrieve(anyString());
    }

    @Test
    @DisplayName("Category questions get the chapter clarification prompt")
    void processQuery_summarization() {
        QueryResponse response = processor.processQuery("what categories are in chapter 40?", state);

        assertThat(response.getType()).isEqualTo(ResponseType.CLARIFICATION_PROMPT);
        assertThat(response.getSummary()).isEqualTo(QueryProcessor.CATEGORY_CLARIFICATION);
        verify(classificationService, never()).retrieve(anyString());
    }

    @Test
    @DisplayName("A failing retrieval leaves the conversation untouched")
    void processQuery_failureLeavesStateUnchanged() {
        // Given: a pending choice from an earlier turn
        when(classificationService.retrieve("rubber tyres")).thenReturn(ranked(0.91, 0.79));
        processor.processQuery("rubber tyres", state);
        List<DisambiguationOption> pending = state.getPendingOptions();
        when(classificationService.retrieve("conveyor belts")).thenThrow(
                new UpstreamFailureException(ServiceType.VECTOR_STORE, "timeout", new RuntimeException()));

        // When / Then
        assertThatThrownBy(() -> processor.processQuery("conveyor belts", state))
                .isInstanceOf(UpstreamFailureException.class);
        assertThat(state.getPendingOptions()).isEqualTo(pending);
        assertThat(state.getTurns()).hasSize(1);
    }

    @Test
    @DisplayName("Every completed turn appends exactly one history entry")
    void processQuery_appendsOneTurnEach() {
        when(classificationService.retrieve("rubber tyres")).thenReturn(ranked(0.91, 0.79));

        processor.processQuery("rubber tyres", state);
        processor.processQuery("7", state);
        processor.processQuery("1", state);

        assertThat(state.getTurns()).hasSize(3);
        assertThat(state.getTurns()).extracting(turn -> turn.response().getType()).containsExactly(
                ResponseType.DISAMBIGUATION, ResponseType.INVALID_SELECTION, ResponseType.CLASSIFICATION_RESULT);
        assertThat(state.historyText()).startsWith("User: rubber tyres\nSystem: I found a few possible matches.");
    }

    @Test
    @DisplayName("Blank queries are rejected before any state change")
    void processQuery_rejectsBlank() {
        assertThatThrownBy(() -> processor.processQuery("  ", state)).isInstanceOf(IllegalArgumentException.class);
        assertThat(state.getTurns()).isEmpty();
    }

    @Test
    @DisplayName("Offers at most the configured number of options")
    void ambiguousOptions_capsAtMaxOptions() {
        List<DisambiguationOption> options = processor.ambiguousOptions(ranked(0.80, 0.79, 0.78, 0.77));

        assertThat(options).extracting(DisambiguationOption::hsnCode)
                .containsExactly("40111010", "40112010", "40101100");
    }

    @Test
    @DisplayName("A single document is never ambiguous")
    void ambiguousOptions_singleDocument() {
        assertThat(processor.ambiguousOptions(ranked(0.55))).isEmpty();
    }

    @Test
    @DisplayName("A summary request while choosing drops the pending options")
    void processQuery_summarizationWhileAwaitingSelection() {
        // Given
        when(classificationService.retrieve("rubber tyres")).thenReturn(ranked(0.91, 0.79));
        processor.processQuery("rubber tyres", state);
        assertThat(state.getPhase()).isEqualTo(DialoguePhase.AWAITING_SELECTION);

        // When
        QueryResponse response = processor.processQuery("what categories exist?", state);

        // Then
        assertThat(response.getType()).isEqualTo(ResponseType.CLARIFICATION_PROMPT);
        assertThat(state.getPhase()).isEqualTo(DialoguePhase.IDLE);
        assertThat(state.getPendingOptions()).isEmpty();
        assertThat(state.getTurns()).hasSize(2);
    }

    @Test
    @DisplayName("A new ambiguous query while choosing replaces the pending options")
    void processQuery_newAmbiguityWhileAwaitingSelection() {
        // Given
        when(classificationService.retrieve("rubber tyres")).thenReturn(ranked(0.91, 0.79));
        when(classificationService.retrieve("conveyor belts")).thenReturn(List.of(
                TestDocuments.retrieved("40101100", 0.85),
                TestDocuments.retrieved("40011010", 0.80),
                TestDocuments.retrieved("40111010", 0.79)));
        processor.processQuery("rubber tyres", state);

        // When
        QueryResponse response = processor.processQuery("conveyor belts", state);

        // Then
        assertThat(response.getType()).isEqualTo(ResponseType.DISAMBIGUATION);
        assertThat(state.getPhase()).isEqualTo(DialoguePhase.AWAITING_SELECTION);
        assertThat(state.getPendingOptions())
                .extracting(DisambiguationOption::hsnCode)
                .containsExactly("40101100", "40011010", "40111010");
        assertThat(state.getPendingOptions())
                .extracting(DisambiguationOption::position)
                .containsExactly(1, 2, 3);
    }
}
