package com.purchasingpower.hsn.query;

import com.google.common.base.Preconditions;
import com.purchasingpower.hsn.configuration.DialogueProperties;
import com.purchasingpower.hsn.configuration.HsnProperties;
import com.purchasingpower.hsn.conversation.ConversationState;
import com.purchasingpower.hsn.core.DisambiguationOption;
import com.purchasingpower.hsn.core.HsnMetadata;
import com.purchasingpower.hsn.core.NoResultReason;
import com.purchasingpower.hsn.core.QueryResponse;
import com.purchasingpower.hsn.core.ResponseType;
import com.purchasingpower.hsn.core.RetrievedDocument;
import com.purchasingpower.hsn.core.TopMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dialogue engine: classifies the intent of a query, runs the matching branch
 * and moves the conversation between {@code IDLE} and
 * {@code AWAITING_SELECTION}.
 *
 * <p>State changes are applied only after the whole response has been built,
 * so a failure from retrieval or generation leaves the conversation exactly as
 * it was. Every completed turn appends one (query, response) pair.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class QueryProcessor {

    static final String NO_RELEVANT_CODES =
            "I'm sorry, but I couldn't find any relevant HSN codes for your query in my knowledge base.";
    static final String UNPARSABLE_SELECTION = "I'm sorry, I didn't understand that selection.";
    static final String INVALID_OPTION = "That's not a valid option number.";
    static final String CATEGORY_CLARIFICATION = """
            Chapter 40 covers 'Rubber and Articles Thereof'. This includes a wide range of products from raw materials to finished goods.

            To help me find the correct code, could you specify the product? For example, are you looking for:
            - Raw materials like **natural rubber latex**?
            - Intermediate products like **vulcanised rubber sheets**?
            - Finished articles like **rubber tyres** or **conveyor belts**?""";

    private static final Pattern FIRST_INTEGER = Pattern.compile("\\d+");

    private final ClassificationService classificationService;
    private final IntentClassifier intentClassifier;
    private final DialogueProperties dialogue;

    public QueryProcessor(ClassificationService classificationService,
                          IntentClassifier intentClassifier,
                          HsnProperties properties) {
        this.classificationService = classificationService;
        this.intentClassifier = intentClassifier;
        this.dialogue = properties.getDialogue();
    }

    public QueryResponse processQuery(String query, ConversationState state) {
        Preconditions.checkArgument(query != null && !query.isBlank(), "Query must not be blank");

        ParsedQuery parsed = intentClassifier.classify(query, state.getPhase());
        log.info("Session {}: processing {} query in {} state", state.getSessionId(), parsed.intent(), state.getPhase());

        Transition transition = switch (parsed.intent()) {
            case DIRECT_LOOKUP -> Transition.toIdle(directLookup(parsed.hsnCode()));
            case SELECTION -> resolveSelection(parsed.text(), state.getPendingOptions());
            case SUMMARIZATION -> Transition.toIdle(categoryClarification());
            case CLASSIFICATION -> classify(query);
        };

        transition.applyTo(state);
        state.addTurn(query, transition.response());
        return transition.response();
    }

    // ================================================================
    // BRANCHES
    // ================================================================

    private QueryResponse directLookup(String hsnCode) {
        Optional<RetrievedDocument> found = classificationService.lookup(hsnCode);
        if (found.isEmpty()) {
            return QueryResponse.builder()
                    .type(ResponseType.NO_RESULT)
                    .summary("HSN Code " + hsnCode + " was not found in our database.")
                    .noResultReason(NoResultReason.CODE_NOT_FOUND)
                    .build();
        }

        HsnMetadata meta = found.get().getMetadata();
        String summary = "**Information for HSN Code " + hsnCode + ":**\n\n"
                + "- **Description:** " + orNa(meta.getItemDescription()) + "\n"
                + "- **Trade Status:** " + QueryResponse.TRADE_POLICY_FREE + "\n\n"
                + "**Hierarchy:**\n"
                + "- **Chapter (" + meta.getChapter() + "):** " + orNa(meta.getChapterDescription()) + "\n"
                + "- **Heading (" + meta.getHeading() + "):** " + orNa(meta.getHeadingDescription()) + "\n"
                + "- **Subheading (" + meta.getSubheading() + "):** " + orNa(meta.getSubheadingDescription());

        return QueryResponse.builder()
                .type(ResponseType.CLASSIFICATION_RESULT)
                .summary(summary)
                .topMatch(TopMatch.confirmed(hsnCode, meta))
                .tradePolicy(QueryResponse.TRADE_POLICY_FREE)
                .build();
    }

    private Transition resolveSelection(String text, List<DisambiguationOption> options) {
        Matcher number = FIRST_INTEGER.matcher(text);
        if (!number.find()) {
            return Transition.unchanged(invalidSelection(UNPARSABLE_SELECTION));
        }

        int selection;
        try {
            selection = Integer.parseInt(number.group());
        } catch (NumberFormatException e) {
            // more digits than an int holds
            return Transition.unchanged(invalidSelection(INVALID_OPTION));
        }
        if (selection < 1 || selection > options.size()) {
            log.info("Selection {} out of range 1..{}", selection, options.size());
            return Transition.unchanged(invalidSelection(INVALID_OPTION));
        }

        DisambiguationOption chosen = options.get(selection - 1);
        QueryResponse response = QueryResponse.builder()
                .type(ResponseType.CLASSIFICATION_RESULT)
                .summary("Thank you for clarifying. Based on your selection, the correct classification is HSN Code "
                        + chosen.hsnCode() + ".")
                .topMatch(TopMatch.confirmed(chosen.hsnCode(), chosen.document().getMetadata()))
                .confidence(QueryResponse.CONFIDENCE_USER_CONFIRMED)
                .tradePolicy(QueryResponse.TRADE_POLICY_FREE)
                .build();
        return Transition.toIdle(response);
    }

    private Transition classify(String query) {
        List<RetrievedDocument> documents = classificationService.retrieve(query);

        double topScore = documents.isEmpty() ? 0.0 : documents.get(0).getScore();
        if (topScore < dialogue.getRelevanceThreshold()) {
            log.info("Top score {} below relevance threshold {}", topScore, dialogue.getRelevanceThreshold());
            return Transition.toIdle(QueryResponse.builder()
                    .type(ResponseType.NO_RESULT)
                    .summary(NO_RELEVANT_CODES)
                    .confidence(QueryResponse.CONFIDENCE_VERY_LOW)
                    .noResultReason(NoResultReason.LOW_CONFIDENCE)
                    .build());
        }

        List<DisambiguationOption> options = ambiguousOptions(documents);
        if (!options.isEmpty()) {
            return Transition.awaitSelection(disambiguationPrompt(options), options);
        }
        return Transition.toIdle(classificationService.generate(query, documents));
    }

    /**
     * Options to offer when the two best scores are closer than the
     * disambiguation threshold; empty when the result is unambiguous.
     */
    List<DisambiguationOption> ambiguousOptions(List<RetrievedDocument> documents) {
        if (documents.size() < 2) {
            return List.of();
        }

        double first = documents.get(0).getScore();
        double second = documents.get(1).getScore();
        log.info("Checking ambiguity. Scores: {} vs {}", String.format("%.4f", first), String.format("%.4f", second));
        if (first - second >= dialogue.getDisambiguationThreshold()) {
            return List.of();
        }

        int count = Math.min(dialogue.getMaxOptions(), documents.size());
        List<DisambiguationOption> options = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            options.add(new DisambiguationOption(i + 1, documents.get(i)));
        }
        return options;
    }

    private QueryResponse disambiguationPrompt(List<DisambiguationOption> options) {
        StringBuilder prompt = new StringBuilder(
                "I found a few possible matches. To give you the most accurate HSN code, please help me clarify:\n\n");
        for (DisambiguationOption option : options) {
            RetrievedDocument document = option.document();
            HsnMetadata meta = document.getMetadata();
            String context = document.getGraphContext() != null ? document.getGraphContext() : "No additional context.";
            prompt.append("**Option ").append(option.position()).append(": HSN Code ").append(orNa(option.hsnCode())).append("**\n")
                    .append("- Description: ").append(orNa(meta != null ? meta.getItemDescription() : null)).append('\n')
                    .append("- Context: This code is for products under the category of '").append(context).append("'.\n\n");
        }
        prompt.append("Which option best describes your product? Please enter the option number (e.g., '1').");

        return QueryResponse.builder()
                .type(ResponseType.DISAMBIGUATION)
                .summary(prompt.toString())
                .options(options)
                .build();
    }

    private static QueryResponse categoryClarification() {
        return QueryResponse.builder()
                .type(ResponseType.CLARIFICATION_PROMPT)
                .summary(CATEGORY_CLARIFICATION)
                .build();
    }

    private static QueryResponse invalidSelection(String message) {
        return QueryResponse.builder()
                .type(ResponseType.INVALID_SELECTION)
                .summary(message)
                .build();
    }

    private static String orNa(String value) {
        return value != null ? value : "N/A";
    }

    /**
     * Response of one turn plus the state change to apply once it is complete.
     */
    private record Transition(QueryResponse response, Next next, List<DisambiguationOption> options) {

        enum Next { IDLE, AWAIT_SELECTION, UNCHANGED }

        static Transition toIdle(QueryResponse response) {
            return new Transition(response, Next.IDLE, List.of());
        }

        static Transition awaitSelection(QueryResponse response, List<DisambiguationOption> options) {
            return new Transition(response, Next.AWAIT_SELECTION, options);
        }

        static Transition unchanged(QueryResponse response) {
            return new Transition(response, Next.UNCHANGED, List.of());
        }

        void applyTo(ConversationState state) {
            switch (next) {
                case IDLE -> state.clearPendingOptions();
                case AWAIT_SELECTION -> state.awaitSelection(options);
                case UNCHANGED -> {
                }
            }
        }
    }
}
