package com.purchasingpower.hsn.conversation;

import com.google.common.base.Preconditions;
import com.purchasingpower.hsn.core.DisambiguationOption;
import com.purchasingpower.hsn.core.QueryResponse;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-session conversation state: the append-only turn history and the pending
 * disambiguation options, if any.
 *
 * <p>Not thread-safe. Turns for one session must be processed one at a time;
 * {@code ConversationService} serializes them.
 *
 * @since 1.0.0
 */
public class ConversationState {

    public static final String EXPERTISE_LEVEL = "expertise_level";

    @Getter
    private final String sessionId;

    @Getter
    private final Instant createdAt = Instant.now();

    private final List<Turn> turns = new ArrayList<>();
    private final Map<String, Object> userPreferences = new LinkedHashMap<>();
    private List<DisambiguationOption> pendingOptions = List.of();

    public ConversationState() {
        this(UUID.randomUUID().toString());
    }

    public ConversationState(String sessionId) {
        Preconditions.checkArgument(sessionId != null && !sessionId.isBlank(), "sessionId must not be blank");
        this.sessionId = sessionId;
        this.userPreferences.put(EXPERTISE_LEVEL, "novice");
    }

    public DialoguePhase getPhase() {
        return pendingOptions.isEmpty() ? DialoguePhase.IDLE : DialoguePhase.AWAITING_SELECTION;
    }

    public List<DisambiguationOption> getPendingOptions() {
        return pendingOptions;
    }

    public void awaitSelection(List<DisambiguationOption> options) {
        Preconditions.checkArgument(options != null && !options.isEmpty(), "disambiguation needs at least one option");
        this.pendingOptions = List.copyOf(options);
    }

    public void clearPendingOptions() {
        this.pendingOptions = List.of();
    }

    public void addTurn(String query, QueryResponse response) {
        turns.add(new Turn(query, response, Instant.now()));
    }

    public List<Turn> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    public Map<String, Object> getUserPreferences() {
        return userPreferences;
    }

    /**
     * Transcript as alternating {@code User:} and {@code System:} lines.
     */
    public String historyText() {
        StringBuilder sb = new StringBuilder();
        for (Turn turn : turns) {
            String summary = turn.response().getSummary();
            sb.append("User: ").append(turn.query()).append('\n');
            sb.append("System: ").append(summary != null ? summary : "No summary.").append('\n');
        }
        return sb.toString();
    }
}
