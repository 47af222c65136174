package com.purchasingpower.hsn.api;

import com.purchasingpower.hsn.conversation.ConversationState;
import com.purchasingpower.hsn.conversation.DialoguePhase;
import com.purchasingpower.hsn.core.DisambiguationOption;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Session summary with its transcript.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

    private String sessionId;
    private String createdAt;
    private DialoguePhase phase;
    private List<String> pendingOptionCodes;
    private List<Message> messages;

    public static SessionResponse from(ConversationState state) {
        return SessionResponse.builder()
                .sessionId(state.getSessionId())
                .createdAt(state.getCreatedAt().toString())
                .phase(state.getPhase())
                .pendingOptionCodes(state.getPendingOptions().stream().map(DisambiguationOption::hsnCode).toList())
                .messages(state.getTurns().stream()
                        .map(turn -> Message.builder()
                                .query(turn.query())
                                .summary(turn.response().getSummary())
                                .type(turn.response().getType().getWireName())
                                .timestamp(turn.timestamp().toString())
                                .build())
                        .toList())
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private String query;
        private String type;
        private String summary;
        private String timestamp;
    }
}
