package com.purchasingpower.hsn.api;

import com.purchasingpower.hsn.conversation.ConversationState;
import com.purchasingpower.hsn.core.QueryResponse;
import com.purchasingpower.hsn.service.ConversationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for classification sessions.
 *
 * Flow:
 * 1. POST /api/v1/sessions opens a session
 * 2. POST /api/v1/sessions/{id}/queries sends a product description, a code, or an option number
 * 3. DELETE /api/v1/sessions/{id} ends it
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;

    @PostMapping
    public ResponseEntity<SessionResponse> createSession() {
        ConversationState state = conversationService.createSession();
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(state));
    }

    @PostMapping("/{sessionId}/queries")
    public ResponseEntity<QueryResponse> query(@PathVariable String sessionId,
                                               @Valid @RequestBody QueryRequest request) {
        log.info("Query for session {}: {}", sessionId, request.getQuery());
        return ResponseEntity.ok(conversationService.processQuery(sessionId, request.getQuery()));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionResponse.from(conversationService.getSession(sessionId)));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> endSession(@PathVariable String sessionId) {
        conversationService.endSession(sessionId);
        return ResponseEntity.noContent().build();
    }
}
