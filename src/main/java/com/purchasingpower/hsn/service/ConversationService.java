package com.purchasingpower.hsn.service;

import com.purchasingpower.hsn.conversation.ConversationState;
import com.purchasingpower.hsn.core.QueryResponse;

import java.util.Collection;

/**
 * In-memory registry of conversation sessions. Sessions do not survive a
 * restart.
 *
 * @since 1.0.0
 */
public interface ConversationService {

    ConversationState createSession();

    /**
     * @throws com.purchasingpower.hsn.exception.SessionNotFoundException if the session does not exist
     */
    ConversationState getSession(String sessionId);

    /**
     * Process one turn. Turns of the same session run one at a time; turns of
     * different sessions run concurrently.
     */
    QueryResponse processQuery(String sessionId, String query);

    void endSession(String sessionId);

    Collection<ConversationState> activeSessions();
}
