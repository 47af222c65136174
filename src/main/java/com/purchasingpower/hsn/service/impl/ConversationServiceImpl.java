package com.purchasingpower.hsn.service.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.purchasingpower.hsn.configuration.HsnProperties;
import com.purchasingpower.hsn.configuration.SessionProperties;
import com.purchasingpower.hsn.conversation.ConversationState;
import com.purchasingpower.hsn.core.QueryResponse;
import com.purchasingpower.hsn.exception.SessionNotFoundException;
import com.purchasingpower.hsn.query.QueryProcessor;
import com.purchasingpower.hsn.service.ConversationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sessions live in a Caffeine cache bounded by {@code hsn.session.max-sessions}
 * and dropped after {@code hsn.session.idle-timeout} without access.
 *
 * <p>A query for an id that is not live (never created here, expired or
 * evicted) starts a fresh session under that id, so a client resuming after
 * a long pause gets a clean dialogue instead of an error. Reads and deletes
 * of such an id still fail with {@link SessionNotFoundException}.
 */
@Slf4j
@Service
public class ConversationServiceImpl implements ConversationService {

    private final QueryProcessor queryProcessor;
    private final Cache<String, Session> sessions;

    @Autowired
    public ConversationServiceImpl(QueryProcessor queryProcessor, HsnProperties properties) {
        this(queryProcessor, properties.getSession(), Ticker.systemTicker());
    }

    ConversationServiceImpl(QueryProcessor queryProcessor, SessionProperties properties, Ticker ticker) {
        this.queryProcessor = queryProcessor;
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(properties.getIdleTimeout())
                .maximumSize(properties.getMaxSessions())
                .ticker(ticker)
                .removalListener((String sessionId, Session session, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        log.info("Session {} dropped ({})", sessionId, cause);
                    }
                })
                .build();
        log.info("Session store: idle timeout {}, at most {} sessions",
                properties.getIdleTimeout(), properties.getMaxSessions());
    }

    @Override
    public ConversationState createSession() {
        ConversationState state = new ConversationState();
        sessions.put(state.getSessionId(), new Session(state, new ReentrantLock()));
        log.info("Started session {}", state.getSessionId());
        return state;
    }

    @Override
    public ConversationState getSession(String sessionId) {
        return session(sessionId).state();
    }

    @Override
    public QueryResponse processQuery(String sessionId, String query) {
        Session session = sessions.get(sessionId, this::restart);
        session.lock().lock();
        try {
            return queryProcessor.processQuery(query, session.state());
        } finally {
            session.lock().unlock();
        }
    }

    @Override
    public void endSession(String sessionId) {
        if (sessions.asMap().remove(sessionId) == null) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("Ended session {}", sessionId);
    }

    @Override
    public Collection<ConversationState> activeSessions() {
        sessions.cleanUp();
        return sessions.asMap().values().stream().map(Session::state).toList();
    }

    private Session restart(String sessionId) {
        log.info("Session {} is not live, starting it fresh", sessionId);
        return new Session(new ConversationState(sessionId), new ReentrantLock());
    }

    private Session session(String sessionId) {
        Session session = sessions.getIfPresent(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    private record Session(ConversationState state, ReentrantLock lock) {
    }
}
