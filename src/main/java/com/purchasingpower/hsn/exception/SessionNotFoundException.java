package com.purchasingpower.hsn.exception;

import lombok.Getter;

@Getter
public class SessionNotFoundException extends HsnClassifierException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }
}
