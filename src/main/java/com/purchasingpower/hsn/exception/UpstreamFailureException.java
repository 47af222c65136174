package com.purchasingpower.hsn.exception;

import com.purchasingpower.hsn.util.ServiceType;
import lombok.Getter;

/**
 * An external collaborator (vector store, re-ranker, graph database, generation
 * backend) failed. Aborts the current turn; conversation state is left as it
 * was before the turn.
 *
 * @since 1.0.0
 */
@Getter
public class UpstreamFailureException extends HsnClassifierException {

    private final ServiceType service;

    public UpstreamFailureException(ServiceType service, String message, Throwable cause) {
        super(service.getName() + ": " + message, cause);
        this.service = service;
    }
}
