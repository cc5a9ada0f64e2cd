package com.zenith.backend.exception;

import com.zenith.backend.service.ai.RemoteFailure;

/**
 * Raised only by flows that cannot degrade to fallback text, such as structured purchase advice
 * when no conversation thread can be established.
 */
public class AiUnavailableException extends RuntimeException {
    private final RemoteFailure failure;

    public AiUnavailableException(String message, RemoteFailure failure) {
        super(message);
        this.failure = failure;
    }

    public RemoteFailure getFailure() {
        return failure;
    }
}
