package com.zenith.backend.service.ai;

public final class FallbackMessages {

    private FallbackMessages() {
    }

    public static String forFailure(RemoteFailure failure) {
        return switch (failure) {
            case SESSION_UNAVAILABLE -> "Sorry, the AI service is currently unavailable.";
            case TIMEOUT -> "Sorry, the AI is taking too long to respond. Please try again.";
            case REJECTED -> "Sorry, the AI is busy right now. Please try again in a moment.";
            case MALFORMED_RESPONSE -> "Sorry, I couldn't process that right now.";
            case NOT_CONFIGURED, HTTP_ERROR, TRANSPORT, CIRCUIT_OPEN ->
                    "Sorry, the AI is temporarily unavailable. Please try again.";
        };
    }
}
