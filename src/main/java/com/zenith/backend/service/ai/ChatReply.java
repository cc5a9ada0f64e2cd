package com.zenith.backend.service.ai;

/**
 * Text handed back to the user. {@code failure} is null when the text came from the assistant.
 */
public record ChatReply(String text, RemoteFailure failure) {

    public static ChatReply of(String text) {
        return new ChatReply(text, null);
    }

    public static ChatReply fallback(RemoteFailure failure) {
        return new ChatReply(FallbackMessages.forFailure(failure), failure);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
