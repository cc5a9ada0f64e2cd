package com.zenith.backend.service.ai;

public record ThreadHandle(String threadId, boolean initialized) {
}
