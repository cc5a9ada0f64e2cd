package com.zenith.backend.service.ai;

/**
 * The three operations of the hosted assistant API. Implementations never throw; every outcome is a
 * {@link RemoteResult}.
 */
public interface AiGatewayClient {

    RemoteResult<String> createAssistant(String name, String systemPrompt);

    RemoteResult<String> createThread(String assistantId);

    RemoteResult<String> postMessage(String threadId, String content);
}
