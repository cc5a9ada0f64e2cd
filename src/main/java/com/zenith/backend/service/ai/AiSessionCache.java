package com.zenith.backend.service.ai;

import com.zenith.backend.repository.CachedBriefRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Owns the lifecycle of remote assistants and per-user threads.
 *
 * <p>Per topic the assistant goes {@code NO_ASSISTANT -> BOUND}; per (user, topic) the thread goes
 * {@code NO_THREAD -> CREATED -> INITIALIZED}. Bindings are created lazily on the first conversation
 * and only dropped by {@link #reset(ResetScope, Long)}. Nothing here throws to the caller; remote
 * problems come back as fallback replies.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiSessionCache {

    private final AiGatewayClient gatewayClient;
    private final SessionBindingStore bindingStore;
    private final CachedBriefRepository briefRepository;

    public ChatReply converse(Long userId, AiTopic topic, String message, UserContext context) {
        return converseOnThread(userId, topic, message, context)
                .fold(reply -> reply, failure -> ChatReply.fallback(RemoteFailure.SESSION_UNAVAILABLE));
    }

    /**
     * Like {@link #converse} but reports a missing thread as a failure instead of fallback text.
     * Once a thread exists the reply is always present, possibly as a fallback.
     */
    public RemoteResult<ChatReply> converseOnThread(Long userId, AiTopic topic, String message, UserContext context) {
        RemoteResult<ThreadHandle> thread = resolveThread(userId, topic);
        if (thread.isFailure()) {
            log.warn("No AI thread for user {} topic {}: {}", userId, topic.key(), thread.failure());
            return RemoteResult.failure(thread.failure(), thread.detail());
        }
        ThreadHandle handle = thread.value();
        if (!handle.initialized()) {
            prime(userId, topic, handle, context);
        }
        return RemoteResult.success(send(handle.threadId(), message));
    }

    public RemoteResult<String> resolveAssistant(AiTopic topic) {
        Optional<String> existing = bindingStore.findAssistant(topic);
        if (existing.isPresent()) {
            return RemoteResult.success(existing.get());
        }
        RemoteResult<String> created = gatewayClient.createAssistant(topic.assistantName(), topic.systemPrompt());
        if (created.isSuccess()) {
            bindingStore.saveAssistant(topic, created.value());
            log.info("Bound assistant {} to topic {}", created.value(), topic.key());
        }
        return created;
    }

    public RemoteResult<ThreadHandle> resolveThread(Long userId, AiTopic topic) {
        Optional<ThreadHandle> existing = bindingStore.findThread(userId, topic);
        if (existing.isPresent()) {
            return RemoteResult.success(existing.get());
        }
        return resolveAssistant(topic)
                .flatMap(gatewayClient::createThread)
                .map(threadId -> {
                    log.info("Created AI thread {} for user {} topic {}", threadId, userId, topic.key());
                    return bindingStore.saveThread(userId, topic, threadId);
                });
    }

    /**
     * Sends a prompt on a throwaway thread that is never cached, for one-shot insights.
     */
    public ChatReply oneOff(AiTopic topic, String prompt) {
        RemoteResult<String> thread = resolveAssistant(topic).flatMap(gatewayClient::createThread);
        if (thread.isFailure()) {
            return ChatReply.fallback(RemoteFailure.SESSION_UNAVAILABLE);
        }
        return send(thread.value(), prompt);
    }

    @Transactional
    public ResetSummary reset(ResetScope scope, Long userId) {
        ResetSummary summary = switch (scope) {
            case USER -> new ResetSummary(scope, 0, bindingStore.clearThreads(userId), briefRepository.deleteByUser(userId));
            case GLOBAL -> {
                int threads = bindingStore.clearAllThreads();
                int assistants = bindingStore.clearAssistants();
                yield new ResetSummary(scope, assistants, threads, briefRepository.deleteAllBriefs());
            }
        };
        log.info("AI session cache reset scope={} user={} assistants={} threads={} briefs={}",
                scope, userId, summary.assistantsCleared(), summary.threadsCleared(), summary.briefsCleared());
        return summary;
    }

    private void prime(Long userId, AiTopic topic, ThreadHandle handle, UserContext context) {
        String profile = ProfileContextFormatter.format(topic, context);
        if (profile.isEmpty()) {
            return;
        }
        RemoteResult<String> primed = gatewayClient.postMessage(handle.threadId(), ProfileContextFormatter.primingMessage(profile));
        if (primed.isSuccess()) {
            bindingStore.markInitialized(userId, topic, handle.threadId());
            log.debug("Primed thread {} for user {} topic {}", handle.threadId(), userId, topic.key());
        } else {
            log.warn("Priming failed for user {} topic {}: {}", userId, topic.key(), primed.failure());
        }
    }

    private ChatReply send(String threadId, String content) {
        RemoteResult<String> reply = gatewayClient.postMessage(threadId, content);
        if (reply.isFailure()) {
            return ChatReply.fallback(reply.failure());
        }
        String text = ResponseSanitizer.strip(reply.value());
        if (text.isEmpty()) {
            return ChatReply.fallback(RemoteFailure.MALFORMED_RESPONSE);
        }
        return ChatReply.of(text);
    }

    public record ResetSummary(ResetScope scope, int assistantsCleared, int threadsCleared, int briefsCleared) {
    }
}
