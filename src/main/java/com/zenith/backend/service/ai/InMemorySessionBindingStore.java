package com.zenith.backend.service.ai;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local bindings, lost on restart. Selected with {@code zenith.ai.session-store=memory}.
 */
@Component
@ConditionalOnProperty(prefix = "zenith.ai", name = "session-store", havingValue = "memory")
public class InMemorySessionBindingStore implements SessionBindingStore {

    private final Map<AiTopic, String> assistants = new ConcurrentHashMap<>();
    private final Map<String, ThreadHandle> threads = new ConcurrentHashMap<>();

    @Override
    public Optional<String> findAssistant(AiTopic topic) {
        return Optional.ofNullable(assistants.get(topic));
    }

    @Override
    public void saveAssistant(AiTopic topic, String assistantId) {
        assistants.put(topic, assistantId);
    }

    @Override
    public Optional<ThreadHandle> findThread(Long userId, AiTopic topic) {
        return Optional.ofNullable(threads.get(key(userId, topic)));
    }

    @Override
    public ThreadHandle saveThread(Long userId, AiTopic topic, String threadId) {
        ThreadHandle handle = new ThreadHandle(threadId, false);
        threads.put(key(userId, topic), handle);
        return handle;
    }

    @Override
    public void markInitialized(Long userId, AiTopic topic, String threadId) {
        threads.computeIfPresent(key(userId, topic), (key, current) ->
                current.threadId().equals(threadId) ? new ThreadHandle(threadId, true) : current);
    }

    @Override
    public int clearThreads(Long userId) {
        String prefix = userId + ":";
        int before = threads.size();
        threads.keySet().removeIf(key -> key.startsWith(prefix));
        return before - threads.size();
    }

    @Override
    public int clearAllThreads() {
        int removed = threads.size();
        threads.clear();
        return removed;
    }

    @Override
    public int clearAssistants() {
        int removed = assistants.size();
        assistants.clear();
        return removed;
    }

    private String key(Long userId, AiTopic topic) {
        return userId + ":" + topic.key();
    }
}
