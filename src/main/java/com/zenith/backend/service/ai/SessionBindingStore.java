package com.zenith.backend.service.ai;

import java.util.Optional;

/**
 * Key-value storage for remote session handles: topic to assistant id, and (user, topic) to thread.
 * Writes are last-write-wins; concurrent creators may overwrite each other's fresh ids.
 */
public interface SessionBindingStore {

    Optional<String> findAssistant(AiTopic topic);

    void saveAssistant(AiTopic topic, String assistantId);

    Optional<ThreadHandle> findThread(Long userId, AiTopic topic);

    /**
     * Stores a new, uninitialized thread for the pair, replacing whatever was there.
     */
    ThreadHandle saveThread(Long userId, AiTopic topic, String threadId);

    /**
     * Flags the thread as primed. Does nothing if the pair is now bound to a different thread.
     */
    void markInitialized(Long userId, AiTopic topic, String threadId);

    int clearThreads(Long userId);

    int clearAllThreads();

    int clearAssistants();
}
