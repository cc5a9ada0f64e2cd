package com.zenith.backend.service.ai;

import com.zenith.backend.model.AssistantBinding;
import com.zenith.backend.model.ThreadBinding;
import com.zenith.backend.repository.AssistantBindingRepository;
import com.zenith.backend.repository.ThreadBindingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "zenith.ai", name = "session-store", havingValue = "jpa", matchIfMissing = true)
public class JpaSessionBindingStore implements SessionBindingStore {

    private final AssistantBindingRepository assistantRepository;
    private final ThreadBindingRepository threadRepository;

    @Override
    public Optional<String> findAssistant(AiTopic topic) {
        return assistantRepository.findById(topic.key()).map(AssistantBinding::getAssistantId);
    }

    @Override
    public void saveAssistant(AiTopic topic, String assistantId) {
        AssistantBinding binding = AssistantBinding.builder()
                .topic(topic.key())
                .assistantId(assistantId)
                .createdAt(Instant.now())
                .build();
        try {
            assistantRepository.save(binding);
        } catch (DataIntegrityViolationException e) {
            // another request inserted the same topic first; overwrite it
            log.debug("Assistant binding race for topic {}, overwriting", topic.key());
            assistantRepository.save(binding);
        }
    }

    @Override
    public Optional<ThreadHandle> findThread(Long userId, AiTopic topic) {
        return threadRepository.findByUserIdAndTopic(userId, topic.key()).map(this::toHandle);
    }

    @Override
    public ThreadHandle saveThread(Long userId, AiTopic topic, String threadId) {
        try {
            return upsertThread(userId, topic, threadId);
        } catch (DataIntegrityViolationException e) {
            log.debug("Thread binding race for user {} topic {}, overwriting", userId, topic.key());
            return upsertThread(userId, topic, threadId);
        }
    }

    @Override
    @Transactional
    public void markInitialized(Long userId, AiTopic topic, String threadId) {
        threadRepository.markInitialized(userId, topic.key(), threadId);
    }

    @Override
    @Transactional
    public int clearThreads(Long userId) {
        return threadRepository.deleteByUser(userId);
    }

    @Override
    @Transactional
    public int clearAllThreads() {
        return threadRepository.deleteAllBindings();
    }

    @Override
    @Transactional
    public int clearAssistants() {
        return assistantRepository.deleteAllBindings();
    }

    private ThreadHandle upsertThread(Long userId, AiTopic topic, String threadId) {
        ThreadBinding binding = threadRepository.findByUserIdAndTopic(userId, topic.key())
                .orElseGet(() -> ThreadBinding.builder()
                        .userId(userId)
                        .topic(topic.key())
                        .build());
        binding.setThreadId(threadId);
        binding.setInitialized(false);
        binding.setCreatedAt(Instant.now());
        return toHandle(threadRepository.save(binding));
    }

    private ThreadHandle toHandle(ThreadBinding binding) {
        return new ThreadHandle(binding.getThreadId(), binding.isInitialized());
    }
}
