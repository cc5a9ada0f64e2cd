package com.zenith.backend.service.ai;

import com.zenith.backend.dto.BriefResponse;
import com.zenith.backend.model.CachedBrief;
import com.zenith.backend.repository.CachedBriefRepository;
import com.zenith.backend.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Daily topic briefs. A stored brief is reused as-is until a forced refresh replaces it;
 * fallback text is returned to the caller but never stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BriefService {

    private final CachedBriefRepository briefRepository;
    private final AiChatService aiChatService;
    private final UserService userService;

    public BriefResponse generateBrief(Long userId, AiTopic topic, boolean force) {
        if (!force) {
            Optional<CachedBrief> cached = briefRepository.findByUserIdAndTopic(userId, topic.key());
            if (cached.isPresent()) {
                return BriefResponse.builder()
                        .topic(topic.key())
                        .content(cached.get().getContent())
                        .cached(true)
                        .generatedAt(cached.get().getCreatedAt())
                        .build();
            }
        }

        UserContext context = userService.userContext(userId);
        ChatReply reply = aiChatService.ask(userId, topic, briefPrompt(topic, context), context);
        if (!reply.succeeded()) {
            log.warn("Brief for user {} topic {} fell back: {}", userId, topic.key(), reply.failure());
            return BriefResponse.builder()
                    .topic(topic.key())
                    .content(reply.text())
                    .fallback(true)
                    .generatedAt(Instant.now())
                    .build();
        }

        CachedBrief stored = store(userId, topic, reply.text());
        return BriefResponse.builder()
                .topic(topic.key())
                .content(stored.getContent())
                .generatedAt(stored.getCreatedAt())
                .build();
    }

    static String briefPrompt(AiTopic topic, UserContext context) {
        String focus = topic.briefFocus();
        return "Write my daily brief. Start with a one-line greeting that uses my name, " + context.displayName() + ". "
                + "Then give exactly 3 numbered recommendations about " + focus + " tailored to what you know about me. "
                + "Then give exactly 3 example questions I could ask you, each on its own line starting with \"Q: \". "
                + "Finish with one short encouraging closing line. Use plain text only, no markdown.";
    }

    private CachedBrief store(Long userId, AiTopic topic, String content) {
        try {
            return briefRepository.save(upsertTarget(userId, topic, content));
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent brief insert for user {} topic {}, retrying as update", userId, topic.key());
            return briefRepository.save(upsertTarget(userId, topic, content));
        }
    }

    private CachedBrief upsertTarget(Long userId, AiTopic topic, String content) {
        CachedBrief brief = briefRepository.findByUserIdAndTopic(userId, topic.key())
                .orElseGet(() -> CachedBrief.builder().userId(userId).topic(topic.key()).build());
        brief.setContent(content);
        brief.setCreatedAt(Instant.now());
        return brief;
    }
}
