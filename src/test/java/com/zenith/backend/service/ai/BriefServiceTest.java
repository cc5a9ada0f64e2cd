package com.zenith.backend.service.ai;

import com.zenith.backend.dto.BriefResponse;
import com.zenith.backend.model.CachedBrief;
import com.zenith.backend.repository.CachedBriefRepository;
import com.zenith.backend.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BriefServiceTest {

    private static final long USER_ID = 3L;

    @Mock
    private CachedBriefRepository briefRepository;

    @Mock
    private AiChatService aiChatService;

    @Mock
    private UserService userService;

    @InjectMocks
    private BriefService briefService;

    private final AtomicReference<CachedBrief> stored = new AtomicReference<>();
    private final UserContext context = new UserContext(null, BigDecimal.TEN, 4);

    @BeforeEach
    void setUp() {
        lenient().when(briefRepository.findByUserIdAndTopic(USER_ID, "guardian"))
                .thenAnswer(invocation -> Optional.ofNullable(stored.get()));
    }

    @Test
    void secondRequestReusesStoredBrief() {
        stubStorage();
        when(userService.userContext(USER_ID)).thenReturn(context);
        when(aiChatService.ask(eq(USER_ID), eq(AiTopic.GUARDIAN), anyString(), eq(context)))
                .thenReturn(ChatReply.of("Good morning!\n1. Budget\n2. Save\n3. Track\nQ: a\nQ: b\nQ: c\nYou got this."));

        BriefResponse first = briefService.generateBrief(USER_ID, AiTopic.GUARDIAN, false);
        BriefResponse second = briefService.generateBrief(USER_ID, AiTopic.GUARDIAN, false);

        assertThat(first.isCached()).isFalse();
        assertThat(second.isCached()).isTrue();
        assertThat(second.getContent()).isEqualTo(first.getContent());
        verify(aiChatService, times(1)).ask(eq(USER_ID), eq(AiTopic.GUARDIAN), anyString(), eq(context));
    }

    @Test
    void cachedBriefIsReturnedWithoutCallingAi() {
        stored.set(CachedBrief.builder().userId(USER_ID).topic("guardian").content("old brief").createdAt(Instant.now()).build());

        BriefResponse response = briefService.generateBrief(USER_ID, AiTopic.GUARDIAN, false);

        assertThat(response.getContent()).isEqualTo("old brief");
        assertThat(response.isCached()).isTrue();
        verifyNoInteractions(aiChatService);
    }

    @Test
    void forceRegeneratesAndOverwrites() {
        stubStorage();
        stored.set(CachedBrief.builder().id(9L).userId(USER_ID).topic("guardian").content("old brief").createdAt(Instant.EPOCH).build());
        when(userService.userContext(USER_ID)).thenReturn(context);
        when(aiChatService.ask(eq(USER_ID), eq(AiTopic.GUARDIAN), anyString(), eq(context)))
                .thenReturn(ChatReply.of("new brief"));

        BriefResponse response = briefService.generateBrief(USER_ID, AiTopic.GUARDIAN, true);

        assertThat(response.getContent()).isEqualTo("new brief");
        assertThat(response.isCached()).isFalse();
        assertThat(stored.get().getId()).isEqualTo(9L);
        assertThat(stored.get().getContent()).isEqualTo("new brief");
    }

    @Test
    void fallbackIsReturnedButNotStored() {
        when(userService.userContext(USER_ID)).thenReturn(context);
        when(aiChatService.ask(eq(USER_ID), eq(AiTopic.GUARDIAN), anyString(), eq(context)))
                .thenReturn(ChatReply.fallback(RemoteFailure.TIMEOUT));

        BriefResponse response = briefService.generateBrief(USER_ID, AiTopic.GUARDIAN, false);

        assertThat(response.isFallback()).isTrue();
        assertThat(response.getContent()).isEqualTo("Sorry, the AI is taking too long to respond. Please try again.");
        verify(briefRepository, never()).save(any());
    }

    @Test
    void promptAsksForThreeRecommendationsAndQuestions() {
        String prompt = BriefService.briefPrompt(AiTopic.SCHOLAR, context);

        assertThat(prompt)
                .contains("exactly 3 numbered recommendations about studying")
                .contains("exactly 3 example questions")
                .contains("\"Q: \"")
                .contains("User")
                .contains("no markdown");
    }

    private void stubStorage() {
        when(briefRepository.save(any(CachedBrief.class))).thenAnswer(invocation -> {
            CachedBrief brief = invocation.getArgument(0);
            stored.set(brief);
            return brief;
        });
    }
}
