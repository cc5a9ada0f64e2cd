package com.zenith.backend.service.ai;

import com.zenith.backend.exception.BadRequestException;
import com.zenith.backend.service.UserService;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AiChatServiceTest {

    @Mock
    private AiSessionCache sessionCache;

    @Mock
    private UserService userService;

    private ExecutorService executor;
    private AiChatService chatService;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        TimeLimiter timeLimiter = TimeLimiter.of("test", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(200))
                .cancelRunningFuture(false)
                .build());
        chatService = new AiChatService(sessionCache, userService, executor, timeLimiter);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void chatRedactsBeforeSending() {
        UserContext context = new UserContext(null, BigDecimal.ONE, 5);
        when(userService.userContext(1L)).thenReturn(context);
        when(sessionCache.converse(1L, AiTopic.GUARDIAN, "please ask [NAME] at [EMAIL] about rent", context))
                .thenReturn(ChatReply.of("Sure."));

        ChatReply reply = chatService.chat(1L, AiTopic.GUARDIAN, "  please ask Mary Jones at mary@example.com about rent ");

        assertThat(reply.text()).isEqualTo("Sure.");
        assertThat(reply.succeeded()).isTrue();
    }

    @Test
    void blankMessageIsRejected() {
        assertThatThrownBy(() -> chatService.chat(1L, AiTopic.SCHOLAR, "   "))
                .isInstanceOf(BadRequestException.class);
        verifyNoInteractions(sessionCache);
    }

    @Test
    void slowCallTimesOut() {
        RemoteResult<String> result = chatService.runBounded(() -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        });

        assertThat(result.failure()).isEqualTo(RemoteFailure.TIMEOUT);
    }

    @Test
    void timeoutBecomesFallbackReply() {
        UserContext context = new UserContext(null, null, null);
        when(sessionCache.converse(1L, AiTopic.VITALS, "plan", context)).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return ChatReply.of("too late");
        });

        ChatReply reply = chatService.ask(1L, AiTopic.VITALS, "plan", context);

        assertThat(reply.failure()).isEqualTo(RemoteFailure.TIMEOUT);
        assertThat(reply.text()).isEqualTo(FallbackMessages.forFailure(RemoteFailure.TIMEOUT));
    }

    @Test
    void saturatedPoolIsReportedAsRejected() {
        AiChatService saturated = new AiChatService(sessionCache, userService,
                command -> {
                    throw new RejectedExecutionException("queue full");
                },
                TimeLimiter.of(Duration.ofSeconds(1)));

        RemoteResult<String> result = saturated.runBounded(() -> "never");

        assertThat(result.failure()).isEqualTo(RemoteFailure.REJECTED);
    }

    @Test
    void fastCallSucceeds() {
        assertThat(chatService.runBounded(() -> "ok").value()).isEqualTo("ok");
    }
}
