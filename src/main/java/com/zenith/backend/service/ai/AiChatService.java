package com.zenith.backend.service.ai;

import com.zenith.backend.exception.BadRequestException;
import com.zenith.backend.service.UserService;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Entry point for conversational AI. Every remote interaction runs on the bounded {@code aiExecutor}
 * under a time limit so request threads never wait on the gateway longer than the configured timeout.
 */
@Slf4j
@Service
public class AiChatService {

    private final AiSessionCache sessionCache;
    private final UserService userService;
    private final Executor aiExecutor;
    private final TimeLimiter aiTimeLimiter;

    public AiChatService(AiSessionCache sessionCache,
                         UserService userService,
                         @Qualifier("aiExecutor") Executor aiExecutor,
                         TimeLimiter aiTimeLimiter) {
        this.sessionCache = sessionCache;
        this.userService = userService;
        this.aiExecutor = aiExecutor;
        this.aiTimeLimiter = aiTimeLimiter;
    }

    public ChatReply chat(Long userId, AiTopic topic, String message) {
        if (message == null || message.isBlank()) {
            throw new BadRequestException("Message is required");
        }
        UserContext context = userService.userContext(userId);
        return ask(userId, topic, PiiRedactor.redact(message.trim()), context);
    }

    /**
     * Sends an already prepared prompt on the user's thread for the topic.
     */
    public ChatReply ask(Long userId, AiTopic topic, String prompt, UserContext context) {
        return runBounded(() -> sessionCache.converse(userId, topic, prompt, context))
                .fold(reply -> reply, ChatReply::fallback);
    }

    public <T> RemoteResult<T> runBounded(Supplier<T> call) {
        try {
            T value = aiTimeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, aiExecutor));
            return RemoteResult.success(value);
        } catch (TimeoutException e) {
            log.warn("AI call exceeded time limit: {}", e.getMessage());
            return RemoteResult.failure(RemoteFailure.TIMEOUT, e.getMessage());
        } catch (RejectedExecutionException e) {
            log.warn("AI worker pool saturated: {}", e.getMessage());
            return RemoteResult.failure(RemoteFailure.REJECTED, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RemoteResult.failure(RemoteFailure.TIMEOUT, "Interrupted while waiting for AI reply");
        } catch (Exception e) {
            log.warn("AI call failed: {}", e.toString());
            return RemoteResult.failure(RemoteFailure.SESSION_UNAVAILABLE, e.getMessage());
        }
    }
}
