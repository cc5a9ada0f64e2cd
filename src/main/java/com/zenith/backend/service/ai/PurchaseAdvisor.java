package com.zenith.backend.service.ai;

import com.zenith.backend.exception.AiUnavailableException;
import com.zenith.backend.exception.BadRequestException;
import com.zenith.backend.service.UserService;
import com.zenith.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the guardian assistant whether a purchase is a good idea. Unlike chat, this flow refuses to
 * answer with generic text when no thread can be established.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PurchaseAdvisor {

    private static final Pattern VERDICT = Pattern.compile("VERDICT:\\s*(APPROVE|CAUTION|DENY)", Pattern.CASE_INSENSITIVE);

    private final AiChatService aiChatService;
    private final AiSessionCache sessionCache;
    private final UserService userService;

    public PurchaseAdvice evaluate(Long userId, String itemName, BigDecimal amount) {
        if (itemName == null || itemName.isBlank()) {
            throw new BadRequestException("Item name is required");
        }
        if (!MoneyUtils.isPositive(amount)) {
            throw new BadRequestException("Amount must be a positive number");
        }
        UserContext context = userService.userContext(userId);
        String prompt = advicePrompt(itemName.trim(), amount, context);

        RemoteResult<RemoteResult<ChatReply>> outcome = aiChatService.runBounded(
                () -> sessionCache.converseOnThread(userId, AiTopic.GUARDIAN, prompt, context));
        if (outcome.isFailure()) {
            return new PurchaseAdvice(PurchaseAdvice.Verdict.UNKNOWN, FallbackMessages.forFailure(outcome.failure()), true);
        }
        RemoteResult<ChatReply> reply = outcome.value();
        if (reply.isFailure()) {
            throw new AiUnavailableException("Could not open an AI advisor session", reply.failure());
        }
        ChatReply chat = reply.value();
        if (!chat.succeeded()) {
            return new PurchaseAdvice(PurchaseAdvice.Verdict.UNKNOWN, chat.text(), true);
        }
        return parse(chat.text());
    }

    static PurchaseAdvice parse(String text) {
        Matcher matcher = VERDICT.matcher(text);
        if (!matcher.find()) {
            return new PurchaseAdvice(PurchaseAdvice.Verdict.UNKNOWN, text.trim(), false);
        }
        PurchaseAdvice.Verdict verdict = PurchaseAdvice.Verdict.valueOf(matcher.group(1).toUpperCase(Locale.ROOT));
        String advice = (text.substring(0, matcher.start()) + text.substring(matcher.end())).trim();
        return new PurchaseAdvice(verdict, advice, false);
    }

    private static String advicePrompt(String itemName, BigDecimal amount, UserContext context) {
        StringBuilder prompt = new StringBuilder()
                .append("I'm thinking about buying \"").append(itemName).append("\" for $")
                .append(MoneyUtils.display(amount)).append(". ");
        if (context.balance() != null) {
            prompt.append("My balance is $").append(MoneyUtils.display(context.balance())).append(". ");
        }
        if (context.stressLevel() != null) {
            prompt.append("My stress level is ").append(context.stressLevel()).append("/10. ");
        }
        return prompt.append("Start your answer with exactly one line: VERDICT: APPROVE, VERDICT: CAUTION or VERDICT: DENY. ")
                .append("Then explain in two or three plain sentences.")
                .toString();
    }
}
