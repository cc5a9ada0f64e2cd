package com.zenith.backend.service.ai;

import com.zenith.backend.config.ZenithAiProperties;
import com.zenith.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class InsightService {

    private final ZenithAiProperties aiProperties;
    private final AiChatService aiChatService;
    private final AiSessionCache sessionCache;

    /**
     * One-line dashboard insight from a throwaway guardian thread, or a fixed hint when AI is unavailable.
     */
    public String dashboardInsight(UserContext context) {
        if (!aiProperties.isConfigured()) {
            return fallbackInsight(context.stressLevel());
        }
        String prompt = "In one short plain sentence, give me a financial wellness insight for today. "
                + "My balance is $" + MoneyUtils.display(context.balance())
                + " and my stress level is " + context.stressLevel() + "/10.";
        ChatReply reply = aiChatService.runBounded(() -> sessionCache.oneOff(AiTopic.GUARDIAN, prompt))
                .fold(r -> r, ChatReply::fallback);
        if (!reply.succeeded()) {
            log.debug("Dashboard insight fell back: {}", reply.failure());
            return fallbackInsight(context.stressLevel());
        }
        return reply.text();
    }

    static String fallbackInsight(Integer stressLevel) {
        return "Zenith AI: With stress at " + stressLevel + "/10, consider a mindful pause before financial decisions today.";
    }
}
