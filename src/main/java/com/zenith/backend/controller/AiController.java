package com.zenith.backend.controller;

import com.zenith.backend.config.OpenApiConfig;
import com.zenith.backend.config.ZenithAiProperties;
import com.zenith.backend.dto.BriefResponse;
import com.zenith.backend.dto.ChatRequest;
import com.zenith.backend.dto.ChatResponse;
import com.zenith.backend.exception.NotFoundException;
import com.zenith.backend.security.UserPrincipal;
import com.zenith.backend.service.ai.AiChatService;
import com.zenith.backend.service.ai.AiSessionCache;
import com.zenith.backend.service.ai.AiTopic;
import com.zenith.backend.service.ai.BriefService;
import com.zenith.backend.service.ai.ChatReply;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ai")
@RequiredArgsConstructor
@Tag(name = OpenApiConfig.TAG_AI)
public class AiController {

    private final AiChatService aiChatService;
    private final BriefService briefService;
    private final AiSessionCache sessionCache;
    private final ZenithAiProperties aiProperties;

    @PostMapping("/{topic}/chat")
    public ChatResponse chat(@AuthenticationPrincipal UserPrincipal principal,
                             @PathVariable String topic,
                             @Valid @RequestBody ChatRequest request) {
        AiTopic aiTopic = resolveTopic(topic);
        ChatReply reply = aiChatService.chat(principal.getUserId(), aiTopic, request.getMessage());
        return new ChatResponse(aiTopic.key(), reply.text(), !reply.succeeded());
    }

    @GetMapping("/{topic}/brief")
    public BriefResponse brief(@AuthenticationPrincipal UserPrincipal principal,
                               @PathVariable String topic,
                               @RequestParam(defaultValue = "false") boolean force) {
        return briefService.generateBrief(principal.getUserId(), resolveTopic(topic), force);
    }

    @PostMapping("/reset")
    public AiSessionCache.ResetSummary reset(@AuthenticationPrincipal UserPrincipal principal) {
        return sessionCache.reset(aiProperties.getResetScope(), principal.getUserId());
    }

    private AiTopic resolveTopic(String topic) {
        return AiTopic.fromKey(topic)
                .orElseThrow(() -> new NotFoundException("Unknown AI topic: " + topic));
    }
}
