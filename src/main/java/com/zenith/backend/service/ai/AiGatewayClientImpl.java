package com.zenith.backend.service.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zenith.backend.config.ZenithAiProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AiGatewayClientImpl implements AiGatewayClient {

    static final String API_KEY_HEADER = "X-API-Key";

    private final RestTemplate aiRestTemplate;
    private final CircuitBreaker aiCircuitBreaker;
    private final ZenithAiProperties aiProperties;
    private final MeterRegistry meterRegistry;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public RemoteResult<String> createAssistant(String name, String systemPrompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("system_prompt", systemPrompt);
        if (aiProperties.getModel() != null && !aiProperties.getModel().isBlank()) {
            body.put("model", aiProperties.getModel());
        }
        return post("create_assistant", "/assistants", body, "assistant_id", "id");
    }

    @Override
    public RemoteResult<String> createThread(String assistantId) {
        return post("create_thread", "/assistants/" + assistantId + "/threads", Map.of(), "thread_id", "id");
    }

    @Override
    public RemoteResult<String> postMessage(String threadId, String content) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", content);
        body.put("stream", false);
        return post("post_message", "/threads/" + threadId + "/messages", body,
                "content", "message", "response", "text");
    }

    private RemoteResult<String> post(String operation, String path, Object body, String... replyFields) {
        if (!aiProperties.isConfigured()) {
            return RemoteResult.failure(RemoteFailure.NOT_CONFIGURED, "AI API key not configured");
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        RemoteResult<String> result;
        try {
            String response = CircuitBreaker.decorateSupplier(aiCircuitBreaker, () -> exchange(path, body)).get();
            result = extract(response, replyFields);
        } catch (CallNotPermittedException e) {
            result = RemoteResult.failure(RemoteFailure.CIRCUIT_OPEN, "AI gateway circuit open");
        } catch (HttpStatusCodeException e) {
            result = RemoteResult.failure(RemoteFailure.HTTP_ERROR, "HTTP " + e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            result = RemoteResult.failure(RemoteFailure.TRANSPORT, e.getMessage());
        } catch (RestClientException e) {
            result = RemoteResult.failure(RemoteFailure.TRANSPORT, e.getMessage());
        }
        if (result.isFailure()) {
            log.warn("AI gateway {} failed reason={} detail={}", operation, result.failure(), result.detail());
        }
        sample.stop(Timer.builder("ai_gateway_call_latency")
                .tag("operation", operation)
                .tag("outcome", result.isSuccess() ? "success" : result.failure().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry));
        return result;
    }

    private String exchange(String path, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(API_KEY_HEADER, aiProperties.getApiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Object> entity = new HttpEntity<>(body, headers);
        ResponseEntity<String> response = aiRestTemplate.exchange(baseUrl() + path, HttpMethod.POST, entity, String.class);
        return response.getBody();
    }

    private RemoteResult<String> extract(String response, String... fields) {
        if (response == null || response.isBlank()) {
            return RemoteResult.failure(RemoteFailure.MALFORMED_RESPONSE, "empty body");
        }
        try {
            JsonNode root = objectMapper.readTree(response);
            for (String field : fields) {
                JsonNode node = root.path(field);
                if (node.isValueNode() && !node.asText().isBlank()) {
                    return RemoteResult.success(node.asText());
                }
            }
            return RemoteResult.failure(RemoteFailure.MALFORMED_RESPONSE, "none of " + String.join("/", fields) + " present");
        } catch (Exception e) {
            return RemoteResult.failure(RemoteFailure.MALFORMED_RESPONSE, e.getMessage());
        }
    }

    private String baseUrl() {
        String base = aiProperties.getBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
