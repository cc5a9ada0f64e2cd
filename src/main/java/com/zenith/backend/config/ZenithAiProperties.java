package com.zenith.backend.config;

import com.zenith.backend.service.ai.ResetScope;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "zenith.ai")
@Data
@Validated
public class ZenithAiProperties {

    @NotBlank
    private String baseUrl = "https://app.backboard.io/api";

    private String apiKey;

    private String model = "gpt-4o-mini";

    @Min(1)
    private int workers = 4;

    @Min(0)
    private int queueCapacity = 100;

    @Positive
    private long callTimeoutSeconds = 60;

    private ResetScope resetScope = ResetScope.USER;

    /**
     * Where assistant/thread bindings live: {@code jpa} or {@code memory}.
     */
    private String sessionStore = "jpa";

    private Http http = new Http();
    private Circuit circuit = new Circuit();

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Data
    public static class Http {
        @Positive
        private int connectTimeoutMs = 15000;

        @Positive
        private int readTimeoutMs = 30000;
    }

    @Data
    public static class Circuit {
        @Positive
        private float failureRateThreshold = 50;

        @Positive
        private long waitOpenSeconds = 30;

        @Min(2)
        private int slidingWindowSize = 20;
    }
}
