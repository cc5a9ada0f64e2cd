package com.zenith.backend.controller;

import com.zenith.backend.config.OpenApiConfig;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
@Tag(name = OpenApiConfig.TAG_HEALTH)
public class HealthController {

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "Zenith backend is running");
    }

    @GetMapping("/api/health")
    public Map<String, Object> health() {
        return Map.of("status", "UP", "timestamp", Instant.now().toString());
    }
}
