package com.zenith.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    public static final String TAG_AUTH = "Auth";
    public static final String TAG_PROFILE = "Profile";
    public static final String TAG_PURCHASES = "Purchases";
    public static final String TAG_DASHBOARD = "Dashboard";
    public static final String TAG_AI = "AI Advisors";
    public static final String TAG_HEALTH = "Health";

    static final String BEARER_SCHEME = "bearerAuth";

    @Bean
    public OpenAPI zenithOpenApi() {
        SecurityScheme bearerScheme = new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .bearerFormat("JWT")
                .description("Session token from POST /api/auth/login. A new login or a logout revokes older tokens.");
        return new OpenAPI()
                .info(new Info()
                        .title("Zenith API")
                        .description("Stress-aware purchase guard with an append-only ledger, and per-topic AI advisors "
                                + "(scholar, guardian, vitals) that remember each user's conversation.")
                        .version("1.0"))
                .tags(List.of(
                        new Tag().name(TAG_AUTH).description("Registration and session tokens"),
                        new Tag().name(TAG_PROFILE).description("Onboarding survey, balance and stress check-ins"),
                        new Tag().name(TAG_PURCHASES).description("Purchase attempts, income and the transaction ledger"),
                        new Tag().name(TAG_DASHBOARD).description("Balance, stress, recent activity and a daily insight"),
                        new Tag().name(TAG_AI).description("Topic chat, daily briefs and advisor reset"),
                        new Tag().name(TAG_HEALTH).description("Liveness")))
                .components(new Components().addSecuritySchemes(BEARER_SCHEME, bearerScheme))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
    }
}
