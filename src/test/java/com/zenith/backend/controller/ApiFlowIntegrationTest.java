package com.zenith.backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import com.zenith.backend.dto.LoginRequest;
import com.zenith.backend.dto.RegisterRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ApiFlowIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void publicEndpointsNeedNoToken() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").exists());
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(header().exists("X-Request-Id"));
    }

    @Test
    void protectedEndpointWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/balance"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.status").value(401));
        mockMvc.perform(get("/api/balance").header("Authorization", "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void duplicateRegistrationConflicts() throws Exception {
        String username = uniqueName();
        register(username, "secret123");

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new RegisterRequest(username, "other123"))))
                .andExpect(status().isConflict());
    }

    @Test
    void wrongPasswordIsUnauthorized() throws Exception {
        String username = uniqueName();
        register(username, "secret123");

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new LoginRequest(username, "wrong-pass"))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid username or password"));
    }

    @Test
    void invalidRegistrationIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new RegisterRequest("ab", "123"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").isArray());
    }

    @Test
    void onboardingThenPurchasesUpdateBalanceAndLedger() throws Exception {
        String token = registerAndLogin();

        mockMvc.perform(post("/api/onboarding")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"survey\":{\"name\":\"Ada\",\"spendingProfile\":\"careful\"},\"balance\":100,\"stressLevel\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.onboarded").value(true))
                .andExpect(jsonPath("$.balance").value(100.0));

        mockMvc.perform(post("/api/onboarding")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"survey\":{\"name\":\"Ada\"},\"balance\":9999}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(100.0));

        mockMvc.perform(post("/api/purchases/attempt")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemName\":\"Books\",\"amount\":50}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ALLOWED"))
                .andExpect(jsonPath("$.newBalance").value(50.0));

        mockMvc.perform(post("/api/purchases/execute")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemName\":\"Laptop\",\"amount\":500}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("BLOCKED"))
                .andExpect(jsonPath("$.reason").value("Insufficient funds."));

        mockMvc.perform(post("/api/income")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":25,\"source\":\"Tutoring\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("INCOME"))
                .andExpect(jsonPath("$.newBalance").value(75.0));

        mockMvc.perform(get("/api/transactions").header("Authorization", bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[0].status").value("INCOME"))
                .andExpect(jsonPath("$[2].itemName").value("Books"));

        mockMvc.perform(get("/api/balance").header("Authorization", bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(75.0))
                .andExpect(jsonPath("$.stressLevel").value(2));
    }

    @Test
    void invalidPurchaseBodyIsBadRequest() throws Exception {
        String token = registerAndLogin();

        mockMvc.perform(post("/api/purchases/attempt")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemName\":\"\",\"amount\":-3}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void stressUpdatesAreLogged() throws Exception {
        String token = registerAndLogin();

        mockMvc.perform(put("/api/stress")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"level\":9,\"note\":\"exam week\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.level").value(9));

        mockMvc.perform(put("/api/stress")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"level\":11}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/stress/history").header("Authorization", bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].note").value("exam week"));
    }

    @Test
    void surveyCanBeReplaced() throws Exception {
        String token = registerAndLogin();

        mockMvc.perform(put("/api/survey")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Grace\",\"healthGoals\":[\"sleep more\"]}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/survey").header("Authorization", bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Grace"))
                .andExpect(jsonPath("$.healthGoals[0]").value("sleep more"));
    }

    @Test
    void chatWithoutAiConfigurationFallsBack() throws Exception {
        String token = registerAndLogin();

        mockMvc.perform(post("/api/ai/guardian/chat")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Can I afford a trip?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.topic").value("guardian"))
                .andExpect(jsonPath("$.fallback").value(true))
                .andExpect(jsonPath("$.reply").value("Sorry, the AI service is currently unavailable."));

        mockMvc.perform(get("/api/ai/scholar/brief").header("Authorization", bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fallback").value(true))
                .andExpect(jsonPath("$.cached").value(false));
    }

    @Test
    void unknownTopicIsNotFound() throws Exception {
        String token = registerAndLogin();

        mockMvc.perform(post("/api/ai/astrology/chat")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hi\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void purchaseAdviceWithoutSessionIsServiceUnavailable() throws Exception {
        String token = registerAndLogin();

        mockMvc.perform(post("/api/purchases/evaluate")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemName\":\"Console\",\"amount\":400}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void dashboardUsesFallbackInsight() throws Exception {
        String token = registerAndLogin();

        mockMvc.perform(get("/api/dashboard").header("Authorization", bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stressLevel").value(5))
                .andExpect(jsonPath("$.recentTransactions", hasSize(0)))
                .andExpect(jsonPath("$.insight")
                        .value("Zenith AI: With stress at 5/10, consider a mindful pause before financial decisions today."));
    }

    @Test
    void resetClearsUserScope() throws Exception {
        String token = registerAndLogin();

        mockMvc.perform(post("/api/ai/reset").header("Authorization", bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scope").value("USER"))
                .andExpect(jsonPath("$.threadsCleared").value(0));
    }

    @Test
    void logoutRevokesToken() throws Exception {
        String token = registerAndLogin();

        mockMvc.perform(get("/api/auth/me").header("Authorization", bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.onboarded").value(false));

        mockMvc.perform(post("/api/auth/logout").header("Authorization", bearer(token)))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/auth/me").header("Authorization", bearer(token)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("SESSION_ENDED"));
    }

    @Test
    void newLoginReplacesPreviousSession() throws Exception {
        String username = uniqueName();
        register(username, "secret123");
        String first = login(username, "secret123");
        String second = login(username, "secret123");

        mockMvc.perform(get("/api/balance").header("Authorization", bearer(first)))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/balance").header("Authorization", bearer(second)))
                .andExpect(status().isOk());
    }

    private String registerAndLogin() throws Exception {
        String username = uniqueName();
        register(username, "secret123");
        return login(username, "secret123");
    }

    private void register(String username, String password) throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new RegisterRequest(username, password))))
                .andExpect(status().isCreated());
    }

    private String login(String username, String password) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new LoginRequest(username, password))))
                .andExpect(status().isOk())
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.token");
    }

    private String uniqueName() {
        return "user_" + UUID.randomUUID().toString().substring(0, 8);
    }

    private String bearer(String token) {
        return "Bearer " + token;
    }
}
