package com.zenith.backend.controller;

import com.zenith.backend.config.OpenApiConfig;
import com.zenith.backend.dto.BalanceResponse;
import com.zenith.backend.dto.OnboardingRequest;
import com.zenith.backend.dto.StressLogDTO;
import com.zenith.backend.dto.StressUpdateRequest;
import com.zenith.backend.dto.UserProfileDTO;
import com.zenith.backend.model.SurveyProfile;
import com.zenith.backend.security.UserPrincipal;
import com.zenith.backend.service.UserService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = OpenApiConfig.TAG_PROFILE)
public class ProfileController {

    private final UserService userService;

    @PostMapping("/onboarding")
    public UserProfileDTO onboard(@AuthenticationPrincipal UserPrincipal principal,
                                  @Valid @RequestBody OnboardingRequest request) {
        return userService.onboard(principal.getUserId(), request);
    }

    @GetMapping("/survey")
    public SurveyProfile getSurvey(@AuthenticationPrincipal UserPrincipal principal) {
        return userService.survey(principal.getUserId());
    }

    @PutMapping("/survey")
    public SurveyProfile updateSurvey(@AuthenticationPrincipal UserPrincipal principal,
                                      @RequestBody SurveyProfile survey) {
        return userService.updateSurvey(principal.getUserId(), survey);
    }

    @GetMapping("/balance")
    public BalanceResponse balance(@AuthenticationPrincipal UserPrincipal principal) {
        return userService.balance(principal.getUserId());
    }

    @PutMapping("/stress")
    public StressLogDTO updateStress(@AuthenticationPrincipal UserPrincipal principal,
                                     @Valid @RequestBody StressUpdateRequest request) {
        return userService.updateStress(principal.getUserId(), request.getLevel(), request.getNote());
    }

    @GetMapping("/stress/history")
    public List<StressLogDTO> stressHistory(@AuthenticationPrincipal UserPrincipal principal) {
        return userService.stressHistory(principal.getUserId());
    }
}
