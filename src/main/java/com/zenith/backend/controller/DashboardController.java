package com.zenith.backend.controller;

import com.zenith.backend.config.OpenApiConfig;
import com.zenith.backend.dto.DashboardResponse;
import com.zenith.backend.security.UserPrincipal;
import com.zenith.backend.service.DashboardService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
@Tag(name = OpenApiConfig.TAG_DASHBOARD)
public class DashboardController {

    private final DashboardService dashboardService;

    @GetMapping
    public DashboardResponse dashboard(@AuthenticationPrincipal UserPrincipal principal) {
        return dashboardService.dashboard(principal.getUserId());
    }
}
