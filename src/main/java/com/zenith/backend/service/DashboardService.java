package com.zenith.backend.service;

import com.zenith.backend.dto.DashboardResponse;
import com.zenith.backend.model.User;
import com.zenith.backend.service.ai.InsightService;
import com.zenith.backend.service.ai.UserContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DashboardService {

    static final int RECENT_TRANSACTIONS = 5;

    private final UserService userService;
    private final LedgerService ledgerService;
    private final InsightService insightService;

    public DashboardResponse dashboard(Long userId) {
        User user = userService.getUser(userId);
        UserContext context = new UserContext(user.getSurvey(), user.getBalance(), user.getStressLevel());
        return DashboardResponse.builder()
                .username(user.getUsername())
                .balance(user.getBalance())
                .stressLevel(user.getStressLevel())
                .recentTransactions(ledgerService.recent(userId, RECENT_TRANSACTIONS))
                .insight(insightService.dashboardInsight(context))
                .build();
    }
}
