package com.zenith.backend.service.ai;

import com.zenith.backend.model.SurveyProfile;

import java.math.BigDecimal;

/**
 * Snapshot of what the assistants may know about a user, taken on the request thread.
 */
public record UserContext(SurveyProfile survey, BigDecimal balance, Integer stressLevel) {

    public boolean hasSurvey() {
        return survey != null;
    }

    public String displayName() {
        if (survey == null || survey.getName() == null || survey.getName().isBlank()) {
            return "User";
        }
        return survey.getName().trim();
    }
}
