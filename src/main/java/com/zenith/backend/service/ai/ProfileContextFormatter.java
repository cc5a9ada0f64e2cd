package com.zenith.backend.service.ai;

import com.zenith.backend.model.SurveyProfile;
import com.zenith.backend.util.MoneyUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the one-line profile summary sent to a fresh thread, e.g.
 * {@code User: Ada | Age: 25-34 | Spending profile: impulsive | Balance: $120.00}.
 */
public final class ProfileContextFormatter {

    static final String DELIMITER = " | ";
    private static final String PRIMING_TEMPLATE = "[User Profile] %s. Remember this about me for all our conversations.";

    private ProfileContextFormatter() {
    }

    public static String format(AiTopic topic, UserContext context) {
        if (context == null || !context.hasSurvey()) {
            return "";
        }
        SurveyProfile survey = context.survey();
        List<String> parts = new ArrayList<>();
        parts.add("User: " + context.displayName());
        addIfPresent(parts, "Age", survey.getAgeRange());
        addIfPresent(parts, "Occupation", survey.getOccupation());

        switch (topic) {
            case SCHOLAR -> {
                addIfPresent(parts, "Education", survey.getEducationLevel());
                addIfPresent(parts, "Interests", survey.getSubjects());
                addIfPresent(parts, "Learning style", survey.getLearningStyle());
                addIfPresent(parts, "Study goals", survey.getStudyGoals());
            }
            case GUARDIAN -> {
                addIfPresent(parts, "Spending profile", survey.getSpendingProfile());
                addIfPresent(parts, "Income", survey.getIncomeRange());
                addIfPresent(parts, "Savings", survey.getSavings());
                addIfPresent(parts, "Financial goals", survey.getFinancialGoals());
                if (context.balance() != null) {
                    parts.add("Balance: $" + MoneyUtils.display(context.balance()));
                }
            }
            case VITALS -> {
                addIfPresent(parts, "Exercise", survey.getExerciseFrequency());
                addIfPresent(parts, "Sleep", survey.getSleepQuality());
                addIfPresent(parts, "Diet", survey.getDietQuality());
                addIfPresent(parts, "Health goals", survey.getHealthGoals());
                if (context.stressLevel() != null) {
                    parts.add("Stress: " + context.stressLevel() + "/10");
                }
            }
        }
        return String.join(DELIMITER, parts);
    }

    public static String primingMessage(String context) {
        return String.format(PRIMING_TEMPLATE, context);
    }

    private static void addIfPresent(List<String> parts, String label, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(label + ": " + value.trim());
        }
    }

    private static void addIfPresent(List<String> parts, String label, List<String> values) {
        if (values == null) {
            return;
        }
        List<String> present = values.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(String::trim)
                .collect(Collectors.toList());
        if (!present.isEmpty()) {
            parts.add(label + ": " + String.join(", ", present));
        }
    }
}
