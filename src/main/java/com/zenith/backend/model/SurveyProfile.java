package com.zenith.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Onboarding survey answers. Every field is optional; the per-topic sections are only read by
 * the matching AI persona.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SurveyProfile {

    private String name;
    private String ageRange;
    private String occupation;

    // scholar
    private String educationLevel;
    @Builder.Default
    private List<String> subjects = new ArrayList<>();
    private String learningStyle;
    @Builder.Default
    private List<String> studyGoals = new ArrayList<>();

    // guardian
    private String spendingProfile;
    private String incomeRange;
    private String savings;
    @Builder.Default
    private List<String> financialGoals = new ArrayList<>();

    // vitals
    private String exerciseFrequency;
    private String sleepQuality;
    private String dietQuality;
    @Builder.Default
    private List<String> healthGoals = new ArrayList<>();
}
