package com.zenith.backend.service.ai;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum AiTopic {

    SCHOLAR("scholar", "Zenith Scholar",
            "You are Zenith Scholar, an AI study tutor. You help students study effectively, break down "
                    + "complex concepts, build study plans and suggest learning strategies. You are encouraging "
                    + "and structured, and you explain with clear examples. Always give actionable steps. "
                    + "Keep responses concise but thorough.",
            "studying, learning habits and exam preparation"),

    GUARDIAN("guardian", "Zenith Guardian",
            "You are Zenith Guardian, a financial wellness advisor. You help users manage money, build "
                    + "budgets, understand spending patterns and make sound financial decisions. You are protective "
                    + "and thoughtful and always put financial health first. Give specific, actionable advice and "
                    + "be reassuring when users are stressed about money. Keep responses concise and practical.",
            "budgeting, saving and spending habits"),

    VITALS("vitals", "Zenith Vitals",
            "You are Zenith Vitals, a physical health and wellness coach. You help users improve exercise "
                    + "habits, sleep quality, nutrition and overall physical wellness. You are motivating and give "
                    + "evidence-based recommendations adapted to the user's fitness level and goals. "
                    + "Keep responses encouraging and actionable.",
            "exercise, sleep and nutrition");

    private final String key;
    private final String assistantName;
    private final String systemPrompt;
    private final String briefFocus;

    AiTopic(String key, String assistantName, String systemPrompt, String briefFocus) {
        this.key = key;
        this.assistantName = assistantName;
        this.systemPrompt = systemPrompt;
        this.briefFocus = briefFocus;
    }

    public String key() {
        return key;
    }

    public String assistantName() {
        return assistantName;
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    public String briefFocus() {
        return briefFocus;
    }

    public static Optional<AiTopic> fromKey(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(topic -> topic.key.equals(normalized))
                .findFirst();
    }
}
