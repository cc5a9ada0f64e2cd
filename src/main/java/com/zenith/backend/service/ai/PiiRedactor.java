package com.zenith.backend.service.ai;

import java.util.regex.Pattern;

/**
 * Best-effort scrubbing of free text before it leaves the service. Heuristic only: any run of two
 * or more capitalised words is treated as a name.
 */
public final class PiiRedactor {

    public static final String EMAIL_PLACEHOLDER = "[EMAIL]";
    public static final String NAME_PLACEHOLDER = "[NAME]";

    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern CAPITALISED_RUN = Pattern.compile("\\b[A-Z][a-z]+(?:[ \\t]+[A-Z][a-z]+)+\\b");

    private PiiRedactor() {
    }

    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String redacted = EMAIL.matcher(text).replaceAll(EMAIL_PLACEHOLDER);
        return CAPITALISED_RUN.matcher(redacted).replaceAll(NAME_PLACEHOLDER);
    }
}
