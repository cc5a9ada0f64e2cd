package com.zenith.backend.service.ai;

import java.util.regex.Pattern;

/**
 * Turns assistant markdown into plain prose. Numbered lines are left alone.
 */
public final class ResponseSanitizer {

    private static final Pattern HEADING = Pattern.compile("(?m)^[ \\t]{0,3}#{1,6}[ \\t]*");
    private static final Pattern BULLET = Pattern.compile("(?m)^[ \\t]*[-*+\\u2022][ \\t]+");
    private static final Pattern BOLD_STARS = Pattern.compile("\\*\\*(.+?)\\*\\*");
    private static final Pattern BOLD_UNDERSCORES = Pattern.compile("__(.+?)__");
    private static final Pattern ITALIC_STAR = Pattern.compile("(?<![\\w*])\\*(?!\\s)(.+?)(?<!\\s)\\*(?![\\w*])");
    private static final Pattern ITALIC_UNDERSCORE = Pattern.compile("(?<![\\w_])_(?!\\s)(.+?)(?<!\\s)_(?![\\w_])");
    private static final Pattern TRAILING_SPACES = Pattern.compile("(?m)[ \\t]+$");
    private static final Pattern BLANK_RUNS = Pattern.compile("\\n{3,}");

    private ResponseSanitizer() {
    }

    public static String strip(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.replace("\r\n", "\n");
        text = HEADING.matcher(text).replaceAll("");
        text = BULLET.matcher(text).replaceAll("");
        text = BOLD_STARS.matcher(text).replaceAll("$1");
        text = BOLD_UNDERSCORES.matcher(text).replaceAll("$1");
        text = ITALIC_STAR.matcher(text).replaceAll("$1");
        text = ITALIC_UNDERSCORE.matcher(text).replaceAll("$1");
        text = TRAILING_SPACES.matcher(text).replaceAll("");
        text = BLANK_RUNS.matcher(text).replaceAll("\n\n");
        return text.trim();
    }
}
