package com.cfoPilot.aiCfo.gateway.util;

import java.util.regex.Pattern;

/**
 * Cleans free-text goals before they enter the pipeline.
 */
public class InputSanitizer {

    public static final int MAX_GOAL_LENGTH = 500;

    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");
    private static final Pattern WHITESPACE_RUNS = Pattern.compile("\\s{2,}");

    private InputSanitizer() {}

    /**
     * Replaces control characters with spaces, collapses whitespace runs, trims and truncates.
     *
     * @return the cleaned text, empty when nothing printable remains
     */
    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(text).replaceAll(" ");
        cleaned = WHITESPACE_RUNS.matcher(cleaned).replaceAll(" ").trim();
        return cleaned.length() > MAX_GOAL_LENGTH ? cleaned.substring(0, MAX_GOAL_LENGTH).trim() : cleaned;
    }
}
