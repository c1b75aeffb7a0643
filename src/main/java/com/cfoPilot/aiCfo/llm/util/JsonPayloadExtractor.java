package com.cfoPilot.aiCfo.llm.util;

/**
 * Pulls the outermost JSON object out of model output that may be wrapped in
 * markdown fences or prose.
 */
public final class JsonPayloadExtractor {

    private JsonPayloadExtractor() {}

    /**
     * @return the substring from the first '{' to the last '}', or null when there is none
     */
    public static String extractObject(String content) {
        if (content == null) {
            return null;
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return content.substring(start, end + 1);
    }
}
