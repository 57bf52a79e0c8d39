package com.examparse.core.validation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the JSON payload out of a model response that may carry Markdown fences or prose.
 */
public final class JsonResponseCleaner {

    private static final Pattern FENCE_OPEN = Pattern.compile("```(?:json)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern OUTERMOST_JSON = Pattern.compile("[{\\[].*[}\\]]", Pattern.DOTALL);

    private JsonResponseCleaner() {}

    /**
     * @return the JSON text, or an empty string when none can be located
     */
    public static String clean(String response) {
        if (response == null || response.isBlank()) {
            return "";
        }
        String text = FENCE_OPEN.matcher(response).replaceAll("").replace("```", "").strip();
        if (text.startsWith("{") || text.startsWith("[")) {
            return text;
        }
        Matcher matcher = OUTERMOST_JSON.matcher(text);
        return matcher.find() ? matcher.group().strip() : "";
    }
}
