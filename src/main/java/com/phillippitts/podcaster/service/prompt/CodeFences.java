package com.phillippitts.podcaster.service.prompt;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes a single Markdown code fence that wraps an entire model response.
 *
 * <p>Only a fence enclosing the whole trimmed text is removed. Fences inside the payload
 * (for example inside a JSON string) are kept, and text with an unterminated fence or
 * trailing prose after the closing fence is returned trimmed but otherwise unchanged.
 */
public final class CodeFences {

    private static final Pattern ENCLOSING_FENCE = Pattern.compile(
            "^```(?:json|[A-Za-z0-9_+-]+(?=\\s))?\\s*(.*?)\\s*```$",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private CodeFences() {
    }

    public static String strip(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        Matcher matcher = ENCLOSING_FENCE.matcher(trimmed);
        if (matcher.matches()) {
            return matcher.group(1).trim();
        }
        return trimmed;
    }
}
