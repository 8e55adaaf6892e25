package io.graphsight.core.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Text helpers for oracle replies, without external dependencies.
///
/// Oracles wrap answers in markdown fences and surround JSON with prose. These helpers
/// recover the payload; structured parsing is left to
/// {@link io.graphsight.core.oracle.OracleResponseParser} implementations.
public final class ResponseText {

    private static final Pattern FENCE = Pattern.compile("```[\\w-]*\\s*\\n?(.*?)```", Pattern.DOTALL);

    private ResponseText() {}

    /// Returns the content of the first markdown code fence, or null when there is none.
    ///
    /// @param text text that may contain a fence, may be null
    /// @return fenced content without the fence lines, trimmed, or null
    public static String firstFencedBlock(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = FENCE.matcher(text);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    /// Strips a surrounding code fence if present, otherwise trims the text.
    ///
    /// @param text reply text, may be null
    /// @return unfenced text, never null
    public static String stripCodeFence(String text) {
        if (text == null) {
            return "";
        }
        String fenced = firstFencedBlock(text);
        return fenced != null ? fenced : text.trim();
    }

    /// Extracts the first balanced JSON object from text that may contain prose.
    ///
    /// Braces inside string literals are ignored.
    ///
    /// @param output reply text, not null
    /// @return the JSON object text, or null if no balanced object exists
    public static String extractJsonObject(String output) {
        int start = output.indexOf('{');
        if (start == -1) {
            return null;
        }

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;

        for (int i = start; i < output.length(); i++) {
            char c = output.charAt(i);

            if (escaped) {
                escaped = false;
                continue;
            }
            if (c == '\\') {
                escaped = true;
                continue;
            }
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (!inString) {
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return output.substring(start, i + 1);
                    }
                }
            }
        }
        return null;
    }

    /// Truncates text for log messages.
    public static String abbreviate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}
