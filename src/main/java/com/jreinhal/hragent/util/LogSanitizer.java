package com.jreinhal.hragent.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    // Control characters enable log injection/forging.
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private LogSanitizer() {
    }

    /**
     * Length and hash of a user question, so questions can be correlated without being logged.
     */
    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,id=none]";
        }
        int len = query.length();
        String id = Integer.toHexString(query.hashCode());
        return "[len=" + len + ",id=" + id + "]";
    }

    /**
     * Strip control characters from values before they enter log output.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
    }

    /**
     * Sanitized value cut to {@code maxChars}, for model replies and other free text.
     */
    public static String preview(String value, int maxChars) {
        String clean = sanitize(value);
        if (maxChars <= 0 || clean.length() <= maxChars) {
            return clean;
        }
        return clean.substring(0, maxChars) + "...";
    }
}
