package com.example.shield.util;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips credential-like substrings, long numbers and e-mail addresses from
 * text before it leaves the process.
 */
public final class MessageRedactor {

    public static final String REDACTED = "[REDACTED]";
    public static final String EMAIL = "[EMAIL]";

    private static final Pattern EMAIL_ADDRESS =
            Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");
    private static final Pattern SECRET_ASSIGNMENT = Pattern.compile(
            "(?i)\\b(?:password|passwd|pwd|token|secret|api[_-]?key|key|authorization|bearer)\\s*[=:]\\s*[^\\s,;&]+");
    private static final Pattern BEARER_VALUE = Pattern.compile("(?i)\\bbearer\\s+[A-Za-z0-9._~+/=-]+");
    private static final List<Pattern> SENSITIVE_WORDS = List.of(
            Pattern.compile("(?i)password"),
            Pattern.compile("(?i)token"),
            Pattern.compile("(?i)secret"),
            Pattern.compile("(?i)key"));
    private static final Pattern LONG_NUMBER = Pattern.compile("\\b\\d{4,}\\b");

    private MessageRedactor() {
    }

    public static String redact(String message) {
        if (message == null || message.isEmpty()) {
            return message;
        }
        String result = EMAIL_ADDRESS.matcher(message).replaceAll(EMAIL);
        result = SECRET_ASSIGNMENT.matcher(result).replaceAll(REDACTED);
        result = BEARER_VALUE.matcher(result).replaceAll(REDACTED);
        for (Pattern word : SENSITIVE_WORDS) {
            result = word.matcher(result).replaceAll(REDACTED);
        }
        return LONG_NUMBER.matcher(result).replaceAll(REDACTED);
    }
}
