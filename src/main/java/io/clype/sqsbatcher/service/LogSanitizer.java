package io.clype.sqsbatcher.service;

import java.util.regex.Pattern;

final class LogSanitizer {

    /** Removes all control characters, ANSI escape sequences included. */
    private static final Pattern LOG_SANITIZE_PATTERN = Pattern.compile("[\\p{Cntrl}\\p{Cc}]");

    private LogSanitizer() {
    }

    static String sanitize(String input) {
        if (input == null) {
            return "null";
        }
        return LOG_SANITIZE_PATTERN.matcher(input).replaceAll("_");
    }
}
