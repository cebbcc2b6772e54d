package com.vuong.pgconnect.util;

import org.springframework.util.StringUtils;

import java.util.regex.Pattern;

/**
 * Makes connection strings and JDBC URLs safe to log by masking credentials.
 * Handles both the {@code key=value key=value} form and the {@code ?key=value&key=value} URL form.
 */
public final class ConnectionStringSanitizer {

    private static final int MAX_LOG_LENGTH = 1000;

    private static final Pattern PASSWORD_PATTERN = Pattern.compile("(?i)(password=)[^&\\s]+");
    private static final Pattern SECRET_PATTERN = Pattern.compile("(?i)((?:ssl)?(?:secret|key|token)=)[^&\\s]+");
    // user:password@ in URL authority
    private static final Pattern USER_INFO_PATTERN = Pattern.compile("(//[^/:@\\s]+:)[^/@\\s]+@");

    private ConnectionStringSanitizer() {
    }

    /**
     * Sanitizes a connection string for logging by limiting length and masking passwords, keys and tokens.
     * @param input the connection string or URL
     * @return the sanitized value, or the input itself if it is null or blank
     */
    public static String sanitizeForLogging(String input) {
        if (!StringUtils.hasText(input)) {
            return input;
        }

        String sanitized = input;
        if (sanitized.length() > MAX_LOG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_LOG_LENGTH) + "...";
        }

        sanitized = PASSWORD_PATTERN.matcher(sanitized).replaceAll("$1***");
        sanitized = SECRET_PATTERN.matcher(sanitized).replaceAll("$1***");
        sanitized = USER_INFO_PATTERN.matcher(sanitized).replaceAll("$1***@");

        return sanitized;
    }
}
