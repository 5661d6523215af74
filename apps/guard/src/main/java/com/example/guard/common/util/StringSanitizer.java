package com.example.guard.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

public final class StringSanitizer {

    private static final Pattern SAFE_IDENTIFIER_PATTERN = Pattern.compile("^[a-zA-Z0-9_@.:+-]{1,128}$");
    private static final Pattern SAFE_TAG_PATTERN = Pattern.compile("[^a-zA-Z0-9_./-]");
    private static final int DEFAULT_LOG_MAX_LENGTH = 64;
    private static final int DEFAULT_TAG_MAX_LENGTH = 50;

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
        return sanitized.substring(0, Math.min(sanitized.length(), maxLength));
    }

    /**
     * Bounds a value used as a metric tag so user input cannot explode cardinality.
     */
    @NonNull
    public static String forTag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        String cleaned = SAFE_TAG_PATTERN.matcher(value).replaceAll("_");
        return cleaned.substring(0, Math.min(cleaned.length(), DEFAULT_TAG_MAX_LENGTH));
    }

    /**
     * Identifiers are user names, e-mail addresses or network addresses.
     */
    public static boolean isValidIdentifier(@Nullable String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return false;
        }
        return SAFE_IDENTIFIER_PATTERN.matcher(identifier).matches();
    }

    @Nullable
    public static String trimToNull(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
