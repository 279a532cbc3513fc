package com.chathub.common.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.function.Function;

/**
 * Environment variable helpers: accepted-option logging and boolean/number parsing.
 */
public final class EnvUtils {

    private EnvUtils() {
    }

    private static final Logger log = LoggerFactory.getLogger(EnvUtils.class);
    private static final Set<String> TRUTHY_VALUES = Set.of("1", "true", "yes", "on");

    /**
     * Log an accepted environment variable (value shown).
     */
    public static void logAcceptedEnvOption(Function<String, String> env, String key, String description) {
        logAcceptedEnvOption(env, key, description, false);
    }

    /**
     * Log an accepted environment variable.
     *
     * @param env         variable lookup
     * @param key         env variable name
     * @param description what it does
     * @param redact      whether to redact the value in logs
     */
    public static void logAcceptedEnvOption(Function<String, String> env, String key, String description,
            boolean redact) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) {
            return;
        }
        String displayValue = redact ? "<redacted>" : formatValue(value);
        log.info("env: {}={} ({})", key, displayValue, description);
    }

    private static String formatValue(String value) {
        String singleLine = value.replaceAll("\\s+", " ").trim();
        if (singleLine.length() <= 160) {
            return singleLine;
        }
        return singleLine.substring(0, 160) + "…";
    }

    /**
     * Check if an environment variable value is truthy.
     */
    public static boolean isTruthy(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        return TRUTHY_VALUES.contains(value.trim().toLowerCase());
    }

    /**
     * Parse a non-negative integer, falling back when missing or malformed.
     */
    public static int parseNonNegativeInt(String value, int fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed >= 0 ? parsed : fallback;
        } catch (NumberFormatException e) {
            log.warn("env: ignoring malformed number '{}', using {}", value, fallback);
            return fallback;
        }
    }

    /**
     * Return the trimmed value, or the fallback when missing or blank.
     */
    public static String stringOrDefault(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim();
    }
}
