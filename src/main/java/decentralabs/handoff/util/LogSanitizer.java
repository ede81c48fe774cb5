package decentralabs.handoff.util;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Helpers that keep caller-controlled values safe for log statements.
 * Control characters are replaced to prevent log injection, and emails or
 * opaque identifiers can be masked so logs never carry them in full.
 */
public final class LogSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");

    private LogSanitizer() {
        // Utility class
    }

    /**
     * Replaces CR, LF and tab runs with an underscore.
     *
     * @param value caller provided value
     * @return value safe for log statements, never null
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("_");
    }

    /**
     * Masks an opaque identifier such as a user id or nonce, keeping a short
     * prefix and suffix for correlation.
     */
    public static String maskIdentifier(String identifier) {
        String sanitized = sanitize(identifier);
        if (sanitized.isEmpty()) {
            return "";
        }
        if (sanitized.length() <= 4) {
            return sanitized.charAt(0) + "***";
        }
        int prefixLength = Math.min(6, sanitized.length() / 2);
        int suffixLength = Math.min(4, Math.max(1, sanitized.length() - prefixLength));
        return sanitized.substring(0, prefixLength) + "..." + sanitized.substring(sanitized.length() - suffixLength);
    }

    /**
     * Masks the local part of an email address: {@code alice@example.com} becomes
     * {@code a***@example.com}.
     */
    public static String maskEmail(String email) {
        String sanitized = sanitize(email);
        int at = sanitized.indexOf('@');
        if (at <= 0) {
            return maskIdentifier(sanitized);
        }
        return sanitized.charAt(0) + "***" + sanitized.substring(at);
    }

    public static String sanitizeOrDefault(String value, String defaultValue) {
        if (value == null) {
            return Objects.requireNonNullElse(defaultValue, "");
        }
        return sanitize(value);
    }
}
