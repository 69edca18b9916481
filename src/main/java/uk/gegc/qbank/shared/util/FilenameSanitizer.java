package uk.gegc.qbank.shared.util;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Makes user-supplied names safe to use as file names on Windows, macOS and Linux.
 */
public final class FilenameSanitizer {

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1f]");
    private static final Pattern REPEATED_REPLACEMENT = Pattern.compile("_+");
    private static final Pattern EDGE_JUNK = Pattern.compile("^[_.]+|[_.]+$");

    private static final Set<String> RESERVED_NAMES = Set.of(
            "CON", "PRN", "AUX", "NUL",
            "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
            "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9"
    );

    private FilenameSanitizer() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Replaces unsafe characters with {@code _}, collapses runs of {@code _}, trims leading and trailing
     * {@code _} and {@code .}, suffixes Windows device names with {@code _file} and truncates to
     * {@code maxLength} while keeping any extension.
     *
     * @return the sanitized name, or an empty string when nothing usable remains
     */
    public static String sanitize(String name, int maxLength) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String sanitized = UNSAFE_CHARS.matcher(name.strip()).replaceAll("_");
        sanitized = REPEATED_REPLACEMENT.matcher(sanitized).replaceAll("_");
        sanitized = EDGE_JUNK.matcher(sanitized).replaceAll("");

        if (RESERVED_NAMES.contains(stem(sanitized).toUpperCase(Locale.ROOT))) {
            sanitized = sanitized + "_file";
        }
        return truncate(sanitized, maxLength);
    }

    /**
     * Removes a trailing extension such as {@code .zip} when it matches one of {@code extensions}, ignoring case.
     */
    public static String stripExtension(String name, String... extensions) {
        if (name == null) {
            return null;
        }
        String trimmed = name.strip();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            String suffix = "." + extension.toLowerCase(Locale.ROOT);
            if (lower.endsWith(suffix)) {
                return trimmed.substring(0, trimmed.length() - suffix.length());
            }
        }
        return trimmed;
    }

    private static String truncate(String name, int maxLength) {
        if (name.length() <= maxLength) {
            return name;
        }
        int dot = name.lastIndexOf('.');
        String extension = dot > 0 ? name.substring(dot) : "";
        int available = maxLength - extension.length();
        if (available > 0) {
            return name.substring(0, available) + extension;
        }
        return name.substring(0, maxLength);
    }

    private static String stem(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
