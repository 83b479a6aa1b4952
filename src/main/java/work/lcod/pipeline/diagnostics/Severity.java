package work.lcod.pipeline.diagnostics;

import java.util.Locale;

/**
 * Diagnostic severities, ordered from the most verbose to the most severe.
 */
public enum Severity {
    DEBUG,
    INFO,
    WARNING,
    ERROR;

    public static Severity from(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARN".equals(normalized)) {
            return WARNING;
        }
        try {
            return Severity.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported severity: " + value);
        }
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
