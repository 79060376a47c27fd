package ai.sleepy.notation.report;

import java.util.Locale;

/**
 * Rendering of command results on standard output.
 */
public enum OutputFormat {
    TEXT,
    JSON;

    public static OutputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Output format must be provided");
        }
        try {
            return OutputFormat.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported output format: " + raw, ex);
        }
    }
}
