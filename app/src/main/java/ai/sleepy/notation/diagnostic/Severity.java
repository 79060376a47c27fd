package ai.sleepy.notation.diagnostic;

import java.util.Locale;

/**
 * Diagnostic severity. Every structural problem is an error.
 */
public enum Severity {
    ERROR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
