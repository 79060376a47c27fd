package ai.sleepy.notation.cli;

import java.util.Locale;

/**
 * Operations offered on the command line.
 */
public enum Command {
    VALIDATE,
    FORMAT,
    CLASSIFY,
    ANALYZE,
    PARSE,
    GENERATE;

    public static Command from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Command must be provided");
        }
        for (Command command : values()) {
            if (command.name().equals(raw.trim().toUpperCase(Locale.ROOT))) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unknown command: " + raw);
    }

    public boolean readsDocuments() {
        return this != GENERATE;
    }
}
