package ai.sleepy.notation.generate;

/**
 * Mode controlling which generator produces notation.
 */
public enum GenerationMode {
    PRODUCTION,
    TEMPLATE;

    public static GenerationMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRODUCTION;
        }
        for (GenerationMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported generation mode: " + raw);
    }
}
