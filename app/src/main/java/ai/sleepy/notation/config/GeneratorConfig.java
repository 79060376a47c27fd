package ai.sleepy.notation.config;

import ai.sleepy.notation.generate.GenerationMode;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds runtime settings for notation generation.
 */
public record GeneratorConfig(LlmProvider provider,
                              String modelName,
                              Optional<String> baseUrl,
                              GenerationMode mode,
                              int maxAttempts) {

    public GeneratorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName must not be blank");
        }
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        mode = Objects.requireNonNull(mode, "mode");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }
}
