package ai.sleepy.notation.config;

import ai.sleepy.notation.EngineSettings;
import java.util.Objects;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(LogFormat logFormat,
                     boolean verbose,
                     EngineSettings engineSettings,
                     GeneratorConfig generatorConfig,
                     Secrets secrets) {

    public Config {
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(engineSettings, "engineSettings");
        Objects.requireNonNull(generatorConfig, "generatorConfig");
        secrets = secrets == null ? Secrets.none() : secrets;
    }
}
