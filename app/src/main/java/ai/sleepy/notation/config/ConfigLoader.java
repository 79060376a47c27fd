package ai.sleepy.notation.config;

import ai.sleepy.notation.EngineSettings;
import ai.sleepy.notation.analyze.ComplexityThresholds;
import ai.sleepy.notation.cli.CliArguments;
import ai.sleepy.notation.generate.GenerationMode;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_LOG_FORMAT = "SLEEPY_LOG_FORMAT";
    static final String ENV_MAX_DEPTH = "SLEEPY_MAX_DEPTH";
    static final String ENV_ENTERPRISE_ENDPOINTS = "SLEEPY_ENTERPRISE_ENDPOINTS";
    static final String ENV_ENTERPRISE_TABLES = "SLEEPY_ENTERPRISE_TABLES";
    static final String ENV_COMPLEX_ENDPOINTS = "SLEEPY_COMPLEX_ENDPOINTS";
    static final String ENV_COMPLEX_TABLES = "SLEEPY_COMPLEX_TABLES";
    static final String ENV_MODERATE_ENDPOINTS = "SLEEPY_MODERATE_ENDPOINTS";
    static final String ENV_MODERATE_TABLES = "SLEEPY_MODERATE_TABLES";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_GENERATION_MODE = "GENERATION_MODE";
    static final String ENV_GENERATION_MAX_ATTEMPTS = "GENERATION_MAX_ATTEMPTS";

    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final int DEFAULT_GENERATION_MAX_ATTEMPTS = 3;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        LogFormat logFormat = resolveLogFormat(arguments);

        int maxDepth = arguments.maxDepth() != null
                ? EngineSettings.requireSupportedDepth(arguments.maxDepth(), "--max-depth")
                : readInteger(ENV_MAX_DEPTH).map(value -> EngineSettings.requireSupportedDepth(value, ENV_MAX_DEPTH))
                        .orElse(EngineSettings.DEFAULT_MAX_DEPTH);
        ComplexityThresholds thresholds = new ComplexityThresholds(
                readInteger(ENV_ENTERPRISE_ENDPOINTS).orElse(ComplexityThresholds.DEFAULT_ENTERPRISE_ENDPOINTS),
                readInteger(ENV_ENTERPRISE_TABLES).orElse(ComplexityThresholds.DEFAULT_ENTERPRISE_TABLES),
                readInteger(ENV_COMPLEX_ENDPOINTS).orElse(ComplexityThresholds.DEFAULT_COMPLEX_ENDPOINTS),
                readInteger(ENV_COMPLEX_TABLES).orElse(ComplexityThresholds.DEFAULT_COMPLEX_TABLES),
                readInteger(ENV_MODERATE_ENDPOINTS).orElse(ComplexityThresholds.DEFAULT_MODERATE_ENDPOINTS),
                readInteger(ENV_MODERATE_TABLES).orElse(ComplexityThresholds.DEFAULT_MODERATE_TABLES));

        LlmProvider provider = readString(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);
        String modelName = readString(ENV_LLM_MODEL).orElse(defaultModelFor(provider));
        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(readString(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
        }
        GenerationMode generationMode = arguments.generationMode() != null
                ? arguments.generationMode()
                : readString(ENV_GENERATION_MODE).map(GenerationMode::from).orElse(GenerationMode.PRODUCTION);
        int maxAttempts = readInteger(ENV_GENERATION_MAX_ATTEMPTS)
                .map(value -> requirePositive(value, ENV_GENERATION_MAX_ATTEMPTS))
                .orElse(DEFAULT_GENERATION_MAX_ATTEMPTS);

        Secrets secrets = new Secrets(readString(ENV_GEMINI_API_KEY));
        GeneratorConfig generatorConfig = new GeneratorConfig(provider, modelName, baseUrl, generationMode, maxAttempts);
        return new Config(logFormat, arguments.verbose(), new EngineSettings(maxDepth, thresholds),
                generatorConfig, secrets);
    }

    private String defaultModelFor(LlmProvider provider) {
        return switch (provider) {
            case GEMINI -> "models/gemini-1.5-pro-latest";
            case OLLAMA -> "llama3.1:8b";
        };
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return readString(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<String> readString(String key) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim);
    }

    private Optional<Integer> readInteger(String key) {
        return readString(key).map(raw -> parseNonNegativeInteger(raw, key));
    }

    private static int parseNonNegativeInteger(String raw, String key) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(key + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static int requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1");
        }
        return value;
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
