package ai.sleepy.notation.generate;

import ai.sleepy.notation.NotationEngine;
import ai.sleepy.notation.diagnostic.Diagnostic;
import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a generator, checks every candidate with the engine and falls back to the template
 * generator when the model cannot produce valid notation.
 */
public class GenerationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationService.class);
    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile("(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    private final GeneratorFactory generatorFactory;
    private final NotationEngine engine;
    private final int maxAttempts;
    private final int initialBackoffSeconds;
    private final int maxBackoffSeconds;
    private final double jitterFactor;

    public GenerationService(GeneratorFactory generatorFactory, NotationEngine engine, int maxAttempts) {
        this(generatorFactory, engine, maxAttempts, 2, 60, 0.3);
    }

    public GenerationService(GeneratorFactory generatorFactory, NotationEngine engine,
                             int maxAttempts, int initialBackoffSeconds, int maxBackoffSeconds, double jitterFactor) {
        this.generatorFactory = Objects.requireNonNull(generatorFactory, "generatorFactory");
        this.engine = Objects.requireNonNull(engine, "engine");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoffSeconds < 1) {
            throw new IllegalArgumentException("initialBackoffSeconds must be at least 1");
        }
        if (maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("maxBackoffSeconds must be at least initialBackoffSeconds");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffSeconds = initialBackoffSeconds;
        this.maxBackoffSeconds = maxBackoffSeconds;
        this.jitterFactor = jitterFactor;
    }

    public GenerationResult generate(GenerationRequest request, GenerationMode mode) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(mode, "mode");
        if (mode == GenerationMode.TEMPLATE) {
            return fromTemplate(request, 0);
        }
        NotationGenerator generator = generatorFactory.select(mode);
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            String candidate;
            try {
                candidate = generator.generate(request);
            } catch (GenerationException ex) {
                Optional<Duration> delay = calculateRetryDelay(ex, attempt - 1);
                if (delay.isEmpty() || attempt == maxAttempts) {
                    LOGGER.warn("Model generation failed after {} attempt(s): {}", attempt, ex.getMessage());
                    break;
                }
                LOGGER.warn("Generation rate limited (429/RESOURCE_EXHAUSTED); retrying in {} ms (attempt {}/{})",
                        delay.get().toMillis(), attempt, maxAttempts);
                if (!sleep(delay.get())) {
                    break;
                }
                continue;
            }
            List<Diagnostic> diagnostics = check(candidate);
            if (diagnostics.isEmpty()) {
                LOGGER.info("Model produced valid notation on attempt {}/{}", attempt, maxAttempts);
                return new GenerationResult(engine.format(candidate), GenerationResult.Source.MODEL, attempt, List.of());
            }
            LOGGER.warn("Generated notation has {} diagnostic(s) on attempt {}/{}; first: {} at {}",
                    diagnostics.size(), attempt, maxAttempts, diagnostics.get(0).message(), diagnostics.get(0).position());
        }
        LOGGER.warn("Falling back to template generation");
        return fromTemplate(request, attempt);
    }

    private GenerationResult fromTemplate(GenerationRequest request, int attempts) {
        String candidate = generatorFactory.fallback().generate(request);
        List<Diagnostic> diagnostics = check(candidate);
        String notation = diagnostics.isEmpty() ? engine.format(candidate) : candidate;
        return new GenerationResult(notation, GenerationResult.Source.TEMPLATE, attempts, diagnostics);
    }

    /**
     * Bracket check first, then the full parse for structural problems.
     */
    private List<Diagnostic> check(String candidate) {
        List<Diagnostic> diagnostics = engine.validate(candidate);
        if (!diagnostics.isEmpty()) {
            return diagnostics;
        }
        return engine.parse(candidate).diagnostics();
    }

    private boolean sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Generation retry interrupted");
            return false;
        }
    }

    private Optional<Duration> calculateRetryDelay(Throwable throwable, int attemptNumber) {
        if (!isRateLimitError(throwable)) {
            return Optional.empty();
        }
        Optional<Duration> providerDelay = extractProviderRetryAfter(throwable);
        if (providerDelay.isPresent()) {
            return providerDelay;
        }
        long baseDelaySeconds = initialBackoffSeconds * (1L << attemptNumber);
        long cappedDelaySeconds = Math.min(baseDelaySeconds, maxBackoffSeconds);
        double jitterMultiplier = 1.0 + (Math.random() * 2.0 - 1.0) * jitterFactor;
        long finalDelaySeconds = Math.max(1, (long) (cappedDelaySeconds * jitterMultiplier));
        return Optional.of(Duration.ofSeconds(finalDelaySeconds));
    }

    private boolean isRateLimitError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private Optional<Duration> extractProviderRetryAfter(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            String message = cause.getMessage();
            if (message != null) {
                Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
                if (matcher.find()) {
                    long millis = Math.max(0, (long) (Double.parseDouble(matcher.group(1)) * 1000));
                    return Optional.of(Duration.ofMillis(millis));
                }
            }
            cause = cause.getCause();
        }
        return Optional.empty();
    }
}
