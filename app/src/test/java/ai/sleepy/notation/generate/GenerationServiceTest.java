package ai.sleepy.notation.generate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.sleepy.notation.NotationEngine;
import dev.langchain4j.exception.RateLimitException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class GenerationServiceTest {

    private static final GenerationRequest REQUEST = GenerationRequest.forPrompt("a login button");

    private final NotationEngine engine = new NotationEngine();

    @Test
    void acceptsValidModelOutputAndFormatsIt() {
        NotationGenerator model = request -> "button$login:(content:\"Log in\")";
        GenerationService service = new GenerationService(factory(model), engine, 3);

        GenerationResult result = service.generate(REQUEST, GenerationMode.PRODUCTION);

        assertThat(result.source()).isEqualTo(GenerationResult.Source.MODEL);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.isValid()).isTrue();
        assertThat(result.notation()).isEqualTo("button$login:(\n  content: \"Log in\"\n)\n");
    }

    @Test
    void fallsBackToTemplateAfterInvalidAttempts() {
        AtomicInteger calls = new AtomicInteger();
        NotationGenerator model = request -> {
            calls.incrementAndGet();
            return "card:(title:x]";
        };
        GenerationService service = new GenerationService(factory(model), engine, 3);

        GenerationResult result = service.generate(REQUEST, GenerationMode.PRODUCTION);

        assertThat(calls.get()).isEqualTo(3);
        assertThat(result.source()).isEqualTo(GenerationResult.Source.TEMPLATE);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.isValid()).isTrue();
        assertThat(result.notation()).startsWith("card$generated:(");
    }

    @Test
    void doesNotRetryOnNonRateLimitErrors() {
        AtomicInteger calls = new AtomicInteger();
        NotationGenerator model = request -> {
            calls.incrementAndGet();
            throw new GenerationException("connection refused", null);
        };
        GenerationService service = new GenerationService(factory(model), engine, 3);

        GenerationResult result = service.generate(REQUEST, GenerationMode.PRODUCTION);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(result.source()).isEqualTo(GenerationResult.Source.TEMPLATE);
        assertThat(result.attempts()).isEqualTo(1);
    }

    @Test
    void retriesRateLimitedCallsUsingProviderDelay() {
        AtomicInteger calls = new AtomicInteger();
        NotationGenerator model = request -> {
            if (calls.incrementAndGet() == 1) {
                throw new GenerationException("429 Too Many Requests, retry in 0s", new RateLimitException("429"));
            }
            return "button:\"ok\"";
        };
        GenerationService service = new GenerationService(factory(model), engine, 3, 10, 60, 0.0);

        long startTime = System.currentTimeMillis();
        GenerationResult result = service.generate(REQUEST, GenerationMode.PRODUCTION);
        long duration = System.currentTimeMillis() - startTime;

        assertThat(result.source()).isEqualTo(GenerationResult.Source.MODEL);
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(duration).isLessThan(5000);
    }

    @Test
    void templateModeSkipsTheModel() {
        NotationGenerator model = request -> {
            throw new AssertionError("model must not be called");
        };
        GenerationService service = new GenerationService(factory(model), engine, 3);

        GenerationResult result = service.generate(REQUEST, GenerationMode.TEMPLATE);

        assertThat(result.source()).isEqualTo(GenerationResult.Source.TEMPLATE);
        assertThat(result.attempts()).isZero();
    }

    @Test
    void validatesRetryConfiguration() {
        GeneratorFactory factory = factory(request -> "a:b");

        assertThatThrownBy(() -> new GenerationService(factory, engine, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxAttempts");
        assertThatThrownBy(() -> new GenerationService(factory, engine, 3, 10, 5, 0.3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxBackoffSeconds");
        assertThatThrownBy(() -> new GenerationService(factory, engine, 3, 1, 60, 1.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jitterFactor");
    }

    private static GeneratorFactory factory(NotationGenerator model) {
        return new GeneratorFactory(model, new TemplateNotationGenerator());
    }
}
