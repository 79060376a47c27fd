package ai.sleepy.notation.generate;

import java.util.Objects;
import java.util.Optional;

/**
 * What to generate notation for: a captured element, a free-form request, or both.
 */
public record GenerationRequest(Optional<ElementDescription> element, Optional<String> prompt) {

    public GenerationRequest {
        element = element == null ? Optional.empty() : element;
        prompt = prompt == null ? Optional.empty() : prompt.map(String::strip).filter(value -> !value.isEmpty());
        if (element.isEmpty() && prompt.isEmpty()) {
            throw new IllegalArgumentException("Either an element description or a prompt is required");
        }
    }

    public static GenerationRequest forElement(ElementDescription element) {
        return new GenerationRequest(Optional.of(Objects.requireNonNull(element, "element")), Optional.empty());
    }

    public static GenerationRequest forPrompt(String prompt) {
        return new GenerationRequest(Optional.empty(), Optional.ofNullable(prompt));
    }
}
