package ai.sleepy.notation.generate;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Generator backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelNotationGenerator implements NotationGenerator {

    private static final String FENCE = "```";

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    public ChatModelNotationGenerator(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public String generate(GenerationRequest request) {
        Objects.requireNonNull(request, "request");
        String response;
        try {
            response = model.chat(buildPrompt(request));
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new GenerationException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new GenerationException("LangChain generation failed", ex);
        }
        if (response == null || response.isBlank()) {
            throw new GenerationException("%s model '%s' returned an empty response".formatted(providerName, modelName), null);
        }
        String cleaned = extractNotation(response);
        if (cleaned.isBlank()) {
            throw new GenerationException("No notation found in the model response", null);
        }
        return cleaned;
    }

    String buildPrompt(GenerationRequest request) {
        StringBuilder subject = new StringBuilder();
        request.element().ifPresent(element -> {
            subject.append("ELEMENT:\n");
            subject.append("- tag: ").append(element.tag()).append('\n');
            element.id().ifPresent(id -> subject.append("- id: ").append(id).append('\n'));
            if (!element.classes().isEmpty()) {
                subject.append("- classes: ").append(String.join(" ", element.classes())).append('\n');
            }
            element.text().ifPresent(text -> subject.append("- text: ").append(text).append('\n'));
            Map<String, String> sorted = new TreeMap<>(element.attributes());
            sorted.forEach((key, value) -> subject.append("- attribute ").append(key).append(": ").append(value).append('\n'));
        });
        request.prompt().ifPresent(prompt -> subject.append("REQUEST:\n").append(prompt).append('\n'));
        return """
Generate Sleepy notation for the subject below.
Format:
- Components use name$variant: (content), for example card$product: (...)
- Layouts use row: [elements] and column: [elements]
- Styling uses plain properties, for example padding: 4, backgroundColor: #c96442
- Data binding uses dotted paths rooted at api, item, db or response, for example api.product.name
- Conditionals and loops use if: condition: [content], unless: condition: [content] and forEach: api.items: [template]
- Quote any literal that contains a colon, a comma or a bracket

Example:
card$product: (
  column: [
    img$product-image: api.product.image,
    h3: api.product.name,
    button$add-cart: "Add to Cart"
  ]
)

""" + subject + """

Return only the notation for one component. Do not wrap it in code fences and do not add commentary.""";
    }

    /**
     * Drops code fences and the prose a model tends to put around its answer.
     */
    static String extractNotation(String response) {
        List<String> lines = new ArrayList<>();
        for (String line : response.strip().split("\\R", -1)) {
            if (!line.strip().startsWith(FENCE)) {
                lines.add(line.stripTrailing());
            }
        }
        int start = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (looksLikeNotation(lines.get(i))) {
                start = i;
                break;
            }
        }
        if (start < 0) {
            return String.join("\n", lines).strip();
        }
        int end = -1;
        for (int i = lines.size() - 1; i >= start; i--) {
            String line = lines.get(i).strip();
            if (!line.isEmpty() && !line.startsWith("//") && !line.startsWith("Note:")) {
                end = i;
                break;
            }
        }
        return String.join("\n", lines.subList(start, end + 1)).strip();
    }

    private static boolean looksLikeNotation(String line) {
        String stripped = line.strip();
        if (stripped.startsWith("{")) {
            return true;
        }
        int colon = stripped.indexOf(':');
        if (colon <= 0) {
            return false;
        }
        String head = stripped.substring(0, colon).strip();
        return !head.isEmpty() && head.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '$' || c == '-'
                || c == '_' || c == '.');
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
