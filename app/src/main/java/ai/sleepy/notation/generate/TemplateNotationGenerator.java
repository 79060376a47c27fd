package ai.sleepy.notation.generate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rule-based generator used when no model is configured or the model fails. Its output is
 * always valid notation.
 */
public class TemplateNotationGenerator implements NotationGenerator {

    private static final Pattern GENERATED_ID = Pattern.compile("^[a-f0-9-]+$");
    private static final List<String> SEMANTIC_HINTS = List.of(
            "button", "btn", "card", "nav", "header", "footer", "menu", "product", "user", "search");
    private static final Map<String, String> GRAY_SCALE = Map.of(
            "50", "f9fafb", "100", "f3f4f6", "200", "e5e7eb", "300", "d1d5db", "400", "9ca3af",
            "500", "6b7280", "600", "4b5563", "700", "374151", "800", "1f2937", "900", "111827");
    private static final int MAX_CONTENT_LENGTH = 100;

    @Override
    public String generate(GenerationRequest request) {
        if (request.element().isEmpty()) {
            return "card$generated: (\n  content: " + quote(request.prompt().orElse("")) + "\n)";
        }
        ElementDescription element = request.element().get();
        String name = semanticName(element);
        List<String> body = new ArrayList<>(styling(element.classes()));
        content(element).ifPresent(body::add);
        if (body.isEmpty()) {
            return name + ": ()";
        }
        return name + ": (\n  " + String.join(",\n  ", body) + "\n)";
    }

    String semanticName(ElementDescription element) {
        String tag = slug(element.tag());
        if (tag.isEmpty()) {
            tag = "div";
        }
        Optional<String> id = element.id().filter(value -> !GENERATED_ID.matcher(value).matches());
        if (id.isPresent() && !slug(id.get()).isEmpty()) {
            return tag + "$" + slug(id.get());
        }
        for (String cssClass : element.classes()) {
            String lower = cssClass.toLowerCase(Locale.ROOT);
            if (SEMANTIC_HINTS.stream().anyMatch(lower::contains)) {
                String semantic = slug(lower.replaceFirst("btn|button", "button"));
                if (!semantic.isEmpty()) {
                    return tag + "$" + semantic;
                }
            }
        }
        if ((tag.equals("button") || tag.equals("a")) && element.text().isPresent()) {
            String words = element.text().get().toLowerCase(Locale.ROOT)
                    .replaceAll("[^a-z0-9\\s]", "")
                    .strip()
                    .replaceAll("\\s+", "-");
            String truncated = words.substring(0, Math.min(20, words.length()));
            String semantic = slug(truncated);
            if (!semantic.isEmpty()) {
                return tag + "$" + semantic;
            }
        }
        if (element.classes().stream().anyMatch(value -> value.contains("container") || value.contains("wrapper"))) {
            return tag + "$container";
        }
        return tag;
    }

    /**
     * Converts utility classes into styling properties.
     */
    List<String> styling(List<String> classes) {
        List<String> styling = new ArrayList<>();
        for (String cssClass : classes) {
            if (cssClass.startsWith("bg-")) {
                String color = cssClass.substring(3).replaceFirst("-", "");
                styling.add("backgroundColor: " + (color.chars().allMatch(Character::isDigit)
                        ? "#" + GRAY_SCALE.getOrDefault(color, "6b7280")
                        : slug(color)));
            } else if (cssClass.startsWith("text-")) {
                styling.add("color: " + slug(cssClass.substring(5)));
            } else if (cssClass.startsWith("p-")) {
                styling.add("padding: " + slug(cssClass.substring(2)));
            } else if (cssClass.startsWith("m-")) {
                styling.add("margin: " + slug(cssClass.substring(2)));
            } else if (cssClass.equals("rounded")) {
                styling.add("borderRadius: md");
            } else if (cssClass.startsWith("rounded-")) {
                styling.add("borderRadius: " + slug(cssClass.substring(8)));
            } else if (cssClass.equals("flex")) {
                styling.add("display: flex");
            } else if (cssClass.equals("flex-col")) {
                styling.add("flexDirection: column");
            } else if (cssClass.contains("shadow")) {
                styling.add("boxShadow: md");
            }
        }
        styling.removeIf(entry -> entry.endsWith(": "));
        return styling;
    }

    private static Optional<String> content(ElementDescription element) {
        Optional<String> text = element.text().filter(value -> value.length() < MAX_CONTENT_LENGTH);
        if (text.isPresent()) {
            return Optional.of("content: " + quote(text.get()));
        }
        Optional<String> href = element.attribute("href");
        if (href.isPresent()) {
            return Optional.of("href: " + quote(href.get()));
        }
        return element.attribute("src").map(src -> "src: " + quote(src));
    }

    /**
     * Keeps identifier characters only; other runs become a single hyphen.
     */
    static String slug(String raw) {
        String replaced = raw.replaceAll("[^A-Za-z0-9_-]+", "-");
        return replaced.replaceAll("^-+|-+$", "");
    }

    static String quote(String raw) {
        String flattened = raw.replaceAll("\\s+", " ").strip();
        return "\"" + flattened.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
