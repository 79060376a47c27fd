package ai.sleepy.notation.generate;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A captured page element: tag, id, CSS classes, visible text and attributes.
 */
public record ElementDescription(String tag,
                                 Optional<String> id,
                                 List<String> classes,
                                 Optional<String> text,
                                 Map<String, String> attributes) {

    public ElementDescription {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("tag must not be blank");
        }
        tag = tag.trim().toLowerCase(Locale.ROOT);
        id = id == null ? Optional.empty() : id.filter(value -> !value.isBlank());
        classes = classes == null ? List.of() : classes.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
        text = text == null ? Optional.empty() : text.map(String::strip).filter(value -> !value.isEmpty());
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name)).filter(value -> !value.isBlank());
    }
}
