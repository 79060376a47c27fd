package ai.sleepy.notation.ast;

import ai.sleepy.notation.Vocabulary;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A dotted reference to external data such as {@code api.user.name}. The first segment is
 * always one of {@link Vocabulary#BINDING_ROOTS} and there are at least two segments.
 */
public record BindingExpression(List<String> segments) {

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");

    public BindingExpression {
        segments = List.copyOf(Objects.requireNonNull(segments, "segments"));
        if (segments.size() < 2 || !Vocabulary.isBindingRoot(segments.get(0))) {
            throw new IllegalArgumentException("Not a binding expression: " + String.join(".", segments));
        }
    }

    public static Optional<BindingExpression> parse(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        List<String> parts = List.of(text.split("\\.", -1));
        if (parts.size() < 2 || !Vocabulary.isBindingRoot(parts.get(0))) {
            return Optional.empty();
        }
        for (String part : parts) {
            if (!SEGMENT.matcher(part).matches()) {
                return Optional.empty();
            }
        }
        return Optional.of(new BindingExpression(parts));
    }

    public String root() {
        return segments.get(0);
    }

    public String path() {
        return String.join(".", segments);
    }

    @Override
    public String toString() {
        return path();
    }
}
