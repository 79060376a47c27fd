package ai.sleepy.notation.ast;

import ai.sleepy.notation.lex.Position;
import java.util.Objects;
import java.util.Optional;

/**
 * A terminal value: a bare literal, a binding, or a {@code name:value} pair without style
 * variants or body.
 *
 * @param name name left of the colon, empty for a bare value
 * @param start start of the name, or of the value when unnamed
 * @param value value text with internal whitespace collapsed to single spaces
 * @param binding the value as a binding expression, when it is one
 * @param valueStart start of the value
 * @param end position just past the value
 */
public record Leaf(String name,
                   Position start,
                   String value,
                   Optional<BindingExpression> binding,
                   Position valueStart,
                   Position end) implements Element {

    public Leaf {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(value, "value");
        binding = binding == null ? Optional.empty() : binding;
        Objects.requireNonNull(valueStart, "valueStart");
        Objects.requireNonNull(end, "end");
    }

    public static Leaf bare(String value, Optional<BindingExpression> binding, Position start, Position end) {
        return new Leaf("", start, value, binding, start, end);
    }

    public Leaf withName(String newName, Position nameStart) {
        return new Leaf(newName, nameStart, value, binding, valueStart, end);
    }

    public boolean isBinding() {
        return binding.isPresent();
    }

    public int valueLength() {
        return end.offset() - valueStart.offset();
    }
}
