package ai.sleepy.notation.ast;

import ai.sleepy.notation.lex.Position;
import java.util.Objects;

/**
 * A {@code $name} presentation variant attached to a node.
 *
 * @param position location of the {@code $}
 */
public record StyleVariant(String name, Position position) {

    public StyleVariant {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(position, "position");
    }

    /** Source length including the {@code $}. */
    public int length() {
        return name.length() + 1;
    }
}
