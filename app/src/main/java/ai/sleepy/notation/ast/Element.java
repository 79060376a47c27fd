package ai.sleepy.notation.ast;

import ai.sleepy.notation.lex.Position;

/**
 * A unit of the parse tree: either a {@link Node} or a {@link Leaf}.
 */
public interface Element {

    /**
     * The identifier written left of the colon or bracket, or an empty string for anonymous
     * groups and bare values.
     */
    String name();

    Position start();

    /** Position just past the element's last character. */
    Position end();

    default boolean hasName() {
        return !name().isEmpty();
    }

    /**
     * Returns {@code true} when the location lies in {@code [start, end)}.
     */
    default boolean contains(int line, int column) {
        return start().compareTo(line, column) <= 0 && end().compareTo(line, column) > 0;
    }
}
