package ai.sleepy.notation.classify;

import ai.sleepy.notation.lex.Position;
import java.util.Objects;

/**
 * A classified stretch of source text on a single line.
 *
 * @param nestingDepth number of nodes enclosing the span; 0 at the document root
 */
public record SemanticSpan(Position start, int length, SpanCategory category, int nestingDepth) {

    public SemanticSpan {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(category, "category");
        if (length < 1) {
            throw new IllegalArgumentException("length must be positive");
        }
        if (nestingDepth < 0) {
            throw new IllegalArgumentException("nestingDepth must not be negative");
        }
    }

    public int line() {
        return start.line();
    }

    public int column() {
        return start.column();
    }

    public int endOffset() {
        return start.offset() + length;
    }
}
