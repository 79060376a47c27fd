package ai.sleepy.notation.lex;

/**
 * Location of a character in a document. Line and column are 0-based. Offset is the
 * {@code char} index into the original text, so it counts UTF-16 code units rather than
 * encoded bytes; columns count the same way.
 */
public record Position(int line, int column, int offset) implements Comparable<Position> {

    public static final Position START = new Position(0, 0, 0);

    public Position {
        if (line < 0 || column < 0 || offset < 0) {
            throw new IllegalArgumentException("Position components must not be negative");
        }
    }

    @Override
    public int compareTo(Position other) {
        return Integer.compare(offset, other.offset);
    }

    /**
     * Compares by line and column, for callers that only know an editor location.
     */
    public int compareTo(int otherLine, int otherColumn) {
        if (line != otherLine) {
            return Integer.compare(line, otherLine);
        }
        return Integer.compare(column, otherColumn);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
