package ai.sleepy.notation.lex;

import java.util.Optional;

/**
 * The three bracket varieties. The kind that opens a node determines its default meaning:
 * curly for declarations, paren for property groups, square for ordered lists.
 */
public enum BracketKind {
    CURLY('{', '}'),
    PAREN('(', ')'),
    SQUARE('[', ']');

    private final char open;
    private final char close;

    BracketKind(char open, char close) {
        this.open = open;
        this.close = close;
    }

    public char open() {
        return open;
    }

    public char close() {
        return close;
    }

    public static Optional<BracketKind> ofOpening(TokenKind kind) {
        return switch (kind) {
            case OPEN_CURLY -> Optional.of(CURLY);
            case OPEN_PAREN -> Optional.of(PAREN);
            case OPEN_SQUARE -> Optional.of(SQUARE);
            default -> Optional.empty();
        };
    }

    public static Optional<BracketKind> ofClosing(TokenKind kind) {
        return switch (kind) {
            case CLOSE_CURLY -> Optional.of(CURLY);
            case CLOSE_PAREN -> Optional.of(PAREN);
            case CLOSE_SQUARE -> Optional.of(SQUARE);
            default -> Optional.empty();
        };
    }

    public String displayName() {
        return switch (this) {
            case CURLY -> "Curly";
            case PAREN -> "Paren";
            case SQUARE -> "Square";
        };
    }
}
