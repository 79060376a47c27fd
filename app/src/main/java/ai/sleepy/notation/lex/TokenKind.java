package ai.sleepy.notation.lex;

/**
 * Lexical categories produced by the {@link Tokenizer}.
 */
public enum TokenKind {
    IDENTIFIER,
    OPEN_CURLY,
    CLOSE_CURLY,
    OPEN_PAREN,
    CLOSE_PAREN,
    OPEN_SQUARE,
    CLOSE_SQUARE,
    COLON,
    COMMA,
    DOLLAR,
    DOT,
    LITERAL,
    WHITESPACE;

    public boolean isOpenBracket() {
        return this == OPEN_CURLY || this == OPEN_PAREN || this == OPEN_SQUARE;
    }

    public boolean isCloseBracket() {
        return this == CLOSE_CURLY || this == CLOSE_PAREN || this == CLOSE_SQUARE;
    }
}
