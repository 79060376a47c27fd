package ai.sleepy.notation.lex;

import java.util.Objects;

/**
 * A lexeme with its kind and the position of its first character.
 */
public record Token(TokenKind kind, String lexeme, Position position) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(lexeme, "lexeme");
        Objects.requireNonNull(position, "position");
        if (lexeme.isEmpty()) {
            throw new IllegalArgumentException("lexeme must not be empty");
        }
    }

    public int length() {
        return lexeme.length();
    }

    public int endOffset() {
        return position.offset() + lexeme.length();
    }

    /**
     * Position just past the last character, following any line breaks inside the lexeme.
     */
    public Position endPosition() {
        int lastBreak = lexeme.lastIndexOf('\n');
        if (lastBreak < 0) {
            return new Position(position.line(), position.column() + lexeme.length(), endOffset());
        }
        int breaks = (int) lexeme.chars().filter(c -> c == '\n').count();
        return new Position(position.line() + breaks, lexeme.length() - lastBreak - 1, endOffset());
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean isWhitespace() {
        return kind == TokenKind.WHITESPACE;
    }

    public boolean containsLineBreak() {
        return kind == TokenKind.WHITESPACE && lexeme.indexOf('\n') >= 0;
    }

    /**
     * Returns {@code true} for a quoted literal whose closing quote is missing.
     */
    public boolean isUnterminatedString() {
        if (kind != TokenKind.LITERAL || lexeme.isEmpty()) {
            return false;
        }
        char quote = lexeme.charAt(0);
        if (quote != '"' && quote != '\'') {
            return false;
        }
        if (lexeme.length() < 2 || lexeme.charAt(lexeme.length() - 1) != quote) {
            return true;
        }
        int backslashes = 0;
        for (int i = lexeme.length() - 2; i > 0 && lexeme.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }
}
