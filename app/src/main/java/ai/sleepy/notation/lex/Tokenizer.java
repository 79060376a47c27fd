package ai.sleepy.notation.lex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass scanner turning notation text into an ordered token list.
 *
 * <p>Scanning never fails. Characters outside the notation alphabet become one-character
 * {@link TokenKind#LITERAL} tokens so later stages can point at them, and a quoted string
 * without its closing quote runs to the end of its line.
 */
public final class Tokenizer {

    private Tokenizer() {
    }

    public static List<Token> tokenize(String text) {
        Objects.requireNonNull(text, "text");
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int line = 0;
        int column = 0;
        int len = text.length();

        while (i < len) {
            char c = text.charAt(i);
            Position start = new Position(line, column, i);
            int end;
            TokenKind kind;

            if (Character.isWhitespace(c)) {
                end = i;
                while (end < len && Character.isWhitespace(text.charAt(end))) {
                    end++;
                }
                kind = TokenKind.WHITESPACE;
            } else if (isIdentifierChar(c)) {
                end = i;
                while (end < len && isIdentifierChar(text.charAt(end))) {
                    end++;
                }
                kind = TokenKind.IDENTIFIER;
            } else if (c == '"' || c == '\'') {
                end = scanString(text, i, c);
                kind = TokenKind.LITERAL;
            } else {
                end = i + 1;
                kind = punctuation(c);
            }

            String lexeme = text.substring(i, end);
            tokens.add(new Token(kind, lexeme, start));

            for (int k = i; k < end; k++) {
                if (text.charAt(k) == '\n') {
                    line++;
                    column = 0;
                } else {
                    column++;
                }
            }
            i = end;
        }
        return tokens;
    }

    public static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    private static int scanString(String text, int start, char quote) {
        int j = start + 1;
        while (j < text.length()) {
            char c = text.charAt(j);
            if (c == '\\' && j + 1 < text.length() && text.charAt(j + 1) != '\n') {
                j += 2;
                continue;
            }
            if (c == quote) {
                return j + 1;
            }
            if (c == '\n') {
                // unterminated: stop before the line break
                return j;
            }
            j++;
        }
        return j;
    }

    private static TokenKind punctuation(char c) {
        return switch (c) {
            case '{' -> TokenKind.OPEN_CURLY;
            case '}' -> TokenKind.CLOSE_CURLY;
            case '(' -> TokenKind.OPEN_PAREN;
            case ')' -> TokenKind.CLOSE_PAREN;
            case '[' -> TokenKind.OPEN_SQUARE;
            case ']' -> TokenKind.CLOSE_SQUARE;
            case ':' -> TokenKind.COLON;
            case ',' -> TokenKind.COMMA;
            case '$' -> TokenKind.DOLLAR;
            case '.' -> TokenKind.DOT;
            default -> TokenKind.LITERAL;
        };
    }
}
