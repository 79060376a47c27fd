package ai.sleepy.notation.diagnostic;

import ai.sleepy.notation.lex.BracketKind;
import ai.sleepy.notation.lex.Token;
import java.util.List;
import java.util.Optional;

/**
 * Decides how a closing bracket relates to the stack of open frames. The parser and the
 * validator both route every closing bracket through {@link #decide} so they report the same
 * mismatches at the same positions.
 */
public final class BracketRecovery {

    /**
     * Outcome for one closing bracket.
     */
    public enum Action {
        /** Closes the innermost frame. */
        MATCH,
        /** Closes an enclosing frame; every frame above it is closed synthetically. */
        UNWIND,
        /** Wrong kind, but stands in for the innermost frame's close. */
        SUBSTITUTE,
        /** Stray bracket; skipped without touching the stack. */
        IGNORE
    }

    /**
     * @param action what to do with the bracket
     * @param targetIndex index into the frame stack of the frame that ends up closed, or -1
     */
    public record Decision(Action action, int targetIndex) {

        public boolean reportsMismatch() {
            return action != Action.MATCH;
        }
    }

    private BracketRecovery() {
    }

    /**
     * @param frames open frames, outermost first
     * @param found the kind of the closing bracket at {@code tokens.get(index)}
     */
    public static Decision decide(List<BracketKind> frames, BracketKind found, List<Token> tokens, int index) {
        if (frames.isEmpty()) {
            return new Decision(Action.IGNORE, -1);
        }
        int top = frames.size() - 1;
        BracketKind current = frames.get(top);
        if (current == found) {
            return new Decision(Action.MATCH, top);
        }
        Optional<BracketKind> nextClose = nextCloseAtSameLevel(tokens, index + 1);
        if (nextClose.isPresent() && nextClose.get() == current) {
            return new Decision(Action.IGNORE, -1);
        }
        for (int i = top - 1; i >= 0; i--) {
            if (frames.get(i) == found) {
                return new Decision(Action.UNWIND, i);
            }
        }
        return new Decision(Action.SUBSTITUTE, top);
    }

    /**
     * Builds the diagnostic for a non-matching decision.
     */
    public static Diagnostic describe(Decision decision, List<BracketKind> frames, Token token, BracketKind found) {
        if (frames.isEmpty()) {
            return Diagnostic.bracketMismatch(token.position(),
                    "Unmatched closing '" + found.close() + "' with no open bracket", null, found);
        }
        BracketKind expected = frames.get(frames.size() - 1);
        String message = switch (decision.action()) {
            case UNWIND -> "Expected '" + expected.close() + "' but found '" + found.close()
                    + "'; closing " + (frames.size() - decision.targetIndex() - 1) + " unclosed bracket(s)";
            case SUBSTITUTE -> "Expected '" + expected.close() + "' but found '" + found.close() + "'";
            case IGNORE -> "Unexpected '" + found.close() + "' inside '" + expected.open() + "'";
            case MATCH -> throw new IllegalArgumentException("A matching bracket has no diagnostic");
        };
        return Diagnostic.bracketMismatch(token.position(), message, expected, found);
    }

    public static Diagnostic unclosed(Token openToken, BracketKind kind) {
        return Diagnostic.bracketMismatch(openToken.position(),
                "Unmatched opening '" + kind.open() + "'", kind, null);
    }

    private static Optional<BracketKind> nextCloseAtSameLevel(List<Token> tokens, int from) {
        int depth = 0;
        for (int i = from; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.kind().isOpenBracket()) {
                depth++;
            } else if (token.kind().isCloseBracket()) {
                if (depth == 0) {
                    return BracketKind.ofClosing(token.kind());
                }
                depth--;
            }
        }
        return Optional.empty();
    }
}
