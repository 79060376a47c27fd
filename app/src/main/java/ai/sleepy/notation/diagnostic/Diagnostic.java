package ai.sleepy.notation.diagnostic;

import ai.sleepy.notation.lex.BracketKind;
import ai.sleepy.notation.lex.Position;
import java.util.Objects;
import java.util.Optional;

/**
 * A located structural error. Bracket mismatches carry the expected and found kinds where
 * they are known.
 */
public record Diagnostic(Position position,
                         Severity severity,
                         DiagnosticKind kind,
                         String message,
                         Optional<BracketKind> expectedKind,
                         Optional<BracketKind> foundKind) {

    public Diagnostic {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        expectedKind = expectedKind == null ? Optional.empty() : expectedKind;
        foundKind = foundKind == null ? Optional.empty() : foundKind;
    }

    public static Diagnostic error(Position position, DiagnosticKind kind, String message) {
        return new Diagnostic(position, Severity.ERROR, kind, message, Optional.empty(), Optional.empty());
    }

    public static Diagnostic bracketMismatch(Position position, String message,
                                             BracketKind expected, BracketKind found) {
        return new Diagnostic(position, Severity.ERROR, DiagnosticKind.BRACKET_MISMATCH_ERROR, message,
                Optional.ofNullable(expected), Optional.ofNullable(found));
    }

    public int line() {
        return position.line();
    }

    public int column() {
        return position.column();
    }

    public boolean isBracketMismatch() {
        return kind == DiagnosticKind.BRACKET_MISMATCH_ERROR;
    }
}
