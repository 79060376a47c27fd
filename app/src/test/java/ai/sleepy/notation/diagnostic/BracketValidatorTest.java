package ai.sleepy.notation.diagnostic;

import static org.assertj.core.api.Assertions.assertThat;

import ai.sleepy.notation.lex.BracketKind;
import ai.sleepy.notation.lex.Position;
import ai.sleepy.notation.lex.Tokenizer;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BracketValidatorTest {

    private final BracketValidator validator = new BracketValidator();

    private List<Diagnostic> validate(String text) {
        return validator.validate(Tokenizer.tokenize(text));
    }

    @Test
    void balancedInputHasNoDiagnostics() {
        assertThat(validate("{a:(b,c)}")).isEmpty();
        assertThat(validate("frontend:(column:[img:api.user.avatar, h3:\"(not a bracket]\"])")).isEmpty();
    }

    @Test
    @DisplayName("A stray closing bracket inside a group yields exactly one diagnostic at the bracket")
    void strayCloseInsideGroup() {
        List<Diagnostic> diagnostics = validate("card:(title:x])");

        assertThat(diagnostics).hasSize(1);
        Diagnostic diagnostic = diagnostics.get(0);
        assertThat(diagnostic.position()).isEqualTo(new Position(0, 13, 13));
        assertThat(diagnostic.foundKind()).contains(BracketKind.SQUARE);
        assertThat(diagnostic.expectedKind()).contains(BracketKind.PAREN);
    }

    @Test
    void strayCloseAtTopLevel() {
        List<Diagnostic> diagnostics = validate("a:(b)]");

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).column()).isEqualTo(5);
        assertThat(diagnostics.get(0).expectedKind()).isEmpty();
        assertThat(diagnostics.get(0).message()).contains("no open bracket");
    }

    @Test
    @DisplayName("A wrong-kind close reports one diagnostic with both kinds")
    void wrongKindClose() {
        List<Diagnostic> diagnostics = validate("{a:(b,c]");

        assertThat(diagnostics).hasSize(1);
        Diagnostic diagnostic = diagnostics.get(0);
        assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.BRACKET_MISMATCH_ERROR);
        assertThat(diagnostic.expectedKind()).contains(BracketKind.PAREN);
        assertThat(diagnostic.foundKind()).contains(BracketKind.SQUARE);
        assertThat(diagnostic.position()).isEqualTo(new Position(0, 7, 7));
        assertThat(diagnostic.severity()).isEqualTo(Severity.ERROR);
    }

    @Test
    void unclosedFramesAreReportedInnermostFirst() {
        List<Diagnostic> diagnostics = validate("{a:(b");

        assertThat(diagnostics).hasSize(2);
        assertThat(diagnostics.get(0).column()).isEqualTo(3);
        assertThat(diagnostics.get(0).expectedKind()).contains(BracketKind.PAREN);
        assertThat(diagnostics.get(1).column()).isZero();
        assertThat(diagnostics.get(1).expectedKind()).contains(BracketKind.CURLY);
    }

    @Test
    void closeMatchingAnEnclosingFrameUnwindsWithOneDiagnostic() {
        List<Diagnostic> diagnostics = validate("{a:(b}");

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).expectedKind()).contains(BracketKind.PAREN);
        assertThat(diagnostics.get(0).foundKind()).contains(BracketKind.CURLY);
        assertThat(diagnostics.get(0).message()).contains("closing 1 unclosed bracket(s)");
    }

    @Test
    @DisplayName("A stray close does not hide an enclosing bracket left open")
    void strayCloseKeepsOuterUnclosedFrame() {
        List<Diagnostic> diagnostics = validate("[a:(b])");

        assertThat(diagnostics).hasSize(2);
        assertThat(diagnostics.get(0).message()).isEqualTo("Unexpected ']' inside '('");
        assertThat(diagnostics.get(0).column()).isEqualTo(5);
        assertThat(diagnostics.get(1).message()).isEqualTo("Unmatched opening '['");
        assertThat(diagnostics.get(1).column()).isZero();
    }

    @Test
    void unwindingDoesNotHideFramesBelowTheTarget() {
        List<Diagnostic> diagnostics = validate("[{a:(b}");

        assertThat(diagnostics).hasSize(2);
        assertThat(diagnostics.get(0).message()).isEqualTo("Expected ')' but found '}'; closing 1 unclosed bracket(s)");
        assertThat(diagnostics.get(1).message()).isEqualTo("Unmatched opening '['");
        assertThat(diagnostics.get(1).column()).isZero();
        assertThat(validate("(x:[y)]"))
                .extracting(Diagnostic::message)
                .containsExactly("Unexpected ')' inside '['", "Unmatched opening '('");
    }

    @Test
    void reportsEveryIndependentMismatch() {
        List<Diagnostic> diagnostics = validate("a:(b], c:[d)");

        assertThat(diagnostics)
                .extracting(Diagnostic::column)
                .containsExactly(4, 11);
    }

    @Test
    void emptyInputIsValid() {
        assertThat(validate("")).isEmpty();
    }
}
