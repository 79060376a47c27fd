package ai.sleepy.notation.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import ai.sleepy.notation.diagnostic.BracketValidator;
import ai.sleepy.notation.diagnostic.Diagnostic;
import ai.sleepy.notation.diagnostic.DiagnosticKind;
import ai.sleepy.notation.lex.BracketKind;
import ai.sleepy.notation.lex.Tokenizer;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NotationParserTest {

    private final NotationParser parser = new NotationParser();

    private ParseResult parse(String text) {
        return parser.parse(Tokenizer.tokenize(text));
    }

    @Test
    void parsesBracedDeclarationWithParenBody() {
        ParseResult result = parse("{a:(b,c)}");

        assertThat(result.diagnostics()).isEmpty();
        Node root = result.root();
        assertThat(root.name()).isEqualTo("a");
        assertThat(root.braced()).isTrue();
        assertThat(root.openKind()).contains(BracketKind.PAREN);
        assertThat(root.children()).hasSize(2);
        assertThat(root.children()).allMatch(child -> child instanceof Leaf);
        assertThat(root.children())
                .extracting(child -> ((Leaf) child).value())
                .containsExactly("b", "c");
    }

    @Test
    void emptyInputYieldsEmptyAnonymousRoot() {
        ParseResult result = parse("");

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.roots()).isEmpty();
        assertThat(result.root().isAnonymous()).isTrue();
        assertThat(result.root().children()).isEmpty();
    }

    @Test
    void readsStyleVariantsAndBindings() {
        ParseResult result = parse("card$primary$dark:(h3:api.user.name)");

        assertThat(result.diagnostics()).isEmpty();
        Node card = result.root();
        assertThat(card.styleVariantNames()).containsExactly("primary", "dark");
        Leaf title = (Leaf) card.children().get(0);
        assertThat(title.name()).isEqualTo("h3");
        assertThat(title.binding()).map(BindingExpression::path).contains("api.user.name");
        assertThat(title.binding()).map(BindingExpression::root).contains("api");
    }

    @Test
    void colonChainKeepsArgumentsBeforeBodyAndTrailingAfter() {
        ParseResult result = parse("POST:/auth/login:(body:(email, password)):\"Sign In\"");

        assertThat(result.diagnostics()).isEmpty();
        Node post = result.root();
        assertThat(post.name()).isEqualTo("POST");
        assertThat(post.arguments()).extracting(Leaf::value).containsExactly("/auth/login");
        assertThat(post.openKind()).contains(BracketKind.PAREN);
        assertThat(post.trailing()).extracting(Leaf::value).containsExactly("\"Sign In\"");
    }

    @Test
    void stylingPropertyBodyIsMarkedAsValueList() {
        Node button = parse("button:(padding:(8px, 16px), color:white)").root();

        Node padding = (Node) button.children().get(0);
        assertThat(padding.valueList()).isTrue();
        assertThat(button.valueList()).isFalse();
        assertThat(button.children().get(1)).isInstanceOf(Leaf.class);
    }

    @Test
    void collapsesWhitespaceInsideValues() {
        Leaf content = (Leaf) parse("content:  Sign   in now\nnext:x").roots().get(0);

        assertThat(content.value()).isEqualTo("Sign in now");
    }

    @Test
    void severalRootsAreWrappedInDocumentNode() {
        ParseResult result = parse("a:b\nc:(d)");

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.roots()).hasSize(2);
        assertThat(result.root().isAnonymous()).isTrue();
        assertThat(result.root().openKind()).isEmpty();
        assertThat(result.root().children()).containsExactlyElementsOf(result.roots());
    }

    @Test
    void anonymousGroupKeepsItsBracketKind() {
        ParseResult result = parse("[a, b]");

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.root().isAnonymous()).isTrue();
        assertThat(result.root().openKind()).contains(BracketKind.SQUARE);
        assertThat(result.root().children()).hasSize(2);
    }

    @Test
    @DisplayName("500 nested parentheses produce a depth diagnostic instead of overflowing")
    void deepNestingIsBounded() {
        String text = "(".repeat(500) + ")".repeat(500);

        ParseResult result = parse(text);

        assertThat(result.diagnostics()).hasSize(1);
        Diagnostic diagnostic = result.diagnostics().get(0);
        assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.UNEXPECTED_STRUCTURE_ERROR);
        assertThat(diagnostic.message()).contains("maximum depth of 256");
        assertThat(diagnostic.column()).isEqualTo(256);
    }

    @Test
    void configuredDepthLimitApplies() {
        ParseResult result = new NotationParser(2).parse(Tokenizer.tokenize("a:(b:(c:(d)))"));

        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0).column()).isEqualTo(8);
    }

    @Test
    void rejectsUnsupportedDepthLimits() {
        assertThatThrownBy(() -> new NotationParser(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new NotationParser(100000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 1 and 1024");
    }

    @Test
    void unclosedInputDeeperThanLimitStillReportsEveryOpening() {
        String text = "(".repeat(300);

        ParseResult result = parse(text);

        assertThat(result.diagnostics()).filteredOn(Diagnostic::isBracketMismatch).hasSize(300);
    }

    @Test
    @DisplayName("Bracket diagnostics from the parser match the validator's")
    void bracketDiagnosticsAgreeWithValidator() {
        BracketValidator validator = new BracketValidator();
        List<String> inputs = List.of(
                "{a:(b,c]",
                "card:(title:x])",
                "{a:(b",
                "{a:(b}",
                "a:(b], c:[d)",
                ")]",
                "x:[(]",
                "frontend:(column:[row:(a, b], c)",
                "[a:(b])",
                "[{a:(b}",
                "(x:[y)]",
                "(".repeat(270) + "]" + ")".repeat(270));

        for (String input : inputs) {
            List<Diagnostic> fromParser = parse(input).diagnostics().stream()
                    .filter(Diagnostic::isBracketMismatch)
                    .toList();
            assertThat(fromParser)
                    .as("bracket diagnostics for %s", input)
                    .containsExactlyElementsOf(validator.validate(Tokenizer.tokenize(input)));
        }
    }

    @Test
    void reportsOuterBracketLeftOpenAroundAMismatch() {
        assertThat(parse("[a:(b])").diagnostics())
                .extracting(Diagnostic::message, Diagnostic::column)
                .containsExactly(
                        tuple("Unexpected ']' inside '('", 5),
                        tuple("Unmatched opening '['", 0));
        assertThat(parse("[{a:(b}").diagnostics())
                .extracting(Diagnostic::message, Diagnostic::column)
                .containsExactly(
                        tuple("Expected ')' but found '}'; closing 1 unclosed bracket(s)", 6),
                        tuple("Unmatched opening '['", 0));
    }

    @Test
    void wrongKindCloseYieldsSingleDiagnostic() {
        ParseResult result = parse("{a:(b,c]");

        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0).expectedKind()).contains(BracketKind.PAREN);
        assertThat(result.diagnostics().get(0).foundKind()).contains(BracketKind.SQUARE);
        assertThat(result.root().name()).isEqualTo("a");
    }

    @Test
    void reportsConsecutiveColons() {
        ParseResult result = parse("a::b");

        assertThat(result.diagnostics())
                .extracting(Diagnostic::kind, Diagnostic::message)
                .containsExactly(tuple(DiagnosticKind.UNEXPECTED_STRUCTURE_ERROR, "Consecutive ':'"));
        assertThat(((Leaf) result.root().children().get(0)).value()).isEqualTo("b");
    }

    @Test
    void reportsColonWithoutValue() {
        ParseResult result = parse("card:(title:)");

        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0).message()).isEqualTo("':' must be followed by a value or a body");
        assertThat(result.diagnostics().get(0).column()).isEqualTo(11);
    }

    @Test
    void reportsMissingCommaAndEmptyItem() {
        ParseResult result = parse("row:(a:(x) b:c, , d)");

        assertThat(result.diagnostics())
                .extracting(Diagnostic::message)
                .containsExactly("Expected ',' between items", "Empty item before ','");
    }

    @Test
    void reportsDollarWithoutVariantName() {
        ParseResult result = parse("card$:(a)");

        assertThat(result.diagnostics())
                .extracting(Diagnostic::message)
                .containsExactly("'$' must be followed by a variant name");
    }

    @Test
    void reportsSecondBody() {
        ParseResult result = parse("card:(a):(b)");

        assertThat(result.diagnostics())
                .extracting(Diagnostic::message)
                .containsExactly("'card' already has a body");
    }

    @Test
    void contentAfterClosedRootIsTrailingContent() {
        ParseResult result = parse("{a:b} stray");

        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0).kind()).isEqualTo(DiagnosticKind.TRAILING_CONTENT_ERROR);
        assertThat(result.diagnostics().get(0).column()).isEqualTo(6);
        assertThat(result.roots()).hasSize(1);
    }

    @Test
    void bareValueBeforeAnyDeclarationIsUnexpected() {
        ParseResult result = parse("hello");

        assertThat(result.diagnostics())
                .extracting(Diagnostic::kind)
                .containsExactly(DiagnosticKind.UNEXPECTED_STRUCTURE_ERROR);
        assertThat(result.roots()).isEmpty();
    }

    @Test
    void unterminatedStringIsLexError() {
        ParseResult result = parse("p: \"oops\n");

        assertThat(result.diagnostics())
                .extracting(Diagnostic::kind)
                .containsExactly(DiagnosticKind.LEX_ERROR);
    }
}
