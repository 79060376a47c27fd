package ai.sleepy.notation.classify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import ai.sleepy.notation.ast.NotationParser;
import ai.sleepy.notation.lex.Token;
import ai.sleepy.notation.lex.Tokenizer;
import java.util.List;
import org.junit.jupiter.api.Test;

class SemanticClassifierTest {

    private final SemanticClassifier classifier = new SemanticClassifier();

    private List<SemanticSpan> classify(String text) {
        List<Token> tokens = Tokenizer.tokenize(text);
        return classifier.classify(tokens, new NotationParser().parse(tokens).root());
    }

    private static SemanticSpan spanAt(List<SemanticSpan> spans, int column, SpanCategory category) {
        return spans.stream()
                .filter(span -> span.column() == column && span.category() == category)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No " + category + " span at column " + column + " in " + spans));
    }

    @Test
    void classifiesVariantsBindingsAndElementNamesByDepth() {
        List<SemanticSpan> spans = classify("card$primary:(column:[img:api.user.avatar,h3:api.user.name])");

        assertThat(spanAt(spans, 4, SpanCategory.STYLE_VARIANT).length()).isEqualTo("$primary".length());
        assertThat(spanAt(spans, 26, SpanCategory.DATA_BINDING).length()).isEqualTo("api.user.avatar".length());
        assertThat(spanAt(spans, 45, SpanCategory.DATA_BINDING).length()).isEqualTo("api.user.name".length());

        SemanticSpan card = spanAt(spans, 0, SpanCategory.ELEMENT_NAME);
        SemanticSpan column = spanAt(spans, 14, SpanCategory.ELEMENT_NAME);
        SemanticSpan img = spanAt(spans, 22, SpanCategory.ELEMENT_NAME);
        SemanticSpan h3 = spanAt(spans, 42, SpanCategory.ELEMENT_NAME);
        assertThat(card.nestingDepth()).isLessThan(column.nestingDepth());
        assertThat(column.nestingDepth()).isLessThan(img.nestingDepth());
        assertThat(h3.nestingDepth()).isEqualTo(img.nestingDepth());
        assertThat(card.nestingDepth()).isZero();
    }

    @Test
    void splitsHttpVerbAndPath() {
        List<SemanticSpan> spans = classify("api:(GET:/users:(auth:required))");

        assertThat(spans)
                .extracting(SemanticSpan::column, SemanticSpan::length, SemanticSpan::category, SemanticSpan::nestingDepth)
                .containsExactly(
                        tuple(0, 3, SpanCategory.SECTION_KEYWORD, 0),
                        tuple(5, 3, SpanCategory.HTTP_VERB, 1),
                        tuple(9, 6, SpanCategory.HTTP_PATH, 2),
                        tuple(17, 4, SpanCategory.ELEMENT_NAME, 2),
                        tuple(22, 8, SpanCategory.PLAIN_VALUE, 2));
    }

    @Test
    void verbLeafWithPathIsSplitToo() {
        List<SemanticSpan> spans = classify("api:(DELETE:/users)");

        assertThat(spans)
                .extracting(SemanticSpan::column, SemanticSpan::category)
                .contains(tuple(5, SpanCategory.HTTP_VERB), tuple(12, SpanCategory.HTTP_PATH));
    }

    @Test
    void verbWithoutPathIsAnElementName() {
        List<SemanticSpan> spans = classify("menu:(GET:items)");

        assertThat(spanAt(spans, 6, SpanCategory.ELEMENT_NAME).length()).isEqualTo(3);
    }

    @Test
    void controlFlowKeywordsKeepTheirCategoryAtAnyDepth() {
        List<SemanticSpan> spans = classify("frontend:(forEach:api.items:[card:item.name])");

        assertThat(spanAt(spans, 0, SpanCategory.SECTION_KEYWORD).nestingDepth()).isZero();
        assertThat(spanAt(spans, 10, SpanCategory.CONTROL_FLOW_KEYWORD).nestingDepth()).isEqualTo(1);
        assertThat(spanAt(spans, 18, SpanCategory.DATA_BINDING).length()).isEqualTo("api.items".length());
        assertThat(spanAt(spans, 34, SpanCategory.DATA_BINDING).length()).isEqualTo("item.name".length());
    }

    @Test
    void findsBindingInsideLongerValue() {
        List<SemanticSpan> spans = classify("p: \"Hello\" api.user.name");

        assertThat(spans)
                .extracting(SemanticSpan::column, SemanticSpan::length, SemanticSpan::category)
                .containsExactly(
                        tuple(0, 1, SpanCategory.ELEMENT_NAME),
                        tuple(3, 7, SpanCategory.PLAIN_VALUE),
                        tuple(11, 13, SpanCategory.DATA_BINDING));
    }

    @Test
    void spansAreOrderedBySourceOffset() {
        List<SemanticSpan> spans = classify("frontend:(\n  button$primary: \"Go\",\n  p: item.label\n)");

        assertThat(spans).isSortedAccordingTo((a, b) -> Integer.compare(a.start().offset(), b.start().offset()));
        assertThat(spans).extracting(SemanticSpan::line).contains(0, 1, 2);
    }

    @Test
    void emptyDocumentHasNoSpans() {
        assertThat(classify("")).isEmpty();
    }
}
