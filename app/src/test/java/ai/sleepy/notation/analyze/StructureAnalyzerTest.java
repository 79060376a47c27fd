package ai.sleepy.notation.analyze;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.sleepy.notation.ast.Node;
import ai.sleepy.notation.ast.NotationParser;
import ai.sleepy.notation.lex.Tokenizer;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class StructureAnalyzerTest {

    private final StructureAnalyzer analyzer = new StructureAnalyzer();

    private static Node parse(String text) {
        return new NotationParser().parse(Tokenizer.tokenize(text)).root();
    }

    @Test
    void forEachIsNotASection() {
        StructureSummary summary = analyzer.analyze(parse(
                "frontend:(forEach:api.products:[card$product:(h3:item.name)])"));

        assertThat(summary.sections()).containsExactly("frontend");
        assertThat(summary.sections()).doesNotContain("forEach");
        assertThat(summary.uiComponentCount()).isGreaterThanOrEqualTo(1);
        assertThat(summary.uiComponentCount()).isEqualTo(2);
        assertThat(summary.complexity()).isEqualTo(Complexity.SIMPLE);
    }

    @Test
    void countsEndpointsTablesAndSectionsInSourceOrder() {
        StructureSummary summary = analyzer.analyze(parse("""
                api:(
                  GET:/users,
                  POST:/users:(body:(name, email)),
                  DELETE:/users/id
                )
                database:(
                  users:(id:uuid, name:string),
                  posts:(id:uuid),
                  comments:(id:uuid)
                )
                frontend:(
                  column:[button$primary:"Save", input:api.user.name]
                )
                """));

        assertThat(summary.sections()).containsExactly("api", "database", "frontend");
        assertThat(summary.apiEndpointCount()).isEqualTo(3);
        assertThat(summary.dbTableCount()).isEqualTo(3);
        assertThat(summary.uiComponentCount()).isEqualTo(3);
        assertThat(summary.complexity()).isEqualTo(Complexity.COMPLEX);
    }

    @Test
    void bindingRootUsedAsValueIsNotASection() {
        StructureSummary summary = analyzer.analyze(parse("frontend:(p:api.user.name)"));

        assertThat(summary.sections()).containsExactly("frontend");
    }

    @Test
    void complexityFollowsDefaultThresholds() {
        assertThat(analyzer.analyze(parse("frontend:(card:x)")).complexity()).isEqualTo(Complexity.SIMPLE);
        assertThat(analyzer.analyze(parse("api:(GET:/health)")).complexity()).isEqualTo(Complexity.MODERATE);
        assertThat(analyzer.analyze(parse(endpoints(6))).complexity()).isEqualTo(Complexity.COMPLEX);
        assertThat(analyzer.analyze(parse(endpoints(11))).complexity()).isEqualTo(Complexity.ENTERPRISE);
        assertThat(analyzer.analyze(parse(endpoints(10))).complexity()).isEqualTo(Complexity.COMPLEX);
    }

    @Test
    void customThresholdsAreApplied() {
        StructureAnalyzer strict = new StructureAnalyzer(new ComplexityThresholds(1, 1, 0, 0, 0, 0));

        assertThat(strict.analyze(parse(endpoints(2))).complexity()).isEqualTo(Complexity.ENTERPRISE);
        assertThat(strict.analyze(parse(endpoints(1))).complexity()).isEqualTo(Complexity.COMPLEX);
    }

    @Test
    void rejectsDecreasingThresholds() {
        assertThatThrownBy(() -> new ComplexityThresholds(1, 5, 5, 2, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ComplexityThresholds(10, 5, 5, 2, -1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyDocumentIsSimple() {
        StructureSummary summary = analyzer.analyze(parse(""));

        assertThat(summary.sections()).isEmpty();
        assertThat(summary.apiEndpointCount()).isZero();
        assertThat(summary.complexity()).isEqualTo(Complexity.SIMPLE);
    }

    private static String endpoints(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> "GET:/items/n" + i)
                .collect(Collectors.joining(", ", "api:(", ")"));
    }
}
