package ai.sleepy.notation.report;

import ai.sleepy.notation.analyze.StructureSummary;
import ai.sleepy.notation.ast.ParseResult;
import ai.sleepy.notation.classify.SemanticSpan;
import ai.sleepy.notation.diagnostic.Diagnostic;
import ai.sleepy.notation.generate.GenerationResult;
import java.util.List;

/**
 * Turns engine results into command output. {@code source} names the document, such as a
 * file path or {@code <stdin>}.
 */
public interface ReportRenderer {

    String diagnostics(String source, List<Diagnostic> diagnostics);

    String spans(String source, List<SemanticSpan> spans);

    String summary(String source, StructureSummary summary);

    String tree(String source, ParseResult result);

    String generation(GenerationResult result);

    static ReportRenderer forFormat(OutputFormat format) {
        return switch (format) {
            case TEXT -> new TextReportRenderer();
            case JSON -> new JsonReportRenderer();
        };
    }
}
