package ai.sleepy.notation.report;

import ai.sleepy.notation.analyze.StructureSummary;
import ai.sleepy.notation.ast.Element;
import ai.sleepy.notation.ast.Leaf;
import ai.sleepy.notation.ast.Node;
import ai.sleepy.notation.ast.ParseResult;
import ai.sleepy.notation.classify.SemanticSpan;
import ai.sleepy.notation.diagnostic.Diagnostic;
import ai.sleepy.notation.generate.GenerationResult;
import java.util.List;

/**
 * Human-readable output. Locations are printed 1-based, the way compilers report them.
 */
public class TextReportRenderer implements ReportRenderer {

    @Override
    public String diagnostics(String source, List<Diagnostic> diagnostics) {
        StringBuilder out = new StringBuilder();
        for (Diagnostic diagnostic : diagnostics) {
            out.append(location(source, diagnostic.line(), diagnostic.column()))
                    .append(": ").append(diagnostic.severity().label())
                    .append(": ").append(diagnostic.message())
                    .append(" [").append(diagnostic.kind().displayName()).append(']')
                    .append('\n');
        }
        return out.toString();
    }

    @Override
    public String spans(String source, List<SemanticSpan> spans) {
        StringBuilder out = new StringBuilder();
        for (SemanticSpan span : spans) {
            out.append(location(source, span.line(), span.column()))
                    .append(' ').append(span.category().displayName())
                    .append(" length=").append(span.length())
                    .append(" depth=").append(span.nestingDepth())
                    .append('\n');
        }
        return out.toString();
    }

    @Override
    public String summary(String source, StructureSummary summary) {
        return source + '\n'
                + "  Sections: " + (summary.sections().isEmpty() ? "none" : String.join(", ", summary.sections())) + '\n'
                + "  API endpoints: " + summary.apiEndpointCount() + '\n'
                + "  Database tables: " + summary.dbTableCount() + '\n'
                + "  UI components: " + summary.uiComponentCount() + '\n'
                + "  Complexity: " + summary.complexity().displayName() + '\n';
    }

    @Override
    public String tree(String source, ParseResult result) {
        StringBuilder out = new StringBuilder();
        for (Element root : result.roots()) {
            outline(root, 0, out);
        }
        out.append(diagnostics(source, result.diagnostics()));
        return out.toString();
    }

    @Override
    public String generation(GenerationResult result) {
        StringBuilder out = new StringBuilder(result.notation());
        if (!result.notation().endsWith("\n")) {
            out.append('\n');
        }
        out.append(diagnostics("<generated>", result.diagnostics()));
        return out.toString();
    }

    private static void outline(Element element, int level, StringBuilder out) {
        out.append("  ".repeat(level));
        if (element instanceof Leaf leaf) {
            out.append(leaf.hasName() ? leaf.name() + ": " : "").append(leaf.value());
            if (leaf.isBinding()) {
                out.append(" (binding)");
            }
            out.append('\n');
            return;
        }
        Node node = (Node) element;
        out.append(node.isAnonymous() ? "<group>" : node.name());
        node.styleVariants().forEach(variant -> out.append(" $").append(variant.name()));
        node.arguments().forEach(argument -> out.append(" : ").append(argument.value()));
        node.openKind().ifPresent(kind -> out.append(" [").append(kind.displayName()).append(']'));
        if (node.valueList()) {
            out.append(" (value list)");
        }
        node.trailing().forEach(value -> out.append(" : ").append(value.value()));
        out.append('\n');
        for (Element child : node.children()) {
            outline(child, level + 1, out);
        }
    }

    private static String location(String source, int line, int column) {
        return source + ':' + (line + 1) + ':' + (column + 1);
    }
}
