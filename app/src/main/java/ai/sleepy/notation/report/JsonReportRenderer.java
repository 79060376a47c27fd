package ai.sleepy.notation.report;

import ai.sleepy.notation.analyze.StructureSummary;
import ai.sleepy.notation.ast.Element;
import ai.sleepy.notation.ast.Leaf;
import ai.sleepy.notation.ast.Node;
import ai.sleepy.notation.ast.ParseResult;
import ai.sleepy.notation.classify.SemanticSpan;
import ai.sleepy.notation.diagnostic.Diagnostic;
import ai.sleepy.notation.generate.GenerationResult;
import ai.sleepy.notation.lex.BracketKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Locale;

/**
 * Machine-readable output built as Jackson trees. Locations are 0-based.
 */
public class JsonReportRenderer implements ReportRenderer {

    private final ObjectMapper mapper;

    public JsonReportRenderer() {
        this(new ObjectMapper());
    }

    public JsonReportRenderer(ObjectMapper mapper) {
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String diagnostics(String source, List<Diagnostic> diagnostics) {
        ObjectNode root = document(source);
        root.set("diagnostics", diagnosticArray(diagnostics));
        return write(root);
    }

    @Override
    public String spans(String source, List<SemanticSpan> spans) {
        ObjectNode root = document(source);
        ArrayNode array = root.putArray("spans");
        for (SemanticSpan span : spans) {
            array.addObject()
                    .put("line", span.line())
                    .put("column", span.column())
                    .put("length", span.length())
                    .put("category", span.category().displayName())
                    .put("nestingDepth", span.nestingDepth());
        }
        return write(root);
    }

    @Override
    public String summary(String source, StructureSummary summary) {
        ObjectNode root = document(source);
        ArrayNode sections = root.putArray("sections");
        summary.sections().forEach(sections::add);
        root.put("apiEndpointCount", summary.apiEndpointCount());
        root.put("dbTableCount", summary.dbTableCount());
        root.put("uiComponentCount", summary.uiComponentCount());
        root.put("complexity", summary.complexity().displayName());
        return write(root);
    }

    @Override
    public String tree(String source, ParseResult result) {
        ObjectNode root = document(source);
        root.set("root", element(result.root()));
        root.set("diagnostics", diagnosticArray(result.diagnostics()));
        return write(root);
    }

    @Override
    public String generation(GenerationResult result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("notation", result.notation());
        root.put("source", result.source().name().toLowerCase(Locale.ROOT));
        root.put("attempts", result.attempts());
        root.set("diagnostics", diagnosticArray(result.diagnostics()));
        return write(root);
    }

    /**
     * Exports an element and its descendants.
     */
    public ObjectNode element(Element element) {
        ObjectNode json = mapper.createObjectNode();
        if (element instanceof Leaf leaf) {
            json.put("type", "leaf");
            if (leaf.hasName()) {
                json.put("name", leaf.name());
            }
            json.put("value", leaf.value());
            leaf.binding().ifPresent(binding -> json.put("binding", binding.path()));
            position(json, leaf);
            return json;
        }
        Node node = (Node) element;
        json.put("type", "node");
        json.put("name", node.name());
        if (!node.styleVariants().isEmpty()) {
            ArrayNode variants = json.putArray("styleVariants");
            node.styleVariantNames().forEach(variants::add);
        }
        node.bindingExpression().ifPresent(binding -> json.put("binding", binding.path()));
        if (!node.arguments().isEmpty()) {
            ArrayNode arguments = json.putArray("arguments");
            node.arguments().forEach(argument -> arguments.add(argument.value()));
        }
        node.openKind().map(BracketKind::displayName).ifPresent(kind -> json.put("openKind", kind));
        if (node.braced()) {
            json.put("braced", true);
        }
        if (node.valueList()) {
            json.put("valueList", true);
        }
        position(json, node);
        ArrayNode children = json.putArray("children");
        node.children().forEach(child -> children.add(element(child)));
        if (!node.trailing().isEmpty()) {
            ArrayNode trailing = json.putArray("trailing");
            node.trailing().forEach(value -> trailing.add(value.value()));
        }
        return json;
    }

    private ArrayNode diagnosticArray(List<Diagnostic> diagnostics) {
        ArrayNode array = mapper.createArrayNode();
        for (Diagnostic diagnostic : diagnostics) {
            ObjectNode json = array.addObject()
                    .put("line", diagnostic.line())
                    .put("column", diagnostic.column())
                    .put("severity", diagnostic.severity().label())
                    .put("kind", diagnostic.kind().displayName())
                    .put("message", diagnostic.message());
            diagnostic.expectedKind().ifPresent(kind -> json.put("expectedKind", kind.displayName()));
            diagnostic.foundKind().ifPresent(kind -> json.put("foundKind", kind.displayName()));
        }
        return array;
    }

    private static void position(ObjectNode json, Element element) {
        json.put("line", element.start().line());
        json.put("column", element.start().column());
    }

    private ObjectNode document(String source) {
        ObjectNode root = mapper.createObjectNode();
        root.put("source", source);
        return root;
    }

    private String write(ObjectNode root) {
        try {
            return mapper.writeValueAsString(root) + System.lineSeparator();
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to render JSON output", ex);
        }
    }
}
