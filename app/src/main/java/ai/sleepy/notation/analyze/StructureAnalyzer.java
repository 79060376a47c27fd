package ai.sleepy.notation.analyze;

import ai.sleepy.notation.Vocabulary;
import ai.sleepy.notation.ast.Element;
import ai.sleepy.notation.ast.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts sections, endpoints, tables and UI components in a single traversal.
 */
public class StructureAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(StructureAnalyzer.class);

    private final ComplexityThresholds thresholds;

    public StructureAnalyzer() {
        this(ComplexityThresholds.defaults());
    }

    public StructureAnalyzer(ComplexityThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    public StructureSummary analyze(Node root) {
        Objects.requireNonNull(root, "root");
        Set<String> sections = new LinkedHashSet<>();
        int endpoints = 0;
        int tables = 0;
        int components = 0;

        Deque<Element> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Element element = pending.pop();
            String name = element.name();
            if (Vocabulary.isHttpVerb(name)) {
                endpoints++;
            }
            if (Vocabulary.isUiElement(name)) {
                components++;
            }
            if (element instanceof Node node) {
                if (Vocabulary.isSectionKeyword(name)) {
                    sections.add(name);
                }
                if ("database".equals(name)) {
                    tables += (int) node.children().stream().filter(Element::hasName).count();
                }
                // reverse push keeps sections in source order
                for (int i = node.children().size() - 1; i >= 0; i--) {
                    pending.push(node.children().get(i));
                }
            }
        }

        Complexity complexity = thresholds.classify(endpoints, tables);
        LOGGER.debug("Analyzed structure: {} endpoint(s), {} table(s), {} component(s), {}",
                endpoints, tables, components, complexity);
        return new StructureSummary(sections, endpoints, tables, components, complexity);
    }
}
