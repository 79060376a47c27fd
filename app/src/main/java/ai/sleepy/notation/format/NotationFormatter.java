package ai.sleepy.notation.format;

import ai.sleepy.notation.ast.Element;
import ai.sleepy.notation.ast.Leaf;
import ai.sleepy.notation.ast.Node;
import ai.sleepy.notation.ast.NotationParser;
import ai.sleepy.notation.ast.ParseResult;
import ai.sleepy.notation.ast.StyleVariant;
import ai.sleepy.notation.diagnostic.BracketValidator;
import ai.sleepy.notation.lex.BracketKind;
import ai.sleepy.notation.lex.Token;
import ai.sleepy.notation.lex.Tokenizer;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders notation in canonical layout: two-space indentation, one child per line, value
 * lists kept on one line. Text with any diagnostic is returned untouched.
 */
public class NotationFormatter {

    private static final Logger LOGGER = LoggerFactory.getLogger(NotationFormatter.class);
    private static final String INDENT = "  ";

    private final NotationParser parser;
    private final BracketValidator validator;

    public NotationFormatter() {
        this(new NotationParser(), new BracketValidator());
    }

    public NotationFormatter(NotationParser parser, BracketValidator validator) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public String format(String text) {
        Objects.requireNonNull(text, "text");
        List<Token> tokens = Tokenizer.tokenize(text);
        if (!validator.validate(tokens).isEmpty()) {
            LOGGER.debug("Bracket diagnostics present; leaving text unchanged");
            return text;
        }
        ParseResult result = parser.parse(tokens);
        if (result.hasDiagnostics()) {
            LOGGER.debug("{} parse diagnostic(s); leaving text unchanged", result.diagnostics().size());
            return text;
        }
        return render(result.roots());
    }

    /**
     * Renders top-level items. A root ending in a closing curly bracket is followed by a
     * blank line when another root follows.
     */
    public String render(List<Element> roots) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < roots.size(); i++) {
            element(roots.get(i), 0, false, out);
            if (i < roots.size() - 1 && out.charAt(out.length() - 1) == '}') {
                out.append("\n\n");
            } else {
                out.append('\n');
            }
        }
        return out.toString();
    }

    private void element(Element element, int level, boolean inline, StringBuilder out) {
        if (element instanceof Leaf leaf) {
            leaf(leaf, out);
            return;
        }
        Node node = (Node) element;
        if (node.braced() && !inline) {
            out.append(BracketKind.CURLY.open()).append('\n');
            indent(level + 1, out);
            chain(node, level + 1, false, out);
            out.append('\n');
            indent(level, out);
            out.append(BracketKind.CURLY.close());
            return;
        }
        if (node.braced()) {
            out.append(BracketKind.CURLY.open());
            chain(node, level, true, out);
            out.append(BracketKind.CURLY.close());
            return;
        }
        chain(node, level, inline, out);
    }

    private void chain(Node node, int level, boolean inline, StringBuilder out) {
        out.append(node.name());
        for (StyleVariant variant : node.styleVariants()) {
            out.append('$').append(variant.name());
        }
        boolean head = node.hasName() || !node.styleVariants().isEmpty();
        for (Leaf argument : node.arguments()) {
            colonValue(argument.value(), out);
        }
        if (node.openKind().isPresent()) {
            if (head || !node.arguments().isEmpty()) {
                out.append(':');
            }
            group(node, level, inline || node.valueList(), out);
        }
        for (Leaf value : node.trailing()) {
            colonValue(value.value(), out);
        }
    }

    private void group(Node node, int level, boolean inline, StringBuilder out) {
        BracketKind kind = node.openKind().orElseThrow();
        List<Element> children = node.children();
        out.append(kind.open());
        if (children.isEmpty()) {
            out.append(kind.close());
            return;
        }
        if (inline) {
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                element(children.get(i), level, true, out);
            }
            out.append(kind.close());
            return;
        }
        out.append('\n');
        for (int i = 0; i < children.size(); i++) {
            indent(level + 1, out);
            element(children.get(i), level + 1, false, out);
            if (i < children.size() - 1) {
                out.append(',');
            }
            out.append('\n');
        }
        indent(level, out);
        out.append(kind.close());
    }

    private static void leaf(Leaf leaf, StringBuilder out) {
        if (leaf.hasName()) {
            out.append(leaf.name());
            colonValue(leaf.value(), out);
        } else {
            out.append(leaf.value());
        }
    }

    private static void colonValue(String value, StringBuilder out) {
        out.append(':');
        if (!value.startsWith("/")) {
            out.append(' ');
        }
        out.append(value);
    }

    private static void indent(int level, StringBuilder out) {
        out.append(INDENT.repeat(level));
    }
}
