package ai.sleepy.notation.assist;

import ai.sleepy.notation.NotationEngine;
import ai.sleepy.notation.Vocabulary;
import ai.sleepy.notation.ast.BindingExpression;
import ai.sleepy.notation.ast.Element;
import ai.sleepy.notation.ast.Leaf;
import ai.sleepy.notation.ast.Node;
import ai.sleepy.notation.ast.NotationTrees;
import ai.sleepy.notation.ast.ParseResult;
import ai.sleepy.notation.lex.BracketKind;
import ai.sleepy.notation.lex.Tokenizer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offers completions for a cursor location, driven by the element enclosing it.
 */
public class SuggestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SuggestionService.class);
    private static final List<String> VARIANT_ORDER = List.of("primary", "secondary", "ghost", "dark", "light", "hover");

    private final NotationEngine engine;

    public SuggestionService(NotationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public List<Suggestion> suggest(String text, int line, int column) {
        Objects.requireNonNull(text, "text");
        int offset = offsetOf(text, line, column);
        int wordStart = offset;
        while (wordStart > 0 && (Tokenizer.isIdentifierChar(text.charAt(wordStart - 1)) || text.charAt(wordStart - 1) == '.')) {
            wordStart--;
        }
        String word = text.substring(wordStart, offset);
        ParseResult result = engine.parse(text);

        List<Suggestion> suggestions;
        if (wordStart > 0 && text.charAt(wordStart - 1) == '$') {
            suggestions = variants(word);
        } else if (word.indexOf('.') > 0 && Vocabulary.isBindingRoot(word.substring(0, word.indexOf('.')))) {
            suggestions = bindings(result.root(), word);
        } else if (atDocumentLevel(text, result.root(), offset)) {
            suggestions = sections(word);
        } else {
            suggestions = new ArrayList<>(keywords(word));
            suggestions.addAll(components(word));
        }
        LOGGER.debug("{} suggestion(s) for '{}' at {}:{}", suggestions.size(), word, line, column);
        return List.copyOf(suggestions);
    }

    /**
     * Looks at the character left of the cursor so a cursor at the end of an unclosed body
     * still counts as inside it.
     */
    private static boolean atDocumentLevel(String text, Node root, int offset) {
        if (offset == 0) {
            return true;
        }
        int before = offset - 1;
        int line = 0;
        int lineStart = 0;
        for (int i = 0; i < before; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        Optional<Node> owner = NotationTrees.enclosingBody(root, line, before - lineStart);
        return owner.isEmpty()
                || owner.get().isAnonymous() && owner.get().openKind().filter(kind -> kind == BracketKind.CURLY).isPresent();
    }

    private static List<Suggestion> sections(String prefix) {
        List<Suggestion> out = new ArrayList<>();
        for (String section : new TreeSet<>(Vocabulary.SECTION_KEYWORDS)) {
            if (section.startsWith(prefix)) {
                String detail = Character.toUpperCase(section.charAt(0)) + section.substring(1) + " section";
                out.add(new Suggestion(section, SuggestionKind.SECTION, detail, section + ":(\n  \n)"));
            }
        }
        return out;
    }

    private static List<Suggestion> keywords(String prefix) {
        List<Suggestion> out = new ArrayList<>();
        for (String keyword : new TreeSet<>(Vocabulary.CONTROL_FLOW_KEYWORDS)) {
            if (keyword.startsWith(prefix)) {
                out.add(Suggestion.plain(keyword, SuggestionKind.CONTROL_FLOW,
                        KeywordDocumentation.describe(keyword).orElse("Control flow")));
            }
        }
        return out;
    }

    private static List<Suggestion> components(String prefix) {
        List<Suggestion> out = new ArrayList<>();
        for (String component : new TreeSet<>(Vocabulary.UI_ELEMENTS)) {
            if (component.startsWith(prefix)) {
                out.add(Suggestion.plain(component, SuggestionKind.COMPONENT, "UI component"));
            }
        }
        return out;
    }

    private static List<Suggestion> variants(String prefix) {
        List<Suggestion> out = new ArrayList<>();
        for (String variant : VARIANT_ORDER) {
            if (variant.startsWith(prefix)) {
                out.add(Suggestion.plain(variant, SuggestionKind.STYLE_VARIANT, "Style variant"));
            }
        }
        return out;
    }

    /**
     * Binding paths already written in the document that extend the typed prefix.
     */
    private static List<Suggestion> bindings(Node root, String prefix) {
        TreeSet<String> paths = new TreeSet<>();
        Deque<Element> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Element element = pending.pop();
            if (element instanceof Leaf leaf) {
                leaf.binding().ifPresent(binding -> paths.add(binding.path()));
                continue;
            }
            Node node = (Node) element;
            BindingExpression.parse(node.name()).ifPresent(binding -> paths.add(binding.path()));
            node.arguments().forEach(pending::push);
            node.children().forEach(pending::push);
            node.trailing().forEach(pending::push);
        }
        List<Suggestion> out = new ArrayList<>();
        for (String path : paths) {
            if (path.startsWith(prefix) && !path.equals(prefix)) {
                out.add(Suggestion.plain(path, SuggestionKind.BINDING, "Data binding"));
            }
        }
        return out;
    }

    static int offsetOf(String text, int line, int column) {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("line and column must not be negative");
        }
        int offset = 0;
        for (int current = 0; current < line; current++) {
            int next = text.indexOf('\n', offset);
            if (next < 0) {
                return text.length();
            }
            offset = next + 1;
        }
        int lineEnd = text.indexOf('\n', offset);
        int limit = lineEnd < 0 ? text.length() : lineEnd;
        return Math.min(offset + column, limit);
    }
}
