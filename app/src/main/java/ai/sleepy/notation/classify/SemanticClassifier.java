package ai.sleepy.notation.classify;

import ai.sleepy.notation.Vocabulary;
import ai.sleepy.notation.ast.BindingExpression;
import ai.sleepy.notation.ast.Element;
import ai.sleepy.notation.ast.Leaf;
import ai.sleepy.notation.ast.Node;
import ai.sleepy.notation.ast.StyleVariant;
import ai.sleepy.notation.lex.Position;
import ai.sleepy.notation.lex.Token;
import ai.sleepy.notation.lex.TokenKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns highlighting categories by walking the parsed tree. Names are classified from
 * their place in the tree; values are split along the token stream so a binding written
 * inside longer text still gets its own span.
 */
public class SemanticClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(SemanticClassifier.class);

    public List<SemanticSpan> classify(List<Token> tokens, Node root) {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(root, "root");
        List<SemanticSpan> spans = new ArrayList<>();
        if (isDocument(root)) {
            for (Element child : root.children()) {
                visit(child, 0, tokens, spans);
            }
        } else {
            visit(root, 0, tokens, spans);
        }
        spans.sort(Comparator.comparingInt((SemanticSpan span) -> span.start().offset())
                .thenComparing(SemanticSpan::category));
        LOGGER.debug("Classified {} span(s)", spans.size());
        return List.copyOf(spans);
    }

    private static boolean isDocument(Node root) {
        return root.isAnonymous() && root.openKind().isEmpty() && !root.braced();
    }

    private void visit(Element element, int depth, List<Token> tokens, List<SemanticSpan> spans) {
        if (element instanceof Leaf leaf) {
            visitLeaf(leaf, depth, tokens, spans);
            return;
        }
        Node node = (Node) element;
        boolean httpPath = Vocabulary.isHttpVerb(node.name())
                && !node.arguments().isEmpty() && node.arguments().get(0).value().startsWith("/");
        if (node.hasName()) {
            spans.add(new SemanticSpan(node.namePosition(), node.name().length(),
                    nameCategory(node.name(), httpPath), depth));
        }
        for (StyleVariant variant : node.styleVariants()) {
            spans.add(new SemanticSpan(variant.position(), variant.length(), SpanCategory.STYLE_VARIANT, depth));
        }
        for (int i = 0; i < node.arguments().size(); i++) {
            Leaf argument = node.arguments().get(i);
            if (i == 0 && httpPath) {
                addValueSpan(argument, SpanCategory.HTTP_PATH, depth + 1, spans);
            } else {
                visitValue(argument, depth + 1, tokens, spans);
            }
        }
        for (Element child : node.children()) {
            visit(child, depth + 1, tokens, spans);
        }
        for (Leaf value : node.trailing()) {
            visitValue(value, depth + 1, tokens, spans);
        }
    }

    private void visitLeaf(Leaf leaf, int depth, List<Token> tokens, List<SemanticSpan> spans) {
        boolean httpPath = Vocabulary.isHttpVerb(leaf.name()) && leaf.value().startsWith("/");
        if (leaf.hasName()) {
            spans.add(new SemanticSpan(leaf.start(), leaf.name().length(), nameCategory(leaf.name(), httpPath), depth));
        }
        if (httpPath) {
            addValueSpan(leaf, SpanCategory.HTTP_PATH, depth, spans);
        } else {
            visitValue(leaf, depth, tokens, spans);
        }
    }

    /**
     * Category of an element name, resolved by fixed precedence.
     */
    static SpanCategory nameCategory(String name, boolean followedByPath) {
        if (Vocabulary.isSectionKeyword(name)) {
            return SpanCategory.SECTION_KEYWORD;
        }
        if (Vocabulary.isControlFlowKeyword(name)) {
            return SpanCategory.CONTROL_FLOW_KEYWORD;
        }
        if (BindingExpression.parse(name).isPresent()) {
            return SpanCategory.DATA_BINDING;
        }
        if (followedByPath) {
            return SpanCategory.HTTP_VERB;
        }
        return SpanCategory.ELEMENT_NAME;
    }

    private void visitValue(Leaf leaf, int depth, List<Token> tokens, List<SemanticSpan> spans) {
        if (leaf.isBinding()) {
            addValueSpan(leaf, SpanCategory.DATA_BINDING, depth, spans);
            return;
        }
        int startOffset = leaf.valueStart().offset();
        int endOffset = leaf.end().offset();
        int index = firstTokenAt(tokens, startOffset);
        Token plainStart = null;
        Token plainEnd = null;
        while (index < tokens.size() && tokens.get(index).position().offset() < endOffset) {
            int bindingEnd = bindingRunEnd(tokens, index, endOffset);
            if (bindingEnd > index) {
                flushPlain(plainStart, plainEnd, depth, spans);
                plainStart = null;
                Token first = tokens.get(index);
                Token last = tokens.get(bindingEnd - 1);
                spans.add(new SemanticSpan(first.position(), last.endOffset() - first.position().offset(),
                        SpanCategory.DATA_BINDING, depth));
                index = bindingEnd;
                continue;
            }
            Token token = tokens.get(index);
            if (!token.isWhitespace()) {
                if (plainStart == null) {
                    plainStart = token;
                }
                plainEnd = token;
            }
            index++;
        }
        flushPlain(plainStart, plainEnd, depth, spans);
    }

    private static void flushPlain(Token first, Token last, int depth, List<SemanticSpan> spans) {
        if (first == null) {
            return;
        }
        spans.add(new SemanticSpan(first.position(), last.endOffset() - first.position().offset(),
                SpanCategory.PLAIN_VALUE, depth));
    }

    private static void addValueSpan(Leaf leaf, SpanCategory category, int depth, List<SemanticSpan> spans) {
        Position start = leaf.valueStart();
        int length = leaf.valueLength();
        if (length > 0) {
            spans.add(new SemanticSpan(start, length, category, depth));
        }
    }

    /**
     * Returns the index after a binding-shaped run ({@code root.segment...}) starting at
     * {@code index}, or {@code index} when there is none.
     */
    private static int bindingRunEnd(List<Token> tokens, int index, int limit) {
        Token first = tokens.get(index);
        if (!first.is(TokenKind.IDENTIFIER) || !Vocabulary.isBindingRoot(first.lexeme())) {
            return index;
        }
        if (index > 0 && tokens.get(index - 1).is(TokenKind.DOT)) {
            return index;
        }
        int end = index + 1;
        while (end + 1 < tokens.size()
                && tokens.get(end).is(TokenKind.DOT)
                && tokens.get(end + 1).is(TokenKind.IDENTIFIER)
                && tokens.get(end + 1).endOffset() <= limit) {
            end += 2;
        }
        return end > index + 1 ? end : index;
    }

    private static int firstTokenAt(List<Token> tokens, int offset) {
        int low = 0;
        int high = tokens.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (tokens.get(mid).position().offset() < offset) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
