package ai.sleepy.notation.ast;

import ai.sleepy.notation.EngineSettings;
import ai.sleepy.notation.Vocabulary;
import ai.sleepy.notation.diagnostic.BracketFrames;
import ai.sleepy.notation.diagnostic.BracketRecovery;
import ai.sleepy.notation.diagnostic.Diagnostic;
import ai.sleepy.notation.diagnostic.DiagnosticKind;
import ai.sleepy.notation.lex.BracketKind;
import ai.sleepy.notation.lex.Position;
import ai.sleepy.notation.lex.Token;
import ai.sleepy.notation.lex.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser producing the element tree for a token list.
 *
 * <p>Closing brackets are resolved through {@link BracketRecovery} against the same frame
 * stack the {@link ai.sleepy.notation.diagnostic.BracketValidator} keeps, so both report
 * identical bracket diagnostics. Groups nested deeper than the configured limit are
 * skipped without recursion.
 */
public class NotationParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(NotationParser.class);

    private final int maxDepth;

    public NotationParser() {
        this(EngineSettings.DEFAULT_MAX_DEPTH);
    }

    public NotationParser(int maxDepth) {
        this.maxDepth = EngineSettings.requireSupportedDepth(maxDepth, "maxDepth");
    }

    public ParseResult parse(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        ParseResult result = new Run(tokens).document();
        LOGGER.debug("Parsed {} tokens into {} root(s) with {} diagnostic(s)",
                tokens.size(), result.roots().size(), result.diagnostics().size());
        return result;
    }

    private record Group(BracketKind kind, List<Element> children, Position start, Position end) {
    }

    private record Value(String text, Position start, Position end) {
    }

    /**
     * Mutable state for a single parse call.
     */
    private final class Run {

        private final List<Token> tokens;
        private final BracketFrames frames = new BracketFrames();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private int pos;
        private int unwindTarget = -1;

        Run(List<Token> tokens) {
            this.tokens = tokens;
        }

        ParseResult document() {
            List<Element> roots = new ArrayList<>();
            boolean afterClosedRoot = false;
            while (true) {
                skipWhitespace();
                if (atEnd()) {
                    break;
                }
                Token token = current();
                if (token.is(TokenKind.COMMA)) {
                    pos++;
                    continue;
                }
                if (token.kind().isCloseBracket()) {
                    closeAtTopLevel(token);
                    continue;
                }
                if (token.is(TokenKind.COLON)) {
                    error(token.position(), DiagnosticKind.UNEXPECTED_STRUCTURE_ERROR, "':' without a name");
                    pos++;
                    continue;
                }
                Element item = item();
                if (item instanceof Leaf leaf && !leaf.hasName()) {
                    if (afterClosedRoot) {
                        error(leaf.start(), DiagnosticKind.TRAILING_CONTENT_ERROR,
                                "Unexpected content '" + leaf.value() + "' after the last closing bracket");
                    } else {
                        error(leaf.start(), DiagnosticKind.UNEXPECTED_STRUCTURE_ERROR,
                                "Expected a declaration but found '" + leaf.value() + "'");
                    }
                    continue;
                }
                roots.add(item);
                afterClosedRoot = pos > 0 && tokens.get(pos - 1).kind().isCloseBracket();
            }
            Position end = tokens.isEmpty() ? Position.START : tokens.get(tokens.size() - 1).endPosition();
            Node root = roots.size() == 1 && roots.get(0) instanceof Node single
                    ? single
                    : Node.document(roots, end);
            return new ParseResult(root, roots, diagnostics);
        }

        private void closeAtTopLevel(Token token) {
            BracketKind found = BracketKind.ofClosing(token.kind()).orElseThrow();
            frames.close(found, tokens, pos, diagnostics);
            pos++;
        }

        private Element item() {
            Token token = current();
            if (token.kind().isOpenBracket()) {
                return groupElement(group());
            }
            if (token.is(TokenKind.IDENTIFIER)) {
                return element();
            }
            Value value = value();
            return Leaf.bare(value.text(), BindingExpression.parse(value.text()), value.start(), value.end());
        }

        /**
         * Curly braces around a single declaration mark that declaration as braced. Braces are a
         * flag, not a level, so {@code { {a:(b)} }} collapses to the same braced {@code a} as
         * {@code {a:(b)}}.
         */
        private Element groupElement(Group group) {
            if (group.kind() == BracketKind.CURLY && group.children().size() == 1 && group.children().get(0).hasName()) {
                Element only = group.children().get(0);
                Node declared = only instanceof Node node ? node : Node.fromLeaf((Leaf) only);
                return declared.asBraced(group.start(), group.end());
            }
            return Node.anonymous(group.kind(), group.children(), group.start(), group.end());
        }

        private Group group() {
            Token open = current();
            BracketKind kind = BracketKind.ofOpening(open.kind()).orElseThrow();
            if (frames.size() >= maxDepth) {
                error(open.position(), DiagnosticKind.UNEXPECTED_STRUCTURE_ERROR,
                        "Nesting exceeds the maximum depth of " + maxDepth);
                Position end = skipTooDeep(open, kind);
                return new Group(kind, List.of(), open.position(), end);
            }
            int index = frames.size();
            frames.push(kind, open);
            pos++;
            List<Element> children = new ArrayList<>();
            boolean haveItem = false;
            while (true) {
                if (unwindTarget >= 0) {
                    Token close = current();
                    if (unwindTarget == index) {
                        unwindTarget = -1;
                        pos++;
                        return new Group(kind, children, open.position(), close.endPosition());
                    }
                    return new Group(kind, children, open.position(), close.position());
                }
                skipWhitespace();
                if (atEnd()) {
                    frames.closeUnclosed(index, diagnostics);
                    return new Group(kind, children, open.position(), endOfInput());
                }
                Token token = current();
                if (token.kind().isCloseBracket()) {
                    BracketKind found = BracketKind.ofClosing(token.kind()).orElseThrow();
                    BracketRecovery.Decision decision = frames.close(found, tokens, pos, diagnostics);
                    switch (decision.action()) {
                        case MATCH, SUBSTITUTE -> {
                            pos++;
                            return new Group(kind, children, open.position(), token.endPosition());
                        }
                        case IGNORE -> pos++;
                        case UNWIND -> {
                            unwindTarget = decision.targetIndex();
                            return new Group(kind, children, open.position(), token.position());
                        }
                    }
                    continue;
                }
                if (token.is(TokenKind.COMMA)) {
                    if (!haveItem) {
                        error(token.position(), DiagnosticKind.UNEXPECTED_STRUCTURE_ERROR, "Empty item before ','");
                    }
                    haveItem = false;
                    pos++;
                    continue;
                }
                if (token.is(TokenKind.COLON)) {
                    error(token.position(), DiagnosticKind.UNEXPECTED_STRUCTURE_ERROR, "':' without a name");
                    pos++;
                    continue;
                }
                if (haveItem) {
                    error(token.position(), DiagnosticKind.UNEXPECTED_STRUCTURE_ERROR, "Expected ',' between items");
                }
                children.add(item());
                haveItem = true;
            }
        }

        /**
         * Walks past a group that is nested too deeply, keeping the frame stack in step with
         * the validator. Returns the position where the group ended.
         */
        private Position skipTooDeep(Token open, BracketKind kind) {
            int base = frames.size();
            frames.push(kind, open);
            pos++;
            while (frames.size() > base) {
                if (atEnd()) {
                    frames.closeUnclosed(base, diagnostics);
                    return endOfInput();
                }
                Token token = current();
                Optional<BracketKind> opening = BracketKind.ofOpening(token.kind());
                Optional<BracketKind> closing = BracketKind.ofClosing(token.kind());
                if (opening.isPresent()) {
                    frames.push(opening.get(), token);
                } else if (closing.isPresent()) {
                    BracketRecovery.Decision decision = frames.close(closing.get(), tokens, pos, diagnostics);
                    if (decision.action() == BracketRecovery.Action.UNWIND && decision.targetIndex() < base) {
                        unwindTarget = decision.targetIndex();
                        return token.position();
                    }
                } else if (token.isUnterminatedString()) {
                    error(token.position(), DiagnosticKind.LEX_ERROR, "Unterminated string literal");
                }
                pos++;
            }
            return tokens.get(pos - 1).endPosition();
        }

        private Element element() {
            int startIndex = pos;
            Token first = current();
            Position start = first.position();
            StringBuilder name = new StringBuilder(first.lexeme());
            List<StyleVariant> variants = new ArrayList<>();
            Position headEnd = first.endPosition();
            pos++;
            while (!atEnd()) {
                Token token = current();
                if (token.is(TokenKind.DOLLAR)) {
                    Token next = peek(1);
                    if (next != null && next.is(TokenKind.IDENTIFIER)) {
                        variants.add(new StyleVariant(next.lexeme(), token.position()));
                        headEnd = next.endPosition();
                        pos += 2;
                    } else {
                        error(token.position(), DiagnosticKind.UNEXPECTED_STRUCTURE_ERROR,
                                "'$' must be followed by a variant name");
                        headEnd = token.endPosition();
                        pos++;
                    }
                } else if (token.is(TokenKind.DOT) && variants.isEmpty()
                        && peek(1) != null && peek(1).is(TokenKind.IDENTIFIER)) {
                    name.append('.').append(peek(1).lexeme());
                    headEnd = peek(1).endPosition();
                    pos += 2;
                } else {
                    break;
                }
            }
            int afterHead = pos;
            skipHorizontalWhitespace();
            if (atEnd() || !current().is(TokenKind.COLON)) {
                pos = afterHead;
                if (!variants.isEmpty()) {
                    return new Node(name.toString(), start, variants, List.of(), Optional.empty(), List.of(), List.of(),
                            false, false, start, headEnd);
                }
                pos = startIndex;
                Value value = value();
                return Leaf.bare(value.text(), BindingExpression.parse(value.text()), value.start(), value.end());
            }
            return colonChain(name.toString(), start, variants, headEnd);
        }

        private Element colonChain(String name, Position start, List<StyleVariant> variants, Position headEnd) {
            List<Leaf> arguments = new ArrayList<>();
            List<Leaf> trailing = new ArrayList<>();
            Group body = null;
            Position end = headEnd;
            while (true) {
                Token colon = current();
                pos++;
                end = colon.endPosition();
                skipWhitespace();
                if (atEnd() || current().is(TokenKind.COMMA) || current().kind().isCloseBracket()) {
                    error(colon.position(), DiagnosticKind.UNEXPECTED_STRUCTURE_ERROR,
                            "':' must be followed by a value or a body");
                    break;
                }
                Token next = current();
                if (next.is(TokenKind.COLON)) {
                    error(next.position(), DiagnosticKind.UNEXPECTED_STRUCTURE_ERROR, "Consecutive ':'");
                    continue;
                }
                if (next.kind().isOpenBracket()) {
                    Group group = group();
                    if (body == null) {
                        body = group;
                    } else {
                        error(next.position(), DiagnosticKind.UNEXPECTED_STRUCTURE_ERROR,
                                "'" + name + "' already has a body");
                    }
                    end = group.end();
                    if (unwindTarget >= 0) {
                        break;
                    }
                } else {
                    Value value = value();
                    Leaf leaf = Leaf.bare(value.text(), BindingExpression.parse(value.text()), value.start(), value.end());
                    (body == null ? arguments : trailing).add(leaf);
                    end = value.end();
                }
                int resume = pos;
                skipWhitespace();
                if (atEnd() || !current().is(TokenKind.COLON)) {
                    pos = resume;
                    break;
                }
            }
            if (body == null && variants.isEmpty() && arguments.size() == 1 && trailing.isEmpty()) {
                return arguments.get(0).withName(name, start);
            }
            return new Node(name, start, variants, arguments,
                    body == null ? Optional.empty() : Optional.of(body.kind()),
                    body == null ? List.of() : body.children(),
                    trailing, false, body != null && Vocabulary.isStylingProperty(name), start, end);
        }

        /**
         * Reads a run of value tokens. Horizontal whitespace inside the run collapses to a
         * single space; a line break ends the value.
         */
        private Value value() {
            StringBuilder text = new StringBuilder();
            Position start = current().position();
            Position end = start;
            while (!atEnd()) {
                Token token = current();
                if (isValueToken(token)) {
                    if (token.isUnterminatedString()) {
                        error(token.position(), DiagnosticKind.LEX_ERROR, "Unterminated string literal");
                    }
                    text.append(token.lexeme());
                    end = token.endPosition();
                    pos++;
                } else if (token.isWhitespace() && !token.containsLineBreak()
                        && peek(1) != null && isValueToken(peek(1))) {
                    text.append(' ');
                    pos++;
                } else {
                    break;
                }
            }
            return new Value(text.toString(), start, end);
        }

        private boolean isValueToken(Token token) {
            return switch (token.kind()) {
                case IDENTIFIER, LITERAL, DOT, DOLLAR -> true;
                default -> false;
            };
        }

        private void error(Position position, DiagnosticKind kind, String message) {
            diagnostics.add(Diagnostic.error(position, kind, message));
        }

        private boolean atEnd() {
            return pos >= tokens.size();
        }

        private Token current() {
            return tokens.get(pos);
        }

        private Token peek(int ahead) {
            int index = pos + ahead;
            return index < tokens.size() ? tokens.get(index) : null;
        }

        private void skipWhitespace() {
            while (!atEnd() && current().isWhitespace()) {
                pos++;
            }
        }

        private void skipHorizontalWhitespace() {
            while (!atEnd() && current().isWhitespace() && !current().containsLineBreak()) {
                pos++;
            }
        }

        private Position endOfInput() {
            return tokens.isEmpty() ? Position.START : tokens.get(tokens.size() - 1).endPosition();
        }
    }
}
