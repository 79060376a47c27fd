package ai.sleepy.notation;

import ai.sleepy.notation.analyze.StructureAnalyzer;
import ai.sleepy.notation.analyze.StructureSummary;
import ai.sleepy.notation.ast.Element;
import ai.sleepy.notation.ast.Node;
import ai.sleepy.notation.ast.NotationParser;
import ai.sleepy.notation.ast.NotationTrees;
import ai.sleepy.notation.ast.ParseResult;
import ai.sleepy.notation.classify.SemanticClassifier;
import ai.sleepy.notation.classify.SemanticSpan;
import ai.sleepy.notation.diagnostic.BracketValidator;
import ai.sleepy.notation.diagnostic.Diagnostic;
import ai.sleepy.notation.format.NotationFormatter;
import ai.sleepy.notation.lex.Token;
import ai.sleepy.notation.lex.Tokenizer;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Text-in entry points for every engine operation. Instances hold only immutable settings
 * and may be shared between threads; each call tokenizes its input afresh.
 */
public final class NotationEngine {

    private final EngineSettings settings;
    private final NotationParser parser;
    private final BracketValidator validator;
    private final SemanticClassifier classifier;
    private final NotationFormatter formatter;
    private final StructureAnalyzer analyzer;

    public NotationEngine() {
        this(EngineSettings.defaults());
    }

    public NotationEngine(EngineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.parser = new NotationParser(settings.maxDepth());
        this.validator = new BracketValidator();
        this.classifier = new SemanticClassifier();
        this.formatter = new NotationFormatter(parser, validator);
        this.analyzer = new StructureAnalyzer(settings.thresholds());
    }

    public EngineSettings settings() {
        return settings;
    }

    /**
     * Bracket-only check, cheap enough to run on every edit.
     */
    public List<Diagnostic> validate(String text) {
        return validator.validate(tokenize(text));
    }

    public ParseResult parse(String text) {
        return parser.parse(tokenize(text));
    }

    public String format(String text) {
        return formatter.format(text);
    }

    public List<SemanticSpan> classify(String text) {
        List<Token> tokens = tokenize(text);
        return classifier.classify(tokens, parser.parse(tokens).root());
    }

    public StructureSummary analyze(String text) {
        return analyzer.analyze(parse(text).root());
    }

    public Optional<Element> nodeAt(Node root, int line, int column) {
        return NotationTrees.nodeAt(root, line, column);
    }

    private static List<Token> tokenize(String text) {
        return Tokenizer.tokenize(Objects.requireNonNull(text, "text"));
    }
}
