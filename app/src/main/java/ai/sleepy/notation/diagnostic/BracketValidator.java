package ai.sleepy.notation.diagnostic;

import ai.sleepy.notation.lex.BracketKind;
import ai.sleepy.notation.lex.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cheap bracket-only check suitable for validating on every keystroke. Names, colons and
 * commas are ignored; exactly one diagnostic is reported per mismatch.
 */
public class BracketValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(BracketValidator.class);

    public List<Diagnostic> validate(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        List<Diagnostic> diagnostics = new ArrayList<>();
        BracketFrames frames = new BracketFrames();

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Optional<BracketKind> opening = BracketKind.ofOpening(token.kind());
            if (opening.isPresent()) {
                frames.push(opening.get(), token);
                continue;
            }
            Optional<BracketKind> closing = BracketKind.ofClosing(token.kind());
            if (closing.isPresent()) {
                frames.close(closing.get(), tokens, i, diagnostics);
            }
        }
        frames.closeUnclosed(0, diagnostics);
        LOGGER.debug("Validated {} tokens: {} diagnostic(s)", tokens.size(), diagnostics.size());
        return List.copyOf(diagnostics);
    }
}
