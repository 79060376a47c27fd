package ai.sleepy.notation.diagnostic;

import ai.sleepy.notation.lex.BracketKind;
import ai.sleepy.notation.lex.Token;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stack of open brackets shared by the parser and the validator.
 *
 * <p>A wrong-kind close that substitutes for the innermost frame marks the frames enclosing
 * it; a marked frame is not reported again as unclosed at end of input. Stray closes and
 * closes that unwind to an outer frame mark nothing, so brackets left open around them are
 * still reported.
 */
public final class BracketFrames {

    private final List<BracketKind> kinds = new ArrayList<>();
    private final List<Token> openers = new ArrayList<>();
    private final List<Boolean> marked = new ArrayList<>();

    public void push(BracketKind kind, Token opener) {
        kinds.add(kind);
        openers.add(opener);
        marked.add(Boolean.FALSE);
    }

    public void truncate(int size) {
        while (kinds.size() > size) {
            int last = kinds.size() - 1;
            kinds.remove(last);
            openers.remove(last);
            marked.remove(last);
        }
    }

    public int size() {
        return kinds.size();
    }

    /**
     * Decides the closing bracket at {@code tokens.get(index)}, records the mismatch if any and
     * applies the decision to the stack.
     */
    public BracketRecovery.Decision close(BracketKind found, List<Token> tokens, int index,
                                          List<Diagnostic> diagnostics) {
        BracketRecovery.Decision decision = BracketRecovery.decide(kinds, found, tokens, index);
        if (decision.reportsMismatch()) {
            diagnostics.add(BracketRecovery.describe(decision, kinds, tokens.get(index), found));
        }
        if (decision.action() == BracketRecovery.Action.SUBSTITUTE) {
            Collections.fill(marked, Boolean.TRUE);
        }
        if (decision.targetIndex() >= 0) {
            truncate(decision.targetIndex());
        }
        return decision;
    }

    /**
     * Reports and drops every frame at or above {@code from}, innermost first.
     */
    public void closeUnclosed(int from, List<Diagnostic> diagnostics) {
        for (int i = kinds.size() - 1; i >= from; i--) {
            if (!marked.get(i)) {
                diagnostics.add(BracketRecovery.unclosed(openers.get(i), kinds.get(i)));
            }
        }
        truncate(from);
    }
}
