package ai.sleepy.notation.assist;

import java.util.Objects;

/**
 * A completion candidate.
 *
 * @param insertText text to insert in place of the word being typed
 */
public record Suggestion(String label, SuggestionKind kind, String detail, String insertText) {

    public Suggestion {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
        Objects.requireNonNull(insertText, "insertText");
    }

    static Suggestion plain(String label, SuggestionKind kind, String detail) {
        return new Suggestion(label, kind, detail, label);
    }
}
