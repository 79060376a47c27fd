package ai.sleepy.notation.ast;

import ai.sleepy.notation.diagnostic.Diagnostic;
import java.util.List;
import java.util.Objects;

/**
 * Output of one parse call.
 *
 * @param root the single top-level node, or an anonymous document node holding every
 *             top-level item when there are zero or several
 * @param roots top-level items in source order
 * @param diagnostics problems in the order they were found
 */
public record ParseResult(Node root, List<Element> roots, List<Diagnostic> diagnostics) {

    public ParseResult {
        Objects.requireNonNull(root, "root");
        roots = List.copyOf(Objects.requireNonNull(roots, "roots"));
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
