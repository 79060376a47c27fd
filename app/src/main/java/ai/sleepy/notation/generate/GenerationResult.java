package ai.sleepy.notation.generate;

import ai.sleepy.notation.diagnostic.Diagnostic;
import java.util.List;
import java.util.Objects;

/**
 * Final notation handed back to the caller.
 *
 * @param attempts number of model calls made; 0 when only the template generator ran
 * @param diagnostics problems remaining in {@code notation}; empty for accepted output
 */
public record GenerationResult(String notation, Source source, int attempts, List<Diagnostic> diagnostics) {

    public enum Source {
        MODEL,
        TEMPLATE
    }

    public GenerationResult {
        Objects.requireNonNull(notation, "notation");
        Objects.requireNonNull(source, "source");
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
    }

    public boolean isValid() {
        return diagnostics.isEmpty();
    }
}
