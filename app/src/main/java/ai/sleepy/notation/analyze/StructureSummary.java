package ai.sleepy.notation.analyze;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregate counts for one document.
 *
 * @param sections section keywords present, in order of first appearance
 */
public record StructureSummary(Set<String> sections,
                               int apiEndpointCount,
                               int dbTableCount,
                               int uiComponentCount,
                               Complexity complexity) {

    public StructureSummary {
        sections = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(sections, "sections")));
        Objects.requireNonNull(complexity, "complexity");
    }
}
