package ai.sleepy.notation;

import ai.sleepy.notation.analyze.ComplexityThresholds;
import java.util.Objects;

/**
 * Tunables handed to the engine by its caller.
 *
 * @param maxDepth deepest bracket nesting the parser descends into; deeper groups are
 *                 reported and skipped. At most {@link #MAX_SUPPORTED_DEPTH}, since the parser,
 *                 formatter and classifier recurse once per level
 * @param thresholds breakpoints for the complexity label of a structure summary
 */
public record EngineSettings(int maxDepth, ComplexityThresholds thresholds) {

    public static final int DEFAULT_MAX_DEPTH = 256;
    public static final int MAX_SUPPORTED_DEPTH = 1024;

    public EngineSettings {
        requireSupportedDepth(maxDepth, "maxDepth");
        Objects.requireNonNull(thresholds, "thresholds");
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_MAX_DEPTH, ComplexityThresholds.defaults());
    }

    public EngineSettings withMaxDepth(int depth) {
        return new EngineSettings(depth, thresholds);
    }

    public static int requireSupportedDepth(int depth, String name) {
        if (depth < 1 || depth > MAX_SUPPORTED_DEPTH) {
            throw new IllegalArgumentException(name + " must be between 1 and " + MAX_SUPPORTED_DEPTH);
        }
        return depth;
    }
}
