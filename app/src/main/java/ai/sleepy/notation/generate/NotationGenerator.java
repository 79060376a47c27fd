package ai.sleepy.notation.generate;

/**
 * Produces candidate notation text. Candidates are not guaranteed to be valid.
 */
public interface NotationGenerator {

    String generate(GenerationRequest request);
}
