package ai.sleepy.notation.generate;

/**
 * Runtime exception used to propagate generation failures.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
