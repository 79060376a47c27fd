package ai.sleepy.notation.io;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Raised when a notation document cannot be read or written.
 */
public class NotationIoException extends UncheckedIOException {

    public NotationIoException(String message, IOException cause) {
        super(message, cause);
    }
}
