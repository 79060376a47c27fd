package ai.sleepy.notation.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads notation text as UTF-8 from files or standard input.
 */
public class DocumentReader {

    public String read(Path source) {
        Objects.requireNonNull(source, "source");
        try {
            return Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new NotationIoException("Failed to read notation document: " + source, ex);
        }
    }

    public String read(InputStream input) {
        Objects.requireNonNull(input, "input");
        try {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new NotationIoException("Failed to read notation from standard input", ex);
        }
    }
}
