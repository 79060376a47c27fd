package ai.sleepy.notation.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes formatted notation back to disk.
 */
public class DocumentWriter {

    public void write(Path target, String text) {
        if (target == null || text == null) {
            throw new IllegalArgumentException("target and text must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException ex) {
            throw new NotationIoException("Failed to write notation document: " + target, ex);
        }
    }
}
