package ai.sleepy.notation.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentReaderTest {

    @TempDir
    Path tempDir;

    private final DocumentReader reader = new DocumentReader();

    @Test
    void readsUtf8File() throws Exception {
        Path source = tempDir.resolve("menu.sleepy");
        Files.writeString(source, "h1: \"Café ☕\"", StandardCharsets.UTF_8);

        assertThat(reader.read(source)).isEqualTo("h1: \"Café ☕\"");
    }

    @Test
    void readsStandardInput() {
        ByteArrayInputStream input = new ByteArrayInputStream("{a:b}".getBytes(StandardCharsets.UTF_8));

        assertThat(reader.read(input)).isEqualTo("{a:b}");
    }

    @Test
    void missingFileRaisesNotationIoException() {
        Path missing = tempDir.resolve("missing.sleepy");

        assertThatThrownBy(() -> reader.read(missing))
                .isInstanceOf(NotationIoException.class)
                .hasMessageContaining("missing.sleepy");
    }
}
