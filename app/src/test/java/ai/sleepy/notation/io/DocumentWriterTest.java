package ai.sleepy.notation.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesTextAndCreatesDirectories() throws Exception {
        DocumentWriter writer = new DocumentWriter();
        Path target = tempDir.resolve("ui/login.sleepy");

        writer.write(target, "login:(\n  h1: \"Welcome\"\n)\n");

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("login:(\n  h1: \"Welcome\"\n)\n");
    }

    @Test
    void replacesExistingContent() throws Exception {
        DocumentWriter writer = new DocumentWriter();
        Path target = tempDir.resolve("card.sleepy");
        Files.writeString(target, "card : (  title:x  )   \n\n\n", StandardCharsets.UTF_8);

        writer.write(target, "card:(\n  title: x\n)\n");

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("card:(\n  title: x\n)\n");
    }

    @Test
    void wrapsFailuresInNotationIoException() throws Exception {
        DocumentWriter writer = new DocumentWriter();
        Path directory = Files.createDirectory(tempDir.resolve("taken"));

        assertThatThrownBy(() -> writer.write(directory, "a:b"))
                .isInstanceOf(NotationIoException.class)
                .hasMessageContaining("taken");
    }
}
