package io.sagescan.discovery;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceReaderTest {

    @TempDir
    Path tempDir;

    private final SourceReader reader = new SourceReader();

    @Test
    void read_decodesUtf8() throws IOException {
        Path file = Files.writeString(tempDir.resolve("a.py"), "name = \"ünïcode\"\n", StandardCharsets.UTF_8);

        assertThat(reader.read(file)).isEqualTo("name = \"ünïcode\"\n");
    }

    @Test
    void read_fallsBackToLatin1OnMalformedUtf8() throws IOException {
        Path file = Files.write(tempDir.resolve("b.py"), new byte[]{'c', 'a', 'f', (byte) 0xE9});

        assertThat(reader.read(file)).isEqualTo("café");
    }

    @Test
    void read_stripsByteOrderMark() throws IOException {
        Path file = Files.write(tempDir.resolve("c.py"),
                new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'x', '=', '1'});

        assertThat(reader.read(file)).isEqualTo("x=1");
    }

    @Test
    void read_failsForMissingFile() {
        Path missing = tempDir.resolve("missing.py");

        assertThatThrownBy(() -> reader.read(missing))
                .isInstanceOf(FileAccessException.class)
                .satisfies(e -> assertThat(((FileAccessException) e).filePath()).isEqualTo(missing.toString()));
    }
}
