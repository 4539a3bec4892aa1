package io.sagescan.discovery;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GlobFileDiscoveryTest {

    @TempDir
    Path tempDir;

    private Path write(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, "x = 1\n");
    }

    private List<String> relativeNames(List<Path> files) {
        return files.stream().map(f -> tempDir.relativize(f).toString().replace('\\', '/')).toList();
    }

    @Test
    void discover_matchesIncludeGlobsSorted() throws IOException {
        write("b.py");
        write("a.py");
        write("pkg/c.py");
        write("notes.txt");

        GlobFileDiscovery discovery = new GlobFileDiscovery(List.of("*.py"), List.of(), false);

        assertThat(relativeNames(discovery.discover(tempDir))).containsExactly("a.py", "b.py", "pkg/c.py");
    }

    @Test
    void discover_skipsToolingDirectories() throws IOException {
        write("app.js");
        write("node_modules/lib/index.js");
        write(".git/hooks/pre-commit.js");
        write("__pycache__/x.py");

        GlobFileDiscovery discovery = new GlobFileDiscovery(List.of("*.js", "*.py"), List.of(), false);

        assertThat(relativeNames(discovery.discover(tempDir))).containsExactly("app.js");
    }

    @Test
    void discover_appliesIgnorePatterns() throws IOException {
        write("app.js");
        write("vendor.min.js");
        write("generated/out.js");

        GlobFileDiscovery discovery = new GlobFileDiscovery(List.of("*.js"), List.of("*.min.js", "generated"), false);

        assertThat(relativeNames(discovery.discover(tempDir))).containsExactly("app.js");
    }

    @Test
    void discover_honoursGitignoreWhenRequested() throws IOException {
        write("keep.py");
        write("secret/skip.py");
        Files.writeString(tempDir.resolve(".gitignore"), "# local\nsecret/\n");

        assertThat(relativeNames(new GlobFileDiscovery(List.of("*.py"), List.of(), true).discover(tempDir)))
                .containsExactly("keep.py");
        assertThat(relativeNames(new GlobFileDiscovery(List.of("*.py"), List.of(), false).discover(tempDir)))
                .containsExactly("keep.py", "secret/skip.py");
    }

    @Test
    void discover_acceptsSingleFileRoot() throws IOException {
        Path file = write("only.py");

        assertThat(new GlobFileDiscovery(List.of("*.py"), List.of(), false).discover(file)).containsExactly(file);
        assertThat(new GlobFileDiscovery(List.of("*.js"), List.of(), false).discover(file)).isEmpty();
    }

    @Test
    void discover_failsForMissingRoot() {
        GlobFileDiscovery discovery = new GlobFileDiscovery(List.of(), List.of(), false);

        assertThatThrownBy(() -> discovery.discover(tempDir.resolve("absent")))
                .isInstanceOf(FileAccessException.class)
                .hasMessageContaining("does not exist");
    }
}
