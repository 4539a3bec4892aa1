package io.sagescan.report;

import io.sagescan.model.ProjectResult;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders a {@link ProjectResult}. Reporters only read the result.
 */
public interface Reporter {

    /**
     * Returns the format name, e.g. {@code json}.
     */
    String format();

    void write(ProjectResult result, Writer writer) throws IOException;

    default void write(ProjectResult result, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(result, writer);
        }
    }

    default String render(ProjectResult result) {
        StringWriter out = new StringWriter();
        try {
            write(result, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
