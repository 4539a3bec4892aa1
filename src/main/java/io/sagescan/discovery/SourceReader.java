package io.sagescan.discovery;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads source files as text.
 * <p>
 * Content is decoded as UTF-8; on malformed input the bytes are decoded again with
 * the fallback charset (ISO-8859-1 by default). A file that cannot be read at all
 * raises {@link FileAccessException}, never empty content.
 */
public class SourceReader {

    private final Charset primary;
    private final Charset fallback;

    public SourceReader() {
        this(StandardCharsets.UTF_8, StandardCharsets.ISO_8859_1);
    }

    public SourceReader(Charset primary, Charset fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    public String read(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException | SecurityException e) {
            throw new FileAccessException("Cannot read file: " + e.getMessage(), path.toString(), e);
        }

        try {
            return decode(bytes, primary);
        } catch (CharacterCodingException e) {
            try {
                return decode(bytes, fallback);
            } catch (CharacterCodingException fallbackFailure) {
                throw new FileAccessException("Cannot decode file as " + primary + " or " + fallback,
                        path.toString(), fallbackFailure);
            }
        }
    }

    private static String decode(byte[] bytes, Charset charset) throws CharacterCodingException {
        String text = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        // strip a UTF-8 byte order mark
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            return text.substring(1);
        }
        return text;
    }
}
