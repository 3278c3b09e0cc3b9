package io.github.yok.itgluemigrate.util;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads export text files that are usually UTF-8 (often with a BOM) but occasionally Latin-1.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class TextFiles {

    private static final char BOM = '\uFEFF';

    private TextFiles() {
        // Utility class; do not instantiate.
    }

    /**
     * Reads the whole file as text.
     *
     * <p>
     * The bytes are decoded as strict UTF-8 first and a leading BOM is dropped. If the content is
     * not valid UTF-8, it is decoded as ISO-8859-1, which accepts any byte sequence.
     * </p>
     *
     * @param file file to read
     * @return decoded text
     * @throws IOException if the file cannot be read
     */
    public static String readText(Path file) throws IOException {
        Preconditions.checkNotNull(file, "file must not be null");
        byte[] bytes = Files.readAllBytes(file);
        return decode(bytes, file);
    }

    static String decode(byte[] bytes, Path source) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        String text;
        try {
            text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            log.debug("Not valid UTF-8, falling back to ISO-8859-1: {}", source);
            text = new String(bytes, StandardCharsets.ISO_8859_1);
        }
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        return text;
    }
}
