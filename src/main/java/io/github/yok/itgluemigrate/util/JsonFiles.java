package io.github.yok.itgluemigrate.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes JSON files so that readers only ever see the previous or the new complete content.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class JsonFiles {

    private JsonFiles() {
        // Utility class; do not instantiate.
    }

    /**
     * Serializes {@code value} to a temp file next to {@code target} and moves it over the target.
     *
     * <p>
     * The move is atomic where the file system supports it; otherwise it falls back to a plain
     * replacing move. Parent directories are created. The temp file is removed on failure.
     * </p>
     *
     * @param mapper mapper to serialize with
     * @param target file to replace
     * @param value value to write
     * @throws IOException if the file cannot be written or moved
     */
    public static void writeAtomically(ObjectMapper mapper, Path target, Object value)
            throws IOException {
        Preconditions.checkNotNull(mapper, "mapper must not be null");
        Preconditions.checkNotNull(target, "target must not be null");
        Path absolute = target.toAbsolutePath();
        Path parent = absolute.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        try {
            mapper.writeValue(temp.toFile(), value);
            try {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing in place", absolute);
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }
}
