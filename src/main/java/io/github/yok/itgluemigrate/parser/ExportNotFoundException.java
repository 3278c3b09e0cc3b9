package io.github.yok.itgluemigrate.parser;

import java.nio.file.Path;
import lombok.Getter;

/**
 * Thrown when an export directory or a required export file does not exist.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ExportNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    /**
     * Creates the exception for a missing path.
     *
     * @param path missing path
     */
    public ExportNotFoundException(Path path) {
        super("Export path not found: " + path);
        this.path = path;
    }
}
