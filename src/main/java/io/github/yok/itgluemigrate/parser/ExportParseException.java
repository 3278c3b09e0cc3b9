package io.github.yok.itgluemigrate.parser;

import java.nio.file.Path;
import lombok.Getter;

/**
 * Thrown when an export file cannot be read or contains malformed content.
 *
 * <p>
 * {@link #getRow()} is the 1-based line of the offending record in the file (the header is row
 * 1), or {@code null} when the problem concerns the file as a whole.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ExportParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;
    private final Integer row;

    /**
     * Creates the exception for a file-level problem.
     *
     * @param path offending file
     * @param message description
     */
    public ExportParseException(Path path, String message) {
        this(path, message, null, null);
    }

    /**
     * Creates the exception for a problem at a specific row.
     *
     * @param path offending file
     * @param message description
     * @param row 1-based file row, or {@code null}
     * @param cause underlying error, or {@code null}
     */
    public ExportParseException(Path path, String message, Integer row, Throwable cause) {
        super(buildMessage(path, message, row), cause);
        this.path = path;
        this.row = row;
    }

    private static String buildMessage(Path path, String message, Integer row) {
        if (row != null) {
            return path + " (row " + row + "): " + message;
        }
        return path + ": " + message;
    }
}
