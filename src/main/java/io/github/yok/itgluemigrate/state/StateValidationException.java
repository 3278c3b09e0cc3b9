package io.github.yok.itgluemigrate.state;

/**
 * Thrown when a state or id map file cannot be loaded: unreadable, not JSON, an unsupported
 * version, or a malformed structure.
 *
 * @author Yasuharu.Okawauchi
 */
public class StateValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StateValidationException(String message) {
        super(message);
    }

    public StateValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
