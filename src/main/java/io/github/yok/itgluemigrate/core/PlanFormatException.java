package io.github.yok.itgluemigrate.core;

/**
 * Thrown when a migration plan file cannot be read or does not have the expected shape.
 *
 * @author Yasuharu.Okawauchi
 */
public class PlanFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PlanFormatException(String message) {
        super(message);
    }

    public PlanFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
