package io.github.yok.itgluemigrate.client;

import lombok.Getter;

/**
 * Failure of a destination API call.
 *
 * <p>
 * {@code status} is the HTTP status code, or {@code 0} when no response was received (timeout,
 * connection refused).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int status;

    // The "detail" of an error body, else the body itself.
    private final String detail;

    // Raw response body, may be null.
    private final String body;

    public ApiException(int status, String detail) {
        this(status, detail, null, null);
    }

    /**
     * Creates the exception.
     *
     * @param status HTTP status, 0 for transport failures
     * @param detail error description
     * @param body raw response body
     * @param cause underlying failure
     */
    public ApiException(int status, String detail, String body, Throwable cause) {
        super("API Error " + status + ": " + detail, cause);
        this.status = status;
        this.detail = detail;
        this.body = body;
    }
}
