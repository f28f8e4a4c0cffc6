package io.vectorchat.docprocessor.exception;

import lombok.Getter;

/**
 * Failure reported by (or while reaching) the markdown conversion service.
 *
 * <p>{@link #getStatusCode()} is the HTTP status returned by the service, or
 * {@link #TRANSPORT_FAILURE} when no response was received (timeout, refused connection,
 * interrupted call). Retrying is left to the caller.</p>
 */
@Getter
public class ConversionServiceException extends DocumentProcessingException {

    public static final int TRANSPORT_FAILURE = -1;

    private final int statusCode;
    private final String detail;

    public ConversionServiceException(String message, int statusCode, String detail) {
        super(message);
        this.statusCode = statusCode;
        this.detail = detail;
    }

    public ConversionServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = TRANSPORT_FAILURE;
        this.detail = cause.getMessage();
    }
}
