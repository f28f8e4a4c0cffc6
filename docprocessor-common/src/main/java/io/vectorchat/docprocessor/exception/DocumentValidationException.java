package io.vectorchat.docprocessor.exception;

/**
 * Input was rejected before or after conversion (size, filename, extension, empty content).
 * Never worth retrying with the same input.
 */
public class DocumentValidationException extends DocumentProcessingException {

    public DocumentValidationException(String message) {
        super(message);
    }
}
