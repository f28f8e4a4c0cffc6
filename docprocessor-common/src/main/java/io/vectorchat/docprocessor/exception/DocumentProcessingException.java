package io.vectorchat.docprocessor.exception;

/**
 * Raised when a document or text submission cannot be turned into indexable chunks.
 *
 * <p>Messages name the failed operation and the input (filename, size) but never carry raw
 * document content.</p>
 */
public class DocumentProcessingException extends RuntimeException {

    public DocumentProcessingException(String message) {
        super(message);
    }

    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
