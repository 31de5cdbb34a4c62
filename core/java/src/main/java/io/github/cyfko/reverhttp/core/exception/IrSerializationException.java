package io.github.cyfko.reverhttp.core.exception;

/**
 * Wraps a failure to serialize an IR document.
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public class IrSerializationException extends RuntimeException {

    /**
     * @param message what was being serialized
     * @param cause   the underlying serializer error
     */
    public IrSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
