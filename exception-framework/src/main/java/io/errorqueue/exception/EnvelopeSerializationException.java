package io.errorqueue.exception;

/**
 * An error envelope could not be written or read.
 */
public class EnvelopeSerializationException extends TechnicalException {

    public EnvelopeSerializationException(String operation, Throwable cause) {
        super(
            "ENVELOPE_SERIALIZATION_ERROR",
            String.format("Failed to %s error envelope: %s", operation, cause.getMessage()),
            cause
        );
        with("operation", operation);
    }
}
