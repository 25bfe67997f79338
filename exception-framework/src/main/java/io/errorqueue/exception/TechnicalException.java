package io.errorqueue.exception;

/**
 * Base class for infrastructure failures: broker connectivity, serialization, I/O.
 */
public abstract class TechnicalException extends ErrorQueueException {

    protected TechnicalException(String code, String message) {
        super(code, message);
    }

    protected TechnicalException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
