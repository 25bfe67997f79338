package io.errorqueue.dlq;

/**
 * Receives the diagnostic text produced when an error message could not be written
 * to the error queue. Fire and forget: implementations must not throw.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void recordError(String message);
}
