package io.errorqueue.dlq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes diagnostics at ERROR level through SLF4J.
 */
public class Slf4jDiagnosticSink implements DiagnosticSink {

    private final Logger log;

    public Slf4jDiagnosticSink() {
        this(LoggerFactory.getLogger(ErrorReporter.class));
    }

    public Slf4jDiagnosticSink(Logger log) {
        this.log = log;
    }

    @Override
    public void recordError(String message) {
        log.error(message);
    }
}
