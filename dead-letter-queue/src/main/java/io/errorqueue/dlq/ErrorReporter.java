package io.errorqueue.dlq;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.errorqueue.exception.BrokerException;
import io.errorqueue.logging.ReportContext;

/**
 * Redirects deliveries whose consumer callback threw to a durable error queue.
 *
 * Design decisions:
 * - The broker connection is opened lazily on the first failure and reopened when it
 *   is found closed. Connection creation is not serialized; a thread that loses the
 *   race closes its surplus connection.
 * - Each call publishes on its own session, so sessions are never shared.
 * - Queue and exchange/binding declarations are two independent one-shot cells. Only
 *   the declare step is locked, never the publish.
 * - The cells travel with the connection they were declared on. Under
 *   {@link ReconnectPolicy#REDECLARE} a replacement connection is installed together
 *   with fresh cells, so no thread can publish on it before declaring.
 * - Nothing escapes {@link #handleFailure}: every fault is classified into a
 *   {@link FaultKind} and reported to the {@link DiagnosticSink}.
 *
 * One instance per consumption pipeline; create at startup, {@link #dispose()} at shutdown.
 */
public class ErrorReporter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

    public static final String ERROR_QUEUE = "Burrow.Queue.Error";
    public static final String ERROR_EXCHANGE = "Burrow.Exchange.Error";

    public enum State {
        UNINITIALIZED, // No failure handled yet
        CONNECTED,     // Connection open, topology not yet guaranteed
        READY,         // Connection open, queue and exchange declared
        DISCONNECTED,  // Held connection closed, reopened on next failure
        DISPOSED
    }

    private final BrokerConnectionFactory connectionFactory;
    private final EnvelopeSerializer serializer;
    private final DiagnosticSink diagnostics;
    private final ReportListener listener;
    private final ReconnectPolicy reconnectPolicy;

    // Connection and its declaration cells are swapped together, never one without the other.
    private final AtomicReference<Link> link = new AtomicReference<>();

    // Handling takes the read side, dispose the write side.
    private final ReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private volatile boolean disposed;

    public ErrorReporter(BrokerConnectionFactory connectionFactory,
                         EnvelopeSerializer serializer,
                         DiagnosticSink diagnostics) {
        this(connectionFactory, serializer, diagnostics, ReportListener.NOOP, ReconnectPolicy.KEEP_DECLARATIONS);
    }

    public ErrorReporter(BrokerConnectionFactory connectionFactory,
                         EnvelopeSerializer serializer,
                         DiagnosticSink diagnostics,
                         ReportListener listener,
                         ReconnectPolicy reconnectPolicy) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
    }

    /**
     * Publishes an error envelope for a delivery whose processing failed.
     *
     * Safe to call from any number of consumer threads. Never throws: broker and
     * serialization faults end up as one diagnostic on the sink.
     */
    public void handleFailure(Delivery delivery, Throwable exception) {
        lifecycle.readLock().lock();
        try {
            if (disposed) {
                diagnostics.recordError("ErrorReporter: reporter is disposed, dropping error message for routing key '"
                        + (delivery == null ? null : delivery.getRoutingKey()) + "'");
                return;
            }
            try (ReportContext context = ReportContext.open(
                    delivery == null ? null : delivery.getRoutingKey(),
                    delivery == null ? null : delivery.getExchange())) {
                try {
                    publishErrorMessage(delivery, exception);
                } catch (Throwable fault) {
                    // Nothing may escape into the consumer's processing loop.
                    recordFault(fault);
                }
            }
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    /**
     * Releases the connection. Idempotent, and safe when no failure was ever handled.
     * Waits for in-flight reports to finish, so the connection is not used afterwards.
     */
    public void dispose() {
        lifecycle.writeLock().lock();
        try {
            if (disposed) {
                return;
            }
            disposed = true;
            Link held = link.getAndSet(null);
            if (held != null) {
                closeQuietly(held.connection);
            }
            log.debug("Error reporter disposed");
        } finally {
            lifecycle.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        dispose();
    }

    public State getState() {
        if (disposed) {
            return State.DISPOSED;
        }
        Link current = link.get();
        if (current == null) {
            return State.UNINITIALIZED;
        }
        if (!current.connection.isOpen()) {
            return State.DISCONNECTED;
        }
        return current.topology.isDeclared() ? State.READY : State.CONNECTED;
    }

    public boolean isTopologyDeclared() {
        Link current = link.get();
        return current != null && current.topology.isDeclared();
    }

    private void publishErrorMessage(Delivery delivery, Throwable exception) {
        long start = System.nanoTime();
        Link current = connect();

        try (BrokerSession session = current.connection.openSession()) {
            current.topology.declare(session);

            byte[] body = serializer.serialize(ErrorEnvelope.capture(delivery, exception));
            session.publish(ERROR_EXCHANGE, "", true, serializer.getContentType(), body);
        }

        log.debug("Published error message for {}", delivery);
        notifyListener(() -> listener.onPublished(delivery, Duration.ofNanos(System.nanoTime() - start)));
    }

    private Link connect() {
        Link current = link.get();
        if (current != null && current.connection.isOpen()) {
            return current;
        }

        BrokerConnection fresh = connectionFactory.createConnection();
        Topology topology = current == null || reconnectPolicy == ReconnectPolicy.REDECLARE
                ? new Topology()
                : current.topology;
        Link next = new Link(fresh, topology);
        if (!link.compareAndSet(current, next)) {
            // Another thread replaced the connection first; use theirs.
            closeQuietly(fresh);
            Link winner = link.get();
            return winner != null ? winner : next;
        }

        if (current != null) {
            log.info("Reconnected error reporter to {}", connectionFactory.getHost());
            closeQuietly(current.connection);
        }
        return next;
    }

    private void recordFault(Throwable fault) {
        FaultKind kind = FaultKind.classify(fault);
        String message = switch (kind) {
            case UNREACHABLE_BROKER -> "ErrorReporter: cannot connect to broker.\n"
                    + connectionCheckMessage();
            case OPERATION_INTERRUPTED -> "ErrorReporter: broker connection was closed while attempting to publish error message.\n"
                    + String.format("Message was: '%s'\n", ((BrokerException) fault).getReason())
                    + connectionCheckMessage();
            case UNEXPECTED -> "ErrorReporter: failed to publish error message\nException is:\n"
                    + ErrorEnvelope.describe(fault);
        };
        diagnostics.recordError(message);
        notifyListener(() -> listener.onFault(kind));
    }

    private String connectionCheckMessage() {
        return "Please check the connection settings and that the RabbitMQ broker is running at the specified endpoint.\n"
                + String.format("\tHost: '%s'\n", connectionFactory.getHost())
                + String.format("\tVirtualHost: '%s'\n", connectionFactory.getVirtualHost())
                + String.format("\tUsername: '%s'\n", connectionFactory.getUsername())
                + "Failed to write error message to error queue";
    }

    private void notifyListener(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.warn("Report listener failed: {}", e.getMessage(), e);
        }
    }

    private void closeQuietly(BrokerConnection target) {
        try {
            target.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close error reporter connection: {}", e.getMessage());
        }
    }

    private static final class Link {
        final BrokerConnection connection;
        final Topology topology;

        Link(BrokerConnection connection, Topology topology) {
            this.connection = connection;
            this.topology = topology;
        }
    }

    /**
     * Declaration cells for the error queue and for the exchange plus binding.
     * Independent, so a failed exchange declare does not repeat the queue declare.
     */
    private static final class Topology {
        private final DeclareOnce queue = new DeclareOnce("error queue " + ERROR_QUEUE);
        private final DeclareOnce exchange = new DeclareOnce("error exchange " + ERROR_EXCHANGE);

        void declare(BrokerSession session) {
            queue.runOnce(() -> session.declareQueue(ERROR_QUEUE, true, false, false));
            exchange.runOnce(() -> {
                session.declareDirectExchange(ERROR_EXCHANGE, true);
                session.bindQueue(ERROR_QUEUE, ERROR_EXCHANGE, "");
            });
        }

        boolean isDeclared() {
            return queue.isDeclared() && exchange.isDeclared();
        }
    }
}
