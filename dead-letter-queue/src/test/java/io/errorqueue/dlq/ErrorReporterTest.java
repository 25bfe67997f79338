package io.errorqueue.dlq;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.errorqueue.exception.BrokerException;
import io.errorqueue.exception.EnvelopeSerializationException;

@ExtendWith(MockitoExtension.class)
class ErrorReporterTest {

    private static final String ERROR_QUEUE = ErrorReporter.ERROR_QUEUE;
    private static final String ERROR_EXCHANGE = ErrorReporter.ERROR_EXCHANGE;

    @Mock
    private BrokerConnectionFactory connectionFactory;

    @Mock
    private BrokerConnection connection;

    @Mock
    private BrokerSession session;

    private final JacksonEnvelopeSerializer serializer = new JacksonEnvelopeSerializer();
    private final List<String> diagnostics = new CopyOnWriteArrayList<>();
    private ErrorReporter reporter;

    @BeforeEach
    void setUp() {
        lenient().when(connectionFactory.getHost()).thenReturn("rabbit-prod-1");
        lenient().when(connectionFactory.getVirtualHost()).thenReturn("/orders");
        lenient().when(connectionFactory.getUsername()).thenReturn("order-service");
        lenient().when(connectionFactory.createConnection()).thenReturn(connection);
        lenient().when(connection.isOpen()).thenReturn(true);
        lenient().when(connection.openSession()).thenReturn(session);

        reporter = new ErrorReporter(connectionFactory, serializer, diagnostics::add);
    }

    @Nested
    @DisplayName("Publishing")
    class Publishing {

        @Test
        @DisplayName("should declare queue, then exchange and binding, then publish")
        void shouldDeclareBeforePublish() {
            reporter.handleFailure(orderDelivery(), new IllegalArgumentException("bad json"));

            InOrder inOrder = inOrder(session);
            inOrder.verify(session).declareQueue(ERROR_QUEUE, true, false, false);
            inOrder.verify(session).declareDirectExchange(ERROR_EXCHANGE, true);
            inOrder.verify(session).bindQueue(ERROR_QUEUE, ERROR_EXCHANGE, "");
            inOrder.verify(session).publish(eq(ERROR_EXCHANGE), eq(""), eq(true), eq("application/json"), any());
            inOrder.verify(session).close();
            assertThat(diagnostics).isEmpty();
        }

        @Test
        @DisplayName("should publish envelope with original delivery and exception")
        void shouldPublishEnvelope() {
            reporter.handleFailure(orderDelivery(), new IllegalArgumentException("bad json"));

            ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
            verify(session).publish(eq(ERROR_EXCHANGE), eq(""), eq(true), any(), body.capture());

            ErrorEnvelope envelope = serializer.deserialize(body.getValue());
            assertThat(envelope.getRoutingKey()).isEqualTo("orders.created");
            assertThat(envelope.getExchange()).isEqualTo("orders");
            assertThat(envelope.getMessage()).isEqualTo("{\"id\":1}");
            assertThat(envelope.getException())
                    .contains("IllegalArgumentException")
                    .contains("bad json")
                    .contains("at ");
            assertThat(envelope.getDateTime()).isNotNull();
            assertThat(envelope.getBasicProperties())
                    .containsEntry("contentType", "application/json")
                    .containsEntry("deliveryMode", 2);
        }

        @Test
        @DisplayName("should not re-declare on second failure but still publish it")
        void shouldDeclareOnlyOnce() {
            reporter.handleFailure(orderDelivery(), new RuntimeException("first"));
            reporter.handleFailure(orderDelivery(), new RuntimeException("second"));

            verify(connectionFactory, times(1)).createConnection();
            verify(connection, times(2)).openSession();
            verify(session, times(1)).declareQueue(anyString(), anyBoolean(), anyBoolean(), anyBoolean());
            verify(session, times(1)).declareDirectExchange(anyString(), anyBoolean());
            verify(session, times(1)).bindQueue(anyString(), anyString(), anyString());
            verify(session, times(2)).publish(eq(ERROR_EXCHANGE), eq(""), eq(true), any(), any());
            verify(session, times(2)).close();
        }

        @Test
        @DisplayName("should reconnect without re-declaring when connection was closed")
        void shouldReconnectWithoutRedeclaring() {
            BrokerConnection second = mock(BrokerConnection.class);
            BrokerSession secondSession = mock(BrokerSession.class);
            when(second.openSession()).thenReturn(secondSession);

            reporter.handleFailure(orderDelivery(), new RuntimeException("first"));

            when(connection.isOpen()).thenReturn(false);
            when(connectionFactory.createConnection()).thenReturn(second);
            reporter.handleFailure(orderDelivery(), new RuntimeException("second"));

            verify(connectionFactory, times(2)).createConnection();
            verify(secondSession, never()).declareQueue(anyString(), anyBoolean(), anyBoolean(), anyBoolean());
            verify(secondSession, never()).declareDirectExchange(anyString(), anyBoolean());
            verify(secondSession).publish(eq(ERROR_EXCHANGE), eq(""), eq(true), any(), any());
        }

        @Test
        @DisplayName("should re-declare after reconnect when policy asks for it")
        void shouldRedeclareAfterReconnectWithPolicy() {
            ErrorReporter redeclaring = new ErrorReporter(connectionFactory, serializer, diagnostics::add,
                    ReportListener.NOOP, ReconnectPolicy.REDECLARE);
            BrokerConnection second = mock(BrokerConnection.class);
            BrokerSession secondSession = mock(BrokerSession.class);
            when(second.isOpen()).thenReturn(true);
            when(second.openSession()).thenReturn(secondSession);

            redeclaring.handleFailure(orderDelivery(), new RuntimeException("first"));
            when(connection.isOpen()).thenReturn(false);
            when(connectionFactory.createConnection()).thenReturn(second);
            redeclaring.handleFailure(orderDelivery(), new RuntimeException("second"));
            redeclaring.handleFailure(orderDelivery(), new RuntimeException("third"));

            verify(secondSession, times(1)).declareQueue(ERROR_QUEUE, true, false, false);
            verify(secondSession, times(1)).declareDirectExchange(ERROR_EXCHANGE, true);
            verify(secondSession, times(1)).bindQueue(ERROR_QUEUE, ERROR_EXCHANGE, "");
            verify(secondSession, times(2)).publish(eq(ERROR_EXCHANGE), eq(""), eq(true), any(), any());
        }

        @Test
        @DisplayName("should notify listener of published report")
        void shouldNotifyListener() {
            ReportListener listener = mock(ReportListener.class);
            ErrorReporter observed = new ErrorReporter(connectionFactory, serializer, diagnostics::add,
                    listener, ReconnectPolicy.KEEP_DECLARATIONS);
            Delivery delivery = orderDelivery();

            observed.handleFailure(delivery, new RuntimeException("boom"));

            verify(listener).onPublished(eq(delivery), any(Duration.class));
            verify(listener, never()).onFault(any());
        }
    }

    @Nested
    @DisplayName("Fault Isolation")
    class FaultIsolation {

        @Test
        @DisplayName("should log endpoint when broker is unreachable")
        void shouldLogEndpointWhenUnreachable() {
            when(connectionFactory.createConnection()).thenThrow(
                    BrokerException.unreachable("rabbit-prod-1", "/orders", "order-service", null));

            assertThatCode(() -> reporter.handleFailure(orderDelivery(), new RuntimeException("boom")))
                    .doesNotThrowAnyException();

            assertThat(diagnostics).hasSize(1);
            assertThat(diagnostics.get(0))
                    .contains("cannot connect to broker")
                    .contains("Host: 'rabbit-prod-1'")
                    .contains("VirtualHost: '/orders'")
                    .contains("Username: 'order-service'")
                    .contains("Failed to write error message to error queue");
        }

        @Test
        @DisplayName("should not retry connecting within the same call")
        void shouldNotRetryWithinCall() {
            when(connectionFactory.createConnection()).thenThrow(
                    BrokerException.unreachable("rabbit-prod-1", "/orders", "order-service", null));

            reporter.handleFailure(orderDelivery(), new RuntimeException("boom"));

            verify(connectionFactory, times(1)).createConnection();
            assertThat(reporter.getState()).isEqualTo(ErrorReporter.State.UNINITIALIZED);
        }

        @Test
        @DisplayName("should log interruption reason when session cannot be opened")
        void shouldLogReasonWhenSessionFails() {
            when(connection.openSession()).thenThrow(
                    BrokerException.interrupted("CONNECTION_FORCED - Closed via management plugin", null));

            reporter.handleFailure(orderDelivery(), new RuntimeException("boom"));

            assertThat(diagnostics).hasSize(1);
            assertThat(diagnostics.get(0))
                    .contains("broker connection was closed")
                    .contains("CONNECTION_FORCED - Closed via management plugin")
                    .contains("Host: 'rabbit-prod-1'");
        }

        @Test
        @DisplayName("should keep declarations when publish is interrupted")
        void shouldKeepDeclarationsWhenPublishInterrupted() {
            doThrow(BrokerException.interrupted("channel error; reply-code=404", null))
                    .when(session).publish(anyString(), anyString(), anyBoolean(), any(), any());

            assertThatCode(() -> reporter.handleFailure(orderDelivery(), new RuntimeException("boom")))
                    .doesNotThrowAnyException();

            assertThat(diagnostics).hasSize(1);
            assertThat(diagnostics.get(0)).contains("channel error; reply-code=404");
            assertThat(reporter.isTopologyDeclared()).isTrue();
            verify(session).close();
        }

        @Test
        @DisplayName("should complete only the missing declaration after a partial failure")
        void shouldCompletePartialDeclaration() {
            doThrow(BrokerException.interrupted("exchange declare refused", null))
                    .doNothing()
                    .when(session).declareDirectExchange(anyString(), anyBoolean());

            reporter.handleFailure(orderDelivery(), new RuntimeException("first"));
            assertThat(reporter.isTopologyDeclared()).isFalse();

            reporter.handleFailure(orderDelivery(), new RuntimeException("second"));

            verify(session, times(1)).declareQueue(anyString(), anyBoolean(), anyBoolean(), anyBoolean());
            verify(session, times(2)).declareDirectExchange(ERROR_EXCHANGE, true);
            verify(session, times(1)).bindQueue(ERROR_QUEUE, ERROR_EXCHANGE, "");
            verify(session, times(1)).publish(anyString(), anyString(), anyBoolean(), any(), any());
            assertThat(reporter.isTopologyDeclared()).isTrue();
        }

        @Test
        @DisplayName("should log full detail when serializer fails")
        void shouldLogSerializerFailure() {
            EnvelopeSerializer failing = mock(EnvelopeSerializer.class);
            when(failing.serialize(any())).thenThrow(
                    new EnvelopeSerializationException("serialize", new IllegalStateException("cyclic reference")));
            ErrorReporter withFailingSerializer = new ErrorReporter(connectionFactory, failing, diagnostics::add);

            withFailingSerializer.handleFailure(orderDelivery(), new RuntimeException("boom"));

            assertThat(diagnostics).hasSize(1);
            assertThat(diagnostics.get(0))
                    .contains("failed to publish error message")
                    .contains("EnvelopeSerializationException")
                    .contains("cyclic reference");
            verify(session).close();
            verify(session, never()).publish(anyString(), anyString(), anyBoolean(), any(), any());
        }

        @Test
        @DisplayName("should absorb unexpected faults from declaration")
        void shouldAbsorbUnexpectedDeclareFault() {
            doThrow(new IllegalStateException("session in wrong state"))
                    .when(session).declareQueue(anyString(), anyBoolean(), anyBoolean(), anyBoolean());

            assertThatCode(() -> reporter.handleFailure(orderDelivery(), new RuntimeException("boom")))
                    .doesNotThrowAnyException();

            assertThat(diagnostics).singleElement().asString().contains("session in wrong state");
            assertThat(reporter.isTopologyDeclared()).isFalse();
        }

        @Test
        @DisplayName("should absorb errors such as resource exhaustion")
        void shouldAbsorbErrors() {
            when(connection.openSession()).thenThrow(new OutOfMemoryError("unable to create native thread"));

            assertThatCode(() -> reporter.handleFailure(orderDelivery(), new RuntimeException("boom")))
                    .doesNotThrowAnyException();

            assertThat(diagnostics).singleElement().asString().contains("unable to create native thread");
        }

        @Test
        @DisplayName("should absorb a null delivery")
        void shouldAbsorbNullDelivery() {
            assertThatCode(() -> reporter.handleFailure(null, new RuntimeException("boom")))
                    .doesNotThrowAnyException();

            assertThat(diagnostics).singleElement().asString().contains("NullPointerException");
        }

        @Test
        @DisplayName("should not let a failing listener escape")
        void shouldIsolateListenerFailure() {
            ReportListener listener = mock(ReportListener.class);
            doThrow(new IllegalStateException("registry closed")).when(listener).onFault(any());
            when(connectionFactory.createConnection()).thenThrow(
                    BrokerException.unreachable("rabbit-prod-1", "/orders", "order-service", null));
            ErrorReporter observed = new ErrorReporter(connectionFactory, serializer, diagnostics::add,
                    listener, ReconnectPolicy.KEEP_DECLARATIONS);

            assertThatCode(() -> observed.handleFailure(orderDelivery(), new RuntimeException("boom")))
                    .doesNotThrowAnyException();

            verify(listener).onFault(FaultKind.UNREACHABLE_BROKER);
            assertThat(diagnostics).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Dispose")
    class Dispose {

        @Test
        @DisplayName("should be safe when no connection was ever created")
        void shouldDisposeWithoutConnection() {
            assertThatCode(() -> reporter.dispose()).doesNotThrowAnyException();

            verify(connectionFactory, never()).createConnection();
            assertThat(reporter.getState()).isEqualTo(ErrorReporter.State.DISPOSED);
        }

        @Test
        @DisplayName("should close the connection exactly once")
        void shouldBeIdempotent() {
            reporter.handleFailure(orderDelivery(), new RuntimeException("boom"));

            reporter.dispose();
            reporter.dispose();
            reporter.close();

            verify(connection, times(1)).close();
        }

        @Test
        @DisplayName("should not touch the broker after dispose")
        void shouldDropReportsAfterDispose() {
            reporter.dispose();

            reporter.handleFailure(orderDelivery(), new RuntimeException("late failure"));

            verify(connectionFactory, never()).createConnection();
            assertThat(diagnostics).singleElement().asString()
                    .contains("disposed")
                    .contains("orders.created");
        }

        @Test
        @DisplayName("should absorb failures while closing the connection")
        void shouldAbsorbCloseFailure() {
            doThrow(new IllegalStateException("socket already gone")).when(connection).close();
            reporter.handleFailure(orderDelivery(), new RuntimeException("boom"));

            assertThatCode(() -> reporter.dispose()).doesNotThrowAnyException();
            assertThat(reporter.getState()).isEqualTo(ErrorReporter.State.DISPOSED);
        }
    }

    @Nested
    @DisplayName("State")
    class StateTransitions {

        @Test
        @DisplayName("should move from uninitialized to ready to disconnected")
        void shouldTrackState() {
            assertThat(reporter.getState()).isEqualTo(ErrorReporter.State.UNINITIALIZED);

            reporter.handleFailure(orderDelivery(), new RuntimeException("boom"));
            assertThat(reporter.getState()).isEqualTo(ErrorReporter.State.READY);

            when(connection.isOpen()).thenReturn(false);
            assertThat(reporter.getState()).isEqualTo(ErrorReporter.State.DISCONNECTED);

            reporter.dispose();
            assertThat(reporter.getState()).isEqualTo(ErrorReporter.State.DISPOSED);
        }

        @Test
        @DisplayName("should stay connected but not ready when declaration fails")
        void shouldStayConnectedWhenDeclarationFails() {
            doThrow(BrokerException.interrupted("access refused", null))
                    .when(session).declareQueue(anyString(), anyBoolean(), anyBoolean(), anyBoolean());

            reporter.handleFailure(orderDelivery(), new RuntimeException("boom"));

            assertThat(reporter.getState()).isEqualTo(ErrorReporter.State.CONNECTED);
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject missing collaborators")
        void shouldRejectNulls() {
            assertThatThrownBy(() -> new ErrorReporter(null, serializer, diagnostics::add))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("connectionFactory");
            assertThatThrownBy(() -> new ErrorReporter(connectionFactory, null, diagnostics::add))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("serializer");
            assertThatThrownBy(() -> new ErrorReporter(connectionFactory, serializer, null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("diagnostics");
        }
    }

    @Nested
    @DisplayName("FaultKind Classification")
    class FaultKindClassification {

        @Test
        @DisplayName("should map broker exception kinds and fall back to unexpected")
        void shouldClassify() {
            assertThat(FaultKind.classify(BrokerException.unreachable("h", "/", "u", null)))
                    .isEqualTo(FaultKind.UNREACHABLE_BROKER);
            assertThat(FaultKind.classify(BrokerException.interrupted("closed", null)))
                    .isEqualTo(FaultKind.OPERATION_INTERRUPTED);
            assertThat(FaultKind.classify(new IllegalStateException())).isEqualTo(FaultKind.UNEXPECTED);
            assertThat(FaultKind.classify(new StackOverflowError())).isEqualTo(FaultKind.UNEXPECTED);
        }
    }

    private static Delivery orderDelivery() {
        return Delivery.builder()
                .routingKey("orders.created")
                .exchange("orders")
                .body("{\"id\":1}".getBytes(StandardCharsets.UTF_8))
                .property("contentType", "application/json")
                .property("deliveryMode", 2)
                .build();
    }
}
