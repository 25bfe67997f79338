package io.errorqueue.spring.autoconfigure;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.errorqueue.dlq.BrokerConnectionFactory;
import io.errorqueue.dlq.DiagnosticSink;
import io.errorqueue.dlq.EnvelopeSerializer;
import io.errorqueue.dlq.ErrorReporter;
import io.errorqueue.dlq.JacksonEnvelopeSerializer;
import io.errorqueue.dlq.ReportListener;
import io.errorqueue.dlq.Slf4jDiagnosticSink;
import io.errorqueue.dlq.amqp.AmqpConnectionFactory;
import io.errorqueue.metrics.ErrorQueueMetrics;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Spring Boot Auto-Configuration for the error queue reporter.
 *
 * Automatically configures:
 * - RabbitMQ connection factory from error-queue.* properties
 * - JSON envelope serializer, reusing the application's ObjectMapper when present
 * - Error reporter, disposed with the context
 * - Error queue metrics when a MeterRegistry is available
 *
 * Disable with: error-queue.enabled=false in application.properties
 */
@AutoConfiguration
@EnableConfigurationProperties(ErrorQueueProperties.class)
@ConditionalOnProperty(prefix = "error-queue", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ErrorQueueAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BrokerConnectionFactory errorQueueConnectionFactory(ErrorQueueProperties properties) {
        return AmqpConnectionFactory.builder()
                .host(properties.getHost())
                .port(properties.getPort())
                .virtualHost(properties.getVirtualHost())
                .username(properties.getUsername())
                .password(properties.getPassword())
                .connectionTimeoutMs(properties.getConnectionTimeoutMs())
                .handshakeTimeoutMs(properties.getHandshakeTimeoutMs())
                .connectionName(properties.getConnectionName())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvelopeSerializer errorEnvelopeSerializer(ObjectProvider<ObjectMapper> objectMapper) {
        ObjectMapper mapper = objectMapper.getIfAvailable();
        return mapper != null ? new JacksonEnvelopeSerializer(mapper) : new JacksonEnvelopeSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public DiagnosticSink errorQueueDiagnosticSink() {
        return new Slf4jDiagnosticSink();
    }

    /**
     * The reporter reports outcomes to the one {@link ReportListener} bean in the context,
     * usually {@link ErrorQueueMetrics}. With no listener, or with more than one, it
     * reports to {@link ReportListener#NOOP}; define an {@code ErrorReporter} bean to
     * combine several listeners.
     */
    @Bean(destroyMethod = "dispose")
    @ConditionalOnMissingBean
    public ErrorReporter errorReporter(BrokerConnectionFactory connectionFactory,
                                       EnvelopeSerializer serializer,
                                       DiagnosticSink diagnostics,
                                       ObjectProvider<ReportListener> listener,
                                       ErrorQueueProperties properties) {
        return new ErrorReporter(connectionFactory, serializer, diagnostics,
                listener.getIfUnique(() -> ReportListener.NOOP), properties.getReconnectPolicy());
    }

    // ==================== METRICS ====================

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "error-queue.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsAutoConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ErrorQueueMetrics errorQueueMetrics(MeterRegistry registry, ErrorQueueProperties properties) {
            return new ErrorQueueMetrics(registry, properties.getMetrics().getName());
        }
    }
}
