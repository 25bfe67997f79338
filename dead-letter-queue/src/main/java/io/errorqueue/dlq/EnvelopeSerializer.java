package io.errorqueue.dlq;

/**
 * Turns error envelopes into message bodies and back.
 *
 * Implementations are deterministic and free of side effects. Failures surface as
 * {@link io.errorqueue.exception.EnvelopeSerializationException}.
 */
public interface EnvelopeSerializer {

    byte[] serialize(ErrorEnvelope envelope);

    ErrorEnvelope deserialize(byte[] body);

    /**
     * Content type stamped on published error messages, or null to leave it unset.
     */
    default String getContentType() {
        return null;
    }
}
