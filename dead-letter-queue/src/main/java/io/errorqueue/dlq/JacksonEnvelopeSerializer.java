package io.errorqueue.dlq;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import io.errorqueue.exception.EnvelopeSerializationException;

/**
 * JSON envelope format. Timestamps are written as ISO-8601 text.
 */
public class JacksonEnvelopeSerializer implements EnvelopeSerializer {

    public static final String CONTENT_TYPE = "application/json";

    private final ObjectMapper objectMapper;

    public JacksonEnvelopeSerializer() {
        this(new ObjectMapper());
    }

    /**
     * Uses a copy of the given mapper so the application's own settings are left alone.
     */
    public JacksonEnvelopeSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public byte[] serialize(ErrorEnvelope envelope) {
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new EnvelopeSerializationException("serialize", e);
        }
    }

    @Override
    public ErrorEnvelope deserialize(byte[] body) {
        try {
            return objectMapper.readValue(body, ErrorEnvelope.class);
        } catch (IOException e) {
            throw new EnvelopeSerializationException("deserialize", e);
        }
    }

    @Override
    public String getContentType() {
        return CONTENT_TYPE;
    }
}
