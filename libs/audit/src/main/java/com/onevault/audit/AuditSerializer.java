package com.onevault.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON form of {@link AuditEnvelope}.
 * <p>
 * WHY Jackson: Spring Boot's default JSON library; {@code JavaTimeModule} writes
 * {@code Instant} as ISO-8601.
 */
public final class AuditSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private AuditSerializer() {
        // utility class
    }

    /**
     * @throws AuditSerializationException if serialization fails
     */
    public static String serialize(AuditEnvelope<?> envelope) {
        try {
            return MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to serialize audit record " + envelope.eventId(), e);
        }
    }

    /**
     * @throws AuditSerializationException if the JSON is malformed or does not fit the payload type
     */
    public static <T> AuditEnvelope<T> deserialize(String json, Class<T> payloadType) {
        try {
            JavaType type = MAPPER.getTypeFactory().constructParametricType(AuditEnvelope.class, payloadType);
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to deserialize audit record", e);
        }
    }

    public static class AuditSerializationException extends RuntimeException {
        public AuditSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
