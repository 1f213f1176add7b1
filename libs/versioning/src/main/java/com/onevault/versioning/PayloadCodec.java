package com.onevault.versioning;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.onevault.identity.HashKey;
import java.io.IOException;

/**
 * Canonical JSON encoding of structured satellite payloads (sessions, domain assignments, link
 * attributes).
 *
 * <p>WHY canonical: the store skips writes whose fingerprint matches the current version. Sorted
 * properties and map keys make equal values encode to equal bytes, so an unchanged record is a
 * real no-op.
 *
 * <p>{@link HashKey} is written as its lowercase hex string.
 */
public final class PayloadCodec {

    private static final ObjectMapper MAPPER = createMapper();

    private PayloadCodec() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        SimpleModule hashKeys = new SimpleModule("hash-keys");
        hashKeys.addSerializer(HashKey.class, new JsonSerializer<HashKey>() {
            @Override
            public void serialize(HashKey value, JsonGenerator gen, SerializerProvider serializers)
                    throws IOException {
                gen.writeString(value.toHex());
            }
        });
        hashKeys.addDeserializer(HashKey.class, new JsonDeserializer<HashKey>() {
            @Override
            public HashKey deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                return HashKey.fromHex(p.getValueAsString());
            }
        });

        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .addModule(hashKeys)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Encodes a value to canonical UTF-8 JSON bytes.
     *
     * @throws PayloadCodecException if the value cannot be serialized
     */
    public static byte[] encode(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new PayloadCodecException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Decodes bytes produced by {@link #encode}.
     *
     * @throws PayloadCodecException if the bytes are not valid JSON for {@code type}
     */
    public static <T> T decode(byte[] payload, Class<T> type) {
        try {
            return MAPPER.readValue(payload, type);
        } catch (IOException e) {
            throw new PayloadCodecException("Failed to decode " + type.getSimpleName(), e);
        }
    }

    /** Decodes the payload of a stored version. */
    public static <T> T decode(Version version, Class<T> type) {
        return decode(version.payload(), type);
    }

    /** Serialization or deserialization failed. */
    public static class PayloadCodecException extends RuntimeException {
        public PayloadCodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
