package com.payment.reconciliation.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Serializes {@link IdempotencyRecord} to plain JSON for Redis, without a
 * polymorphic {@code @class} hint, so stored values survive package moves.
 */
public class IdempotencyRecordRedisSerializer implements RedisSerializer<IdempotencyRecord> {

    private final ObjectMapper mapper;

    public IdempotencyRecordRedisSerializer() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] serialize(IdempotencyRecord value) throws SerializationException {
        if (value == null) return null;
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new SerializationException("Could not serialize IdempotencyRecord", e);
        }
    }

    @Override
    public IdempotencyRecord deserialize(byte[] bytes) throws SerializationException {
        if (bytes == null || bytes.length == 0) return null;
        try {
            return mapper.readValue(new String(bytes, StandardCharsets.UTF_8), IdempotencyRecord.class);
        } catch (IOException e) {
            throw new SerializationException("Could not deserialize IdempotencyRecord", e);
        }
    }
}
