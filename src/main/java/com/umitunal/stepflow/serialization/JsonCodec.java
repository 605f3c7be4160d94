package com.umitunal.stepflow.serialization;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Objects;

/**
 * Jackson codec for queue payloads. Larger than {@link KryoCodec} output,
 * but a dispatched command can be read straight off the RocksDB value.
 *
 * Payloads are bound through their fields, so commands need no setters.
 * Unknown properties are ignored, which lets older entries decode after a
 * field is removed.
 *
 * @param <T> the payload type
 */
public class JsonCodec<T> implements PayloadCodec<T> {
    private final Class<T> type;
    private final ObjectReader reader;
    private final ObjectWriter writer;

    public JsonCodec(Class<T> type) {
        this(type, payloadMapper());
    }

    public JsonCodec(Class<T> type, ObjectMapper mapper) {
        this.type = Objects.requireNonNull(type, "type");
        this.reader = mapper.readerFor(type);
        this.writer = mapper.writerFor(type);
    }

    @Override
    public byte[] encode(T payload) {
        Objects.requireNonNull(payload, "payload");
        try {
            return writer.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new CodecException("Failed to write " + type.getSimpleName() + " as JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try {
            return reader.readValue(bytes);
        } catch (IOException e) {
            throw new CodecException("Failed to read " + type.getSimpleName() + " from JSON", e);
        }
    }

    /**
     * Mapper used when none is given: fields visible, ISO-8601 dates,
     * unknown properties ignored.
     */
    public static ObjectMapper payloadMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
