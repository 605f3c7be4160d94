package com.umitunal.stepflow.serialization;

/**
 * Converts queued payloads to and from their stored bytes.
 *
 * @param <T> the type of payload
 */
public interface PayloadCodec<T> {

    byte[] encode(T payload);

    /**
     * @throws CodecException if the bytes do not hold a valid payload
     */
    T decode(byte[] bytes);
}
