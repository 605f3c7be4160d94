package com.umitunal.stepflow.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.util.Pool;

import java.util.Objects;

/**
 * Kryo codec for queue payloads, and the one the dispatcher uses by default.
 *
 * Registration is required, so only the payload type and the extra types
 * given here can be read back. Kryo instances are not thread-safe; each
 * call borrows one from a shared pool.
 *
 * @param <T> the payload type
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private static final int INITIAL_BUFFER_SIZE = 256;

    private final Class<T> type;
    private final Pool<Kryo> pool;

    public KryoCodec(Class<T> type, Class<?>... additionalTypes) {
        this(type, registering(type, additionalTypes));
    }

    /**
     * Create a codec whose Kryo instances come from the given factory.
     * The factory is called once per pooled instance.
     */
    public KryoCodec(Class<T> type, KryoFactory factory) {
        this.type = Objects.requireNonNull(type, "type");
        Objects.requireNonNull(factory, "factory");
        this.pool = new Pool<Kryo>(true, false) {
            @Override
            protected Kryo create() {
                return factory.create();
            }
        };
    }

    @Override
    public byte[] encode(T payload) {
        Objects.requireNonNull(payload, "payload");
        Kryo kryo = pool.obtain();
        try (Output output = new Output(INITIAL_BUFFER_SIZE, -1)) {
            kryo.writeObject(output, payload);
            return output.toBytes();
        } catch (KryoException e) {
            throw new CodecException("Failed to encode " + type.getSimpleName(), e);
        } finally {
            pool.free(kryo);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        Kryo kryo = pool.obtain();
        try (Input input = new Input(bytes)) {
            return kryo.readObject(input, type);
        } catch (KryoException e) {
            throw new CodecException("Failed to decode " + type.getSimpleName(), e);
        } finally {
            pool.free(kryo);
        }
    }

    private static KryoFactory registering(Class<?> type, Class<?>[] additionalTypes) {
        return () -> {
            Kryo kryo = new Kryo();
            kryo.setRegistrationRequired(true);
            kryo.setReferences(false);
            kryo.register(type);
            for (Class<?> additional : additionalTypes) {
                kryo.register(additional);
            }
            return kryo;
        };
    }

    @FunctionalInterface
    public interface KryoFactory {
        Kryo create();
    }
}
