package com.umitunal.stepflow.queue;

import com.umitunal.stepflow.serialization.PayloadCodec;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary layout of a stored {@link WorkUnit}:
 * <pre>
 * id            int length + UTF-8
 * payload       int length + codec bytes
 * scheduledTime long
 * maxAttempts   int
 * attempt       int
 * leaseExpiry   long
 * worker        int length + UTF-8 (0 when unassigned)
 * state         int ordinal
 * createdAt     long
 * reason        int length + UTF-8 (0 when none)
 * version       long
 * </pre>
 *
 * @param <T> the type of payload
 */
public class WorkUnitSerializer<T> {
    private static final byte[] EMPTY = new byte[0];

    private final PayloadCodec<T> payloadCodec;

    public WorkUnitSerializer(PayloadCodec<T> payloadCodec) {
        this.payloadCodec = payloadCodec;
    }

    public byte[] serialize(WorkUnit<T> unit) {
        byte[] idBytes = unit.getId().getBytes(UTF_8);
        byte[] payloadBytes = payloadCodec.encode(unit.getPayload());
        byte[] workerBytes = utf8OrEmpty(unit.getAssignedWorker());
        byte[] reasonBytes = utf8OrEmpty(unit.getFailureReason());

        int totalSize = 4 + idBytes.length
                + 4 + payloadBytes.length
                + 8 + 4 + 4 + 8
                + 4 + workerBytes.length
                + 4 + 8
                + 4 + reasonBytes.length
                + 8;

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        putBytes(buffer, idBytes);
        putBytes(buffer, payloadBytes);
        buffer.putLong(unit.getScheduledTime());
        buffer.putInt(unit.getMaxAttempts());
        buffer.putInt(unit.getCurrentAttempt());
        buffer.putLong(unit.getLeaseExpiry());
        putBytes(buffer, workerBytes);
        buffer.putInt(unit.getState().ordinal());
        buffer.putLong(unit.getCreatedAt());
        putBytes(buffer, reasonBytes);
        buffer.putLong(unit.getVersion());

        return buffer.array();
    }

    public WorkUnit<T> deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);

        String id = new String(getBytes(buffer), UTF_8);
        T payload = payloadCodec.decode(getBytes(buffer));
        long scheduledTime = buffer.getLong();
        int maxAttempts = buffer.getInt();

        WorkUnit<T> unit = new WorkUnit<>(id, payload, scheduledTime, maxAttempts, 0L);
        unit.setCurrentAttempt(buffer.getInt());
        unit.setLeaseExpiry(buffer.getLong());
        unit.setAssignedWorker(stringOrNull(getBytes(buffer)));
        unit.setState(QueuedWork.State.values()[buffer.getInt()]);
        unit.setCreatedAt(buffer.getLong());
        unit.setFailureReason(stringOrNull(getBytes(buffer)));
        unit.setVersion(buffer.getLong());

        return unit;
    }

    private static void putBytes(ByteBuffer buffer, byte[] bytes) {
        buffer.putInt(bytes.length);
        buffer.put(bytes);
    }

    private static byte[] getBytes(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.getInt()];
        buffer.get(bytes);
        return bytes;
    }

    private static byte[] utf8OrEmpty(String value) {
        return value != null ? value.getBytes(UTF_8) : EMPTY;
    }

    private static String stringOrNull(byte[] bytes) {
        return bytes.length > 0 ? new String(bytes, UTF_8) : null;
    }
}
