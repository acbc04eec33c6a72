package dev.sidechain.util;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-ordered 64-bit id generator used for notification events and connection ids.
 *
 * <pre>
 * | 1 bit (unused) | 41 bits (ms since 2024-01-01) | 10 bits (node id) | 12 bits (sequence) |
 * </pre>
 *
 * Ids from one node sort by creation time, which the aggregation presenter relies on
 * when it de-duplicates events arriving through both the push and the poll path.
 */
public final class SnowflakeId {

    private static final long CUSTOM_EPOCH = 1704067200000L;

    private static final int NODE_ID_BITS = 10;
    private static final int SEQUENCE_BITS = 12;

    private static final long MAX_NODE_ID = (1L << NODE_ID_BITS) - 1;
    private static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;

    private static final int NODE_ID_SHIFT = SEQUENCE_BITS;
    private static final int TIMESTAMP_SHIFT = SEQUENCE_BITS + NODE_ID_BITS;

    private static final long MAX_BACKWARDS_DRIFT_MS = 5;

    private final long nodeId;
    /** Packed (timestamp << SEQUENCE_BITS | sequence) of the last issued id. */
    private final AtomicLong lastState = new AtomicLong(0);

    public SnowflakeId(long nodeId) {
        if (nodeId < 0 || nodeId > MAX_NODE_ID) {
            throw new IllegalArgumentException(
                    "Node ID must be between 0 and " + MAX_NODE_ID + ", got: " + nodeId);
        }
        this.nodeId = nodeId;
    }

    /**
     * Lock-free; safe to call from any event-loop thread.
     *
     * @throws IllegalStateException if the clock moved backwards by more than a few milliseconds
     */
    public long nextId() {
        long now = currentTimestamp();
        while (true) {
            long oldState = lastState.get();
            long oldTimestamp = oldState >>> SEQUENCE_BITS;
            long oldSequence = oldState & MAX_SEQUENCE;

            long timestamp;
            long sequence;
            if (now > oldTimestamp) {
                timestamp = now;
                sequence = 0;
            } else {
                long drift = oldTimestamp - now;
                if (drift > MAX_BACKWARDS_DRIFT_MS) {
                    throw new IllegalStateException(
                            "Clock moved backwards by " + drift + "ms. Refusing to generate ID.");
                }
                timestamp = oldTimestamp;
                sequence = (oldSequence + 1) & MAX_SEQUENCE;
                if (sequence == 0) {
                    // sequence exhausted for this millisecond
                    timestamp = oldTimestamp + 1;
                }
            }

            long newState = (timestamp << SEQUENCE_BITS) | sequence;
            if (lastState.compareAndSet(oldState, newState)) {
                return (timestamp << TIMESTAMP_SHIFT) | (nodeId << NODE_ID_SHIFT) | sequence;
            }
            now = currentTimestamp();
        }
    }

    public long getNodeId() {
        return nodeId;
    }

    public static Instant extractInstant(long id) {
        return Instant.ofEpochMilli((id >>> TIMESTAMP_SHIFT) + CUSTOM_EPOCH);
    }

    public static int extractNodeId(long id) {
        return (int) ((id >>> NODE_ID_SHIFT) & MAX_NODE_ID);
    }

    public static int extractSequence(long id) {
        return (int) (id & MAX_SEQUENCE);
    }

    private long currentTimestamp() {
        return System.currentTimeMillis() - CUSTOM_EPOCH;
    }

    @Override
    public String toString() {
        return "SnowflakeId{nodeId=" + nodeId + "}";
    }
}
