package com.agentrelay.gateway.buffer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Predicate;

/**
 * Fixed-capacity circular store of sequenced frames used to replay what a
 * reconnecting client missed.
 * <p>
 * Once full, each push silently overwrites the oldest slot. A cursor that
 * points at an evicted record is not detected: reads return whatever is
 * still retained after it, so callers must treat a short answer as possible
 * loss rather than as an error.
 * <p>
 * Thread-safe via synchronization; a read never observes a half-applied push.
 */
public class SequencedRingBuffer {

    public static final int DEFAULT_CAPACITY = 500;

    private static final Comparator<BufferedRecord> BY_ID = Comparator.comparingLong(BufferedRecord::id);

    private final BufferedRecord[] slots;
    private final LongSupplier clock;
    private int writeIndex;
    private long sequenceCounter;
    private int size;

    public SequencedRingBuffer() {
        this(DEFAULT_CAPACITY);
    }

    public SequencedRingBuffer(int capacity) {
        this(capacity, System::currentTimeMillis);
    }

    /**
     * @param capacity number of retained records, at least 1
     * @param clock    epoch-millisecond source stamped on each push
     */
    public SequencedRingBuffer(int capacity, LongSupplier clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        }
        this.slots = new BufferedRecord[capacity];
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Store a frame, evicting the oldest one when full.
     *
     * @return the id assigned to the frame
     */
    public long push(String kind, String payload) {
        return append(kind, payload).id();
    }

    /**
     * Same as {@link #push} but returns the stored record.
     */
    public synchronized BufferedRecord append(String kind, String payload) {
        BufferedRecord record = new BufferedRecord(++sequenceCounter, clock.getAsLong(), kind, payload);
        slots[writeIndex] = record;
        writeIndex = (writeIndex + 1) % slots.length;
        if (size < slots.length) {
            size++;
        }
        return record;
    }

    /**
     * Retained records with {@code id > sinceId}, in id order.
     */
    public synchronized List<BufferedRecord> getAfter(long sinceId) {
        if (sinceId >= sequenceCounter) {
            return List.of();
        }
        return collect(r -> r.id() > sinceId);
    }

    /**
     * Retained records with {@code timestamp > sinceTs}, in id order.
     */
    public synchronized List<BufferedRecord> getAfterTimestamp(long sinceTs) {
        return collect(r -> r.timestamp() > sinceTs);
    }

    /**
     * Last assigned id, or 0 if nothing was ever pushed.
     */
    public synchronized long currentId() {
        return sequenceCounter;
    }

    /**
     * Smallest id still retained, or 0 if empty.
     */
    public synchronized long oldestId() {
        return size == 0 ? 0 : sequenceCounter - size + 1;
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return slots.length;
    }

    // Slot order differs from id order once the write index has wrapped.
    private List<BufferedRecord> collect(Predicate<BufferedRecord> filter) {
        List<BufferedRecord> results = new ArrayList<>();
        for (BufferedRecord record : slots) {
            if (record != null && filter.test(record)) {
                results.add(record);
            }
        }
        results.sort(BY_ID);
        return results;
    }
}
