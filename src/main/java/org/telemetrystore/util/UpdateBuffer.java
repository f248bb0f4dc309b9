package org.telemetrystore.util;

import org.telemetrystore.model.Update;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity ring buffer of {@link Update}s in arrival order.
 * <p>
 * Once full, each {@link #append(Update)} overwrites the oldest element, so the
 * buffer always holds the {@code capacity} most recent updates.
 * </p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Not synchronized; the owning store serializes access.</li>
 *   <li>{@link #snapshot()} returns a copy, oldest first.</li>
 * </ul>
 */
public final class UpdateBuffer {

    public static final int DEFAULT_CAPACITY = 200;

    private final Update[] slots;
    private int head;  // index of the oldest element
    private int size;

    public UpdateBuffer() {
        this(DEFAULT_CAPACITY);
    }

    public UpdateBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        }
        this.slots = new Update[capacity];
    }

    /**
     * Inserts at the tail, evicting the head when the buffer is full.
     *
     * @param update the update to store; must not be null
     */
    public void append(Update update) {
        if (update == null) {
            throw new IllegalArgumentException("update must not be null");
        }
        int tail = (head + size) % slots.length;
        slots[tail] = update;
        if (size == slots.length) {
            head = (head + 1) % slots.length; // overwrote the oldest
        } else {
            size++;
        }
    }

    /** @return the most recently appended update, or empty if none */
    public Optional<Update> latest() {
        if (size == 0) {
            return Optional.empty();
        }
        return Optional.of(slots[(head + size - 1) % slots.length]);
    }

    /** @return an immutable ordered copy, oldest first */
    public List<Update> snapshot() {
        List<Update> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(slots[(head + i) % slots.length]);
        }
        return Collections.unmodifiableList(out);
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return slots.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }
}
