package com.demo.lending.repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Id-addressed ledger whose ids grow monotonically and are never reused.
 * A closed slot stays in place as a tombstone so later ids never shift.
 *
 * <p>Not thread-safe; the owning engine serializes access.
 */
public class AppendOnlyBook<T> {

    private final List<T> slots = new ArrayList<>();

    public long append(T value) {
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        slots.add(value);
        return slots.size() - 1L;
    }

    public Optional<T> find(long id) {
        if (id < 0 || id >= slots.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(slots.get((int) id));
    }

    /** Replaces an open slot in place. */
    public void replace(long id, T value) {
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        requireAllocated(id);
        slots.set((int) id, value);
    }

    public void tombstone(long id) {
        requireAllocated(id);
        slots.set((int) id, null);
    }

    /**
     * Undoes an {@link #append} that has to be rolled back. The tail slot is released;
     * any other slot is tombstoned so no later id moves.
     */
    public void discard(long id) {
        requireAllocated(id);
        if (id == slots.size() - 1L) {
            slots.remove((int) id);
        } else {
            slots.set((int) id, null);
        }
    }

    /** Number of ids handed out so far, tombstones included. */
    public long size() {
        return slots.size();
    }

    public boolean isOpen(long id) {
        return find(id).isPresent();
    }

    private void requireAllocated(long id) {
        if (id < 0 || id >= slots.size()) {
            throw new IndexOutOfBoundsException("id " + id + " not allocated");
        }
    }
}
