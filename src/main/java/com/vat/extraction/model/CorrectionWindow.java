package com.vat.extraction.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-capacity ring buffer of the most recent corrections. Adding to a
 * full window overwrites the oldest entry.
 */
public class CorrectionWindow {

    public static final int DEFAULT_CAPACITY = 5;

    private final CorrectionRecord[] slots;
    private int head;   // index of the oldest entry
    private int size;

    public CorrectionWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be positive: " + capacity);
        }
        this.slots = new CorrectionRecord[capacity];
    }

    @JsonCreator
    public static CorrectionWindow restore(@JsonProperty("capacity") Integer capacity,
                                           @JsonProperty("corrections") List<CorrectionRecord> corrections) {
        CorrectionWindow window = new CorrectionWindow(capacity != null ? capacity : DEFAULT_CAPACITY);
        if (corrections != null) {
            corrections.forEach(window::add);
        }
        return window;
    }

    public synchronized void add(CorrectionRecord record) {
        Objects.requireNonNull(record, "record");
        if (size < slots.length) {
            slots[(head + size) % slots.length] = record;
            size++;
        } else {
            slots[head] = record;
            head = (head + 1) % slots.length;
        }
    }

    /** Oldest first. */
    @JsonProperty("corrections")
    public synchronized List<CorrectionRecord> getCorrections() {
        List<CorrectionRecord> ordered = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            ordered.add(slots[(head + i) % slots.length]);
        }
        return Collections.unmodifiableList(ordered);
    }

    @JsonIgnore
    public synchronized List<CorrectionRecord> newestFirst() {
        List<CorrectionRecord> ordered = new ArrayList<>(getCorrections());
        Collections.reverse(ordered);
        return ordered;
    }

    @JsonProperty("capacity")
    public int getCapacity() {
        return slots.length;
    }

    @JsonIgnore
    public synchronized int size() {
        return size;
    }

    @JsonIgnore
    public synchronized boolean isEmpty() {
        return size == 0;
    }

    public synchronized CorrectionWindow copy() {
        return restore(slots.length, getCorrections());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CorrectionWindow other)) return false;
        return getCapacity() == other.getCapacity() && getCorrections().equals(other.getCorrections());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getCapacity(), getCorrections());
    }
}
