package io.ledgerrelay.watcher;

import io.ledgerrelay.model.MessageEnvelope;

import java.util.ArrayDeque;
import java.util.Deque;

final class PublishBuffer {
    private final int capacity;
    private final Deque<Entry> entries = new ArrayDeque<>();

    PublishBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("buffer capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    boolean isFull() {
        return entries.size() >= capacity;
    }

    int size() {
        return entries.size();
    }

    int capacity() {
        return capacity;
    }

    void addEvent(MessageEnvelope envelope, String cursor) {
        ensureRoom();
        entries.addLast(new Entry(envelope, cursor));
    }

    void addCursor(String cursor) {
        Entry tail = entries.peekLast();
        if (tail != null && tail.envelope() == null) {
            entries.pollLast();
            entries.addLast(new Entry(null, cursor));
            return;
        }
        ensureRoom();
        entries.addLast(new Entry(null, cursor));
    }

    Entry peek() {
        return entries.peekFirst();
    }

    void removeHead() {
        entries.pollFirst();
    }

    private void ensureRoom() {
        if (isFull()) {
            throw new IllegalStateException("publish buffer is full (" + capacity + ")");
        }
    }

    record Entry(MessageEnvelope envelope, String cursor) {
    }
}
