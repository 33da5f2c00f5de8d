package org.netpreserve.roundabout.queue;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;

public class MemoryQueue<T> implements BackingQueue<T> {
    private final Deque<T> deque = new ArrayDeque<>();
    private final Ordering ordering;

    public MemoryQueue(Ordering ordering) {
        this.ordering = ordering;
    }

    @Override
    public void push(T item) {
        deque.addLast(item);
    }

    @Override
    public @Nullable T pop() {
        return ordering == Ordering.FIFO ? deque.pollFirst() : deque.pollLast();
    }

    @Override
    public int size() {
        return deque.size();
    }

    @Override
    public @Nullable String location() {
        return null;
    }

    @Override
    public void close() {
        deque.clear();
    }
}
