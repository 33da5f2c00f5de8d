package org.netpreserve.roundabout.queue;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;

/**
 * Storage for the entries of a single priority level.
 */
public interface BackingQueue<T> extends AutoCloseable {
    void push(T item) throws IOException;

    /**
     * Removes and returns the next entry according to the queue's {@link Ordering}, or null if empty.
     */
    @Nullable T pop() throws IOException;

    int size();

    /**
     * Where the entries live on disk, relative to the factory root, or null if they don't survive the process.
     */
    @Nullable String location();

    @Override
    void close() throws IOException;
}
