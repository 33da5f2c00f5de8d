package org.netpreserve.roundabout.queue;

import java.io.IOException;

/**
 * Creates the backing queue for each priority level of a partition.
 */
public interface QueueFactory<T> {
    /**
     * Creates a new empty queue.
     *
     * @param partition filesystem-safe name of the partition the queue belongs to
     * @param priority  the priority level the queue will hold
     */
    BackingQueue<T> create(String partition, int priority) throws IOException;

    /**
     * Reattaches to the storage of a queue that was closed with entries still in it.
     */
    BackingQueue<T> open(Bucket bucket) throws IOException;
}
