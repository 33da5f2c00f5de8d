package org.netpreserve.roundabout.queue;

import java.io.IOException;

public class MemoryQueueFactory<T> implements QueueFactory<T> {
    private final Ordering ordering;

    public MemoryQueueFactory(Ordering ordering) {
        this.ordering = ordering;
    }

    @Override
    public BackingQueue<T> create(String partition, int priority) {
        return new MemoryQueue<>(ordering);
    }

    @Override
    public BackingQueue<T> open(Bucket bucket) throws IOException {
        throw new IOException("Memory queues do not survive a restart (priority " + bucket.priority() + ")");
    }
}
