package org.netpreserve.roundabout.queue;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.*;

/**
 * Priority ordered queue for a single partition. Higher priorities are popped first; entries of equal priority
 * leave in the order of the underlying {@link BackingQueue}. Each priority level with entries has its own backing
 * queue, which is closed and dropped as soon as it empties.
 */
public class PartitionQueue<T> {
    private final QueueFactory<T> factory;
    private final String partition;
    private final NavigableMap<Integer, BackingQueue<T>> queues = new TreeMap<>(Comparator.reverseOrder());
    private int size;

    public PartitionQueue(QueueFactory<T> factory, String partition) {
        this.factory = factory;
        this.partition = partition;
    }

    /**
     * Reattaches to the priority levels a previous instance returned from {@link #close()}. Fails if any level is
     * missing or empty, after closing the levels already reattached.
     */
    public PartitionQueue(QueueFactory<T> factory, String partition, List<Bucket> buckets) throws IOException {
        this(factory, partition);
        try {
            for (Bucket bucket : buckets) {
                if (queues.containsKey(bucket.priority())) {
                    throw new IOException("Duplicate priority " + bucket.priority() + " in partition " + partition);
                }
                BackingQueue<T> queue = factory.open(bucket);
                queues.put(bucket.priority(), queue);
                if (queue.size() == 0) {
                    throw new IOException("Queue for priority " + bucket.priority() + " in partition " + partition +
                                          " is empty at " + bucket.location());
                }
                size += queue.size();
            }
        } catch (IOException | RuntimeException e) {
            closeQuietly(e);
            throw e;
        }
    }

    public void push(T item, int priority) throws IOException {
        BackingQueue<T> queue = queues.get(priority);
        if (queue == null) {
            queue = factory.create(partition, priority);
            try {
                queue.push(item);
            } catch (IOException | RuntimeException e) {
                try {
                    queue.close();
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
                throw e;
            }
            queues.put(priority, queue);
        } else {
            queue.push(item);
        }
        size++;
    }

    public @Nullable T pop() throws IOException {
        var entry = queues.firstEntry();
        if (entry == null) return null;
        BackingQueue<T> queue = entry.getValue();
        T item = queue.pop();
        if (item != null) size--;
        if (queue.size() == 0) {
            queues.remove(entry.getKey());
            queue.close();
        }
        return item;
    }

    public int size() {
        return size;
    }

    public String partition() {
        return partition;
    }

    /**
     * Closes every backing queue and returns the priority levels that still hold entries, highest first.
     */
    public List<Bucket> close() throws IOException {
        var buckets = new ArrayList<Bucket>(queues.size());
        IOException failure = null;
        for (var entry : queues.entrySet()) {
            BackingQueue<T> queue = entry.getValue();
            if (queue.size() > 0) {
                buckets.add(new Bucket(entry.getKey(), queue.location()));
            }
            try {
                queue.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        queues.clear();
        size = 0;
        if (failure != null) throw failure;
        return buckets;
    }

    private void closeQuietly(Exception cause) {
        for (BackingQueue<T> queue : queues.values()) {
            try {
                queue.close();
            } catch (IOException e) {
                cause.addSuppressed(e);
            }
        }
        queues.clear();
        size = 0;
    }
}
