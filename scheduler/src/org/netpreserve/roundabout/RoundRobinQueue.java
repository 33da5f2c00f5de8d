package org.netpreserve.roundabout;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.roundabout.queue.Bucket;
import org.netpreserve.roundabout.queue.PartitionQueue;
import org.netpreserve.roundabout.queue.QueueFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * Gives each slot with pending requests one dispatch per turn of the rotation. Within a slot requests are popped
 * in priority order.
 * <p>
 * A slot is in the rotation exactly when its partition queue has entries. Slots join at the tail when they receive
 * their first request, and the slot that was just popped goes back to the tail if it has more.
 */
public class RoundRobinQueue implements FairnessQueue {
    private static final Logger log = LoggerFactory.getLogger(RoundRobinQueue.class);
    private final QueueFactory<Request> factory;
    private final Deque<String> rotation = new ArrayDeque<>();
    private final Map<String, PartitionQueue<Request>> queues = new HashMap<>();

    public RoundRobinQueue(QueueFactory<Request> factory) {
        this.factory = factory;
    }

    /**
     * Reopens the slots recorded in a snapshot, keeping their rotation order. If any slot fails to reopen, the ones
     * already reopened are closed again and nothing is retained.
     */
    public RoundRobinQueue(QueueFactory<Request> factory, Snapshot snapshot) throws IOException {
        this(factory);
        try {
            for (var entry : snapshot.slots().entrySet()) {
                String slot = entry.getKey();
                if (entry.getValue().isEmpty()) {
                    throw new MalformedSnapshotException("No priorities recorded for slot '" + slot + "'");
                }
                queues.put(slot, new PartitionQueue<>(factory, Slots.toPath(slot), entry.getValue()));
                rotation.addLast(slot);
            }
        } catch (IOException | RuntimeException e) {
            for (var queue : queues.values()) {
                try {
                    queue.close();
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            queues.clear();
            rotation.clear();
            throw e;
        }
    }

    @Override
    public void push(Request request, int priority) throws IOException {
        String slot = Slots.resolve(request);
        var queue = queues.get(slot);
        if (queue == null) {
            queue = new PartitionQueue<>(factory, Slots.toPath(slot));
            queue.push(request, priority);
            queues.put(slot, queue);
            rotation.addLast(slot);
        } else {
            queue.push(request, priority);
        }
    }

    @Override
    public @Nullable Request pop() throws IOException {
        if (rotation.isEmpty()) return null;
        String slot = selectSlot();
        rotation.remove(slot);
        var queue = queues.get(slot);
        try {
            return queue.pop();
        } finally {
            if (queue.size() > 0) {
                rotation.addLast(slot);
            } else {
                queues.remove(slot);
            }
        }
    }

    /**
     * Chooses which slot of the rotation to pop from next. Only called when the rotation isn't empty.
     */
    protected String selectSlot() {
        return rotation.getFirst();
    }

    /**
     * Slots with pending requests, in rotation order.
     */
    protected Collection<String> rotation() {
        return Collections.unmodifiableCollection(rotation);
    }

    public List<String> activeSlots() {
        return new ArrayList<>(rotation);
    }

    @Override
    public int size() {
        int size = 0;
        for (var queue : queues.values()) {
            size += queue.size();
        }
        return size;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IncompleteSnapshotException if any slot fails to close, carrying the slots that did
     */
    @Override
    public Snapshot close() throws IOException {
        var state = new LinkedHashMap<String, List<Bucket>>();
        IOException failure = null;
        for (String slot : rotation) {
            try {
                List<Bucket> buckets = queues.get(slot).close();
                if (!buckets.isEmpty()) {
                    state.put(slot, buckets);
                }
            } catch (IOException e) {
                log.error("Failed to close slot '{}', its requests won't be resumed", slot, e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        queues.clear();
        rotation.clear();
        if (failure != null) throw new IncompleteSnapshotException(new Snapshot(state), failure);
        return new Snapshot(state);
    }
}
