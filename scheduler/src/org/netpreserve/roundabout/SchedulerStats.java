package org.netpreserve.roundabout;

/**
 * Counters of requests passing through a scheduler since it was opened.
 *
 * @param enqueuedMemory requests kept in memory
 * @param enqueuedDisk   requests stored in the job directory
 * @param dequeuedMemory requests dispatched from memory
 * @param dequeuedDisk   requests dispatched from the job directory
 * @param unserializable requests that had to be kept in memory because they couldn't be stored
 */
public record SchedulerStats(
        long enqueuedMemory,
        long enqueuedDisk,
        long dequeuedMemory,
        long dequeuedDisk,
        long unserializable) {

    public long enqueued() {
        return enqueuedMemory + enqueuedDisk;
    }

    public long dequeued() {
        return dequeuedMemory + dequeuedDisk;
    }
}
