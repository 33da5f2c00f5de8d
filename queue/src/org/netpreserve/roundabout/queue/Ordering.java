package org.netpreserve.roundabout.queue;

/**
 * Order in which entries of equal priority leave a queue.
 */
public enum Ordering {
    FIFO, LIFO
}
