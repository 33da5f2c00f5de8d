package org.netpreserve.roundabout.queue;

import org.jetbrains.annotations.Nullable;

/**
 * A priority level that still had entries when its partition queue was closed.
 *
 * @param priority the priority level
 * @param location storage location relative to the queue root, null for memory queues
 */
public record Bucket(int priority, @Nullable String location) {
}
