package org.netpreserve.roundabout;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;

/**
 * Queue of requests partitioned by slot, deciding which slot gets the next dispatch.
 * <p>
 * Not thread safe. Callers driving it from several threads need to guard the whole interface with one lock.
 */
public interface FairnessQueue {
    /**
     * @throws InvalidRequestException if the request's slot can't be determined
     */
    void push(Request request, int priority) throws IOException;

    @Nullable Request pop() throws IOException;

    int size();

    /**
     * Closes the queue of every slot and returns what's needed to reopen them. The queue is empty afterwards.
     */
    Snapshot close() throws IOException;
}
