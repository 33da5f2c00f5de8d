package org.netpreserve.roundabout;

import org.netpreserve.roundabout.queue.QueueFactory;

import java.io.IOException;

/**
 * Pops from the slot with the fewest requests currently in flight downstream. Ties go to the slot that comes first
 * in the rotation, which is the one that has waited longest for a turn.
 */
public class DownloaderAwareQueue extends RoundRobinQueue {
    private final SlotActivity activity;

    public DownloaderAwareQueue(QueueFactory<Request> factory, SlotActivity activity) {
        super(factory);
        this.activity = activity;
    }

    public DownloaderAwareQueue(QueueFactory<Request> factory, SlotActivity activity, Snapshot snapshot) throws IOException {
        super(factory, snapshot);
        this.activity = activity;
    }

    @Override
    protected String selectSlot() {
        String selected = null;
        int fewest = Integer.MAX_VALUE;
        for (String slot : rotation()) {
            int inFlight = activity.inFlight(slot);
            if (inFlight < fewest) {
                selected = slot;
                fewest = inFlight;
                if (inFlight == 0) break;
            }
        }
        return selected;
    }
}
