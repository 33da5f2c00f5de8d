package org.netpreserve.roundabout;

import java.io.IOException;

/**
 * Some slots failed to close. The snapshot holds the slots that closed cleanly and can still be reopened.
 */
public class IncompleteSnapshotException extends IOException {
    private final Snapshot snapshot;

    public IncompleteSnapshotException(Snapshot snapshot, IOException cause) {
        super("Failed to close all slots (" + snapshot.slots().size() + " saved)", cause);
        this.snapshot = snapshot;
    }

    public Snapshot snapshot() {
        return snapshot;
    }
}
