package org.netpreserve.roundabout;

import java.io.IOException;

/**
 * The persisted queue state doesn't have the expected shape, typically because it was written by an incompatible
 * older version.
 */
public class MalformedSnapshotException extends IOException {
    public MalformedSnapshotException(String message) {
        super(message);
    }

    public MalformedSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
