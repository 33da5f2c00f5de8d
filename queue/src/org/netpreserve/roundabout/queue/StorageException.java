package org.netpreserve.roundabout.queue;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reading or writing queue storage failed.
 */
public class StorageException extends IOException {
    private final Path path;

    public StorageException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public StorageException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
