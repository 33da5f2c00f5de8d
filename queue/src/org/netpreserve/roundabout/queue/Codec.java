package org.netpreserve.roundabout.queue;

import java.io.IOException;

/**
 * Converts queue entries to and from the bytes stored on disk.
 */
public interface Codec<T> {
    byte[] encode(T item) throws IOException;

    T decode(byte[] data) throws IOException;
}
