package org.netpreserve.roundabout.queue;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface QueueOpener<T> {
    BackingQueue<T> open(Path path) throws IOException;
}
