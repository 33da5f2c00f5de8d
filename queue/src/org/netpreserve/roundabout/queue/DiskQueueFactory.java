package org.netpreserve.roundabout.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates SQLite queues under a root directory, one subdirectory per partition and one file per priority level.
 */
public class DiskQueueFactory<T> implements QueueFactory<T> {
    private static final Logger log = LoggerFactory.getLogger(DiskQueueFactory.class);
    private final Path root;
    private final QueueOpener<T> opener;
    private final QueueOpener<T> uniqueOpener;

    public DiskQueueFactory(Path root, Ordering ordering, Codec<T> codec) {
        this.root = root;
        this.opener = path -> new SqliteQueue<>(path, root.relativize(path).toString(), ordering, codec);
        this.uniqueOpener = UniquePath.wrap(opener);
    }

    @Override
    public BackingQueue<T> create(String partition, int priority) throws IOException {
        Path directory = root.resolve(partition);
        Files.createDirectories(directory);
        BackingQueue<T> queue = uniqueOpener.open(directory.resolve("p" + priority));
        log.debug("Created queue {} for priority {}", queue.location(), priority);
        return queue;
    }

    @Override
    public BackingQueue<T> open(Bucket bucket) throws IOException {
        if (bucket.location() == null) {
            throw new IOException("No storage location recorded for priority " + bucket.priority());
        }
        Path path = root.resolve(bucket.location());
        if (!Files.exists(path)) {
            throw new StorageException(path, "Missing queue file for priority " + bucket.priority());
        }
        return opener.open(path);
    }

    public Path root() {
        return root;
    }
}
