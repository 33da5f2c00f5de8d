package org.netpreserve.roundabout;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.roundabout.config.SchedulerConfig;
import org.netpreserve.roundabout.queue.DiskQueueFactory;
import org.netpreserve.roundabout.queue.MemoryQueueFactory;
import org.netpreserve.roundabout.queue.QueueFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decides which request is dispatched next.
 * <p>
 * Requests are stored in the job directory when one is configured, so a crawl can be stopped and resumed. Requests
 * that can't be serialized, or all requests when there's no job directory, are held in memory and are lost on
 * close. Requests in memory are dispatched before those on disk.
 * <p>
 * Not thread safe.
 */
public class Scheduler implements DispatchListener {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);
    static final String QUEUE_DIRECTORY = "requests.queue";
    static final String STATE_FILE = "active.json";
    private final SchedulerConfig config;
    private final SlotActivity activity = new SlotActivity();
    private FairnessQueue memoryQueue;
    private @Nullable FairnessQueue diskQueue;
    private @Nullable Path queueDirectory;
    private boolean logUnserializable;
    private long enqueuedMemory;
    private long enqueuedDisk;
    private long dequeuedMemory;
    private long dequeuedDisk;
    private long unserializable;

    public Scheduler(SchedulerConfig config) {
        this.config = config;
    }

    /**
     * Opens the scheduler, resuming from the state saved in the job directory if there is any.
     *
     * @throws MalformedSnapshotException if the saved state can't be understood
     */
    public void open() throws IOException {
        Path jobDir = config.jobPath();
        Snapshot snapshot = Snapshot.empty();
        if (jobDir != null) {
            Path stateFile = jobDir.resolve(QUEUE_DIRECTORY).resolve(STATE_FILE);
            if (Files.exists(stateFile)) {
                snapshot = Snapshot.read(stateFile);
            }
        }
        open(snapshot);
    }

    /**
     * Opens the scheduler, reattaching the disk queue to the slots in the given snapshot.
     */
    public void open(Snapshot snapshot) throws IOException {
        if (memoryQueue != null) throw new IllegalStateException("Scheduler is already open");
        Path jobDir = config.jobPath();
        if (jobDir == null && !snapshot.isEmpty()) {
            throw new IllegalArgumentException("Can't resume from a snapshot without a job directory");
        }
        FairnessQueue disk = null;
        Path directory = null;
        if (jobDir != null) {
            directory = jobDir.resolve(QUEUE_DIRECTORY);
            Files.createDirectories(directory);
            disk = newQueue(diskQueueFactory(directory), snapshot);
            if (disk.size() > 0) {
                log.info("Resuming crawl ({} requests scheduled)", disk.size());
            }
        }
        memoryQueue = newQueue(new MemoryQueueFactory<>(config.memoryQueue()), Snapshot.empty());
        diskQueue = disk;
        queueDirectory = directory;
        logUnserializable = config.logUnserializableRequests();
        enqueuedMemory = enqueuedDisk = dequeuedMemory = dequeuedDisk = unserializable = 0;
    }

    QueueFactory<Request> diskQueueFactory(Path directory) {
        return new DiskQueueFactory<>(directory, config.diskQueue(), new RequestCodec());
    }

    private FairnessQueue newQueue(QueueFactory<Request> factory, Snapshot snapshot) throws IOException {
        return switch (config.priorityQueue()) {
            case ROUND_ROBIN -> new RoundRobinQueue(factory, snapshot);
            case DOWNLOADER_AWARE -> new DownloaderAwareQueue(factory, activity, snapshot);
        };
    }

    /**
     * Schedules a request according to its priority.
     *
     * @throws InvalidRequestException if the request's slot can't be determined
     */
    public void enqueue(Request request) throws IOException {
        checkOpen();
        if (diskQueue != null) {
            try {
                diskQueue.push(request, request.priority());
                enqueuedDisk++;
                return;
            } catch (JsonProcessingException e) {
                unserializable++;
                if (logUnserializable) {
                    log.warn("Unable to serialize request: {} - reason: {} - no more unserializable requests " +
                             "will be logged", request, e.getOriginalMessage(), e);
                    logUnserializable = false;
                } else {
                    log.debug("Keeping unserializable request {} in memory", request);
                }
            }
        }
        memoryQueue.push(request, request.priority());
        enqueuedMemory++;
    }

    /**
     * Returns the next request to dispatch, or null if there are none pending.
     */
    public @Nullable Request next() throws IOException {
        checkOpen();
        Request request = memoryQueue.pop();
        if (request != null) {
            dequeuedMemory++;
            return request;
        }
        if (diskQueue != null) {
            request = diskQueue.pop();
            if (request != null) dequeuedDisk++;
        }
        return request;
    }

    public boolean hasPending() {
        return size() > 0;
    }

    public int size() {
        checkOpen();
        return memoryQueue.size() + (diskQueue == null ? 0 : diskQueue.size());
    }

    /**
     * Closes the scheduler and saves the state of the disk queue to the job directory.
     *
     * @param reason why the crawl is closing, for the log
     * @return the saved state, empty if there's no job directory
     * @throws IncompleteSnapshotException if some slots failed to close, after saving the others
     */
    public Snapshot close(String reason) throws IOException {
        checkOpen();
        FairnessQueue memory = memoryQueue;
        FairnessQueue disk = diskQueue;
        memoryQueue = null;
        diskQueue = null;
        int lost = memory.size();
        if (lost > 0) {
            log.warn("Discarding {} requests held in memory ({})", lost, reason);
        }
        memory.close();
        if (disk == null) {
            return Snapshot.empty();
        }
        int remaining = disk.size();
        Snapshot snapshot;
        try {
            snapshot = disk.close();
        } catch (IncompleteSnapshotException e) {
            try {
                e.snapshot().write(queueDirectory.resolve(STATE_FILE));
            } catch (IOException writeFailure) {
                e.addSuppressed(writeFailure);
                throw e;
            }
            log.error("Saved {} slots to {} but others failed to close ({})", e.snapshot().slots().size(),
                    queueDirectory, reason);
            throw e;
        }
        snapshot.write(queueDirectory.resolve(STATE_FILE));
        log.info("Closed scheduler ({}) with {} requests in {} slots saved to {}", reason, remaining,
                snapshot.slots().size(), queueDirectory);
        return snapshot;
    }

    public boolean isOpen() {
        return memoryQueue != null;
    }

    public SchedulerStats stats() {
        return new SchedulerStats(enqueuedMemory, enqueuedDisk, dequeuedMemory, dequeuedDisk, unserializable);
    }

    public SlotActivity activity() {
        return activity;
    }

    @Override
    public void onDispatchStart(Request request) {
        activity.onDispatchStart(request);
    }

    @Override
    public void onDispatchComplete(Request request) {
        activity.onDispatchComplete(request);
    }

    private void checkOpen() {
        if (memoryQueue == null) throw new IllegalStateException("Scheduler is not open");
    }
}
