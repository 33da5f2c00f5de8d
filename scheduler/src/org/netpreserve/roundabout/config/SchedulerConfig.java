package org.netpreserve.roundabout.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.roundabout.queue.Ordering;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Scheduler configuration. Fixed for the lifetime of a scheduler.
 *
 * @param jobDir                    directory to persist pending requests in, or null to keep them in memory only
 * @param priorityQueue             how slots take turns
 * @param memoryQueue               tie-break order within a priority for requests held in memory
 * @param diskQueue                 tie-break order within a priority for requests stored in the job directory
 * @param logUnserializableRequests log every request that can't be stored on disk instead of only the first
 */
public record SchedulerConfig(
        @Nullable String jobDir,
        FairnessPolicy priorityQueue,
        Ordering memoryQueue,
        Ordering diskQueue,
        boolean logUnserializableRequests
) {
    public SchedulerConfig {
        if (priorityQueue == null) priorityQueue = FairnessPolicy.ROUND_ROBIN;
        if (memoryQueue == null) memoryQueue = Ordering.LIFO;
        if (diskQueue == null) diskQueue = Ordering.LIFO;
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(null, null, null, null, false);
    }

    public SchedulerConfig withJobDir(@Nullable Path jobDir) {
        return new SchedulerConfig(jobDir == null ? null : jobDir.toString(), priorityQueue, memoryQueue, diskQueue,
                logUnserializableRequests);
    }

    public SchedulerConfig withPriorityQueue(FairnessPolicy priorityQueue) {
        return new SchedulerConfig(jobDir, priorityQueue, memoryQueue, diskQueue, logUnserializableRequests);
    }

    public SchedulerConfig withOrdering(Ordering ordering) {
        return new SchedulerConfig(jobDir, priorityQueue, ordering, ordering, logUnserializableRequests);
    }

    public @Nullable Path jobPath() {
        return jobDir == null ? null : Path.of(jobDir);
    }

    public static SchedulerConfig load(Path file) throws IOException {
        try (InputStream stream = Files.newInputStream(file)) {
            return load(stream);
        }
    }

    public static SchedulerConfig load(InputStream stream) throws IOException {
        return yamlMapper().readValue(stream, SchedulerConfig.class);
    }

    private static ObjectMapper yamlMapper() {
        return YAMLMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build()
                .findAndRegisterModules();
    }
}
