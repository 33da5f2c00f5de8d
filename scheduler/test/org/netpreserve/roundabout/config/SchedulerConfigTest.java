package org.netpreserve.roundabout.config;

import org.junit.jupiter.api.Test;
import org.netpreserve.roundabout.queue.Ordering;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class SchedulerConfigTest {
    @Test
    public void test() throws IOException {
        SchedulerConfig config;
        try (var stream = getClass().getResourceAsStream("example.yaml")) {
            config = SchedulerConfig.load(stream);
        }
        assertEquals(Path.of("jobs/crawl-1"), config.jobPath());
        assertEquals(FairnessPolicy.DOWNLOADER_AWARE, config.priorityQueue());
        assertEquals(Ordering.FIFO, config.memoryQueue());
        assertEquals(Ordering.LIFO, config.diskQueue());
        assertTrue(config.logUnserializableRequests());
    }

    @Test
    public void testDefaults() throws IOException {
        var config = SchedulerConfig.load(new ByteArrayInputStream("priorityQueue: round_robin\n".getBytes(StandardCharsets.UTF_8)));
        assertNull(config.jobPath());
        assertEquals(FairnessPolicy.ROUND_ROBIN, config.priorityQueue());
        assertEquals(Ordering.LIFO, config.memoryQueue());
        assertEquals(Ordering.LIFO, config.diskQueue());
        assertFalse(config.logUnserializableRequests());
        assertEquals(config, SchedulerConfig.defaults());
    }
}
