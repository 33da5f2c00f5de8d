package org.netpreserve.roundabout.queue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UniquePathTest {
    @Test
    public void testAppendsSuffix(@TempDir Path tempDir) throws IOException {
        List<Path> opened = new ArrayList<>();
        QueueOpener<String> opener = UniquePath.wrap(path -> {
            opened.add(path);
            return new MemoryQueue<>(Ordering.FIFO);
        }, () -> "abc");
        opener.open(tempDir.resolve("p0"));
        assertEquals(List.of(tempDir.resolve("p0-abc")), opened);
    }

    @Test
    public void testRetriesWhilePathExists(@TempDir Path tempDir) throws IOException {
        Files.createFile(tempDir.resolve("p1-a"));
        Files.createFile(tempDir.resolve("p1-a-b"));
        Iterator<String> suffixes = List.of("a", "b", "c").iterator();
        List<Path> opened = new ArrayList<>();
        QueueOpener<String> opener = UniquePath.wrap(path -> {
            opened.add(path);
            return new MemoryQueue<>(Ordering.FIFO);
        }, suffixes::next);
        opener.open(tempDir.resolve("p1"));
        assertEquals(List.of(tempDir.resolve("p1-a-b-c")), opened);
    }

    @Test
    public void testRandomSuffixesDiffer(@TempDir Path tempDir) throws IOException {
        QueueOpener<String> opener = UniquePath.wrap(path -> {
            Files.createFile(path);
            return new MemoryQueue<>(Ordering.FIFO);
        });
        opener.open(tempDir.resolve("p0"));
        opener.open(tempDir.resolve("p0"));
        try (var files = Files.list(tempDir)) {
            List<Path> paths = files.toList();
            assertEquals(2, paths.size());
            for (Path path : paths) {
                assertTrue(path.getFileName().toString().matches("p0-[0-9a-f]{32}"), path.toString());
            }
        }
    }
}
