package org.netpreserve.roundabout;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.roundabout.queue.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class RoundRobinQueueTest {
    @TempDir
    Path tempDir;

    private DiskQueueFactory<Request> diskFactory() {
        return new DiskQueueFactory<>(tempDir, Ordering.FIFO, new RequestCodec());
    }

    private static Request request(String url, String slot) {
        return new Request(url).slot(slot);
    }

    @Test
    public void testEachSlotGetsOneTurnPerRotation() throws IOException {
        var queue = new RoundRobinQueue(new MemoryQueueFactory<>(Ordering.FIFO));
        String[] slots = {"a", "a", "b", "b", "d", "d", "c", "c"};
        for (int i = 0; i < slots.length; i++) {
            queue.push(request("http://foo.com/" + i, slots[i]), 0);
        }
        assertEquals(List.of("a", "b", "d", "c"), queue.activeSlots());

        List<String> popped = new ArrayList<>();
        for (Request request = queue.pop(); request != null; request = queue.pop()) {
            popped.add(request.slot());
        }
        assertEquals(List.of("a", "b", "d", "c", "a", "b", "d", "c"), popped);
        assertEquals(0, queue.size());
        assertEquals(List.of(), queue.activeSlots());
    }

    @Test
    public void testSlotRejoinsAtTail() throws IOException {
        var queue = new RoundRobinQueue(new MemoryQueueFactory<>(Ordering.FIFO));
        queue.push(request("http://x/1", "x"), 0);
        queue.push(request("http://y/1", "y"), 0);
        assertEquals("x", queue.pop().slot());
        assertEquals(List.of("y"), queue.activeSlots());
        queue.push(request("http://x/2", "x"), 0);
        queue.push(request("http://y/2", "y"), 0);
        assertEquals(List.of("y", "x"), queue.activeSlots());
        assertEquals("y", queue.pop().slot());
        assertEquals("x", queue.pop().slot());
        assertEquals("y", queue.pop().slot());
        assertNull(queue.pop());
    }

    @Test
    public void testPriorityWithinSlot() throws IOException {
        var queue = new RoundRobinQueue(new MemoryQueueFactory<>(Ordering.FIFO));
        queue.push(new Request("http://foo.com/low", -5), -5);
        queue.push(new Request("http://foo.com/high", 5), 5);
        queue.push(new Request("http://bar.com/mid", 0), 0);
        assertEquals("http://foo.com/high", queue.pop().url().toString());
        assertEquals("http://bar.com/mid", queue.pop().url().toString());
        assertEquals("http://foo.com/low", queue.pop().url().toString());
    }

    @Test
    public void testSizeTracksPushesAndPops() throws IOException {
        var queue = new RoundRobinQueue(diskFactory());
        var random = new Random(42);
        int expected = 0;
        for (int i = 0; i < 200; i++) {
            if (random.nextInt(3) > 0) {
                queue.push(new Request("http://host" + random.nextInt(5) + "/" + i), random.nextInt(4));
                expected++;
            } else if (queue.pop() != null) {
                expected--;
            }
            assertEquals(expected, queue.size());
            if (i % 50 == 49) {
                queue = new RoundRobinQueue(diskFactory(), queue.close());
                assertEquals(expected, queue.size());
            }
        }
        queue.close();
    }

    @Test
    public void testCloseAndReopenPreservesOrder() throws IOException {
        List<Request> requests = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            requests.add(new Request("http://host" + (i % 3) + ".example/" + i, i % 4));
        }

        var reference = new RoundRobinQueue(new MemoryQueueFactory<>(Ordering.FIFO));
        var persistent = new RoundRobinQueue(diskFactory());
        for (Request request : requests) {
            reference.push(request, request.priority());
            persistent.push(request, request.priority());
        }
        Snapshot snapshot = persistent.close();
        assertEquals(0, persistent.size());
        assertEquals(List.of("host0.example", "host1.example", "host2.example"), List.copyOf(snapshot.slots().keySet()));

        var reopened = new RoundRobinQueue(diskFactory(), snapshot);
        assertEquals(12, reopened.size());
        for (int i = 0; i < 12; i++) {
            Request expected = reference.pop();
            Request actual = reopened.pop();
            assertNotNull(actual);
            assertEquals(expected.url(), actual.url());
            assertEquals(expected.priority(), actual.priority());
            assertEquals(expected.slot(), actual.slot());
        }
        assertNull(reopened.pop());
        assertTrue(reopened.close().isEmpty());
    }

    @Test
    public void testFailedSlotCloseKeepsOtherSlots() throws IOException {
        var queue = new RoundRobinQueue(new FailingCloseFactory(diskFactory(), "b.example"));
        queue.push(new Request("http://a.example/"), 0);
        queue.push(new Request("http://b.example/"), 0);
        queue.push(new Request("http://c.example/"), 1);

        var e = assertThrows(IncompleteSnapshotException.class, queue::close);
        assertEquals(List.of("a.example", "c.example"), List.copyOf(e.snapshot().slots().keySet()));
        assertEquals(0, queue.size());
        assertEquals(List.of(), queue.activeSlots());

        var reopened = new RoundRobinQueue(diskFactory(), e.snapshot());
        assertEquals("http://a.example/", reopened.pop().url().toString());
        assertEquals("http://c.example/", reopened.pop().url().toString());
        assertNull(reopened.pop());
        reopened.close();
    }

    @Test
    public void testReopenFailureLeavesNothingOpen() throws IOException {
        var queue = new RoundRobinQueue(diskFactory());
        queue.push(new Request("http://a.example/"), 0);
        queue.push(new Request("http://b.example/"), 0);
        Snapshot snapshot = queue.close();

        var slots = new LinkedHashMap<>(snapshot.slots());
        slots.put("c.example", List.of(new Bucket(0, "nowhere/p0-x")));
        assertThrows(StorageException.class, () -> new RoundRobinQueue(diskFactory(), new Snapshot(slots)));

        // the files of the slots reopened before the failure are still intact
        var reopened = new RoundRobinQueue(diskFactory(), snapshot);
        assertEquals(2, reopened.size());
        reopened.close();
    }

    @Test
    public void testEmptyBucketListRejected() {
        var snapshot = new Snapshot(Map.of("a", List.of()));
        assertThrows(MalformedSnapshotException.class, () -> new RoundRobinQueue(diskFactory(), snapshot));
    }

    @Test
    public void testSlotDirectories() throws IOException {
        var queue = new RoundRobinQueue(diskFactory());
        queue.push(new Request("http://a.example/").slot("weird/slot"), 1);
        Path slotDir = tempDir.resolve(Slots.toPath("weird/slot"));
        assertTrue(Files.isDirectory(slotDir));
        try (var files = Files.list(slotDir)) {
            assertTrue(files.allMatch(p -> p.getFileName().toString().startsWith("p1-")));
        }
        queue.close();
    }
}
