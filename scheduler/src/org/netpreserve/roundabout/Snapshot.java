package org.netpreserve.roundabout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.netpreserve.roundabout.queue.Bucket;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;

/**
 * What a fairness queue needs to pick up where it left off: for each slot, in rotation order, the priority levels
 * that still had entries when it was closed. The entries themselves stay in the queue files.
 * <p>
 * Stored as a JSON object mapping each slot to an array of {@code {"priority": ..., "location": ...}} objects.
 */
public record Snapshot(Map<String, List<Bucket>> slots) {
    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public Snapshot {
        var copy = new LinkedHashMap<String, List<Bucket>>();
        slots.forEach((slot, buckets) -> copy.put(slot, List.copyOf(buckets)));
        slots = Collections.unmodifiableMap(copy);
    }

    public static Snapshot empty() {
        return new Snapshot(Map.of());
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public static Snapshot read(Path file) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new MalformedSnapshotException("Unable to parse queue state " + file, e);
        }
        return parse(root);
    }

    public static Snapshot parse(JsonNode root) throws MalformedSnapshotException {
        if (root == null || root.isMissingNode() || root.isNull()) return empty();
        if (!root.isObject()) {
            throw new MalformedSnapshotException("Queue state is a " + root.getNodeType() +
                                                 " rather than an object of slots. It was probably written by an " +
                                                 "incompatible older version. Delete the job directory to start " +
                                                 "the crawl afresh.");
        }
        var slots = new LinkedHashMap<String, List<Bucket>>();
        var fields = root.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            String slot = field.getKey();
            JsonNode value = field.getValue();
            if (!value.isArray() || value.isEmpty()) {
                throw new MalformedSnapshotException("Queue state for slot '" + slot +
                                                     "' is not a non-empty list of priorities");
            }
            var buckets = new ArrayList<Bucket>(value.size());
            for (JsonNode element : value) {
                buckets.add(parseBucket(slot, element));
            }
            slots.put(slot, buckets);
        }
        return new Snapshot(slots);
    }

    private static Bucket parseBucket(String slot, JsonNode node) throws MalformedSnapshotException {
        JsonNode priority = node.get("priority");
        JsonNode location = node.get("location");
        if (!node.isObject() || priority == null || !priority.canConvertToInt() || !priority.isIntegralNumber()
            || (location != null && !location.isNull() && !location.isTextual())) {
            throw new MalformedSnapshotException("Invalid priority entry for slot '" + slot + "': " + node);
        }
        return new Bucket(priority.intValue(), location == null || location.isNull() ? null : location.textValue());
    }

    public JsonNode toJson() {
        ObjectNode root = mapper.createObjectNode();
        slots.forEach((slot, buckets) -> {
            ArrayNode array = root.putArray(slot);
            for (Bucket bucket : buckets) {
                array.addObject()
                        .put("priority", bucket.priority())
                        .put("location", bucket.location());
            }
        });
        return root;
    }

    /**
     * Writes the snapshot via a temporary file so a crash never leaves a half-written state behind.
     */
    public void write(Path file) throws IOException {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), toJson());
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
