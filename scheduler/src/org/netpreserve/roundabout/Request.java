package org.netpreserve.roundabout;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.roundabout.util.Url;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work waiting to be dispatched.
 * <p>
 * The scheduler never changes a request's identity. The only field it writes is {@link #slot()}, which it fills
 * in with the URL's host the first time the request is scheduled, unless the caller already chose a slot.
 */
public class Request {
    private final Url url;
    private final int priority;
    private final Map<String, Object> meta;
    private @Nullable String slot;

    public Request(String url) {
        this(new Url(url), 0, null, null);
    }

    public Request(String url, int priority) {
        this(new Url(url), priority, null, null);
    }

    @JsonCreator
    public Request(@JsonProperty("url") @NotNull Url url,
                   @JsonProperty("priority") int priority,
                   @JsonProperty("slot") @Nullable String slot,
                   @JsonProperty("meta") @Nullable Map<String, Object> meta) {
        this.url = Objects.requireNonNull(url, "url");
        this.priority = priority;
        this.slot = slot;
        this.meta = meta == null ? new LinkedHashMap<>() : new LinkedHashMap<>(meta);
    }

    @JsonProperty
    public Url url() {
        return url;
    }

    /**
     * Higher values are dispatched first within a slot.
     */
    @JsonProperty
    public int priority() {
        return priority;
    }

    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public @Nullable String slot() {
        return slot;
    }

    public Request slot(@Nullable String slot) {
        this.slot = slot;
        return this;
    }

    /**
     * Caller-owned metadata. Values must be serializable to JSON for the request to be stored on disk.
     */
    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Object> meta() {
        return meta;
    }

    @Override
    public String toString() {
        return "<" + priority + " " + url + (slot == null ? "" : " slot=" + slot) + ">";
    }
}
