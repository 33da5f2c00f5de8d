package org.netpreserve.roundabout.config;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * How the scheduler chooses which slot to dispatch from next.
 */
public enum FairnessPolicy {
    /**
     * Each slot with pending requests gets one dispatch per turn.
     */
    ROUND_ROBIN,
    /**
     * The slot with the fewest requests in flight downstream goes next.
     */
    DOWNLOADER_AWARE;

    @JsonCreator
    public static FairnessPolicy fromString(String value) {
        return value == null ? null : valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
