package org.netpreserve.roundabout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Counts the dispatched requests of each slot that haven't completed yet.
 */
public class SlotActivity implements DispatchListener {
    private static final Logger log = LoggerFactory.getLogger(SlotActivity.class);
    private final Map<String, Integer> inFlight = new HashMap<>();

    @Override
    public void onDispatchStart(Request request) {
        inFlight.merge(Slots.resolve(request), 1, Integer::sum);
    }

    @Override
    public void onDispatchComplete(Request request) {
        String slot = Slots.resolve(request);
        Integer count = inFlight.get(slot);
        if (count == null) {
            log.warn("Completion of {} without a matching dispatch start", request);
        } else if (count == 1) {
            inFlight.remove(slot);
        } else {
            inFlight.put(slot, count - 1);
        }
    }

    public int inFlight(String slot) {
        return inFlight.getOrDefault(slot, 0);
    }

    public int total() {
        int total = 0;
        for (int count : inFlight.values()) {
            total += count;
        }
        return total;
    }
}
