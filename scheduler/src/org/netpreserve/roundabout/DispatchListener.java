package org.netpreserve.roundabout;

/**
 * Notified by the execution layer as dispatched requests travel downstream. Both methods are called exactly once
 * for every request returned by the scheduler, start before complete.
 */
public interface DispatchListener {
    void onDispatchStart(Request request);

    void onDispatchComplete(Request request);
}
