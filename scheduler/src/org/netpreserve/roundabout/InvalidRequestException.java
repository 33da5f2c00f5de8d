package org.netpreserve.roundabout;

/**
 * Thrown when something that isn't a request is handed to the scheduler.
 */
public class InvalidRequestException extends IllegalArgumentException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
