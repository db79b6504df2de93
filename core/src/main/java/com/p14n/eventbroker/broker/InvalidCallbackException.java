package com.p14n.eventbroker.broker;

/**
 * Thrown at subscription time when a callback cannot be run synchronously on
 * the broker's delivery thread.
 */
public class InvalidCallbackException extends IllegalArgumentException {

    /**
     * Creates a new exception with the given message.
     *
     * @param message description of the rejected callback
     */
    public InvalidCallbackException(String message) {
        super(message);
    }
}
