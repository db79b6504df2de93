package com.p14n.eventbroker.broker;

/**
 * Thrown when an event is published while the broker is not open.
 */
public class BrokerClosedException extends IllegalStateException {

    public BrokerClosedException() {
        super("Broker is closed");
    }
}
