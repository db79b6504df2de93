package com.p14n.eventbroker;

import java.util.concurrent.atomic.AtomicInteger;

import com.p14n.eventbroker.broker.EventSubscriber;
import com.p14n.eventbroker.data.Event;

public enum CountingSubscriber implements EventSubscriber {
    INSTANCE;

    public static final String NOT_A_SUBSCRIBER = "not a subscriber";

    private final AtomicInteger received = new AtomicInteger();

    @Override
    public void onEvent(Event event) {
        received.incrementAndGet();
    }

    public int received() {
        return received.get();
    }

    public void reset() {
        received.set(0);
    }
}
