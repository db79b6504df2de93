package com.p14n.eventbroker.broker;

import java.util.Collection;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.eventbroker.data.Event;

/**
 * An open scope of a {@link LocalEventBroker}, returned by
 * {@link LocalEventBroker#open()}.
 *
 * <p>
 * Closing the handle leaves the scope; closing it again does nothing. When the
 * last open handle of a broker is closed, the call blocks until every delivery
 * already scheduled has run. A handle whose broker was closed through
 * {@link LocalEventBroker#close()} no longer counts towards a later open cycle.
 * </p>
 */
public class BrokerHandle implements EventBroker, AutoCloseable {

    private final LocalEventBroker broker;
    private final BrokerLifecycle lifecycle;
    private final long generation;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    BrokerHandle(LocalEventBroker broker, BrokerLifecycle lifecycle, long generation) {
        this.broker = broker;
        this.lifecycle = lifecycle;
        this.generation = generation;
    }

    public LocalEventBroker broker() {
        return broker;
    }

    @Override
    public SubscriptionToken subscribe(EventSubscriber subscriber, Collection<Class<? extends Event>> eventTypes,
            boolean oneShot) {
        return broker.subscribe(subscriber, eventTypes, oneShot);
    }

    @Override
    public void unsubscribe(SubscriptionToken token) {
        broker.unsubscribe(token);
    }

    @Override
    public void publish(Event event) {
        broker.publish(event);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            lifecycle.release(generation);
        }
    }
}
