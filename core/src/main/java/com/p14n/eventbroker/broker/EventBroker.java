package com.p14n.eventbroker.broker;

import java.util.Collection;

import com.p14n.eventbroker.data.Event;

/**
 * Thread-safe contract for publishing events and managing subscriptions.
 * Deliveries happen asynchronously; none of these methods waits for a
 * subscriber to run.
 */
public interface EventBroker {

    /**
     * Subscribes to events of the given types.
     *
     * @param subscriber the callback to invoke with matching events
     * @param eventTypes event classes to deliver, or {@code null} for every type
     * @param oneShot    if true the subscription is removed once it has matched
     *                   a single event
     * @return token used to unsubscribe
     * @throws InvalidCallbackException if the subscriber cannot be run
     *                                  synchronously by this broker
     */
    SubscriptionToken subscribe(EventSubscriber subscriber, Collection<Class<? extends Event>> eventTypes,
            boolean oneShot);

    /**
     * Subscribes to events of the given types until unsubscribed.
     *
     * @param subscriber the callback to invoke with matching events
     * @param eventTypes event classes to deliver, or {@code null} for every type
     * @return token used to unsubscribe
     */
    default SubscriptionToken subscribe(EventSubscriber subscriber, Collection<Class<? extends Event>> eventTypes) {
        return subscribe(subscriber, eventTypes, false);
    }

    /**
     * Subscribes to every event until unsubscribed.
     *
     * @param subscriber the callback to invoke with every event
     * @return token used to unsubscribe
     */
    default SubscriptionToken subscribe(EventSubscriber subscriber) {
        return subscribe(subscriber, null, false);
    }

    /**
     * Removes a subscription. Tokens that are unknown, already removed or
     * retired after a one-shot match are ignored.
     *
     * @param token the token returned by {@code subscribe}
     */
    void unsubscribe(SubscriptionToken token);

    /**
     * Schedules delivery of the event to every matching subscription and returns
     * without waiting for the deliveries.
     *
     * @param event the event to publish
     * @throws BrokerClosedException    if the broker is not open
     * @throws IllegalArgumentException if the event is null
     */
    void publish(Event event);
}
