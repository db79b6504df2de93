package com.p14n.eventbroker.broker;

import java.util.Set;

import com.p14n.eventbroker.data.Event;

/**
 * A registered interest in events, held by the {@link SubscriptionRegistry}.
 *
 * @param token      handle identifying the subscription
 * @param subscriber callback receiving matching events
 * @param eventTypes event classes to deliver, or {@code null} for every type
 * @param oneShot    whether the subscription is retired after its first match
 */
public record Subscription(SubscriptionToken token,
        EventSubscriber subscriber,
        Set<Class<? extends Event>> eventTypes,
        boolean oneShot) {

    /**
     * Checks whether the event's type satisfies this subscription's filter.
     *
     * @param event the published event
     * @return true if the event should be delivered to this subscription
     */
    public boolean matches(Event event) {
        return eventTypes == null || eventTypes.contains(event.getClass());
    }
}
