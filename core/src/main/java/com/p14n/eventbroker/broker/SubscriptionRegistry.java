package com.p14n.eventbroker.broker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.p14n.eventbroker.data.Event;

/**
 * Holds the active subscriptions of a broker, keyed by token, in registration
 * order.
 *
 * <p>
 * Not thread-safe. {@link LocalEventBroker} serializes every call under its
 * subscription lock.
 * </p>
 */
public class SubscriptionRegistry {

    private final Map<SubscriptionToken, Subscription> subscriptions = new LinkedHashMap<>();
    private long nextId = 1;

    /**
     * Registers a subscription.
     *
     * @param subscriber the callback to register
     * @param eventTypes event classes to deliver; {@code null} or empty for every
     *                   type
     * @param oneShot    whether to retire the subscription after its first match
     * @return the token identifying the new subscription
     * @throws InvalidCallbackException if the subscriber is null or asynchronous
     * @throws IllegalArgumentException if eventTypes contains null
     */
    public SubscriptionToken add(EventSubscriber subscriber, Collection<Class<? extends Event>> eventTypes,
            boolean oneShot) {
        validate(subscriber);
        Set<Class<? extends Event>> types = null;
        if (eventTypes != null && !eventTypes.isEmpty()) {
            for (Class<? extends Event> type : eventTypes) {
                if (type == null) {
                    throw new IllegalArgumentException("Event types cannot contain null");
                }
            }
            types = Set.copyOf(eventTypes);
        }

        SubscriptionToken token = new SubscriptionToken(nextId++);
        subscriptions.put(token, new Subscription(token, subscriber, types, oneShot));
        return token;
    }

    /**
     * Removes a subscription. Unknown or already removed tokens are ignored.
     *
     * @param token the token returned by {@link #add}
     * @return the removed subscription, or {@code null} if there was none
     */
    public Subscription remove(SubscriptionToken token) {
        if (token == null) {
            return null;
        }
        return subscriptions.remove(token);
    }

    /**
     * Returns a copy of every subscription matching the event, in registration
     * order. The copy stays valid while the registry is modified.
     *
     * @param event the published event
     * @return the matching subscriptions
     */
    public List<Subscription> match(Event event) {
        List<Subscription> matched = new ArrayList<>();
        for (Subscription subscription : subscriptions.values()) {
            if (subscription.matches(event)) {
                matched.add(subscription);
            }
        }
        return matched;
    }

    public boolean contains(SubscriptionToken token) {
        return subscriptions.containsKey(token);
    }

    public int size() {
        return subscriptions.size();
    }

    private static void validate(EventSubscriber subscriber) {
        if (subscriber == null) {
            throw new InvalidCallbackException("Subscriber cannot be null");
        }
        if (subscriber instanceof AsyncEventSubscriber) {
            throw new InvalidCallbackException(
                    "Asynchronous subscribers are not supported on a synchronous event broker: "
                            + subscriber.getClass().getName());
        }
    }
}
