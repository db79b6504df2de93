package com.p14n.eventbroker.broker;

/**
 * Opaque handle returned by {@link EventBroker#subscribe} and accepted by
 * {@link EventBroker#unsubscribe}. Tokens carry no reference to the subscriber.
 *
 * @param id registry-unique sequence number
 */
public record SubscriptionToken(long id) {

    @Override
    public String toString() {
        return "subscription-" + id;
    }
}
