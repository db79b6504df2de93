package com.p14n.eventbroker.broker;

import com.p14n.eventbroker.data.Event;

/**
 * Callback registered with an {@link EventBroker}.
 *
 * <p>
 * {@link #onEvent(Event)} runs on the broker's delivery thread and must complete
 * synchronously. Deliveries of one broker never overlap, so a subscriber does
 * not need to guard state that only its callbacks touch.
 * </p>
 */
@FunctionalInterface
public interface EventSubscriber {

    /**
     * Called with each event matching the subscription.
     *
     * @param event the published event
     */
    void onEvent(Event event);

    /**
     * Called on the delivery thread when {@link #onEvent(Event)} threw.
     *
     * @param error the error thrown by {@code onEvent}
     */
    default void onError(Throwable error) {
    }
}
