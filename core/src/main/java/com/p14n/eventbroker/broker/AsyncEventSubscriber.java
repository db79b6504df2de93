package com.p14n.eventbroker.broker;

import java.util.concurrent.CompletionStage;

import com.p14n.eventbroker.data.Event;

/**
 * A subscriber whose work completes asynchronously.
 *
 * <p>
 * {@link LocalEventBroker} runs callbacks one at a time on its delivery thread
 * and refuses these subscribers at subscription time: a delivery that returns
 * before its work is done would let the next delivery overtake it.
 * </p>
 */
@FunctionalInterface
public interface AsyncEventSubscriber extends EventSubscriber {

    /**
     * Starts handling the event.
     *
     * @param event the published event
     * @return a stage completing when the event has been handled
     */
    CompletionStage<Void> onEventAsync(Event event);

    @Override
    default void onEvent(Event event) {
        onEventAsync(event);
    }
}
