package com.p14n.eventbroker.broker;

import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Open/closed state of a {@link LocalEventBroker} and ownership of its delivery
 * pipeline.
 *
 * <p>
 * Opening from {@link State#CLOSED} creates a fresh pipeline. Opens nested
 * inside an open scope are counted, and only the release of the last scope
 * closes the pipeline. The state flip happens under the broker's subscription
 * lock so that no publish can submit a delivery once closing has begun; the
 * drain itself runs outside the lock. An open that follows a close waits for
 * the previous pipeline to finish draining, so deliveries of two cycles never
 * overlap. A delivery of that previous pipeline cannot wait for its own drain,
 * so opening from it is rejected.
 * </p>
 */
public class BrokerLifecycle {
    private static final Logger logger = LoggerFactory.getLogger(BrokerLifecycle.class);

    /**
     * Lifecycle states.
     */
    public enum State {
        CLOSED,
        OPEN
    }

    private final Lock lock;
    private final Supplier<DeliveryPipeline> pipelineFactory;
    private final String name;

    private State state = State.CLOSED;
    private long generation;
    private int openScopes;
    private DeliveryPipeline pipeline;
    private DeliveryPipeline lastClosed;

    /**
     * Creates a closed lifecycle.
     *
     * @param lock            the broker's subscription lock
     * @param pipelineFactory creates the pipeline for each open cycle
     * @param name            broker name used in log messages
     */
    public BrokerLifecycle(Lock lock, Supplier<DeliveryPipeline> pipelineFactory, String name) {
        this.lock = lock;
        this.pipelineFactory = pipelineFactory;
        this.name = name;
    }

    /**
     * Enters an open scope, starting a new pipeline if the broker was closed.
     *
     * @return the open cycle the scope belongs to, passed back to
     *         {@link #release(long)}
     * @throws IllegalStateException if called from a delivery of a cycle that is
     *                               still draining
     */
    public long open() {
        while (true) {
            DeliveryPipeline draining;
            lock.lock();
            try {
                if (openScopes > 0) {
                    openScopes++;
                    return generation;
                }
                draining = lastClosed;
                if (draining != null && draining.isDeliveryThread()) {
                    throw new IllegalStateException(
                            "Cannot open event broker " + name + " from a delivery of the cycle being closed");
                }
                if (draining == null) {
                    pipeline = pipelineFactory.get();
                    state = State.OPEN;
                    openScopes = 1;
                    generation++;
                    logger.atInfo().addArgument(name).log("Event broker {} opened");
                    return generation;
                }
            } finally {
                lock.unlock();
            }

            draining.close();

            lock.lock();
            try {
                if (lastClosed == draining) {
                    lastClosed = null;
                }
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Leaves one open scope. Leaving the last scope closes the broker and blocks
     * until every delivery already submitted has run. Does nothing when the
     * scope's cycle has already been closed.
     *
     * @param scopeGeneration the value returned by {@link #open()}
     */
    public void release(long scopeGeneration) {
        close(false, scopeGeneration);
    }

    /**
     * Leaves every open scope, closing the broker and draining its pipeline.
     */
    public void releaseAll() {
        close(true, -1);
    }

    private void close(boolean all, long scopeGeneration) {
        DeliveryPipeline closing;
        lock.lock();
        try {
            if (openScopes == 0 || (!all && scopeGeneration != generation)) {
                return;
            }
            openScopes = all ? 0 : openScopes - 1;
            if (openScopes > 0) {
                return;
            }
            closing = pipeline;
            pipeline = null;
            state = State.CLOSED;
            lastClosed = closing;
        } finally {
            lock.unlock();
        }

        logger.atInfo().addArgument(name).log("Closing event broker {}, draining deliveries");
        closing.close();
        logger.atInfo().addArgument(name).log("Event broker {} closed");
    }

    /**
     * Returns the pipeline of the current open cycle. Callers must hold the
     * subscription lock.
     *
     * @return the active pipeline
     * @throws BrokerClosedException if the broker is closed
     */
    DeliveryPipeline activePipeline() {
        if (state != State.OPEN) {
            throw new BrokerClosedException();
        }
        return pipeline;
    }

    /**
     * Returns the current state.
     *
     * @return the state
     */
    public State state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }
}
