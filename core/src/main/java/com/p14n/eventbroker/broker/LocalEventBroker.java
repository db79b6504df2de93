package com.p14n.eventbroker.broker;

import static com.p14n.eventbroker.telemetry.OpenTelemetryFunctions.processWithTelemetry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventbroker.data.BrokerConfig;
import com.p14n.eventbroker.data.ConfigData;
import com.p14n.eventbroker.data.Event;
import com.p14n.eventbroker.telemetry.BrokerMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

/**
 * In-process event broker delivering events to subscribers on a single
 * background thread.
 *
 * <p>
 * Key features:
 * </p>
 * <ul>
 * <li>Subscriptions filtered by exact event class, optionally one-shot</li>
 * <li>Publishing never waits for subscribers</li>
 * <li>Deliveries run one at a time in publish order, so each subscriber sees
 * events in the order they were published</li>
 * <li>A failing subscriber is logged and does not affect the others</li>
 * <li>Reentrant open/close lifecycle; subscriptions survive close and
 * reopen</li>
 * <li>OpenTelemetry integration for metrics and tracing</li>
 * </ul>
 *
 * <p>
 * Subscribing and unsubscribing are allowed at any time. Publishing requires an
 * open scope: the broker starts its delivery thread when first opened and stops
 * it, after running every delivery already scheduled, when the last scope is
 * closed.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var broker = new LocalEventBroker(new ConfigData("scheduler"), openTelemetry);
 * var token = broker.subscribe(event -> log(event), Set.of(Heartbeat.class));
 * try (BrokerHandle handle = broker.open()) {
 *     handle.publish(Heartbeat.create("scheduler", 1));
 * } // blocks until the heartbeat has been delivered
 * broker.unsubscribe(token);
 * }</pre>
 */
public class LocalEventBroker implements EventBroker, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LocalEventBroker.class);

    /**
     * Guards the registry, the match-and-retire step of publish and lifecycle
     * state changes. Never held while a subscriber runs.
     */
    private final ReentrantLock subscriptionsLock = new ReentrantLock();

    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final BrokerLifecycle lifecycle;
    private final BrokerMetrics metrics;
    private final Tracer tracer;
    private final OpenTelemetry openTelemetry;
    private final String name;

    /**
     * Creates a closed broker with the given name.
     *
     * @param name the broker name
     * @param ot   the OpenTelemetry instance for metrics and tracing
     */
    public LocalEventBroker(String name, OpenTelemetry ot) {
        this(new ConfigData(name), ot);
    }

    /**
     * Creates a closed broker delivering on a {@link SingleThreadDeliveryExecutor}.
     *
     * @param cfg the broker configuration
     * @param ot  the OpenTelemetry instance for metrics and tracing
     */
    public LocalEventBroker(BrokerConfig cfg, OpenTelemetry ot) {
        this(cfg, () -> new SingleThreadDeliveryExecutor(cfg.threadNameFormat()), ot);
    }

    /**
     * Creates a closed broker with a custom executor for each open cycle.
     *
     * @param cfg              the broker configuration
     * @param executorFactory  creates a fresh executor each time the broker opens
     * @param ot               the OpenTelemetry instance for metrics and tracing
     */
    public LocalEventBroker(BrokerConfig cfg, Supplier<? extends DeliveryExecutor> executorFactory,
            OpenTelemetry ot) {
        this.name = cfg.name();
        this.openTelemetry = ot;
        this.metrics = new BrokerMetrics(ot.getMeter(cfg.name()));
        this.tracer = ot.getTracer(cfg.name());
        this.lifecycle = new BrokerLifecycle(subscriptionsLock,
                () -> new DeliveryPipeline(executorFactory.get(), metrics, openTelemetry, tracer),
                name);
    }

    /**
     * Opens a scope in which events can be published. The first open starts the
     * delivery thread; nested opens share it.
     *
     * @return handle whose close leaves the scope
     */
    public BrokerHandle open() {
        long generation = lifecycle.open();
        return new BrokerHandle(this, lifecycle, generation);
    }

    /**
     * Checks whether the broker is inside an open scope.
     *
     * @return true if events can be published
     */
    public boolean isOpen() {
        return lifecycle.state() == BrokerLifecycle.State.OPEN;
    }

    @Override
    public SubscriptionToken subscribe(EventSubscriber subscriber, Collection<Class<? extends Event>> eventTypes,
            boolean oneShot) {
        SubscriptionToken token;
        subscriptionsLock.lock();
        try {
            token = registry.add(subscriber, eventTypes, oneShot);
        } finally {
            subscriptionsLock.unlock();
        }
        metrics.recordSubscriptionAdded();
        logger.atDebug()
                .addArgument(token)
                .addArgument(subscriber)
                .addArgument(name)
                .log("Added {} for {} on {}");
        return token;
    }

    @Override
    public void unsubscribe(SubscriptionToken token) {
        Subscription removed;
        subscriptionsLock.lock();
        try {
            removed = registry.remove(token);
        } finally {
            subscriptionsLock.unlock();
        }
        if (removed == null) {
            logger.atDebug().addArgument(token).log("Ignoring unsubscribe of unknown {}");
            return;
        }
        metrics.recordSubscriptionsRemoved(1);
    }

    /**
     * Schedules delivery to every matching subscription. One-shot subscriptions
     * are retired before the lock is released, so a concurrent publish cannot
     * match them again.
     */
    @Override
    public void publish(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }

        int retired;
        subscriptionsLock.lock();
        try {
            DeliveryPipeline pipeline = lifecycle.activePipeline();
            metrics.recordPublished(event.eventType());
            retired = processWithTelemetry(openTelemetry, tracer, event, "publish_event", () -> {
                List<SubscriptionToken> oneShotTokens = new ArrayList<>();
                for (Subscription subscription : registry.match(event)) {
                    pipeline.submit(subscription.subscriber(), event);
                    if (subscription.oneShot()) {
                        oneShotTokens.add(subscription.token());
                    }
                }
                for (SubscriptionToken token : oneShotTokens) {
                    registry.remove(token);
                }
                return oneShotTokens.size();
            });
        } finally {
            subscriptionsLock.unlock();
        }
        metrics.recordSubscriptionsRemoved(retired);
    }

    /**
     * Closes every open scope, blocking until scheduled deliveries have run.
     * Subscriptions are kept; the broker can be opened again.
     */
    @Override
    public void close() {
        lifecycle.releaseAll();
    }

    /**
     * Returns the number of registered subscriptions.
     *
     * @return the subscription count
     */
    public int subscriptionCount() {
        subscriptionsLock.lock();
        try {
            return registry.size();
        } finally {
            subscriptionsLock.unlock();
        }
    }
}
