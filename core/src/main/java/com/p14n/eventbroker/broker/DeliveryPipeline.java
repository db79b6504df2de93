package com.p14n.eventbroker.broker;

import static com.p14n.eventbroker.telemetry.OpenTelemetryFunctions.processWithTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventbroker.data.Event;
import com.p14n.eventbroker.telemetry.BrokerMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

/**
 * Delivers events to subscribers on a {@link DeliveryExecutor}, isolating each
 * delivery's failure.
 *
 * <p>
 * A subscriber that throws anything, errors included, is logged with the event
 * type and the subscriber identity, told through
 * {@link EventSubscriber#onError(Throwable)}, and the executor moves on to the
 * next queued delivery. Only a {@link VirtualMachineError} other than a stack
 * overflow is rethrown once it has been reported. Nothing propagates back to the
 * publisher, which has already returned.
 * </p>
 */
public class DeliveryPipeline implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DeliveryPipeline.class);

    private final DeliveryExecutor executor;
    private final BrokerMetrics metrics;
    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;

    /**
     * Creates a pipeline delivering on the given executor.
     *
     * @param executor      the executor running deliveries; owned by this pipeline
     * @param metrics       metrics recorder
     * @param openTelemetry OpenTelemetry instance for trace propagation
     * @param tracer        tracer for delivery spans
     */
    public DeliveryPipeline(DeliveryExecutor executor, BrokerMetrics metrics, OpenTelemetry openTelemetry,
            Tracer tracer) {
        this.executor = executor;
        this.metrics = metrics;
        this.openTelemetry = openTelemetry;
        this.tracer = tracer;
    }

    /**
     * Queues delivery of the event to the subscriber.
     *
     * @param subscriber the subscriber to call
     * @param event      the event to deliver
     * @throws java.util.concurrent.RejectedExecutionException if the pipeline is
     *                                                         closing
     */
    public void submit(EventSubscriber subscriber, Event event) {
        executor.execute(() -> deliver(subscriber, event));
    }

    void deliver(EventSubscriber subscriber, Event event) {
        try {
            processWithTelemetry(openTelemetry, tracer, event, "deliver_event", () -> {
                subscriber.onEvent(event);
                return null;
            });
            metrics.recordDelivered(event.eventType());
        } catch (Throwable e) {
            metrics.recordFailed(event.eventType());
            logger.atError()
                    .setCause(e)
                    .addArgument(event.eventType())
                    .addArgument(subscriber)
                    .log("Error delivering {} event to {}");
            try {
                subscriber.onError(e);
            } catch (Throwable onErrorFailure) {
                logger.atWarn()
                        .setCause(onErrorFailure)
                        .addArgument(subscriber)
                        .log("Error handler of {} failed");
                rethrowIfFatal(onErrorFailure);
            }
            rethrowIfFatal(e);
        }
    }

    // out of memory and internal VM errors still end the worker
    private static void rethrowIfFatal(Throwable t) {
        if (t instanceof VirtualMachineError && !(t instanceof StackOverflowError)) {
            throw (VirtualMachineError) t;
        }
    }

    /**
     * Checks whether the caller is running inside one of this pipeline's
     * deliveries.
     *
     * @return true on the delivery thread
     */
    boolean isDeliveryThread() {
        return executor.isWorkerThread();
    }

    /**
     * Runs every delivery already submitted, then stops the executor.
     */
    @Override
    public void close() {
        executor.close();
    }
}
