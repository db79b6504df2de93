package com.p14n.eventbroker.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for event broker operations.
 *
 * <p>
 * This class provides four metrics, all attributed by event type where one
 * applies:
 * </p>
 * <ul>
 * <li>events_published: Counter for events published</li>
 * <li>events_delivered: Counter for deliveries that completed normally</li>
 * <li>delivery_failures: Counter for deliveries whose subscriber threw</li>
 * <li>active_subscriptions: Up/down counter for registered subscriptions</li>
 * </ul>
 */
public class BrokerMetrics {
        private static final AttributeKey<String> EVENT_TYPE = AttributeKey.stringKey("event_type");

        private final LongCounter publishedEvents;
        private final LongCounter deliveredEvents;
        private final LongCounter failedDeliveries;
        private final LongUpDownCounter activeSubscriptions;

        /**
         * Creates a new BrokerMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BrokerMetrics(Meter meter) {
                publishedEvents = meter.counterBuilder("events_published")
                                .setDescription("Number of events published")
                                .build();

                deliveredEvents = meter.counterBuilder("events_delivered")
                                .setDescription("Number of events delivered to subscribers")
                                .build();

                failedDeliveries = meter.counterBuilder("delivery_failures")
                                .setDescription("Number of deliveries where the subscriber threw")
                                .build();

                activeSubscriptions = meter.upDownCounterBuilder("active_subscriptions")
                                .setDescription("Number of active subscriptions")
                                .build();
        }

        /**
         * Records a publish call for the specified event type.
         * Increments the published events counter with the event type attribute.
         *
         * @param eventType The type of the published event
         */
        public void recordPublished(String eventType) {
                publishedEvents.add(1, Attributes.of(EVENT_TYPE, eventType));
        }

        /**
         * Records a delivery that completed normally.
         * Increments the delivered events counter with the event type attribute.
         *
         * @param eventType The type of the delivered event
         */
        public void recordDelivered(String eventType) {
                deliveredEvents.add(1, Attributes.of(EVENT_TYPE, eventType));
        }

        /**
         * Records a delivery whose subscriber threw.
         * Increments the delivery failures counter with the event type attribute.
         *
         * @param eventType The type of the event that failed to deliver
         */
        public void recordFailed(String eventType) {
                failedDeliveries.add(1, Attributes.of(EVENT_TYPE, eventType));
        }

        /**
         * Records a new subscription.
         * Increments the active subscriptions counter.
         */
        public void recordSubscriptionAdded() {
                activeSubscriptions.add(1);
        }

        /**
         * Records the removal of subscriptions, either unsubscribed or retired
         * after a one-shot match.
         *
         * @param count number of subscriptions removed
         */
        public void recordSubscriptionsRemoved(int count) {
                if (count > 0) {
                        activeSubscriptions.add(-count);
                }
        }
}
