package com.p14n.eventbroker;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventbroker.broker.BrokerHandle;
import com.p14n.eventbroker.broker.EventSubscriber;
import com.p14n.eventbroker.broker.LocalEventBroker;
import com.p14n.eventbroker.data.ConfigData;
import com.p14n.eventbroker.data.Heartbeat;
import com.p14n.eventbroker.telemetry.DefaultTelemetryConfig;
import com.p14n.eventbroker.telemetry.OpenTelemetryFunctions;
import com.p14n.eventbroker.telemetry.TelemetryConfig;
import com.p14n.eventbroker.util.Conversions;
import com.p14n.eventbroker.util.Dates;
import com.p14n.eventbroker.util.References;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Tracer;

/**
 * Publishes heartbeats through a {@link LocalEventBroker} to the subscribers
 * named in the environment.
 *
 * <p>
 * Environment:
 * </p>
 * <ul>
 * <li>{@code APP_BROKER_NAME}: broker name, default {@code app}</li>
 * <li>{@code APP_SUBSCRIBERS}: comma separated subscriber references such as
 * {@code com.p14n.eventbroker:LoggingSubscriber.INSTANCE}</li>
 * <li>{@code APP_HEARTBEATS}: number of heartbeats to publish, default 10</li>
 * <li>{@code APP_HEARTBEAT_MILLIS}: pause between heartbeats, default 1000</li>
 * <li>{@code APP_TRACING}: whether to enable the OpenTelemetry SDK, default
 * true</li>
 * </ul>
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static String[] envVals(Function<String, String> env, String name) {
        var e = env.apply(name);
        if (e != null && !e.isBlank()) {
            return e.split(",");
        }
        return new String[] {};
    }

    private static String envVal(Function<String, String> env, String name, String defaultValue) {
        var e = env.apply(name);
        return e != null && !e.isBlank() ? e : defaultValue;
    }

    public static void main(String[] args) throws Exception {
        run(System::getenv);
    }

    /**
     * Runs the heartbeat publisher until every heartbeat has been delivered.
     *
     * @param env environment lookup
     * @return number of heartbeats published
     * @throws InterruptedException if interrupted between heartbeats
     */
    public static int run(Function<String, String> env) throws InterruptedException {
        var name = envVal(env, "APP_BROKER_NAME", "app");
        int heartbeats = Conversions.asInt(envVal(env, "APP_HEARTBEATS", "10"));
        int pauseMillis = Conversions.asInt(envVal(env, "APP_HEARTBEAT_MILLIS", "1000"));
        boolean tracing = Conversions.asBool(envVal(env, "APP_TRACING", "true"));

        var refs = envVals(env, "APP_SUBSCRIBERS");
        if (refs.length == 0) {
            refs = new String[] { References.objToRef(LoggingSubscriber.INSTANCE) };
        }
        List<EventSubscriber> subscribers = new ArrayList<>();
        for (String ref : refs) {
            subscribers.add(resolveSubscriber(ref.trim()));
        }

        TelemetryConfig telemetry = tracing ? new DefaultTelemetryConfig(name) : new NoopTelemetry();
        try (telemetry) {
            var ot = telemetry.getOpenTelemetry();
            var broker = new LocalEventBroker(new ConfigData(name), ot);
            for (EventSubscriber subscriber : subscribers) {
                broker.subscribe(subscriber);
            }

            logger.atInfo()
                    .addArgument(heartbeats)
                    .addArgument(subscribers.size())
                    .log("Publishing {} heartbeats to {} subscribers");

            try (BrokerHandle handle = broker.open()) {
                awaitNextSecond();
                for (int n = 1; n <= heartbeats; n++) {
                    long sequence = n;
                    OpenTelemetryFunctions.processWithTelemetry(telemetry.getTracer(), "publish_heartbeat", () -> {
                        handle.publish(Heartbeat.create(name, sequence,
                                OpenTelemetryFunctions.serializeTraceContext(ot)));
                        return null;
                    });
                    if (n < heartbeats) {
                        Thread.sleep(pauseMillis);
                    }
                }
            }
        }
        return heartbeats;
    }

    private static EventSubscriber resolveSubscriber(String ref) {
        Object obj = References.refToObj(ref);
        if (!(obj instanceof EventSubscriber)) {
            throw new IllegalArgumentException(ref + " is not an EventSubscriber");
        }
        return (EventSubscriber) obj;
    }

    private static void awaitNextSecond() throws InterruptedException {
        var now = LocalDateTime.now();
        var wait = Duration.between(now, Dates.datetimeCeil(now));
        logger.atDebug().addArgument(Dates.timedeltaSeconds(wait)).log("Aligning heartbeats, waiting {}s");
        Thread.sleep(wait.toMillis());
    }

    private static class NoopTelemetry implements TelemetryConfig {
        private final OpenTelemetry ot = OpenTelemetry.noop();

        @Override
        public Meter getMeter() {
            return ot.getMeter("noop");
        }

        @Override
        public Tracer getTracer() {
            return ot.getTracer("noop");
        }

        @Override
        public OpenTelemetry getOpenTelemetry() {
            return ot;
        }
    }
}
