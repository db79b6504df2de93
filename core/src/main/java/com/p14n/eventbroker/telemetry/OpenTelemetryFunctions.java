package com.p14n.eventbroker.telemetry;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import com.p14n.eventbroker.data.Event;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapSetter;

/**
 * Utility class providing OpenTelemetry instrumentation functions for
 * publishing and delivering events.
 * Supports trace context propagation, span creation, and execution with
 * telemetry.
 *
 * <p>
 * Key features:
 * </p>
 * <ul>
 * <li>Trace context serialization and deserialization</li>
 * <li>Automated span management with error recording</li>
 * <li>Spans tagged with the event type and parented on the event's
 * traceparent</li>
 * </ul>
 */
public class OpenTelemetryFunctions {

        /** Private constructor to prevent instantiation of utility class */
        private OpenTelemetryFunctions() {
        }

        /**
         * Serializes the current trace context into a string format.
         * Events carry it so that deliveries continue the publisher's trace.
         *
         * @param ot OpenTelemetry instance to use for propagation
         * @return String representation of the trace context (traceparent), or
         *         null when there is no active span
         */
        public static String serializeTraceContext(OpenTelemetry ot) {
                Map<String, String> carrier = new HashMap<>();
                TextMapSetter<Map<String, String>> setter = Map::put;
                ot.getPropagators().getTextMapPropagator().inject(Context.current(), carrier, setter);
                return carrier.get("traceparent");
        }

        /**
         * Deserializes a trace context string back into an OpenTelemetry Context.
         *
         * @param ot          OpenTelemetry instance to use for propagation
         * @param traceparent Serialized trace context string
         * @return Reconstructed OpenTelemetry Context
         */
        public static Context deserializeTraceContext(OpenTelemetry ot, String traceparent) {
                Map<String, String> carrier = new HashMap<>();
                carrier.put("traceparent", traceparent);
                return ot.getPropagators().getTextMapPropagator().extract(Context.current(), carrier,
                                new MapTextMapGetter());
        }

        /**
         * Executes an action within a new span tagged with the event type.
         * Failures are recorded on the span and rethrown.
         *
         * @param <T>         Return type of the action
         * @param ot          OpenTelemetry instance
         * @param tracer      Tracer to create spans
         * @param spanName    Name of the span
         * @param eventType   Event type attribute
         * @param traceparent Parent trace context, may be null
         * @param action      Action to execute within the span
         * @return Result of the action
         */
        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, String spanName, String eventType,
                        String traceparent, Supplier<T> action) {

                Context parentContext = traceparent == null ? null
                                : OpenTelemetryFunctions.deserializeTraceContext(ot, traceparent);
                SpanBuilder sb = tracer.spanBuilder(spanName)
                                .setAttribute("event.type", eventType);
                if (parentContext != null) {
                        sb.setParent(parentContext);
                }
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException | Error e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }

        /**
         * Executes an action within a new span with the given name.
         *
         * @param <T>      Return type of the action
         * @param tracer   Tracer to create spans
         * @param spanName Name of the span
         * @param action   Action to execute within the span
         * @return Result of the action
         */
        public static <T> T processWithTelemetry(Tracer tracer, String spanName,
                        Supplier<T> action) {

                Span span = tracer.spanBuilder(spanName).startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException | Error e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }

        /**
         * Executes an action within a span for the given event, continuing the
         * trace recorded in its traceparent.
         *
         * @param <T>      Return type of the action
         * @param ot       OpenTelemetry instance
         * @param tracer   Tracer to create spans
         * @param event    Event providing the type and traceparent
         * @param spanName Name of the span
         * @param action   Action to execute within the span
         * @return Result of the action
         */
        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, Event event, String spanName,
                        Supplier<T> action) {
                return processWithTelemetry(ot, tracer, spanName, event.eventType(), event.traceparent(), action);
        }

}
