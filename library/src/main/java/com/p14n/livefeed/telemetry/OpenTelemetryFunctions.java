package com.p14n.livefeed.telemetry;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import com.p14n.livefeed.data.Traceable;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapSetter;

public class OpenTelemetryFunctions {

        private OpenTelemetryFunctions() {
        }

        /**
         * @return the W3C traceparent of the current span, or null when nothing is
         *         being traced
         */
        public static String serializeTraceContext(OpenTelemetry ot) {
                Map<String, String> carrier = new HashMap<>();
                TextMapSetter<Map<String, String>> setter = Map::put;
                ot.getPropagators().getTextMapPropagator().inject(Context.current(), carrier, setter);
                return carrier.get("traceparent");
        }

        public static Context deserializeTraceContext(OpenTelemetry ot, String traceparent) {
                Map<String, String> carrier = new HashMap<>();
                carrier.put("traceparent", traceparent);
                return ot.getPropagators().getTextMapPropagator().extract(Context.current(), carrier,
                                new TraceparentGetter());
        }

        /**
         * Runs the action in a span parented on the event's stored trace context,
         * so work done for an event on another thread or process joins the trace
         * that published it.
         */
        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, Traceable event, String spanName,
                        Supplier<T> action) {
                SpanBuilder sb = tracer.spanBuilder(spanName)
                                .setAttribute("channel", event.topic())
                                .setAttribute("event.id", event.id())
                                .setAttribute("tenant", event.subject());
                if (event.traceparent() != null) {
                        sb.setParent(deserializeTraceContext(ot, event.traceparent()));
                }
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
