package dev.goodone.rabbit.tracing;

import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapSetter;

import java.util.Collections;
import java.util.Map;

/**
 * Lets a {@link io.opentelemetry.context.propagation.TextMapPropagator} read and write trace context in an AMQP
 * header table.
 */
public final class HeaderCarrier {

    public static final TextMapSetter<Map<String, Object>> SETTER = (carrier, key, value) -> {
        if (carrier != null) {
            carrier.put(key, value);
        }
    };

    /**
     * Values written by another process come back as {@link com.rabbitmq.client.LongString}, so every value is read
     * through its {@code toString()}.
     */
    public static final TextMapGetter<Map<String, Object>> GETTER = new TextMapGetter<Map<String, Object>>() {
        @Override
        public Iterable<String> keys(Map<String, Object> carrier) {
            return carrier == null ? Collections.emptySet() : carrier.keySet();
        }

        @Override
        public String get(Map<String, Object> carrier, String key) {
            if (carrier == null) {
                return null;
            }
            Object value = carrier.get(key);
            return value == null ? null : value.toString();
        }
    };

    private HeaderCarrier() {
    }
}
