package dev.goodone.rabbit;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Declaration of an exchange. Declaring an existing exchange with the same properties is a no-op on the broker.
 */
public class ExchangeSpec {

    public final String name;
    public final ExchangeType type;
    public final boolean durable;
    public final boolean autoDelete;
    public final boolean internal;
    public final Map<String, Object> arguments;

    public ExchangeSpec(String name, ExchangeType type, boolean durable, boolean autoDelete, boolean internal, Map<String, Object> arguments) {
        this.name = name;
        this.type = type;
        this.durable = durable;
        this.autoDelete = autoDelete;
        this.internal = internal;
        this.arguments = arguments == null ? ImmutableMap.of() : ImmutableMap.copyOf(arguments);
    }

    /**
     * A durable, not auto-deleted exchange without arguments.
     */
    public static ExchangeSpec durable(String name, ExchangeType type) {
        return new ExchangeSpec(name, type, true, false, false, null);
    }

    @Override
    public String toString() {
        return "{name='" + name + "', type=" + type + ", durable=" + durable + ", autoDelete=" + autoDelete + "}";
    }
}
