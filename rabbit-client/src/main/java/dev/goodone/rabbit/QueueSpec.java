package dev.goodone.rabbit;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Declaration of a queue. An empty name lets the broker generate one.
 */
public class QueueSpec {

    public final String name;
    public final boolean durable;
    public final boolean exclusive;
    public final boolean autoDelete;
    public final Map<String, Object> arguments;

    public QueueSpec(String name, boolean durable, boolean exclusive, boolean autoDelete, Map<String, Object> arguments) {
        this.name = name == null ? "" : name;
        this.durable = durable;
        this.exclusive = exclusive;
        this.autoDelete = autoDelete;
        this.arguments = arguments == null ? ImmutableMap.of() : ImmutableMap.copyOf(arguments);
    }

    public static QueueSpec durable(String name) {
        return new QueueSpec(name, true, false, false, null);
    }

    public static QueueSpec durable(String name, Map<String, Object> arguments) {
        return new QueueSpec(name, true, false, false, arguments);
    }

    /**
     * A broker-named queue that only lives as long as the connection that declared it.
     */
    public static QueueSpec exclusiveTemporary() {
        return new QueueSpec("", false, true, true, null);
    }

    @Override
    public String toString() {
        return "{name='" + name + "', durable=" + durable + ", exclusive=" + exclusive
                + ", autoDelete=" + autoDelete + ", arguments=" + arguments + "}";
    }
}
