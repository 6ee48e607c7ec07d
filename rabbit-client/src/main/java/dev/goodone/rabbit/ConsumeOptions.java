package dev.goodone.rabbit;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * How a consumer is registered on the broker.
 *
 * By default deliveries are acknowledged by the client after the handler ran (prefetch 1), the consumer tag is
 * chosen by the broker and the consumer is registered again after a lost connection has been replaced.
 */
public class ConsumeOptions {

    public final String queue;
    public final String consumerTag;
    public final boolean autoAck;
    public final boolean exclusive;
    public final boolean recover;
    public final Map<String, Object> arguments;

    private ConsumeOptions(Builder b) {
        this.queue = b.queue;
        this.consumerTag = b.consumerTag;
        this.autoAck = b.autoAck;
        this.exclusive = b.exclusive;
        this.recover = b.recover;
        this.arguments = Collections.unmodifiableMap(new HashMap<>(b.arguments));
    }

    public static ConsumeOptions forQueue(String queue) {
        return new Builder(queue).build();
    }

    @Override
    public String toString() {
        return "{queue='" + queue + "', consumerTag='" + consumerTag + "', autoAck=" + autoAck
                + ", exclusive=" + exclusive + ", recover=" + recover + "}";
    }

    public static class Builder {
        private final String queue;
        private String consumerTag = "";
        private boolean autoAck = false;
        private boolean exclusive = false;
        private boolean recover = true;
        private Map<String, Object> arguments = new HashMap<>();

        public Builder(String queue) {
            if (queue == null || queue.isEmpty()) {
                throw new IllegalArgumentException("queue name must not be empty");
            }
            this.queue = queue;
        }

        public Builder withConsumerTag(String consumerTag) {
            this.consumerTag = consumerTag == null ? "" : consumerTag;
            return this;
        }

        public Builder withAutoAck(boolean autoAck) {
            this.autoAck = autoAck;
            return this;
        }

        public Builder withExclusive(boolean exclusive) {
            this.exclusive = exclusive;
            return this;
        }

        public Builder withRecover(boolean recover) {
            this.recover = recover;
            return this;
        }

        public Builder withArguments(Map<String, Object> arguments) {
            this.arguments = arguments == null ? new HashMap<>() : new HashMap<>(arguments);
            return this;
        }

        public ConsumeOptions build() {
            return new ConsumeOptions(this);
        }
    }
}
