package dev.goodone.rabbit;

/**
 * Where a message is published: an exchange and a routing key, plus the mandatory/immediate publish flags.
 * The empty exchange name is the broker's default exchange, which routes to the queue named by the routing key.
 */
public class Destination {

    public static final String DEFAULT_EXCHANGE = "";

    public final String exchange;
    public final String routingKey;
    public final boolean mandatory;
    public final boolean immediate;

    public Destination(String exchange, String routingKey, boolean mandatory, boolean immediate) {
        if (exchange == null || routingKey == null) {
            throw new IllegalArgumentException("exchange and routing key must not be null");
        }
        this.exchange = exchange;
        this.routingKey = routingKey;
        this.mandatory = mandatory;
        this.immediate = immediate;
    }

    public static Destination of(String exchange, String routingKey) {
        return new Destination(exchange, routingKey, false, false);
    }

    public static Destination queue(String queueName) {
        return new Destination(DEFAULT_EXCHANGE, queueName, false, false);
    }

    @Override
    public String toString() {
        return "{exchange='" + exchange + "', routingKey='" + routingKey + "'}";
    }
}
