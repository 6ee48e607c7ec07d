package dev.goodone.rabbit.topology;

/**
 * The exchange, queue and binding a {@link DirectConsumer} or {@link TopicConsumer} reads from.
 *
 * With dead-lettering enabled, messages rejected by the consumer go to the exchange {@code <exchange>.dlx} and
 * end up in the queue {@code <queue>.dlq}. Dead letters are routed by the queue name, so several queues can share
 * one dead-letter exchange without seeing each other's rejections. The routing key of the first publish stays
 * available through {@link dev.goodone.rabbit.Delivery#ORIGINAL_ROUTING_KEY_HEADER} once a message was retried.
 */
public class ConsumerTopology {

    public static final String DEAD_LETTER_EXCHANGE_SUFFIX = ".dlx";
    public static final String DEAD_LETTER_QUEUE_SUFFIX = ".dlq";

    public final String exchange;
    public final String queue;
    public final String routingKey;
    public final boolean deadLetterEnabled;

    /**
     * @param routingKey the exact routing key for direct exchanges, a pattern with {@code *} and {@code #}
     *                   wildcards for topic exchanges
     */
    public ConsumerTopology(String exchange, String queue, String routingKey, boolean deadLetterEnabled) {
        this.exchange = exchange;
        this.queue = queue;
        this.routingKey = routingKey == null ? "" : routingKey;
        this.deadLetterEnabled = deadLetterEnabled;
    }

    public String deadLetterExchange() {
        return exchange + DEAD_LETTER_EXCHANGE_SUFFIX;
    }

    public String deadLetterQueue() {
        return queue + DEAD_LETTER_QUEUE_SUFFIX;
    }

    @Override
    public String toString() {
        return "{exchange='" + exchange + "', queue='" + queue + "', routingKey='" + routingKey
                + "', deadLetterEnabled=" + deadLetterEnabled + "}";
    }
}
