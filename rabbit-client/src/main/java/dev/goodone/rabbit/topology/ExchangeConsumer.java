package dev.goodone.rabbit.topology;

import dev.goodone.rabbit.DeliveryHandler;
import dev.goodone.rabbit.ExchangeType;
import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.RabbitClient;
import dev.goodone.rabbit.util.Logger;
import rx.Subscription;

/**
 * Consumes the queue of a {@link ConsumerTopology}. The whole topology is declared when the consumer is created.
 */
public abstract class ExchangeConsumer implements AutoCloseable {

    private static final Logger log = new Logger(ExchangeConsumer.class);

    protected final RabbitClient client;
    protected final ConsumerTopology topology;

    private volatile Subscription subscription;

    protected ExchangeConsumer(RabbitClient client, ConsumerTopology topology, ExchangeType type) throws MessagingException {
        this.client = client;
        this.topology = topology;
        Topologies.declareConsumer(client, topology, type);
    }

    public ConsumerTopology getTopology() {
        return topology;
    }

    public synchronized Subscription consume(DeliveryHandler handler) throws MessagingException {
        if (subscription != null && !subscription.isUnsubscribed()) {
            throw new IllegalStateException("Already consuming from " + topology.queue);
        }
        subscription = client.consume(topology.queue, handler);
        return subscription;
    }

    /**
     * Like {@link #consume(DeliveryHandler)} but hands the handler the body deserialized into the given type.
     * A body that can not be deserialized counts as a handler failure.
     */
    public <T> Subscription consumeJson(Class<T> type, JsonHandler<T> handler) throws MessagingException {
        return consume(delivery -> handler.handle(delivery.bodyAs(type), delivery));
    }

    @Override
    public synchronized void close() {
        if (subscription != null) {
            log.infoWithParams("Closing consumer.", "queue", topology.queue);
            subscription.unsubscribe();
            subscription = null;
        }
    }
}
