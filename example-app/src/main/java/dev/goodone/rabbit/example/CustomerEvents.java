package dev.goodone.rabbit.example;

import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.RabbitClient;
import dev.goodone.rabbit.topology.ConsumerTopology;
import dev.goodone.rabbit.topology.DirectConsumer;
import dev.goodone.rabbit.topology.DirectPublisher;
import dev.goodone.rabbit.topology.ExchangeConsumer;
import dev.goodone.rabbit.topology.TopicConsumer;
import dev.goodone.rabbit.topology.TopicPublisher;
import dev.goodone.rabbit.util.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Customer lifecycle events.
 *
 * New customers are announced on the direct exchange {@code customer.direct} for the welcome-mail flow, and every
 * event goes to the topic exchange {@code events.topic} with routing key {@code customer.<event>} or
 * {@code customer.<aspect>.<event>}:
 * <ul>
 *     <li>{@code customer.lifecycle.queue} binds {@code customer.*} and sees single-word events only</li>
 *     <li>{@code customer.audit.queue} binds {@code customer.#} and sees all of them</li>
 * </ul>
 */
public class CustomerEvents implements AutoCloseable {

    private static final Logger log = new Logger(CustomerEvents.class);

    public static final String DIRECT_EXCHANGE = "customer.direct";
    public static final String TOPIC_EXCHANGE = "events.topic";
    public static final String CREATED = "customer.created";
    public static final String ADDRESS_CHANGED = "customer.address.changed";

    public static final String NOTIFICATION_QUEUE = "customer.notifications.queue";
    public static final String LIFECYCLE_QUEUE = "customer.lifecycle.queue";
    public static final String AUDIT_QUEUE = "customer.audit.queue";

    public interface Listener {
        void onEvent(String queue, CustomerEvent event) throws Exception;
    }

    private final DirectPublisher directPublisher;
    private final TopicPublisher topicPublisher;
    private final List<ExchangeConsumer> consumers = new ArrayList<>();

    public CustomerEvents(RabbitClient client) throws MessagingException {
        this.directPublisher = new DirectPublisher(client, DIRECT_EXCHANGE);
        this.topicPublisher = new TopicPublisher(client, TOPIC_EXCHANGE);
        consumers.add(new DirectConsumer(client, new ConsumerTopology(DIRECT_EXCHANGE, NOTIFICATION_QUEUE, CREATED, true)));
        consumers.add(new TopicConsumer(client, new ConsumerTopology(TOPIC_EXCHANGE, LIFECYCLE_QUEUE, "customer.*", true)));
        consumers.add(new TopicConsumer(client, new ConsumerTopology(TOPIC_EXCHANGE, AUDIT_QUEUE, "customer.#", false)));
    }

    public void start(Listener listener) throws MessagingException {
        for (ExchangeConsumer consumer : consumers) {
            String queue = consumer.getTopology().queue;
            consumer.consumeJson(CustomerEvent.class, (event, delivery) -> listener.onEvent(queue, event));
        }
    }

    public void customerCreated(Customer customer) throws MessagingException {
        CustomerEvent event = new CustomerEvent(customer.customer_id, "created", System.currentTimeMillis());
        directPublisher.publish(CREATED, event);
        topicPublisher.publish(CREATED, event);
        log.infoWithParams("Published customer event.", "customerId", customer.customer_id, "event", CREATED);
    }

    public void addressChanged(Customer customer) throws MessagingException {
        CustomerEvent event = new CustomerEvent(customer.customer_id, "address.changed", System.currentTimeMillis());
        topicPublisher.publish(ADDRESS_CHANGED, event);
        log.infoWithParams("Published customer event.", "customerId", customer.customer_id, "event", ADDRESS_CHANGED);
    }

    @Override
    public void close() {
        for (ExchangeConsumer consumer : consumers) {
            consumer.close();
        }
    }
}
