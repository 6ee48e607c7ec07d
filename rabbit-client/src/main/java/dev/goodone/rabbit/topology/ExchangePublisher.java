package dev.goodone.rabbit.topology;

import dev.goodone.rabbit.Destination;
import dev.goodone.rabbit.ExchangeType;
import dev.goodone.rabbit.Message;
import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.RabbitClient;

import java.util.Map;

/**
 * Publishes JSON payloads to one durable exchange, declared when the publisher is created.
 */
public abstract class ExchangePublisher {

    protected final RabbitClient client;
    protected final String exchange;

    protected ExchangePublisher(RabbitClient client, String exchange, ExchangeType type) throws MessagingException {
        this.client = client;
        this.exchange = exchange;
        Topologies.declareExchange(client, exchange, type);
    }

    public String getExchange() {
        return exchange;
    }

    public void publish(String routingKey, Object payload) throws MessagingException {
        publishMessage(routingKey, Message.json(payload).build());
    }

    public void publishWithHeaders(String routingKey, Object payload, Map<String, Object> headers) throws MessagingException {
        publishMessage(routingKey, Message.json(payload).withHeaders(headers).build());
    }

    public void publishMessage(String routingKey, Message message) throws MessagingException {
        client.publish(Destination.of(exchange, routingKey), message);
    }
}
