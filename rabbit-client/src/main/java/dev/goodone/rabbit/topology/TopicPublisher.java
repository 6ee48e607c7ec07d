package dev.goodone.rabbit.topology;

import dev.goodone.rabbit.ExchangeType;
import dev.goodone.rabbit.Message;
import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.RabbitClient;

/**
 * Publishes to a topic exchange. Routing keys are dot separated words matched against the binding patterns.
 */
public class TopicPublisher extends ExchangePublisher {

    public TopicPublisher(RabbitClient client, String exchange) throws MessagingException {
        super(client, exchange, ExchangeType.topic);
    }

    public void publishWithPriority(String routingKey, Object payload, int priority) throws MessagingException {
        publishMessage(routingKey, Message.json(payload).withPriority(priority).build());
    }
}
