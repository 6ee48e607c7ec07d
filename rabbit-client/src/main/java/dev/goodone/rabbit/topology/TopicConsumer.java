package dev.goodone.rabbit.topology;

import dev.goodone.rabbit.ExchangeType;
import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.RabbitClient;

/**
 * Consumer bound to a topic exchange with a routing pattern: {@code *} matches exactly one word, {@code #} matches
 * zero or more words.
 */
public class TopicConsumer extends ExchangeConsumer {

    public TopicConsumer(RabbitClient client, ConsumerTopology topology) throws MessagingException {
        super(client, topology, ExchangeType.topic);
    }
}
