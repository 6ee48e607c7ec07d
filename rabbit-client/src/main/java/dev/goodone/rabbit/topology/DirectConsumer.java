package dev.goodone.rabbit.topology;

import dev.goodone.rabbit.ExchangeType;
import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.RabbitClient;

/**
 * Consumer bound to a direct exchange with an exact routing key.
 */
public class DirectConsumer extends ExchangeConsumer {

    public DirectConsumer(RabbitClient client, ConsumerTopology topology) throws MessagingException {
        super(client, topology, ExchangeType.direct);
    }
}
