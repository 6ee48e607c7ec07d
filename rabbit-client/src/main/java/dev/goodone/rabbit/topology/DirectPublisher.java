package dev.goodone.rabbit.topology;

import dev.goodone.rabbit.ExchangeType;
import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.RabbitClient;

/**
 * Publishes to a direct exchange. Only queues bound with exactly the routing key of a message receive it.
 */
public class DirectPublisher extends ExchangePublisher {

    public DirectPublisher(RabbitClient client, String exchange) throws MessagingException {
        super(client, exchange, ExchangeType.direct);
    }
}
