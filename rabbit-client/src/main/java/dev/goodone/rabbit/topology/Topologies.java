package dev.goodone.rabbit.topology;

import dev.goodone.rabbit.ExchangeSpec;
import dev.goodone.rabbit.ExchangeType;
import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.QueueSpec;
import dev.goodone.rabbit.RabbitClient;
import dev.goodone.rabbit.TopologyException;
import dev.goodone.rabbit.util.Logger;
import com.google.common.base.Strings;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

final class Topologies {

    private static final Logger log = new Logger(Topologies.class);

    static final String DEAD_LETTER_EXCHANGE_ARG = "x-dead-letter-exchange";
    static final String DEAD_LETTER_ROUTING_KEY_ARG = "x-dead-letter-routing-key";

    private static final String RESERVED_PREFIX = "amq.";
    private static final int MAX_SHORT_STRING_BYTES = 255;

    private Topologies() {
    }

    static void declareExchange(RabbitClient client, String exchange, ExchangeType type) throws MessagingException {
        checkName("exchange", exchange);
        client.declareExchange(ExchangeSpec.durable(exchange, type));
    }

    /**
     * Declares the exchange, the optional dead-letter exchange and queue, the main queue and the binding.
     */
    static void declareConsumer(RabbitClient client, ConsumerTopology topology, ExchangeType type) throws MessagingException {
        checkName("exchange", topology.exchange);
        checkName("queue", topology.queue);
        checkRoutingKey(topology.routingKey);

        client.declareExchange(ExchangeSpec.durable(topology.exchange, type));

        Map<String, Object> queueArguments = new HashMap<>();
        if (topology.deadLetterEnabled) {
            client.declareExchange(ExchangeSpec.durable(topology.deadLetterExchange(), type));
            client.declareQueue(QueueSpec.durable(topology.deadLetterQueue()));
            // dead letters are keyed by queue name, each queue only reaches its own dlq
            client.bindQueue(topology.deadLetterQueue(), topology.queue, topology.deadLetterExchange(), null);

            queueArguments.put(DEAD_LETTER_EXCHANGE_ARG, topology.deadLetterExchange());
            queueArguments.put(DEAD_LETTER_ROUTING_KEY_ARG, topology.queue);
        }
        client.declareQueue(QueueSpec.durable(topology.queue, queueArguments));
        client.bindQueue(topology.queue, topology.routingKey, topology.exchange, null);

        log.infoWithParams("Declared consumer topology.",
                "type", type,
                "topology", topology);
    }

    static void checkName(String kind, String name) throws TopologyException {
        if (Strings.isNullOrEmpty(name)) {
            throw new TopologyException(kind + " name must not be empty");
        }
        if (name.startsWith(RESERVED_PREFIX)) {
            throw new TopologyException(kind + " name '" + name + "' uses the reserved prefix " + RESERVED_PREFIX);
        }
        if (name.getBytes(StandardCharsets.UTF_8).length > MAX_SHORT_STRING_BYTES) {
            throw new TopologyException(kind + " name is longer than " + MAX_SHORT_STRING_BYTES + " bytes");
        }
    }

    static void checkRoutingKey(String routingKey) throws TopologyException {
        if (routingKey.getBytes(StandardCharsets.UTF_8).length > MAX_SHORT_STRING_BYTES) {
            throw new TopologyException("routing key is longer than " + MAX_SHORT_STRING_BYTES + " bytes");
        }
    }
}
