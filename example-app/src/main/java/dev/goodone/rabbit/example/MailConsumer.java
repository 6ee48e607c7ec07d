package dev.goodone.rabbit.example;

import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.RabbitClient;
import dev.goodone.rabbit.topology.ConsumerTopology;
import dev.goodone.rabbit.topology.DirectConsumer;
import dev.goodone.rabbit.topology.DirectPublisher;
import dev.goodone.rabbit.util.Logger;
import com.google.common.base.Strings;

/**
 * Reads mail requests from {@code mail.send.queue} and hands them to a {@link MailSender}. Requests that keep
 * failing end up in {@code mail.send.queue.dlq}.
 */
public class MailConsumer implements AutoCloseable {

    private static final Logger log = new Logger(MailConsumer.class);

    public static final String EXCHANGE = "mail.direct";
    public static final String QUEUE = "mail.send.queue";
    public static final String ROUTING_KEY = "mail.send";

    private final DirectConsumer consumer;
    private final DirectPublisher publisher;
    private final MailSender sender;

    public MailConsumer(RabbitClient client, MailSender sender) throws MessagingException {
        this.sender = sender;
        this.consumer = new DirectConsumer(client, new ConsumerTopology(EXCHANGE, QUEUE, ROUTING_KEY, true));
        this.publisher = new DirectPublisher(client, EXCHANGE);
    }

    public void start() throws MessagingException {
        consumer.consumeJson(MailRequest.class, (mail, delivery) -> {
            if (Strings.isNullOrEmpty(mail.to)) {
                throw new IllegalArgumentException("Mail request without recipient");
            }
            log.debugWithParams("Mail request received.",
                    "mail", mail,
                    "retryCount", delivery.retryCount());
            sender.send(mail);
        });
    }

    /**
     * Queues a mail for sending.
     */
    public void enqueue(MailRequest mail) throws MessagingException {
        publisher.publish(ROUTING_KEY, mail);
    }

    @Override
    public void close() {
        consumer.close();
    }
}
