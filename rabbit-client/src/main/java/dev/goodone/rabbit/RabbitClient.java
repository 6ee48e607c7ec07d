package dev.goodone.rabbit;

import com.rabbitmq.client.Channel;
import rx.Subscription;

import java.util.Map;

/**
 * Publishes and consumes messages over a shared pool of channels.
 *
 * Consumers get at-least-once delivery: a delivery whose handler fails is republished with an incremented
 * {@value Delivery#RETRY_COUNT_HEADER} header after a delay, and rejected without requeue (so that a bound
 * dead-letter exchange receives it) once the max retry count is reached.
 */
public interface RabbitClient extends AutoCloseable {

    /**
     * Publishes a persistent message. The current trace context travels in the message headers.
     */
    void publish(Destination destination, Message message) throws MessagingException;

    /**
     * Starts consuming from a queue on a channel leased for the lifetime of the returned subscription.
     * Unsubscribing stops the consumer after the delivery in progress, if any, has been acked or nacked.
     */
    Subscription consume(String queue, DeliveryHandler handler) throws MessagingException;

    Subscription consume(ConsumeOptions options, DeliveryHandler handler) throws MessagingException;

    void declareExchange(ExchangeSpec exchange) throws MessagingException;

    /**
     * @return the name of the declared queue, generated by the broker when none was given
     */
    String declareQueue(QueueSpec queue) throws MessagingException;

    void bindQueue(String queue, String routingKey, String exchange, Map<String, Object> arguments) throws MessagingException;

    Channel getChannel() throws MessagingException;

    void returnChannel(Channel channel);

    void addRecoveryListener(RecoveryListener listener);

    ClientSettings getSettings();

    /**
     * Stops every active consumer and shuts the pool down. Calling it more than once has no effect.
     */
    @Override
    void close();
}
