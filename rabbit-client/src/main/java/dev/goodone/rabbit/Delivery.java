package dev.goodone.rabbit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;

import java.io.IOException;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

/**
 * This class wraps all the data delivered by the rabbitmq broker for a given message.
 *
 * Handlers never acknowledge a delivery themselves: returning normally acks it, throwing hands it to the
 * retry and dead-letter protocol of the client.
 *
 * @see RabbitClient#consume(String, DeliveryHandler)
 */
public class Delivery {

    /**
     * Header carrying the number of times a message has been republished after a handler failure.
     */
    public static final String RETRY_COUNT_HEADER = "x-retry-count";

    /**
     * Headers keeping the exchange and routing key of the first publish when a failed message is republished
     * straight to its queue.
     */
    public static final String ORIGINAL_EXCHANGE_HEADER = "x-original-exchange";
    public static final String ORIGINAL_ROUTING_KEY_HEADER = "x-original-routing-key";

    private static final ObjectMapper mapper = new ObjectMapper();

    private final String consumerTag;
    private final Envelope envelope;
    private final AMQP.BasicProperties properties;
    private final byte[] body;
    private final Map<String, Object> headers;

    public Delivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        this.consumerTag = consumerTag;
        this.envelope = envelope;
        this.properties = properties == null ? new AMQP.BasicProperties() : properties;
        this.body = body == null ? new byte[0] : body;
        this.headers = this.properties.getHeaders() == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new HashMap<>(this.properties.getHeaders()));
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    /**
     * The exchange the message was first published to, which differs from the envelope for retried messages.
     */
    public String getExchange() {
        Object original = headers.get(ORIGINAL_EXCHANGE_HEADER);
        return original == null ? envelope.getExchange() : original.toString();
    }

    public String getRoutingKey() {
        Object original = headers.get(ORIGINAL_ROUTING_KEY_HEADER);
        return original == null ? envelope.getRoutingKey() : original.toString();
    }

    public long getDeliveryTag() {
        return envelope.getDeliveryTag();
    }

    public boolean isRedeliver() {
        return envelope.isRedeliver();
    }

    public byte[] getBody() {
        return body.clone();
    }

    /**
     * Header values are as the broker sent them, strings usually arrive as {@link com.rabbitmq.client.LongString}.
     */
    public Map<String, Object> getHeaders() {
        return headers;
    }

    public String getContentType() {
        return properties.getContentType();
    }

    public String getMessageId() {
        return properties.getMessageId();
    }

    public String getCorrelationId() {
        return properties.getCorrelationId();
    }

    public String getReplyTo() {
        return properties.getReplyTo();
    }

    public Integer getPriority() {
        return properties.getPriority();
    }

    public String getExpiration() {
        return properties.getExpiration();
    }

    public Date getTimestamp() {
        return properties.getTimestamp();
    }

    public String getType() {
        return properties.getType();
    }

    public AMQP.BasicProperties getProperties() {
        return properties;
    }

    /**
     * The value of the {@value #RETRY_COUNT_HEADER} header, 0 when it is absent or unreadable.
     */
    public int retryCount() {
        Object value = headers.get(RETRY_COUNT_HEADER);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    public <T> T bodyAs(Class<T> type) throws IOException {
        return mapper.readValue(body, type);
    }

    /**
     * An outbound copy of this delivery with the same body and properties.
     */
    public Message toMessage() {
        return Message.builder()
                .withBody(body)
                .withContentType(properties.getContentType())
                .withHeaders(headers)
                .withPriority(properties.getPriority())
                .withExpiration(properties.getExpiration())
                .withMessageId(properties.getMessageId())
                .withTimestamp(properties.getTimestamp())
                .withType(properties.getType())
                .withReplyTo(properties.getReplyTo())
                .withCorrelationId(properties.getCorrelationId())
                .build();
    }

    @Override
    public String toString() {
        return "Delivery{" +
                "exchange='" + getExchange() + '\'' +
                ", routingKey='" + getRoutingKey() + '\'' +
                ", deliveryTag=" + getDeliveryTag() +
                ", messageId='" + getMessageId() + '\'' +
                ", retryCount=" + retryCount() +
                '}';
    }
}
