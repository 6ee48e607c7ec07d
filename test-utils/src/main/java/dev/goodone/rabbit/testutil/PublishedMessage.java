package dev.goodone.rabbit.testutil;

import com.rabbitmq.client.AMQP;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

/**
 * A message as the fake broker saw it, either on the wire from a publisher or sitting in a queue.
 */
public final class PublishedMessage {

    public final String exchange;
    public final String routingKey;
    public final AMQP.BasicProperties properties;
    public final byte[] body;
    final boolean redelivered;

    PublishedMessage(String exchange, String routingKey, AMQP.BasicProperties properties, byte[] body, boolean redelivered) {
        this.exchange = exchange;
        this.routingKey = routingKey;
        this.properties = properties == null ? new AMQP.BasicProperties() : properties;
        this.body = body == null ? new byte[0] : body;
        this.redelivered = redelivered;
    }

    PublishedMessage redelivered() {
        return new PublishedMessage(exchange, routingKey, properties, body, true);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public Map<String, Object> headers() {
        Map<String, Object> headers = properties.getHeaders();
        return headers == null ? Collections.emptyMap() : headers;
    }

    public Object header(String name) {
        return headers().get(name);
    }

    @Override
    public String toString() {
        return "PublishedMessage{" +
                "exchange='" + exchange + '\'' +
                ", routingKey='" + routingKey + '\'' +
                ", messageId=" + properties.getMessageId() +
                ", headers=" + headers() +
                ", body='" + bodyAsString() + '\'' +
                '}';
    }
}
