package dev.goodone.rabbit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An outbound message. Immutable once built, use {@link #toBuilder()} to derive a modified copy.
 */
public class Message {

    public static final String APPLICATION_JSON = "application/json";

    private static final ObjectMapper mapper = new ObjectMapper();

    private final byte[] body;
    private final String contentType;
    private final Map<String, Object> headers;
    private final Integer priority;
    private final String expiration;
    private final String messageId;
    private final Date timestamp;
    private final String type;
    private final String replyTo;
    private final String correlationId;

    private Message(Builder b) {
        this.body = b.body;
        this.contentType = b.contentType;
        this.headers = Collections.unmodifiableMap(new HashMap<>(b.headers));
        this.priority = b.priority;
        this.expiration = b.expiration;
        this.messageId = b.messageId;
        this.timestamp = b.timestamp == null ? null : new Date(b.timestamp.getTime());
        this.type = b.type;
        this.replyTo = b.replyTo;
        this.correlationId = b.correlationId;
    }

    /**
     * A JSON message with a random message id and the current time as timestamp.
     *
     * @throws IllegalArgumentException if the payload can not be serialized
     */
    public static Builder json(Object payload) {
        try {
            return new Builder()
                    .withBody(mapper.writeValueAsBytes(payload))
                    .withContentType(APPLICATION_JSON)
                    .withMessageId(UUID.randomUUID().toString())
                    .withTimestamp(new Date());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize payload of type " + payload.getClass().getName(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withBody(body)
                .withContentType(contentType)
                .withHeaders(headers)
                .withPriority(priority)
                .withExpiration(expiration)
                .withMessageId(messageId)
                .withTimestamp(timestamp)
                .withType(type)
                .withReplyTo(replyTo)
                .withCorrelationId(correlationId);
    }

    public byte[] getBody() {
        return body.clone();
    }

    public String getContentType() {
        return contentType;
    }

    public Map<String, Object> getHeaders() {
        return headers;
    }

    public Integer getPriority() {
        return priority;
    }

    public String getExpiration() {
        return expiration;
    }

    public String getMessageId() {
        return messageId;
    }

    public Date getTimestamp() {
        return timestamp == null ? null : new Date(timestamp.getTime());
    }

    public String getType() {
        return type;
    }

    public String getReplyTo() {
        return replyTo;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    @Override
    public String toString() {
        return "Message{" +
                "messageId='" + messageId + '\'' +
                ", contentType='" + contentType + '\'' +
                ", correlationId='" + correlationId + '\'' +
                ", replyTo='" + replyTo + '\'' +
                ", headers=" + headers +
                ", bodySize=" + body.length +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Message message = (Message) o;
        return Arrays.equals(body, message.body)
                && headers.equals(message.headers)
                && Objects.equals(contentType, message.contentType)
                && Objects.equals(messageId, message.messageId)
                && Objects.equals(correlationId, message.correlationId);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(body);
        result = 31 * result + headers.hashCode();
        result = 31 * result + (messageId != null ? messageId.hashCode() : 0);
        return result;
    }

    public static class Builder {
        private byte[] body = new byte[0];
        private String contentType;
        private Map<String, Object> headers = new HashMap<>();
        private Integer priority;
        private String expiration;
        private String messageId;
        private Date timestamp;
        private String type;
        private String replyTo;
        private String correlationId;

        public Message build() {
            return new Message(this);
        }

        public Builder withBody(byte[] body) {
            this.body = body == null ? new byte[0] : body.clone();
            return this;
        }

        public Builder withContentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder withHeaders(Map<String, Object> headers) {
            this.headers = headers == null ? new HashMap<>() : new HashMap<>(headers);
            return this;
        }

        public Builder withHeader(String key, Object value) {
            this.headers.put(key, value);
            return this;
        }

        public Builder withPriority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder withExpiration(String expiration) {
            this.expiration = expiration;
            return this;
        }

        public Builder withMessageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder withTimestamp(Date timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder withType(String type) {
            this.type = type;
            return this;
        }

        public Builder withReplyTo(String replyTo) {
            this.replyTo = replyTo;
            return this;
        }

        public Builder withCorrelationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }
    }
}
