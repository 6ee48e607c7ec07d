package dev.goodone.rabbit.tracing;

import io.opentelemetry.api.common.AttributeKey;

public final class MessagingAttributes {

    public static final String INSTRUMENTATION_NAME = "dev.goodone.rabbit";

    public static final AttributeKey<String> SYSTEM = AttributeKey.stringKey("messaging.system");
    public static final AttributeKey<String> DESTINATION = AttributeKey.stringKey("messaging.destination.name");
    public static final AttributeKey<String> ROUTING_KEY = AttributeKey.stringKey("messaging.rabbitmq.destination.routing_key");
    public static final AttributeKey<String> MESSAGE_ID = AttributeKey.stringKey("messaging.message.id");
    public static final AttributeKey<Long> RETRY_COUNT = AttributeKey.longKey("messaging.rabbitmq.retry_count");

    public static final String RABBITMQ = "rabbitmq";

    private MessagingAttributes() {
    }
}
