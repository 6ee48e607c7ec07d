package dev.goodone.rabbit.testutil;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.ShutdownSignalException;
import org.mockito.invocation.InvocationOnMock;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import static org.mockito.Mockito.RETURNS_DEFAULTS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.withSettings;

/**
 * Broker side of one channel. The mutable fields are guarded by the broker lock.
 */
class FakeChannel {

    final FakeBroker broker;
    final FakeConnection connection;
    final int number;
    final Channel mock;

    final Map<String, ConsumerRegistration> consumers = new LinkedHashMap<>();
    final TreeMap<Long, Unacked> unacked = new TreeMap<>();
    int prefetch = 0;
    long deliveryTags = 0;
    volatile boolean open = true;
    volatile ShutdownSignalException closeReason;

    FakeChannel(FakeBroker broker, FakeConnection connection, int number) {
        this.broker = broker;
        this.connection = connection;
        this.number = number;
        this.mock = mock(Channel.class, withSettings().stubOnly().defaultAnswer(this::answer));
    }

    private void ensureOpen() {
        if (!open) {
            throw new AlreadyClosedException(closeReason);
        }
    }

    @SuppressWarnings("unchecked")
    private Object answer(InvocationOnMock invocation) throws Throwable {
        Object[] args = invocation.getArguments();
        String method = invocation.getMethod().getName();
        switch (method) {
            case "isOpen":
                return open;
            case "getChannelNumber":
                return number;
            case "getConnection":
                return connection.mock;
            case "getCloseReason":
                return closeReason;
            case "toString":
                return "FakeChannel{" + connection.name + "#" + number + ", open=" + open + "}";
            case "close":
            case "abort":
                if (open) {
                    broker.closeChannel(this, new ShutdownSignalException(false, true, null, mock));
                } else if (method.equals("close")) {
                    throw new AlreadyClosedException(closeReason);
                }
                return null;
            default:
                break;
        }

        ensureOpen();
        switch (method) {
            case "exchangeDeclare":
                broker.declareExchange((String) args[0], exchangeType(args[1]), args.length > 2 && (Boolean) args[2]);
                return null;
            case "queueDeclare":
                if (args.length == 0) {
                    return broker.declareQueue(this, "", false, true, true, new HashMap<>());
                }
                return broker.declareQueue(this, (String) args[0], (Boolean) args[1], (Boolean) args[2],
                        (Boolean) args[3], (Map<String, Object>) args[4]);
            case "queueBind":
                broker.bindQueue((String) args[0], (String) args[1], (String) args[2]);
                return null;
            case "queueDelete":
                broker.deleteQueue((String) args[0]);
                return null;
            case "basicQos":
                broker.setPrefetch(this, (Integer) (args.length == 3 ? args[1] : args[0]));
                return null;
            case "basicPublish":
                publish(args);
                return null;
            case "basicConsume":
                if (args.length != 7) {
                    throw new UnsupportedOperationException("Only the 7 argument basicConsume is supported");
                }
                return broker.consume(this, (String) args[0], (Boolean) args[1], (String) args[2],
                        (Boolean) args[4], (Consumer) args[6]);
            case "basicCancel":
                broker.cancel(this, (String) args[0]);
                return null;
            case "basicAck":
                broker.ack(this, (Long) args[0], (Boolean) args[1]);
                return null;
            case "basicNack":
                broker.nack(this, (Long) args[0], (Boolean) args[1], (Boolean) args[2]);
                return null;
            case "basicReject":
                broker.nack(this, (Long) args[0], false, (Boolean) args[1]);
                return null;
            default:
                return RETURNS_DEFAULTS.answer(invocation);
        }
    }

    private void publish(Object[] args) throws Exception {
        String exchange = (String) args[0];
        String routingKey = (String) args[1];
        AMQP.BasicProperties props = (AMQP.BasicProperties) args[args.length - 2];
        byte[] body = (byte[]) args[args.length - 1];
        broker.publishFromChannel(exchange, routingKey, props, body);
    }

    private static String exchangeType(Object type) {
        if (type instanceof BuiltinExchangeType) {
            return ((BuiltinExchangeType) type).getType();
        }
        return String.valueOf(type);
    }

    static class ConsumerRegistration {
        final FakeChannel channel;
        final String tag;
        final String queue;
        final boolean autoAck;
        final Consumer consumer;
        int unacked = 0;

        ConsumerRegistration(FakeChannel channel, String tag, String queue, boolean autoAck, Consumer consumer) {
            this.channel = channel;
            this.tag = tag;
            this.queue = queue;
            this.autoAck = autoAck;
            this.consumer = consumer;
        }

        boolean canTake() {
            return channel.open && (autoAck || channel.prefetch == 0 || unacked < channel.prefetch);
        }
    }

    static class Unacked {
        final ConsumerRegistration registration;
        final PublishedMessage message;

        Unacked(ConsumerRegistration registration, PublishedMessage message) {
            this.registration = registration;
            this.message = message;
        }
    }
}
