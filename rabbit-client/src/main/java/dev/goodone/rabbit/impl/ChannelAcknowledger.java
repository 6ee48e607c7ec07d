package dev.goodone.rabbit.impl;

import dev.goodone.rabbit.Acknowledger;
import com.rabbitmq.client.Channel;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Acks or nacks one delivery on the channel it arrived on. The first call wins, any later call is a bug in the
 * caller and fails with {@link IllegalStateException}.
 */
class ChannelAcknowledger implements Acknowledger {

    /**
     * Stands in for deliveries the broker considered acknowledged as soon as it sent them.
     */
    static final Acknowledger AUTO_ACKED = new Acknowledger() {
        @Override
        public void ack() {
        }

        @Override
        public void nack(boolean requeue) {
        }

        @Override
        public boolean isTerminated() {
            return true;
        }
    };

    private final Channel channel;
    private final long deliveryTag;
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    ChannelAcknowledger(Channel channel, long deliveryTag) {
        this.channel = channel;
        this.deliveryTag = deliveryTag;
    }

    @Override
    public void ack() throws IOException {
        markTerminated();
        channel.basicAck(deliveryTag, false);
    }

    @Override
    public void nack(boolean requeue) throws IOException {
        markTerminated();
        channel.basicNack(deliveryTag, false, requeue);
    }

    @Override
    public boolean isTerminated() {
        return terminated.get();
    }

    private void markTerminated() {
        if (!terminated.compareAndSet(false, true)) {
            throw new IllegalStateException("Delivery " + deliveryTag + " has already been acked or nacked");
        }
    }
}
