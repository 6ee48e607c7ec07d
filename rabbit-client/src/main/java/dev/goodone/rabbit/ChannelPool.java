package dev.goodone.rabbit;

import com.rabbitmq.client.Channel;

/**
 * Owns one broker connection and a fixed number of channels opened on it.
 *
 * A channel handed out by {@link #getChannel()} belongs to the caller until it is given back with
 * {@link #returnChannel(Channel)}. When the connection is lost the pool dials a new one and replaces every channel.
 */
public interface ChannelPool extends AutoCloseable {

    enum State {
        DISCONNECTED,
        CONNECTING,
        CONNECTED,
        RECONNECTING,
        CLOSED
    }

    /**
     * Dials the broker and fills the pool. Failing to do so is fatal.
     */
    void connect() throws ConnectionException;

    /**
     * Leases a channel, waiting up to the configured checkout timeout for one to become free.
     */
    Channel getChannel() throws ChannelTimeoutException, ClientClosedException;

    /**
     * Gives a leased channel back. Closes it instead if the pool is full, closed or the channel belongs to a
     * connection that has been replaced.
     */
    void returnChannel(Channel channel);

    void addRecoveryListener(Runnable listener);

    State state();

    int availableChannels();

    /**
     * Incremented every time a connection is established, so a channel's owner can tell whether the pool has
     * moved on to a new connection.
     */
    long generation();

    /**
     * Closes every pooled channel and the connection. Calling it more than once has no effect.
     */
    @Override
    void close();
}
