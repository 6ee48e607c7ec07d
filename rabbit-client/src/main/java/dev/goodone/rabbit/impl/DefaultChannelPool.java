package dev.goodone.rabbit.impl;

import dev.goodone.rabbit.BrokerAddress;
import dev.goodone.rabbit.ChannelPool;
import dev.goodone.rabbit.ChannelTimeoutException;
import dev.goodone.rabbit.ClientClosedException;
import dev.goodone.rabbit.ClientSettings;
import dev.goodone.rabbit.ConnectionException;
import dev.goodone.rabbit.util.BackoffRetrier;
import dev.goodone.rabbit.util.ExponentialBackoffAlgorithm;
import dev.goodone.rabbit.util.FatalErrorHandler;
import dev.goodone.rabbit.util.Logger;
import dev.goodone.rabbit.util.RetriesExhaustedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.impl.AMQConnection;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import rx.Scheduler;
import rx.schedulers.Schedulers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A {@link ChannelPool} holding one connection and {@code pool_size} channels.
 *
 * The connection and the pool are swapped together under the write lock of a single read/write lock, lease and
 * return operations take the read lock. A lost connection is detected through its shutdown listener and replaced
 * on a dedicated worker, retrying with exponential backoff; giving up is reported to the {@link FatalErrorHandler}.
 */
public class DefaultChannelPool implements ChannelPool {

    private static final Logger log = new Logger(DefaultChannelPool.class);
    private static final AtomicInteger poolCount = new AtomicInteger();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong();
    private final AtomicReference<State> state = new AtomicReference<>(State.DISCONNECTED);
    private final List<Runnable> recoveryListeners = new CopyOnWriteArrayList<>();

    private final ConnectionFactory connectionFactory;
    private final ClientSettings settings;
    private final BackoffRetrier retrier;
    private final FatalErrorHandler fatalErrorHandler;
    private final Scheduler.Worker monitorWorker;
    private final String poolName;

    private volatile ConnectionInfo current;
    private volatile BlockingQueue<Channel> channels;

    public DefaultChannelPool(ConnectionFactory connectionFactory, ClientSettings settings, FatalErrorHandler fatalErrorHandler) {
        this.connectionFactory = connectionFactory;
        this.settings = settings;
        this.fatalErrorHandler = fatalErrorHandler;
        this.retrier = new BackoffRetrier(
                settings.connect_max_retries,
                new ExponentialBackoffAlgorithm(settings.initial_backoff_millis, settings.max_backoff_millis));
        this.channels = new ArrayBlockingQueue<>(settings.pool_size);
        this.poolName = "pool-" + poolCount.incrementAndGet();
        this.monitorWorker = Schedulers.io().createWorker();
        monitorWorker.schedule(() -> Thread.currentThread().setName("rabbit-" + poolName + "-monitor"));
    }

    /**
     * Creates a connection factory for the given broker. Automatic recovery is turned off, the pool replaces lost
     * connections itself.
     */
    public static ConnectionFactory newConnectionFactory(BrokerAddress address, ClientSettings settings) {
        ConnectionFactory cf = new ConnectionFactory();
        address.applyTo(cf);
        cf.setRequestedHeartbeat(settings.heartbeat);
        cf.setConnectionTimeout(settings.connection_timeout_millis);
        cf.setShutdownTimeout(settings.shutdown_timeout_millis);
        cf.setHandshakeTimeout(settings.handshake_timeout_millis);
        cf.setRequestedChannelMax(0);//Hard coded ..
        cf.setAutomaticRecoveryEnabled(false);//Hard coded ..
        cf.setTopologyRecoveryEnabled(false);//Hard coded ..
        return cf;
    }

    @Override
    public void connect() throws ConnectionException {
        if (closed.get()) {
            throw new ConnectionException("The pool has been closed");
        }
        state.set(State.CONNECTING);
        ConnectionInfo info;
        try {
            info = retrier.retryWithBackoff("RabbitMQ connection", this::dial);
        } catch (RetriesExhaustedException e) {
            throw fatal("Could not connect to the broker", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw fatal("Interrupted while connecting to the broker", e);
        }

        BlockingQueue<Channel> filled = new ArrayBlockingQueue<>(settings.pool_size);
        try {
            for (int i = 0; i < settings.pool_size; i++) {
                filled.add(openChannel(info));
            }
        } catch (IOException | ShutdownSignalException e) {
            closeConnection(info);
            throw fatal("Could not open the channels of the pool", e);
        }

        lock.writeLock().lock();
        try {
            current = info;
            channels = filled;
            generation.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }
        monitor(info);
        state.set(State.CONNECTED);
        log.infoWithParams("Channel pool ready.",
                "pool", poolName,
                "connectionName", info.name,
                "poolSize", settings.pool_size);
    }

    @Override
    public Channel getChannel() throws ChannelTimeoutException, ClientClosedException {
        lock.readLock().lock();
        try {
            if (closed.get()) {
                throw new ClientClosedException("The client has been shut down");
            }
            final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.channel_timeout_millis);
            while (true) {
                long remaining = Math.max(0, deadline - System.nanoTime());
                Channel channel = channels.poll(remaining, TimeUnit.NANOSECONDS);
                if (channel == null) {
                    throw new ChannelTimeoutException("No channel became available within "
                            + settings.channel_timeout_millis + " ms");
                }
                if (channel.isOpen()) {
                    return channel;
                }
                Channel replacement = replace(channel);
                if (replacement != null) {
                    return replacement;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelTimeoutException("Interrupted while waiting for a channel", e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void returnChannel(Channel channel) {
        if (channel == null) {
            return;
        }
        lock.readLock().lock();
        try {
            ConnectionInfo info = current;
            if (closed.get() || info == null || channel.getConnection() != info.connection) {
                closeChannel(channel);
                return;
            }
            Channel pooled = channel;
            if (!channel.isOpen()) {
                pooled = replace(channel);
                if (pooled == null) {
                    return;
                }
            }
            if (!channels.offer(pooled)) {
                log.warnWithParams("Channel returned to a full pool, closing it.",
                        "pool", poolName,
                        "channelNr", pooled.getChannelNumber());
                closeChannel(pooled);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void addRecoveryListener(Runnable listener) {
        recoveryListeners.add(listener);
    }

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public int availableChannels() {
        return channels.size();
    }

    @Override
    public long generation() {
        return generation.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            log.debugWithParams("Pool already closed, doing nothing.", "pool", poolName);
            return;
        }
        lock.writeLock().lock();
        try {
            List<Channel> pooled = new ArrayList<>();
            channels.drainTo(pooled);
            for (Channel channel : pooled) {
                closeChannel(channel);
            }
            if (current != null) {
                closeConnection(current);
            }
            state.set(State.CLOSED);
        } finally {
            lock.writeLock().unlock();
        }
        monitorWorker.unsubscribe();
        log.infoWithParams("Channel pool closed.", "pool", poolName);
    }

    private void monitor(ConnectionInfo info) {
        info.connection.addShutdownListener(cause -> onConnectionLost(info, cause));
    }

    private void onConnectionLost(ConnectionInfo info, ShutdownSignalException cause) {
        if (closed.get() || info != current) {
            return;
        }
        log.errorWithParams("The rabbit connection was unexpectedly disconnected.", cause,
                "pool", poolName,
                "connectionName", info.name,
                "connectTime", info.startTime);
        state.set(State.RECONNECTING);
        monitorWorker.schedule(this::reconnect);
    }

    void reconnect() {
        if (closed.get()) {
            return;
        }
        state.set(State.RECONNECTING);
        ConnectionInfo info;
        try {
            info = retrier.retryWithBackoff("RabbitMQ reconnection", this::dial);
        } catch (RetriesExhaustedException e) {
            fatal("Could not reconnect to the broker", e);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fatal("Interrupted while reconnecting to the broker", e);
            return;
        }

        int opened = 0;
        lock.writeLock().lock();
        try {
            if (closed.get()) {
                closeConnection(info);
                return;
            }
            List<Channel> stale = new ArrayList<>();
            channels.drainTo(stale);
            for (Channel channel : stale) {
                closeChannel(channel);
            }
            BlockingQueue<Channel> refilled = new ArrayBlockingQueue<>(settings.pool_size);
            for (int i = 0; i < settings.pool_size; i++) {
                try {
                    refilled.add(openChannel(info));
                    opened++;
                } catch (IOException | ShutdownSignalException e) {
                    log.errorWithParams("Could not open channel while rebuilding the pool, skipping it.", e,
                            "pool", poolName,
                            "slot", i);
                }
            }
            current = info;
            channels = refilled;
            generation.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }
        monitor(info);
        state.set(State.CONNECTED);
        log.infoWithParams("Reconnected to broker and rebuilt the channel pool.",
                "pool", poolName,
                "connectionName", info.name,
                "channels", opened,
                "poolSize", settings.pool_size);

        for (Runnable listener : recoveryListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.errorWithParams("Recovery listener failed.", e, "pool", poolName);
            }
        }
    }

    private synchronized ConnectionInfo dial() throws IOException, TimeoutException {
        String connectionName = settings.app_id + "-" + poolName;
        DateTime startTime = new DateTime(DateTimeZone.UTC);

        Map<String, Object> clientProperties = new HashMap<>(AMQConnection.defaultClientProperties());
        clientProperties.put("app_id", settings.app_id);
        clientProperties.put("name", connectionName);
        clientProperties.put("connect_time", startTime.toString());
        clientProperties.put("connection_type", "pooled");
        connectionFactory.setClientProperties(clientProperties);

        Connection connection = connectionFactory.newConnection(connectionName);
        log.infoWithParams("Successfully created connection to broker.",
                "name", connectionName,
                "connectTime", startTime.toString(),
                "settings", settings.toString());
        return new ConnectionInfo(connection, startTime, connectionName);
    }

    private Channel openChannel(ConnectionInfo info) throws IOException {
        Channel channel = info.connection.createChannel();
        if (channel == null) {
            throw new IOException("No free channel number on connection " + info.name);
        }
        return channel;
    }

    private Channel replace(Channel dead) {
        ConnectionInfo info = current;
        if (info != null && info.connection.isOpen() && !closed.get()) {
            try {
                Channel fresh = openChannel(info);
                log.infoWithParams("Replaced closed channel.",
                        "pool", poolName,
                        "closedChannelNr", dead.getChannelNumber(),
                        "channelNr", fresh.getChannelNumber());
                return fresh;
            } catch (IOException | ShutdownSignalException e) {
                log.warnWithParams("Could not replace closed channel, pool capacity is reduced.", e,
                        "pool", poolName);
                return null;
            }
        }
        log.warnWithParams("Dropping closed channel, the connection is down.",
                "pool", poolName,
                "channelNr", dead.getChannelNumber());
        return null;
    }

    private ConnectionException fatal(String message, Exception cause) {
        state.set(State.DISCONNECTED);
        fatalErrorHandler.onFatalError(message, cause);
        return new ConnectionException(message, cause);
    }

    private void closeChannel(Channel channel) {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            log.warnWithParams("Unexpected error when closing channel.", e,
                    "pool", poolName,
                    "channelNr", channel.getChannelNumber());
        }
    }

    private void closeConnection(ConnectionInfo info) {
        boolean connectionIsOpen = info.connection.isOpen();
        if (connectionIsOpen) {
            try {
                info.connection.close();
            } catch (IOException | ShutdownSignalException e) {
                log.warnWithParams("Unexpected error when closing connection.", e,
                        "name", info.name,
                        "isOpen", info.connection.isOpen());
            }
        }
        log.infoWithParams("Closed and disposed connection.",
                "name", info.name,
                "connectTime", info.startTime,
                "wasOpen", connectionIsOpen);
    }

    static class ConnectionInfo {
        final Connection connection;
        final DateTime startTime;
        final String name;

        ConnectionInfo(Connection connection, DateTime startTime, String name) {
            this.connection = connection;
            this.startTime = startTime;
            this.name = name;
        }

        @Override
        public String toString() {
            return "ConnectionInfo{" +
                    "startTime=" + startTime +
                    ", name='" + name + '\'' +
                    '}';
        }
    }
}
