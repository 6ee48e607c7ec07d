package dev.goodone.rabbit.testutil;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import org.mockito.invocation.InvocationOnMock;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.Mockito.RETURNS_DEFAULTS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.withSettings;

/**
 * Broker side of one client connection. Consumer callbacks and shutdown notifications run on the connection's own
 * single dispatch thread, in the order the broker produced them.
 */
class FakeConnection {

    final FakeBroker broker;
    final String name;
    final Connection mock;
    final List<FakeChannel> channels = new CopyOnWriteArrayList<>();
    final List<ShutdownListener> shutdownListeners = new CopyOnWriteArrayList<>();
    final ExecutorService dispatcher;

    private final AtomicInteger channelNumbers = new AtomicInteger();
    volatile boolean open = true;
    volatile ShutdownSignalException closeReason;

    FakeConnection(FakeBroker broker, String name) {
        this.broker = broker;
        this.name = name;
        this.dispatcher = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("fake-broker-" + name + "-%d")
                .setDaemon(true)
                .build());
        this.mock = mock(Connection.class, withSettings().stubOnly().defaultAnswer(this::answer));
    }

    int nextChannelNumber() {
        return channelNumbers.incrementAndGet();
    }

    void dispatch(Runnable callback) {
        try {
            dispatcher.execute(() -> {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    FakeBroker.log.error("Client callback failed on connection {}", name, e);
                }
            });
        } catch (RejectedExecutionException e) {
            FakeBroker.log.debug("Connection {} is gone, dropping callback", name, e);
        }
    }

    private Object answer(InvocationOnMock invocation) throws Throwable {
        switch (invocation.getMethod().getName()) {
            case "createChannel":
                if (!open) {
                    throw new AlreadyClosedException(closeReason);
                }
                return broker.createChannel(this).mock;
            case "addShutdownListener":
                shutdownListeners.add(invocation.getArgument(0));
                return null;
            case "removeShutdownListener":
                shutdownListeners.remove(invocation.<ShutdownListener>getArgument(0));
                return null;
            case "isOpen":
                return open;
            case "getCloseReason":
                return closeReason;
            case "getClientProvidedName":
                return name;
            case "close":
            case "abort":
                if (open) {
                    broker.closeConnection(this, true);
                }
                return null;
            case "toString":
                return "FakeConnection{" + name + ", open=" + open + "}";
            default:
                return RETURNS_DEFAULTS.answer(invocation);
        }
    }
}
