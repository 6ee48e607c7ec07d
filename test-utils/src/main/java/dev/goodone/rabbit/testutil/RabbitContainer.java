package dev.goodone.rabbit.testutil;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.GetResponse;
import org.awaitility.Awaitility;
import org.awaitility.core.ConditionTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.Container;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.utility.DockerImageName;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A real RabbitMQ broker in a Docker container, for the tests that must not rely on {@link FakeBroker}.
 */
public class RabbitContainer {

    private static final Logger log = LoggerFactory.getLogger(RabbitContainer.class);

    public static final String IMAGE = "rabbitmq:3-management-alpine";

    private final RabbitMQContainer container;

    private RabbitContainer(RabbitMQContainer container) {
        this.container = container;
    }

    public static boolean dockerAvailable() {
        try {
            return DockerClientFactory.instance().isDockerAvailable();
        } catch (RuntimeException e) {
            log.warn("Could not reach a Docker daemon", e);
            return false;
        }
    }

    public static RabbitContainer start() {
        RabbitMQContainer container = new RabbitMQContainer(DockerImageName.parse(IMAGE));
        container.start();
        log.info("Started broker {} on {}", IMAGE, container.getAmqpUrl());
        return new RabbitContainer(container).assertUp();
    }

    public ConnectionFactory connectionFactory() {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(container.getHost());
        factory.setPort(container.getAmqpPort());
        factory.setUsername(container.getAdminUsername());
        factory.setPassword(container.getAdminPassword());
        // the channel pool replaces lost connections itself
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
        return factory;
    }

    public RabbitContainer assertUp() {
        try {
            Awaitility
                    .with()
                    .pollInterval(500, TimeUnit.MILLISECONDS)
                    .await()
                    .atMost(30, TimeUnit.SECONDS)
                    .until(this::accepting);
        } catch (ConditionTimeoutException e) {
            throw new IllegalStateException("Broker never accepted connections on " + container.getAmqpUrl(), e);
        }
        return this;
    }

    /**
     * Number of ready messages in the queue, read on a short-lived admin connection.
     */
    public int messageCount(String queue) throws IOException, TimeoutException {
        try (Connection connection = connectionFactory().newConnection("test-admin");
             Channel channel = connection.createChannel()) {
            return channel.queueDeclarePassive(queue).getMessageCount();
        }
    }

    /**
     * Takes one message off the queue, {@code null} when it is empty.
     */
    public GetResponse take(String queue) throws IOException, TimeoutException {
        try (Connection connection = connectionFactory().newConnection("test-admin");
             Channel channel = connection.createChannel()) {
            return channel.basicGet(queue, true);
        }
    }

    /**
     * Lets the broker close every client connection, as an operator or a node restart would.
     */
    public void closeAllConnections() throws IOException, InterruptedException {
        Container.ExecResult result = container.execInContainer(
                "rabbitmqctl", "close_all_connections", "closed by test");
        if (result.getExitCode() != 0) {
            throw new IllegalStateException("rabbitmqctl failed: " + result.getStderr());
        }
        log.info("Closed all broker connections");
    }

    public void stop() {
        container.stop();
    }

    private boolean accepting() {
        try (Connection ignored = connectionFactory().newConnection("test-ping")) {
            return true;
        } catch (IOException | TimeoutException e) {
            log.debug("Broker not up yet: {}", e.getMessage());
            return false;
        }
    }
}
