package dev.goodone.rabbit;

import dev.goodone.rabbit.impl.DefaultRabbitClient;
import dev.goodone.rabbit.rpc.RpcClient;
import dev.goodone.rabbit.rpc.RpcServer;
import dev.goodone.rabbit.testutil.RabbitContainer;
import dev.goodone.rabbit.topology.ConsumerTopology;
import dev.goodone.rabbit.topology.DirectConsumer;
import dev.goodone.rabbit.topology.DirectPublisher;
import dev.goodone.rabbit.topology.TopicConsumer;
import dev.goodone.rabbit.topology.TopicPublisher;
import com.google.common.collect.ImmutableMap;
import com.rabbitmq.client.GetResponse;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;
import static org.junit.Assume.assumeTrue;

/**
 * Runs the client against a RabbitMQ broker in Docker. Skipped when no Docker daemon is reachable.
 */
public class RabbitBrokerIntegrationTest {

    @Rule
    public Timeout globalTimeout = new Timeout(60, TimeUnit.SECONDS);

    private static RabbitContainer broker;

    private TestClients.RecordingFatalErrorHandler fatalErrors;
    private DefaultRabbitClient client;
    private String suffix;

    public static class CustomerRequest {
        public String customer_id;

        public CustomerRequest() {
        }

        CustomerRequest(String customerId) {
            this.customer_id = customerId;
        }
    }

    public static class CustomerReply {
        public String customer_id;
        public String name;

        public CustomerReply() {
        }

        CustomerReply(String customerId, String name) {
            this.customer_id = customerId;
            this.name = name;
        }
    }

    @BeforeClass
    public static void startBroker() {
        assumeTrue("docker is not available", RabbitContainer.dockerAvailable());
        broker = RabbitContainer.start();
    }

    @AfterClass
    public static void stopBroker() {
        if (broker != null) {
            broker.stop();
        }
    }

    @Before
    public void setup() throws Exception {
        // durable names survive between tests on the one broker
        suffix = UUID.randomUUID().toString().substring(0, 8);
        fatalErrors = new TestClients.RecordingFatalErrorHandler();
        client = DefaultRabbitClient.connect(broker.connectionFactory(),
                TestClients.fastSettings()
                        .withPoolSize(8)
                        .withConnectMaxRetries(10)
                        .withAppId("integration-test")
                        .build(),
                OpenTelemetry.noop(),
                fatalErrors);
    }

    @After
    public void teardown() {
        if (client != null) {
            client.close();
        }
    }

    @Test
    public void single_word_wildcard_does_not_match_longer_keys() throws Exception {
        String exchange = "events.topic." + suffix;
        String one = "customer.one." + suffix;
        String all = "customer.all." + suffix;
        new TopicConsumer(client, new ConsumerTopology(exchange, one, "customer.*", false));
        new TopicConsumer(client, new ConsumerTopology(exchange, all, "customer.#", false));
        TopicPublisher publisher = new TopicPublisher(client, exchange);

        publisher.publish("customer.created", ImmutableMap.of("customer_id", "1"));
        publisher.publish("customer.created.extra", ImmutableMap.of("customer_id", "1"));

        await("both messages routed").atMost(10, TimeUnit.SECONDS).until(() -> broker.messageCount(all) == 2);
        assertThat(broker.messageCount(one), is(1));
        GetResponse routed = broker.take(one);
        assertThat(routed.getEnvelope().getRoutingKey(), equalTo("customer.created"));
    }

    @Test
    public void failing_message_ends_up_in_the_dead_letter_queue_with_its_origin() throws Exception {
        String exchange = "customer.direct." + suffix;
        String queue = "notifications." + suffix;
        DirectConsumer consumer = new DirectConsumer(client, new ConsumerTopology(exchange, queue, "customer.created", true));
        DirectPublisher publisher = new DirectPublisher(client, exchange);
        AtomicInteger calls = new AtomicInteger();
        List<String> seenRoutingKeys = new CopyOnWriteArrayList<>();

        consumer.consume(delivery -> {
            calls.incrementAndGet();
            seenRoutingKeys.add(delivery.getExchange() + "/" + delivery.getRoutingKey());
            throw new IllegalStateException("mail server down");
        });
        publisher.publish("customer.created", ImmutableMap.of("customer_id", "1"));

        String deadLetterQueue = queue + ConsumerTopology.DEAD_LETTER_QUEUE_SUFFIX;
        await("dead lettered").atMost(20, TimeUnit.SECONDS).until(() -> broker.messageCount(deadLetterQueue) == 1);
        int maxRetry = client.getSettings().max_retry;
        assertThat(calls.get(), is(maxRetry + 1));
        assertThat(seenRoutingKeys.get(seenRoutingKeys.size() - 1), equalTo(exchange + "/customer.created"));
        assertThat(broker.messageCount(queue), is(0));

        GetResponse deadLetter = broker.take(deadLetterQueue);
        assertThat(deadLetter, notNullValue());
        assertThat(deadLetter.getEnvelope().getRoutingKey(), equalTo(queue));
        Map<String, Object> headers = deadLetter.getProps().getHeaders();
        assertThat(String.valueOf(headers.get(Delivery.RETRY_COUNT_HEADER)), equalTo(String.valueOf(maxRetry)));
        assertThat(String.valueOf(headers.get(Delivery.ORIGINAL_EXCHANGE_HEADER)), equalTo(exchange));
        assertThat(String.valueOf(headers.get(Delivery.ORIGINAL_ROUTING_KEY_HEADER)), equalTo("customer.created"));
        assertThat(new String(deadLetter.getBody(), StandardCharsets.UTF_8), equalTo("{\"customer_id\":\"1\"}"));
    }

    @Test
    public void retries_stay_on_the_failing_queue_when_two_bindings_match() throws Exception {
        String exchange = "events.topic." + suffix;
        String one = "lifecycle." + suffix;
        String all = "audit." + suffix;
        TopicConsumer lifecycle = new TopicConsumer(client, new ConsumerTopology(exchange, one, "customer.*", true));
        TopicConsumer audit = new TopicConsumer(client, new ConsumerTopology(exchange, all, "customer.#", true));
        TopicPublisher publisher = new TopicPublisher(client, exchange);
        AtomicInteger lifecycleCalls = new AtomicInteger();
        AtomicInteger auditCalls = new AtomicInteger();

        lifecycle.consume(delivery -> {
            lifecycleCalls.incrementAndGet();
            throw new IllegalStateException("lifecycle store down");
        });
        audit.consume(delivery -> {
            auditCalls.incrementAndGet();
            throw new IllegalStateException("audit store down");
        });
        publisher.publish("customer.created", ImmutableMap.of("customer_id", "1"));

        String oneDlq = one + ConsumerTopology.DEAD_LETTER_QUEUE_SUFFIX;
        String allDlq = all + ConsumerTopology.DEAD_LETTER_QUEUE_SUFFIX;
        await("both dead lettered").atMost(20, TimeUnit.SECONDS)
                .until(() -> broker.messageCount(oneDlq) == 1 && broker.messageCount(allDlq) == 1);
        int expectedCalls = client.getSettings().max_retry + 1;
        assertThat(lifecycleCalls.get(), is(expectedCalls));
        assertThat(auditCalls.get(), is(expectedCalls));

        // nothing more trickles in once the retries are spent
        Thread.sleep(500);
        assertThat(broker.messageCount(oneDlq), is(1));
        assertThat(broker.messageCount(allDlq), is(1));
        assertThat(lifecycleCalls.get(), is(expectedCalls));
        assertThat(auditCalls.get(), is(expectedCalls));
    }

    @Test
    public void rpc_call_round_trips_through_the_broker() throws Exception {
        String rpcQueue = "customer.get.rpc." + suffix;
        RpcServer server = new RpcServer(client, rpcQueue);
        server.serveJson(CustomerRequest.class, (request, headers) -> {
            if (!"1".equals(request.customer_id)) {
                throw new IllegalArgumentException("unknown customer " + request.customer_id);
            }
            return new CustomerReply("1", "Ada Lovelace");
        });

        try (RpcClient rpcClient = new RpcClient(client)) {
            CustomerReply reply = rpcClient.callJson(rpcQueue, new CustomerRequest("1"), CustomerReply.class);

            assertThat(reply.customer_id, equalTo("1"));
            assertThat(reply.name, equalTo("Ada Lovelace"));
            try {
                rpcClient.callJson(rpcQueue, new CustomerRequest("42"), CustomerReply.class);
                fail("expected the server error to reach the caller");
            } catch (RpcApplicationException e) {
                assertThat(e.getMessage().contains("unknown customer 42"), is(true));
            }
            assertThat(rpcClient.pendingCalls(), is(0));
        } finally {
            server.close();
        }
    }

    @Test
    public void consumers_resume_after_the_broker_closes_the_connection() throws Exception {
        String queue = "reconnect." + suffix;
        client.declareQueue(QueueSpec.durable(queue));
        List<String> received = new CopyOnWriteArrayList<>();
        client.consume(queue, delivery -> received.add(new String(delivery.getBody(), StandardCharsets.UTF_8)));

        client.publish(Destination.queue(queue), Message.builder().withBody("before".getBytes(StandardCharsets.UTF_8)).build());
        await("first message").atMost(10, TimeUnit.SECONDS).until(() -> received.size() == 1);

        ChannelPool pool = client.getPool();
        long generationBefore = pool.generation();
        broker.closeAllConnections();

        await("reconnected").atMost(20, TimeUnit.SECONDS)
                .until(() -> pool.generation() > generationBefore && pool.state() == ChannelPool.State.CONNECTED);
        client.publish(Destination.queue(queue), Message.builder().withBody("after".getBytes(StandardCharsets.UTF_8)).build());

        await("message after reconnect").atMost(20, TimeUnit.SECONDS).until(() -> received.size() == 2);
        assertThat(received, contains("before", "after"));
        assertThat(fatalErrors.errors.isEmpty(), is(true));
    }
}
