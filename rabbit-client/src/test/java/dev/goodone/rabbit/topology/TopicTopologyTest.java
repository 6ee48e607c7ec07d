package dev.goodone.rabbit.topology;

import dev.goodone.rabbit.TestClients;
import dev.goodone.rabbit.TestTelemetry;
import dev.goodone.rabbit.impl.DefaultRabbitClient;
import dev.goodone.rabbit.testutil.FakeBroker;
import dev.goodone.rabbit.testutil.PublishedMessage;
import com.google.common.collect.ImmutableMap;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class TopicTopologyTest {

    @Rule
    public Timeout globalTimeout = new Timeout(30, TimeUnit.SECONDS);

    private FakeBroker broker;
    private TestTelemetry telemetry;
    private DefaultRabbitClient client;

    @Before
    public void setup() throws Exception {
        broker = new FakeBroker();
        telemetry = new TestTelemetry();
        client = TestClients.connect(broker, TestClients.fastSettings().build(), telemetry,
                new TestClients.RecordingFatalErrorHandler());
    }

    @After
    public void teardown() {
        client.close();
        broker.shutdown();
        telemetry.shutdown();
    }

    @Test
    public void single_and_multi_word_wildcards_route_differently() throws Exception {
        new TopicConsumer(client, new ConsumerTopology("events.topic", "customer.one", "customer.*", false));
        new TopicConsumer(client, new ConsumerTopology("events.topic", "customer.all", "customer.#", false));
        TopicPublisher publisher = new TopicPublisher(client, "events.topic");

        publisher.publish("customer.created", ImmutableMap.of("id", "c-1"));
        publisher.publish("customer.address.changed", ImmutableMap.of("id", "c-1"));
        publisher.publish("order.created", ImmutableMap.of("id", "o-1"));

        assertThat(broker.queueDepth("customer.one"), is(1));
        assertThat(broker.queueDepth("customer.all"), is(2));
        assertThat(broker.messagesIn("customer.one").get(0).routingKey, equalTo("customer.created"));
    }

    @Test
    public void dead_letter_queue_is_keyed_by_queue_name() throws Exception {
        TopicConsumer consumer = new TopicConsumer(client, new ConsumerTopology("events.topic", "audit", "customer.#", true));
        TopicPublisher publisher = new TopicPublisher(client, "events.topic");

        assertThat(broker.exchangeType("events.topic.dlx"), equalTo("topic"));
        assertThat(broker.queueArguments("audit").get(FakeBroker.DEAD_LETTER_ROUTING_KEY_ARG), equalTo("audit"));
        assertThat(broker.bindingKeys("events.topic.dlx", "audit.dlq"), contains("audit"));

        consumer.consume(delivery -> {
            throw new IllegalStateException("audit store down");
        });
        publisher.publish("customer.address.changed", ImmutableMap.of("id", "c-1"));

        await("dead lettered").atMost(10, TimeUnit.SECONDS).until(() -> broker.queueDepth("audit.dlq") == 1);
        PublishedMessage deadLetter = broker.messagesIn("audit.dlq").get(0);
        assertThat(deadLetter.routingKey, equalTo("audit"));
        assertThat(deadLetter.header("x-original-routing-key"), equalTo("customer.address.changed"));
        consumer.close();
    }

    @Test
    public void retries_do_not_reach_other_queues_bound_to_the_exchange() throws Exception {
        TopicConsumer one = new TopicConsumer(client, new ConsumerTopology("events.topic", "q.one", "customer.*", true));
        TopicConsumer all = new TopicConsumer(client, new ConsumerTopology("events.topic", "q.all", "customer.#", true));
        TopicPublisher publisher = new TopicPublisher(client, "events.topic");
        AtomicInteger oneCalls = new AtomicInteger();
        AtomicInteger allCalls = new AtomicInteger();
        one.consume(delivery -> {
            oneCalls.incrementAndGet();
            throw new IllegalStateException("one is down");
        });
        all.consume(delivery -> {
            allCalls.incrementAndGet();
            throw new IllegalStateException("all is down");
        });

        publisher.publish("customer.created", ImmutableMap.of("id", "c-1"));

        await("both dead lettered").atMost(10, TimeUnit.SECONDS)
                .until(() -> broker.queueDepth("q.one.dlq") == 1 && broker.queueDepth("q.all.dlq") == 1);
        assertThat(oneCalls.get(), is(4));
        assertThat(allCalls.get(), is(4));
        assertThat(broker.deadLetterCount(), is(2));
        assertThat(broker.queueDepth("q.one"), is(0));
        assertThat(broker.queueDepth("q.all"), is(0));
        one.close();
        all.close();
    }

    @Test
    public void headers_and_priority_reach_the_consumer() throws Exception {
        TopicConsumer consumer = new TopicConsumer(client, new ConsumerTopology("events.topic", "audit", "#", false));
        TopicPublisher publisher = new TopicPublisher(client, "events.topic");
        List<String> tenants = new CopyOnWriteArrayList<>();
        List<Integer> priorities = new CopyOnWriteArrayList<>();
        consumer.consume(delivery -> {
            tenants.add(String.valueOf(delivery.getHeaders().get("tenant")));
            priorities.add(delivery.getPriority());
        });

        publisher.publishWithHeaders("customer.created", ImmutableMap.of("id", "c-1"), ImmutableMap.of("tenant", "acme"));
        publisher.publishWithPriority("customer.deleted", ImmutableMap.of("id", "c-2"), 7);

        await("both received").atMost(10, TimeUnit.SECONDS).until(() -> tenants.size() == 2);
        assertThat(tenants.get(0), equalTo("acme"));
        assertThat(priorities.get(1), is(7));
        consumer.close();
    }

    @Test
    public void retried_messages_go_straight_back_to_the_failing_queue() throws Exception {
        TopicConsumer consumer = new TopicConsumer(client, new ConsumerTopology("events.topic", "audit", "customer.*", false));
        TopicPublisher publisher = new TopicPublisher(client, "events.topic");
        List<Integer> retryCounts = new CopyOnWriteArrayList<>();
        List<String> routingKeys = new CopyOnWriteArrayList<>();
        consumer.consume(delivery -> {
            retryCounts.add(delivery.retryCount());
            routingKeys.add(delivery.getExchange() + "/" + delivery.getRoutingKey());
            if (retryCounts.size() < 3) {
                throw new IllegalStateException("flaky");
            }
        });

        publisher.publish("customer.created", ImmutableMap.of("id", "c-1"));

        await("eventually handled").atMost(10, TimeUnit.SECONDS).until(() -> retryCounts.size() == 3 && broker.ackCount() == 3);
        assertThat(retryCounts, contains(0, 1, 2));
        assertThat(routingKeys, contains(
                "events.topic/customer.created",
                "events.topic/customer.created",
                "events.topic/customer.created"));
        List<String> published = new CopyOnWriteArrayList<>();
        for (PublishedMessage message : broker.published()) {
            published.add(message.exchange + "/" + message.routingKey);
        }
        assertThat(published, contains(
                "events.topic/customer.created",
                "/audit",
                "/audit"));
        consumer.close();
    }
}
