package dev.goodone.rabbit.impl;

import dev.goodone.rabbit.ClientClosedException;
import dev.goodone.rabbit.ClientSettings;
import dev.goodone.rabbit.ConsumeOptions;
import dev.goodone.rabbit.ConsumeRegistrationException;
import dev.goodone.rabbit.Delivery;
import dev.goodone.rabbit.Destination;
import dev.goodone.rabbit.ExchangeSpec;
import dev.goodone.rabbit.ExchangeType;
import dev.goodone.rabbit.Message;
import dev.goodone.rabbit.PublishException;
import dev.goodone.rabbit.QueueSpec;
import dev.goodone.rabbit.TestClients;
import dev.goodone.rabbit.TestTelemetry;
import dev.goodone.rabbit.testutil.FakeBroker;
import dev.goodone.rabbit.testutil.PublishedMessage;
import dev.goodone.rabbit.util.Logger;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.trace.data.SpanData;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import rx.Subscription;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class DefaultRabbitClientTest {

    @Rule
    public Timeout globalTimeout = new Timeout(30, TimeUnit.SECONDS);

    private static final Logger log = new Logger(DefaultRabbitClientTest.class);

    private static final String QUEUE = "orders.queue";

    private FakeBroker broker;
    private TestTelemetry telemetry;
    private TestClients.RecordingFatalErrorHandler fatalErrors;
    private DefaultRabbitClient client;

    @Before
    public void setup() throws Exception {
        broker = new FakeBroker();
        telemetry = new TestTelemetry();
        fatalErrors = new TestClients.RecordingFatalErrorHandler();
        client = connect(TestClients.fastSettings().build());
        client.declareQueue(QueueSpec.durable(QUEUE));
    }

    @After
    public void teardown() {
        client.close();
        broker.shutdown();
        telemetry.shutdown();
    }

    private DefaultRabbitClient connect(ClientSettings settings) throws Exception {
        return TestClients.connect(broker, settings, telemetry, fatalErrors);
    }

    private static Message text(String body) {
        return Message.builder()
                .withBody(body.getBytes(StandardCharsets.UTF_8))
                .withMessageId(body)
                .build();
    }

    @Test
    public void publishes_persistent_messages_with_trace_context() throws Exception {
        client.publish(Destination.queue(QUEUE), text("order-1"));

        assertThat(broker.published().size(), is(1));
        PublishedMessage published = broker.published().get(0);
        assertThat(published.exchange, equalTo(""));
        assertThat(published.routingKey, equalTo(QUEUE));
        assertThat(published.properties.getDeliveryMode(), is(2));
        assertThat(published.headers(), hasKey("traceparent"));
        assertThat(broker.queueDepth(QUEUE), is(1));

        List<SpanData> spans = telemetry.spansNamed("(default) publish");
        assertThat(spans.size(), is(1));
        assertThat(spans.get(0).getKind(), is(SpanKind.PRODUCER));
        assertThat(published.header("traceparent").toString().contains(spans.get(0).getTraceId()), is(true));
    }

    @Test
    public void failed_publish_is_reported_and_the_channel_comes_back() throws Exception {
        broker.failNextPublishes(1);
        try {
            client.publish(Destination.queue(QUEUE), text("order-1"));
            fail("Expected the publish to fail");
        } catch (PublishException e) {
            log.infoWithParams("Publish failed as expected.", "error", e.getMessage());
        }
        assertThat(client.getPool().availableChannels(), is(4));
        assertThat(telemetry.spansNamed("(default) publish").get(0).getStatus().getStatusCode(), is(StatusCode.ERROR));

        client.publish(Destination.queue(QUEUE), text("order-2"));
        assertThat(broker.queueDepth(QUEUE), is(1));
    }

    @Test
    public void declares_exchanges_and_bindings() throws Exception {
        client.declareExchange(ExchangeSpec.durable("orders.topic", ExchangeType.topic));
        client.bindQueue(QUEUE, "order.*", "orders.topic", null);

        client.publish(Destination.of("orders.topic", "order.created"), text("o-1"));
        client.publish(Destination.of("orders.topic", "invoice.created"), text("i-1"));

        assertThat(broker.exchangeType("orders.topic"), equalTo("topic"));
        assertThat(broker.isDurable("orders.topic"), is(true));
        assertThat(broker.bindingKeys("orders.topic", QUEUE), contains("order.*"));
        assertThat(broker.queueDepth(QUEUE), is(1));
    }

    @Test
    public void server_named_queue_gets_a_generated_name() throws Exception {
        String name = client.declareQueue(QueueSpec.exclusiveTemporary());
        assertThat(name.startsWith("amq.gen-"), is(true));
        assertThat(broker.hasQueue(name), is(true));
    }

    @Test
    public void every_delivery_is_acked_exactly_once() throws Exception {
        int nrMessages = 50;
        for (int i = 0; i < nrMessages; i++) {
            client.publish(Destination.queue(QUEUE), text("order-" + i));
        }
        List<String> received = new CopyOnWriteArrayList<>();
        client.consume(QUEUE, delivery -> received.add(delivery.getMessageId()));

        await("all messages acked").atMost(10, TimeUnit.SECONDS).until(() -> broker.ackCount() == nrMessages);
        assertThat(received.size(), is(nrMessages));
        assertThat(received.get(0), equalTo("order-0"));
        assertThat(received.get(nrMessages - 1), equalTo("order-" + (nrMessages - 1)));
        assertThat(broker.nackCount(), is(0));
        assertThat(broker.unknownDeliveryTagCount(), is(0));
        assertThat(broker.unackedCount(), is(0));
    }

    @Test
    public void consumer_channel_has_prefetch_one() throws Exception {
        client.consume(QUEUE, delivery -> {
        });
        await("consumer registered").atMost(10, TimeUnit.SECONDS).until(() -> broker.consumerCount(QUEUE) == 1);
        assertThat(broker.prefetchOf(QUEUE), is(1));
    }

    @Test
    public void failing_handler_sees_increasing_retry_counts_then_message_is_rejected() throws Exception {
        List<Integer> retryCounts = new CopyOnWriteArrayList<>();
        client.consume(QUEUE, delivery -> {
            retryCounts.add(delivery.retryCount());
            throw new IllegalStateException("cannot process " + delivery.getMessageId());
        });

        client.publish(Destination.queue(QUEUE), text("poison"));

        await("message rejected").atMost(10, TimeUnit.SECONDS).until(() -> broker.nackCount() == 1);
        assertThat(retryCounts, contains(0, 1, 2, 3));
        assertThat(broker.ackCount(), is(3));
        assertThat(broker.requeueCount(), is(0));
        assertThat(broker.queueDepth(QUEUE), is(0));

        List<PublishedMessage> published = broker.published();
        assertThat(published.size(), is(4));
        for (PublishedMessage retry : published.subList(1, 4)) {
            assertThat(retry.properties.getMessageId(), equalTo("poison"));
            assertThat(retry.routingKey, equalTo(QUEUE));
        }
    }

    @Test
    public void retry_count_never_exceeds_max_retry() throws Exception {
        client.close();
        client = connect(TestClients.fastSettings().withMaxRetry(0).build());
        AtomicInteger attempts = new AtomicInteger();
        client.consume(QUEUE, delivery -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("no");
        });

        client.publish(Destination.queue(QUEUE), text("poison"));

        await("message rejected").atMost(10, TimeUnit.SECONDS).until(() -> broker.nackCount() == 1);
        assertThat(attempts.get(), is(1));
        assertThat(broker.published().size(), is(1));
    }

    @Test
    public void failed_republish_requeues_the_original() throws Exception {
        List<Delivery> seen = new CopyOnWriteArrayList<>();
        client.consume(QUEUE, delivery -> {
            seen.add(delivery);
            if (seen.size() == 1) {
                broker.failNextPublishes(1);
                throw new IllegalStateException("first attempt fails");
            }
        });

        client.publish(Destination.queue(QUEUE), text("order-1"));

        await("message acked").atMost(10, TimeUnit.SECONDS).until(() -> broker.ackCount() == 1);
        assertThat(broker.requeueCount(), is(1));
        assertThat(seen.size(), is(2));
        assertThat(seen.get(0).retryCount(), is(0));
        assertThat(seen.get(1).retryCount(), is(0));
        assertThat(seen.get(1).isRedeliver(), is(true));
    }

    @Test
    public void unsubscribe_stops_the_consumer_and_releases_its_channel() throws Exception {
        Subscription subscription = client.consume(QUEUE, delivery -> {
        });
        await("consumer registered").atMost(10, TimeUnit.SECONDS).until(() -> broker.consumerCount(QUEUE) == 1);
        assertThat(client.getPool().availableChannels(), is(3));

        subscription.unsubscribe();

        await("consumer gone").atMost(10, TimeUnit.SECONDS).until(() -> broker.consumerCount(QUEUE) == 0);
        await("channel returned").atMost(10, TimeUnit.SECONDS).until(() -> client.getPool().availableChannels() == 4);
        assertThat(subscription.isUnsubscribed(), is(true));

        client.publish(Destination.queue(QUEUE), text("after-unsubscribe"));
        assertThat(broker.queueDepth(QUEUE), is(1));
    }

    @Test
    public void consuming_a_missing_queue_fails_and_keeps_the_pool_intact() throws Exception {
        try {
            client.consume("no.such.queue", delivery -> {
            });
            fail("Expected the registration to fail");
        } catch (ConsumeRegistrationException e) {
            log.infoWithParams("Registration failed as expected.", "error", e.getMessage());
        }
        assertThat(client.getPool().availableChannels(), is(4));
    }

    @Test
    public void auto_ack_consumer_neither_acks_nor_retries() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        client.consume(new ConsumeOptions.Builder(QUEUE).withAutoAck(true).build(), delivery -> {
            received.add(delivery.getMessageId());
            throw new IllegalStateException("ignored");
        });

        client.publish(Destination.queue(QUEUE), text("order-1"));

        await("message received").atMost(10, TimeUnit.SECONDS).until(() -> received.size() == 1);
        Thread.sleep(50);
        assertThat(broker.ackCount(), is(0));
        assertThat(broker.nackCount(), is(0));
        assertThat(broker.published().size(), is(1));
    }

    @Test
    public void consumer_continues_the_publishers_trace() throws Exception {
        Tracer tracer = telemetry.openTelemetry.getTracer("test");
        Span parent = tracer.spanBuilder("checkout").startSpan();
        try (Scope ignored = parent.makeCurrent()) {
            client.publish(Destination.queue(QUEUE), text("order-1"));
        } finally {
            parent.end();
        }

        AtomicReference<String> traceInHandler = new AtomicReference<>();
        client.consume(QUEUE, delivery -> traceInHandler.set(Span.current().getSpanContext().getTraceId()));

        await("message acked").atMost(10, TimeUnit.SECONDS).until(() -> broker.ackCount() == 1);
        await("process span ended").atMost(10, TimeUnit.SECONDS).until(() -> telemetry.spansNamed(QUEUE + " process").size() == 1);
        SpanData publish = telemetry.spansNamed("(default) publish").get(0);
        SpanData process = telemetry.spansNamed(QUEUE + " process").get(0);

        assertThat(traceInHandler.get(), equalTo(parent.getSpanContext().getTraceId()));
        assertThat(publish.getTraceId(), equalTo(parent.getSpanContext().getTraceId()));
        assertThat(process.getTraceId(), equalTo(parent.getSpanContext().getTraceId()));
        assertThat(process.getParentSpanId(), equalTo(publish.getSpanId()));
        assertThat(process.getKind(), is(SpanKind.CONSUMER));
    }

    @Test
    public void consumer_is_registered_again_after_connection_loss() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        Subscription subscription = client.consume(QUEUE, delivery -> received.add(delivery.getMessageId()));
        client.publish(Destination.queue(QUEUE), text("before"));
        await("first message acked").atMost(10, TimeUnit.SECONDS).until(() -> broker.ackCount() == 1);

        broker.killConnections();

        await("pool reconnected").atMost(10, TimeUnit.SECONDS).until(() -> client.getPool().generation() == 2);
        await("consumer registered again").atMost(10, TimeUnit.SECONDS).until(() -> broker.consumerCount(QUEUE) == 1);
        client.publish(Destination.queue(QUEUE), text("after"));
        await("second message").atMost(10, TimeUnit.SECONDS).until(() -> received.size() == 2);

        assertThat(received, contains("before", "after"));
        assertThat(subscription.isUnsubscribed(), is(false));
        assertThat(fatalErrors.errors.isEmpty(), is(true));
    }

    @Test
    public void consumer_without_recovery_ends_on_connection_loss() throws Exception {
        Subscription subscription = client.consume(new ConsumeOptions.Builder(QUEUE).withRecover(false).build(),
                delivery -> {
                });
        await("consumer registered").atMost(10, TimeUnit.SECONDS).until(() -> broker.consumerCount(QUEUE) == 1);

        broker.killConnections();

        await("subscription ended").atMost(10, TimeUnit.SECONDS).until(subscription::isUnsubscribed);
        await("pool reconnected").atMost(10, TimeUnit.SECONDS).until(() -> client.getPool().generation() == 2);
        Thread.sleep(50);
        assertThat(broker.consumerCount(QUEUE), is(0));
    }

    @Test
    public void unacked_message_is_redelivered_after_connection_loss() throws Exception {
        List<Delivery> received = new CopyOnWriteArrayList<>();
        client.consume(QUEUE, delivery -> {
            received.add(delivery);
            if (received.size() == 1) {
                broker.killConnections();
            }
        });

        client.publish(Destination.queue(QUEUE), text("order-1"));

        await("redelivered").atMost(10, TimeUnit.SECONDS).until(() -> received.size() == 2);
        assertThat(received.get(1).getMessageId(), equalTo("order-1"));
        assertThat(received.get(1).isRedeliver(), is(true));
        await("message acked").atMost(10, TimeUnit.SECONDS).until(() -> broker.ackCount() == 1);
    }

    @Test
    public void recovery_listeners_run_after_reconnect() throws Exception {
        List<Object> recovered = Collections.synchronizedList(new ArrayList<>());
        client.addRecoveryListener(recovered::add);

        broker.killConnections();

        await("listener called").atMost(10, TimeUnit.SECONDS).until(() -> recovered.size() == 1);
        assertThat(recovered.get(0), is((Object) client));
    }

    @Test
    public void close_stops_consumers_and_rejects_further_work() throws Exception {
        Subscription subscription = client.consume(QUEUE, delivery -> {
        });
        await("consumer registered").atMost(10, TimeUnit.SECONDS).until(() -> broker.consumerCount(QUEUE) == 1);

        client.close();
        client.close();

        await("subscription ended").atMost(10, TimeUnit.SECONDS).until(subscription::isUnsubscribed);
        assertThat(broker.openConnectionCount(), is(0));
        try {
            client.publish(Destination.queue(QUEUE), text("too-late"));
            fail("Expected the publish to be refused");
        } catch (ClientClosedException e) {
            assertThat(e.getMessage(), notNullValue());
        }
        try {
            client.consume(QUEUE, delivery -> {
            });
            fail("Expected the consume to be refused");
        } catch (ClientClosedException e) {
            assertThat(e.getMessage(), notNullValue());
        }
    }
}
