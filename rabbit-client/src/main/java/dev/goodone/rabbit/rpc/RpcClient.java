package dev.goodone.rabbit.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.goodone.rabbit.ClientClosedException;
import dev.goodone.rabbit.ConsumeOptions;
import dev.goodone.rabbit.Delivery;
import dev.goodone.rabbit.Destination;
import dev.goodone.rabbit.Message;
import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.QueueSpec;
import dev.goodone.rabbit.RabbitClient;
import dev.goodone.rabbit.RecoveryListener;
import dev.goodone.rabbit.RpcApplicationException;
import dev.goodone.rabbit.RpcTimeoutException;
import dev.goodone.rabbit.util.Logger;
import rx.Subscription;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Date;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Request/reply over plain queues.
 *
 * The client owns an exclusive, broker-named reply queue consumed with auto-ack. Each call registers a future under
 * a fresh correlation id, publishes the request through the default exchange and waits for whichever comes first:
 * the reply, the timeout or an interrupt. The registration is removed before the call returns.
 */
public class RpcClient implements RecoveryListener, AutoCloseable {

    private static final Logger log = new Logger(RpcClient.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final RabbitClient client;
    private final long defaultTimeoutMillis;
    private final Map<String, CompletableFuture<Delivery>> pending = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile String replyQueue;
    private volatile Subscription replySubscription;

    public RpcClient(RabbitClient client) throws MessagingException {
        this(client, client.getSettings().rpc_timeout_millis);
    }

    public RpcClient(RabbitClient client, long defaultTimeoutMillis) throws MessagingException {
        if (defaultTimeoutMillis <= 0) {
            throw new IllegalArgumentException("timeout must be positive: " + defaultTimeoutMillis);
        }
        this.client = client;
        this.defaultTimeoutMillis = defaultTimeoutMillis;
        startReplyLoop();
        client.addRecoveryListener(this);
    }

    public byte[] call(String queue, Object request) throws MessagingException, InterruptedException {
        return callWithTimeout(queue, request, defaultTimeoutMillis);
    }

    public <T> T callJson(String queue, Object request, Class<T> responseType) throws MessagingException, InterruptedException {
        byte[] response = call(queue, request);
        try {
            return mapper.readValue(response, responseType);
        } catch (IOException e) {
            throw new MessagingException("Could not deserialize reply from " + queue + " into " + responseType.getSimpleName(), e);
        }
    }

    /**
     * Same as {@link #call(String, Object)} with another timeout for this call only.
     */
    public byte[] callWithTimeout(String queue, Object request, long timeoutMillis) throws MessagingException, InterruptedException {
        if (closed.get()) {
            throw new ClientClosedException("The RPC client has been closed");
        }
        final byte[] body;
        try {
            body = mapper.writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize request of type " + request.getClass().getName(), e);
        }

        String correlationId = UUID.randomUUID().toString();
        CompletableFuture<Delivery> reply = new CompletableFuture<>();
        pending.put(correlationId, reply);
        try {
            client.publish(Destination.queue(queue), Message.builder()
                    .withBody(body)
                    .withContentType(Message.APPLICATION_JSON)
                    .withCorrelationId(correlationId)
                    .withReplyTo(replyQueue)
                    .withMessageId(UUID.randomUUID().toString())
                    .withTimestamp(new Date())
                    .build());

            Delivery response = awaitReply(queue, reply, timeoutMillis);
            byte[] responseBody = response.getBody();
            checkForError(responseBody);
            return responseBody;
        } finally {
            pending.remove(correlationId);
        }
    }

    public int pendingCalls() {
        return pending.size();
    }

    public String getReplyQueue() {
        return replyQueue;
    }

    @Override
    public void onRecovered(RabbitClient client) {
        if (closed.get()) {
            return;
        }
        try {
            startReplyLoop();
        } catch (MessagingException e) {
            log.errorWithParams("Could not restart the RPC reply consumer after reconnect.", e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Subscription subscription = replySubscription;
        if (subscription != null) {
            subscription.unsubscribe();
        }
        for (CompletableFuture<Delivery> call : new ArrayList<>(pending.values())) {
            call.completeExceptionally(new ClientClosedException("The RPC client has been closed"));
        }
        log.infoWithParams("RPC client closed.", "replyQueue", replyQueue);
    }

    private synchronized void startReplyLoop() throws MessagingException {
        String queue = client.declareQueue(QueueSpec.exclusiveTemporary());
        replySubscription = client.consume(new ConsumeOptions.Builder(queue)
                        .withAutoAck(true)
                        .withExclusive(true)
                        .withRecover(false)
                        .build(),
                this::onReply);
        replyQueue = queue;
        log.infoWithParams("RPC reply consumer started.", "replyQueue", queue);
    }

    private void onReply(Delivery delivery) {
        String correlationId = delivery.getCorrelationId();
        CompletableFuture<Delivery> call = correlationId == null ? null : pending.get(correlationId);
        if (call == null) {
            log.debugWithParams("Dropping reply without a pending call.",
                    "correlationId", correlationId,
                    "replyQueue", replyQueue);
            return;
        }
        call.complete(delivery);
    }

    private Delivery awaitReply(String queue, CompletableFuture<Delivery> reply, long timeoutMillis)
            throws MessagingException, InterruptedException {
        try {
            return reply.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new RpcTimeoutException("No reply from " + queue + " within " + timeoutMillis + " ms");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof MessagingException) {
                throw (MessagingException) e.getCause();
            }
            throw new MessagingException("RPC call to " + queue + " failed", e.getCause());
        }
    }

    private static void checkForError(byte[] responseBody) throws RpcApplicationException {
        JsonNode node;
        try {
            node = mapper.readTree(responseBody);
        } catch (IOException e) {
            // not JSON, hand the raw bytes to the caller
            return;
        }
        // only a string error is a failure, a response type may carry an unset error field
        if (node != null && node.isObject() && node.has("error") && node.get("error").isTextual()) {
            throw new RpcApplicationException(node.get("error").asText());
        }
    }
}
