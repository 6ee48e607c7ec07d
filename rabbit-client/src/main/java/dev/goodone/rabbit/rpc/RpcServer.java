package dev.goodone.rabbit.rpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.goodone.rabbit.Delivery;
import dev.goodone.rabbit.Destination;
import dev.goodone.rabbit.Message;
import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.QueueSpec;
import dev.goodone.rabbit.RabbitClient;
import dev.goodone.rabbit.TopologyException;
import dev.goodone.rabbit.util.Logger;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import rx.Subscription;

/**
 * Answers requests arriving on a durable queue. Every request gets a JSON reply on its reply-to queue carrying the
 * request's correlation id; handler failures are reported in the reply as {@code {"error": "..."}} and the request
 * itself is acked either way.
 */
public class RpcServer implements AutoCloseable {

    private static final Logger log = new Logger(RpcServer.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final RabbitClient client;
    private final String queue;
    private volatile Subscription subscription;

    public RpcServer(RabbitClient client, String queue) throws MessagingException {
        if (Strings.isNullOrEmpty(queue)) {
            throw new TopologyException("RPC queue name must not be empty");
        }
        this.client = client;
        this.queue = queue;
        client.declareQueue(QueueSpec.durable(queue));
    }

    public String getQueue() {
        return queue;
    }

    public synchronized Subscription serve(RequestHandler handler) throws MessagingException {
        if (subscription != null && !subscription.isUnsubscribed()) {
            throw new IllegalStateException("Already serving " + queue);
        }
        subscription = client.consume(queue, delivery -> reply(delivery, handler));
        log.infoWithParams("Serving RPC requests.", "queue", queue);
        return subscription;
    }

    public <T> Subscription serveJson(Class<T> requestType, JsonRequestHandler<T> handler) throws MessagingException {
        return serve((body, headers) -> handler.handle(mapper.readValue(body, requestType), headers));
    }

    private void reply(Delivery request, RequestHandler handler) throws MessagingException {
        byte[] responseBody;
        try {
            Object response = handler.handle(request.getBody(), request.getHeaders());
            responseBody = mapper.writeValueAsBytes(response);
        } catch (Exception e) {
            log.warnWithParams("RPC handler failed, replying with the error.", e,
                    "queue", queue,
                    "correlationId", request.getCorrelationId());
            responseBody = errorBody(e);
        }

        if (Strings.isNullOrEmpty(request.getReplyTo())) {
            log.warnWithParams("RPC request without reply-to, dropping the response.",
                    "queue", queue,
                    "correlationId", request.getCorrelationId());
            return;
        }
        client.publish(Destination.queue(request.getReplyTo()), Message.builder()
                .withBody(responseBody)
                .withContentType(Message.APPLICATION_JSON)
                .withCorrelationId(request.getCorrelationId())
                .build());
    }

    private static byte[] errorBody(Exception e) {
        String message = e.getMessage() == null ? e.toString() : e.getMessage();
        try {
            return mapper.writeValueAsBytes(ImmutableMap.of("error", message));
        } catch (Exception serializationError) {
            throw new IllegalStateException("Could not serialize error reply", serializationError);
        }
    }

    @Override
    public synchronized void close() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
            log.infoWithParams("Stopped serving RPC requests.", "queue", queue);
        }
    }
}
