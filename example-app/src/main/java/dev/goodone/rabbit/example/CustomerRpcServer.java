package dev.goodone.rabbit.example;

import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.RabbitClient;
import dev.goodone.rabbit.rpc.RpcServer;
import dev.goodone.rabbit.util.Logger;

/**
 * Answers {@code {"customer_id": "..."}} lookups on {@code customer.get.rpc}.
 */
public class CustomerRpcServer implements AutoCloseable {

    private static final Logger log = new Logger(CustomerRpcServer.class);

    public static final String QUEUE = "customer.get.rpc";

    public static class CustomerRequest {
        public String customer_id;

        public CustomerRequest() {
        }

        public CustomerRequest(String customerId) {
            this.customer_id = customerId;
        }
    }

    private final RpcServer server;
    private final CustomerDirectory directory;

    public CustomerRpcServer(RabbitClient client, CustomerDirectory directory) throws MessagingException {
        this.directory = directory;
        this.server = new RpcServer(client, QUEUE);
    }

    public void start() throws MessagingException {
        server.serveJson(CustomerRequest.class, (request, headers) -> {
            log.debugWithParams("Customer lookup.", "customerId", request.customer_id);
            return directory.get(request.customer_id);
        });
    }

    @Override
    public void close() {
        server.close();
    }
}
