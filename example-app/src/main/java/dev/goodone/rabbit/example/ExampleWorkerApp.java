package dev.goodone.rabbit.example;

import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.RabbitClient;
import dev.goodone.rabbit.impl.DefaultRabbitClient;
import dev.goodone.rabbit.util.FatalErrorHandler;
import dev.goodone.rabbit.util.Logger;

/**
 * A worker which sends mails, serves customer lookups and follows customer events.
 */
public class ExampleWorkerApp {

    private static final Logger log = new Logger(ExampleWorkerApp.class);

    public static void main(String[] args) throws Exception {
        WorkerConfig config = WorkerConfig.load();
        log.infoWithParams("Starting worker.",
                "broker", config.brokerAddress(),
                "settings", config.clientSettings());

        //Connecting exits the process if the broker stays unreachable
        RabbitClient client = DefaultRabbitClient.connect(config.brokerAddress(), config.clientSettings());

        final ExampleWorkerApp app = new ExampleWorkerApp(
                client,
                new LoggingMailSender(),
                CustomerDirectory.withSampleData(),
                FatalErrorHandler.EXIT_PROCESS);
        app.start();

        //On shutdown call stop
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.infoWithParams("Closing app ...");
            app.stop();
        }));

        //Wait for Ctrl+C
        while (true) {
            try {
                Thread.sleep(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private final RabbitClient client;
    private final MailSender mailSender;
    private final CustomerDirectory directory;
    private final FatalErrorHandler fatalErrorHandler;

    private MailConsumer mailConsumer;
    private CustomerRpcServer customerRpcServer;
    private CustomerEvents customerEvents;

    public ExampleWorkerApp(RabbitClient client,
                            MailSender mailSender,
                            CustomerDirectory directory,
                            FatalErrorHandler fatalErrorHandler) {
        this.client = client;
        this.mailSender = mailSender;
        this.directory = directory;
        this.fatalErrorHandler = fatalErrorHandler;
    }

    /**
     * Declares the topology and registers all consumers. Failures are reported to the fatal error handler before
     * being rethrown.
     */
    public synchronized void start() throws MessagingException {
        try {
            mailConsumer = new MailConsumer(client, mailSender);
            mailConsumer.start();

            customerRpcServer = new CustomerRpcServer(client, directory);
            customerRpcServer.start();

            customerEvents = new CustomerEvents(client);
            customerEvents.start((queue, event) -> log.infoWithParams("Customer event received.",
                    "queue", queue,
                    "customerId", event.customer_id,
                    "type", event.type));
        } catch (MessagingException e) {
            fatalErrorHandler.onFatalError("Could not start the worker", e);
            throw e;
        }
        log.infoWithParams("Worker started.",
                "mailQueue", MailConsumer.QUEUE,
                "rpcQueue", CustomerRpcServer.QUEUE,
                "customers", directory.size());
    }

    public synchronized void stop() {
        if (mailConsumer != null) {
            mailConsumer.close();
        }
        if (customerRpcServer != null) {
            customerRpcServer.close();
        }
        if (customerEvents != null) {
            customerEvents.close();
        }
        client.close();
        log.infoWithParams("Worker stopped.");
    }

    public MailConsumer mailConsumer() {
        return mailConsumer;
    }

    public CustomerEvents customerEvents() {
        return customerEvents;
    }
}
