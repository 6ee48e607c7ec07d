package dev.goodone.rabbit.util;

/**
 * Called when the client hits an error it cannot run without, such as the broker being unreachable at
 * startup or a reconnect giving up.
 *
 * The default implementation stops the JVM. Applications embedding the client can install their own
 * handler to shut down in a more orderly fashion.
 */
public interface FatalErrorHandler {

    void onFatalError(String message, Throwable cause);

    FatalErrorHandler EXIT_PROCESS = new FatalErrorHandler() {
        private final Logger log = new Logger(FatalErrorHandler.class);

        @Override
        public void onFatalError(String message, Throwable cause) {
            log.errorWithParams("Fatal error encountered. Closing down application.", cause,
                    "reason", message);
            System.exit(1);
        }
    };
}
