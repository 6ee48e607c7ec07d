package dev.goodone.rabbit;

/**
 * The operation was attempted after the client was shut down.
 */
public class ClientClosedException extends MessagingException {

    public ClientClosedException(String message) {
        super(message);
    }

    public ClientClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
