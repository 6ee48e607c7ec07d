package dev.goodone.rabbit;

/**
 * The broker could not be reached or a channel could not be opened on the connection.
 */
public class ConnectionException extends MessagingException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
