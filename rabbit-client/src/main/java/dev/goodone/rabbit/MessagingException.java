package dev.goodone.rabbit;

/**
 * Base class of every checked error raised by the client.
 */
public class MessagingException extends Exception {

    public MessagingException(String message) {
        super(message);
    }

    public MessagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
