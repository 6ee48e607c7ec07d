package dev.goodone.rabbit;

/**
 * The broker rejected a publish or the transport failed while publishing.
 */
public class PublishException extends MessagingException {

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
