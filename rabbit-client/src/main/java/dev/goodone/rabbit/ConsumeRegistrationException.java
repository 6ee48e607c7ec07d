package dev.goodone.rabbit;

/**
 * A consumer could not be registered on the broker.
 */
public class ConsumeRegistrationException extends MessagingException {

    public ConsumeRegistrationException(String message) {
        super(message);
    }

    public ConsumeRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
