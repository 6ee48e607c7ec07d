package dev.goodone.rabbit;

/**
 * No pooled channel became available within the checkout timeout.
 */
public class ChannelTimeoutException extends MessagingException {

    public ChannelTimeoutException(String message) {
        super(message);
    }

    public ChannelTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
