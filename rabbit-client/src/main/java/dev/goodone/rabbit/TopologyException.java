package dev.goodone.rabbit;

/**
 * An exchange, queue or binding description is invalid, or the broker refused to declare it.
 */
public class TopologyException extends MessagingException {

    public TopologyException(String message) {
        super(message);
    }

    public TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
