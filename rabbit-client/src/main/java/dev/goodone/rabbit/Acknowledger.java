package dev.goodone.rabbit;

import java.io.IOException;

/**
 * Terminates a {@link Delivery} on the broker, either positively or negatively.
 */
public interface Acknowledger {

    void ack() throws IOException;

    /**
     * @param requeue true to put the message back on its queue, false to dead-letter or drop it
     */
    void nack(boolean requeue) throws IOException;

    /**
     * @return true once ack or nack has been issued
     */
    boolean isTerminated();
}
