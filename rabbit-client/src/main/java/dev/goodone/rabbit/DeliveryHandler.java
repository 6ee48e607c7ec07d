package dev.goodone.rabbit;

@FunctionalInterface
public interface DeliveryHandler {

    /**
     * Processes one delivery. Returning normally acks the delivery, any exception counts as a failed attempt.
     */
    void handle(Delivery delivery) throws Exception;
}
