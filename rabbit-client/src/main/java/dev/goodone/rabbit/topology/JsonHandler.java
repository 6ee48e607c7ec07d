package dev.goodone.rabbit.topology;

import dev.goodone.rabbit.Delivery;

@FunctionalInterface
public interface JsonHandler<T> {

    void handle(T payload, Delivery delivery) throws Exception;
}
