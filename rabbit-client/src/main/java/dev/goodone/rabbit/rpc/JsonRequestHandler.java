package dev.goodone.rabbit.rpc;

import java.util.Map;

@FunctionalInterface
public interface JsonRequestHandler<T> {

    Object handle(T request, Map<String, Object> headers) throws Exception;
}
