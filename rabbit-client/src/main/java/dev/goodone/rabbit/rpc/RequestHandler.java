package dev.goodone.rabbit.rpc;

import java.util.Map;

@FunctionalInterface
public interface RequestHandler {

    /**
     * @return the response, serialized to JSON for the caller. Throwing sends {@code {"error": message}} instead.
     */
    Object handle(byte[] body, Map<String, Object> headers) throws Exception;
}
