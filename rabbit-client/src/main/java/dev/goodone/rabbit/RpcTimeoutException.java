package dev.goodone.rabbit;

/**
 * No reply arrived for an RPC call within the allowed time.
 */
public class RpcTimeoutException extends MessagingException {

    public RpcTimeoutException(String message) {
        super(message);
    }

    public RpcTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
