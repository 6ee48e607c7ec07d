package dev.goodone.rabbit;

/**
 * The remote handler of an RPC call failed. The error message is the one the server sent back in its
 * {@code {"error": "..."}} reply.
 */
public class RpcApplicationException extends MessagingException {

    public RpcApplicationException(String message) {
        super(message);
    }
}
