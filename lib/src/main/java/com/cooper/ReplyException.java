package com.cooper;

/**
 * Unchecked exception thrown when waiting for a reply fails for a reason
 * that is not itself an {@link ActorException}, such as interruption.
 */
public class ReplyException extends RuntimeException {

    public ReplyException(String message) {
        super(message);
    }

    public ReplyException(String message, Throwable cause) {
        super(message, cause);
    }

    public ReplyException(Throwable cause) {
        super(cause);
    }
}
