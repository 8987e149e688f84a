package com.paperless.common.exception;

/**
 * A message could not be handed to the broker. Surfaces to HTTP clients as 503.
 */
public class MessagePublishException extends RuntimeException {

    public MessagePublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
