package com.chattrix.websocket.exception;

/**
 * Base class for failures that end the handling of a single client event.
 * The message is safe to show to the originating client.
 */
public class ChatEventException extends RuntimeException {

    public ChatEventException(String message) {
        super(message);
    }

    public ChatEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
