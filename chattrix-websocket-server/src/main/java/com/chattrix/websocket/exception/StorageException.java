package com.chattrix.websocket.exception;

/**
 * A persistence call failed. In-memory connection state is never rolled back
 * because of it.
 */
public class StorageException extends ChatEventException {

    public static final String CLIENT_MESSAGE = "Message could not be saved, please try again";

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
