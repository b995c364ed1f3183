package com.chattrix.websocket.exception;

/**
 * Referenced message or user does not exist.
 */
public class NotFoundException extends ChatEventException {

    public NotFoundException(String message) {
        super(message);
    }
}
