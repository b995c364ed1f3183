package com.chattrix.websocket.exception;

/**
 * Missing or empty required field.
 */
public class ValidationException extends ChatEventException {

    public ValidationException(String message) {
        super(message);
    }
}
