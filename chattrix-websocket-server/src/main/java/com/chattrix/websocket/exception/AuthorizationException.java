package com.chattrix.websocket.exception;

/**
 * Actor lacks the privilege the event requires.
 */
public class AuthorizationException extends ChatEventException {

    public AuthorizationException(String message) {
        super(message);
    }
}
