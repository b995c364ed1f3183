package com.chattrix.websocket.domain;

/**
 * Wire-level event names. These are shared with the browser client and must not change.
 */
public final class EventNames {

    // Server -> Client
    public static final String ONLINE_USERS = "online_users";
    public static final String RECEIVE_MESSAGE = "receive_message";
    public static final String RECEIVE_PRIVATE_MESSAGE = "receive_private_message";
    public static final String NOTIFICATION = "notification";
    public static final String UPDATE_PINNED = "update_pinned";
    public static final String UPDATE_UNPINNED = "update_unpinned";
    public static final String USER_TYPING = "user_typing";
    public static final String HEARTBEAT_RESPONSE = "heartbeat_response";
    public static final String ERROR = "error";
    public static final String SUCCESS = "success";

    private EventNames() {
    }
}
