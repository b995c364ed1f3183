package com.chattrix.websocket.domain;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Internal command kinds, with the wire event names that map onto each.
 *
 * Several legacy event names are accepted for the same action; they all
 * resolve to a single command here.
 */
public enum CommandType {
    SEND_PUBLIC_MESSAGE("send_message", "message", "new_message", "send_public_message"),
    SEND_PRIVATE_MESSAGE("send_private_message", "private_message"),
    PIN_MESSAGE("pin_message"),
    UNPIN_MESSAGE("unpin_message"),
    TYPING("typing"),
    USER_LOCATION("user_location"),
    JOIN_USER_ROOM("join_user_room"),
    JOIN_PRIVATE_ROOM("join_private_room"),
    GET_ONLINE_USERS("get_online_users"),
    USER_JOINED("user_joined"),
    HEARTBEAT("heartbeat");

    private static final Map<String, CommandType> BY_EVENT_NAME;

    static {
        Map<String, CommandType> table = new HashMap<>();
        for (CommandType type : values()) {
            for (String name : type.eventNames) {
                table.put(name, type);
            }
        }
        BY_EVENT_NAME = Collections.unmodifiableMap(table);
    }

    private final List<String> eventNames;

    CommandType(String... eventNames) {
        this.eventNames = List.of(eventNames);
    }

    public List<String> getEventNames() {
        return eventNames;
    }

    public static Optional<CommandType> fromEventName(String eventName) {
        return Optional.ofNullable(BY_EVENT_NAME.get(eventName));
    }
}
