package com.chattrix.websocket.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Outgoing frame: {@code {"type": <event name>, "data": <payload>}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServerEvent {

    private String type;
    private Object data;

    public static ServerEvent of(String type, Object data) {
        return new ServerEvent(type, data);
    }

    public static ServerEvent error(String message) {
        return new ServerEvent(EventNames.ERROR, Map.of("message", message));
    }

    public static ServerEvent success(String message) {
        return new ServerEvent(EventNames.SUCCESS, Map.of("message", message));
    }
}
