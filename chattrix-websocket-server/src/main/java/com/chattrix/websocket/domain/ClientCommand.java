package com.chattrix.websocket.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canonical form of an inbound client event, resolved once at the wire boundary.
 * Only the fields relevant to {@link #type} are populated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClientCommand {

    private CommandType type;

    // name the client used, kept for logging
    private String eventName;

    private String text;
    private Long recipientId;
    private Long messageId;
    private String location;
    private Long user1Id;
    private Long user2Id;
    private String chatType;
    private boolean typing;
}
