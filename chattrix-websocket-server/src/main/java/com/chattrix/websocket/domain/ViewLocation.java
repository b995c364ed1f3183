package com.chattrix.websocket.domain;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Client-reported view a user is looking at.
 *
 * Canonical tokens are {@code public} and {@code private:<otherUserId>}. The
 * web client still sends {@code public_chat} and {@code private_chat[:<id>]},
 * both are accepted. Anything else is kept as an unknown view.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ViewLocation {

    public enum Kind {
        PUBLIC,
        PRIVATE,
        UNKNOWN
    }

    private static final ViewLocation PUBLIC_VIEW = new ViewLocation(Kind.PUBLIC, null, "public");
    private static final ViewLocation UNKNOWN_VIEW = new ViewLocation(Kind.UNKNOWN, null, null);

    private final Kind kind;
    private final Long otherUserId;
    private final String rawToken;

    public static ViewLocation publicChat() {
        return PUBLIC_VIEW;
    }

    public static ViewLocation unknown() {
        return UNKNOWN_VIEW;
    }

    public static ViewLocation privateWith(Long otherUserId) {
        return new ViewLocation(Kind.PRIVATE, otherUserId, "private:" + otherUserId);
    }

    public static ViewLocation parse(String token) {
        if (token == null || token.isBlank()) {
            return UNKNOWN_VIEW;
        }
        String value = token.trim();
        if ("public".equals(value) || "public_chat".equals(value)) {
            return PUBLIC_VIEW;
        }
        for (String prefix : new String[]{"private:", "private_chat:", "private_chat_"}) {
            if (value.startsWith(prefix)) {
                Long other = parseId(value.substring(prefix.length()));
                return other != null ? privateWith(other) : new ViewLocation(Kind.PRIVATE, null, value);
            }
        }
        if ("private".equals(value) || "private_chat".equals(value)) {
            // a private chat, but the peer was not reported
            return new ViewLocation(Kind.PRIVATE, null, value);
        }
        return new ViewLocation(Kind.UNKNOWN, null, value);
    }

    public boolean isPublic() {
        return kind == Kind.PUBLIC;
    }

    public boolean isPrivateWith(Long userId) {
        return kind == Kind.PRIVATE && otherUserId != null && otherUserId.equals(userId);
    }

    public String token() {
        return rawToken != null ? rawToken : "unknown";
    }

    private static Long parseId(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
