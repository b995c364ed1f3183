package com.chattrix.websocket.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresenceInfo {
    private Long id;

    private String username;

    @JsonProperty("display_name")
    private String displayName;

    @JsonProperty("profile_pic")
    private String profilePic; // null when the user has the default picture
}
