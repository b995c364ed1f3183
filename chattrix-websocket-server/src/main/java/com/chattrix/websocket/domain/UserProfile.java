package com.chattrix.websocket.domain;

import com.chattrix.websocket.model.PresenceInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Display metadata attached to a live connection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_PICTURE = "default.jpg";
    private static final String PICTURE_PATH = "/static/profile_pics/";

    private Long id;
    private String username;
    private String displayName;
    private String profilePic;
    private boolean admin;

    public static UserProfile from(UserAccount account) {
        return UserProfile.builder()
                .id(account.getId())
                .username(account.getUsername())
                .displayName(account.getDisplayName())
                .profilePic(account.getProfilePic())
                .admin(account.isAdmin())
                .build();
    }

    public String getName() {
        return displayName != null && !displayName.isBlank() ? displayName : username;
    }

    public boolean hasCustomPicture() {
        return profilePic != null && !profilePic.isBlank() && !DEFAULT_PICTURE.equals(profilePic);
    }

    public String getAvatarUrl() {
        return PICTURE_PATH + (hasCustomPicture() ? profilePic : DEFAULT_PICTURE);
    }

    public PresenceInfo toPresence() {
        return PresenceInfo.builder()
                .id(id)
                .username(username)
                .displayName(displayName)
                .profilePic(hasCustomPicture() ? profilePic : null)
                .build();
    }
}
