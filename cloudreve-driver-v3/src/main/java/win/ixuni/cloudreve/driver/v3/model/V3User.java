package win.ixuni.cloudreve.driver.v3.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.model.UserInfo;

import java.util.List;

/**
 * V3 用户信息
 */
@Data
@NoArgsConstructor
public class V3User {

    private String id;

    /**
     * Login e-mail
     */
    @JsonProperty("user_name")
    private String userName;

    private String nickname;

    private int status;

    private String avatar;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("preferred_theme")
    private String preferredTheme;

    private boolean anonymous;

    private Group group;

    private List<String> tags;

    public UserInfo toUserInfo() {
        return UserInfo.builder()
                .id(id)
                .email(userName)
                .nickname(nickname)
                .group(group == null ? null : group.getName())
                .status(String.valueOf(status))
                .build();
    }

    @Data
    @NoArgsConstructor
    public static class Group {

        private int id;

        private String name;

        @JsonProperty("allow_share")
        private boolean allowShare;

        @JsonProperty("allow_remote_download")
        private boolean allowRemoteDownload;

        @JsonProperty("allow_archive_download")
        private boolean allowArchiveDownload;

        private boolean compress;

        private boolean webdav;
    }
}
