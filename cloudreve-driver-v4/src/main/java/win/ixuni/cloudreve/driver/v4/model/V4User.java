package win.ixuni.cloudreve.driver.v4.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.model.UserInfo;

@Data
@NoArgsConstructor
public class V4User {

    private String id;

    private String email;

    private String nickname;

    /**
     * active / inactive / manual_banned / sys_banned
     */
    private String status;

    private String avatar;

    @JsonProperty("created_at")
    private String createdAt;

    private Group group;

    public UserInfo toUserInfo() {
        return UserInfo.builder()
                .id(id)
                .email(email)
                .nickname(nickname)
                .group(group == null ? null : group.getName())
                .status(status)
                .build();
    }

    @Data
    @NoArgsConstructor
    public static class Group {

        private String id;

        private String name;

        private String permission;

        @JsonProperty("direct_link_batch_size")
        private Long directLinkBatchSize;

        @JsonProperty("trash_retention")
        private Long trashRetention;
    }
}
