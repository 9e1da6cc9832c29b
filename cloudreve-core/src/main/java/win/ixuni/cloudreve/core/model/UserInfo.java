package win.ixuni.cloudreve.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * User profile
 */
@Value
@Builder
public class UserInfo {

    String id;

    String email;

    String nickname;

    String group;

    String status;
}
