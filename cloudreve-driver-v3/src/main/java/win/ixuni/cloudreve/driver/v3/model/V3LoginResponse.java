package win.ixuni.cloudreve.driver.v3.model;

import lombok.Value;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.model.LoginResponse;
import win.ixuni.cloudreve.core.model.UserInfo;

/**
 * Result of a V3 login; the session itself travels in the cookie
 */
@Value
public class V3LoginResponse implements LoginResponse {

    V3User user;

    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V3;
    }

    @Override
    public String getNickname() {
        return user.getNickname();
    }

    @Override
    public String getEmail() {
        return user.getUserName();
    }

    @Override
    public String getUserId() {
        return user.getId();
    }

    @Override
    public UserInfo toUserInfo() {
        return user.toUserInfo();
    }
}
