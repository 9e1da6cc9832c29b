package win.ixuni.cloudreve.driver.v4.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.model.LoginResponse;
import win.ixuni.cloudreve.core.model.UserInfo;

/**
 * Response of {@code POST /session/token}: the user plus the token pair
 */
@Data
@NoArgsConstructor
public class V4LoginResponse implements LoginResponse {

    private V4User user;

    private V4Token token;

    @JsonIgnore
    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V4;
    }

    @JsonIgnore
    @Override
    public String getNickname() {
        return user.getNickname();
    }

    @JsonIgnore
    @Override
    public String getEmail() {
        return user.getEmail();
    }

    @JsonIgnore
    @Override
    public String getUserId() {
        return user.getId();
    }

    @Override
    public UserInfo toUserInfo() {
        return user.toUserInfo();
    }
}
