package win.ixuni.cloudreve.core.model;

import lombok.Value;
import win.ixuni.cloudreve.core.driver.ApiVersion;

/**
 * Credential snapshot for external persistence (e.g. a CLI token cache)
 * <p>
 * A V3 session cookie value or a V4 access token.
 */
@Value
public class TokenInfo {

    ApiVersion apiVersion;

    String value;

    public static TokenInfo v3Session(String cookie) {
        return new TokenInfo(ApiVersion.V3, cookie);
    }

    public static TokenInfo v4Jwt(String token) {
        return new TokenInfo(ApiVersion.V4, token);
    }

    public boolean isV3() {
        return apiVersion == ApiVersion.V3;
    }

    public boolean isV4() {
        return apiVersion == ApiVersion.V4;
    }
}
