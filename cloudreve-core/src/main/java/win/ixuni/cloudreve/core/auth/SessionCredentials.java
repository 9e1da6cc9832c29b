package win.ixuni.cloudreve.core.auth;

import win.ixuni.cloudreve.core.model.UserInfo;

import java.util.Optional;

/**
 * In-memory credentials of one driver instance
 * <p>
 * Holds the session cookie (V3) or the bearer access token (V4), the V4 refresh token
 * and the user returned by the last login. Created empty, filled by login or by an explicit
 * {@link #setAccessToken(String)}, cleared only by logout or overwrite.
 * All accessors are synchronized; the library never renews tokens on its own.
 */
public class SessionCredentials {

    private String accessToken;
    private String refreshToken;
    private UserInfo user;

    public synchronized Optional<String> getAccessToken() {
        return Optional.ofNullable(accessToken);
    }

    public synchronized void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    public synchronized Optional<String> getRefreshToken() {
        return Optional.ofNullable(refreshToken);
    }

    public synchronized void setRefreshToken(String refreshToken) {
        this.refreshToken = refreshToken;
    }

    public synchronized Optional<UserInfo> getUser() {
        return Optional.ofNullable(user);
    }

    public synchronized void setUser(UserInfo user) {
        this.user = user;
    }

    /**
     * Replace all credential fields at once after a successful login
     */
    public synchronized void update(String accessToken, String refreshToken, UserInfo user) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.user = user;
    }

    public synchronized void clear() {
        this.accessToken = null;
        this.refreshToken = null;
        this.user = null;
    }
}
