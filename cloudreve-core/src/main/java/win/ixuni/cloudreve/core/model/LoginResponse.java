package win.ixuni.cloudreve.core.model;

import win.ixuni.cloudreve.core.driver.ApiVersion;

/**
 * Result of a successful login
 */
public interface LoginResponse {

    ApiVersion getApiVersion();

    String getNickname();

    /**
     * Login e-mail (the V3 user name is an e-mail address)
     */
    String getEmail();

    String getUserId();

    /**
     * The logged-in user in version-neutral form
     */
    UserInfo toUserInfo();
}
