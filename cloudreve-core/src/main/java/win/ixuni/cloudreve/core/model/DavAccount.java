package win.ixuni.cloudreve.core.model;

import win.ixuni.cloudreve.core.driver.ApiVersion;

/**
 * WebDAV account
 */
public interface DavAccount {

    ApiVersion getApiVersion();

    String getId();

    String getName();

    /**
     * Root exposed by the account: a path under V3, a resource URI under V4
     */
    String getRoot();

    String getPassword();

    String getCreatedAt();
}
