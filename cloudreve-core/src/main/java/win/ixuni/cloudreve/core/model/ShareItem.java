package win.ixuni.cloudreve.core.model;

import win.ixuni.cloudreve.core.driver.ApiVersion;

/**
 * Share link owned by the current user
 */
public interface ShareItem {

    ApiVersion getApiVersion();

    /**
     * Identifier accepted by update/delete (the share key under V3)
     */
    String getId();

    String getName();

    String getUrl();

    String getCreatedAt();

    boolean isExpired();
}
