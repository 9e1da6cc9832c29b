package win.ixuni.cloudreve.driver.v3.model;

import lombok.Value;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.model.FileInfo;

/**
 * File information assembled from the parent listing
 */
@Value
public class V3FileInfo implements FileInfo {

    /**
     * Path the entry was resolved from
     */
    String path;

    V3Object object;

    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V3;
    }

    @Override
    public String getId() {
        return object.getId();
    }

    @Override
    public String getName() {
        return object.getName();
    }

    @Override
    public long getSize() {
        return object.getSize();
    }

    @Override
    public boolean isFolder() {
        return object.isFolder();
    }

    @Override
    public String getCreatedAt() {
        return object.getCreateDate();
    }

    @Override
    public String getUpdatedAt() {
        return object.getDate();
    }
}
