package win.ixuni.cloudreve.driver.v4.model;

import lombok.Value;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.model.FileInfo;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;

/**
 * File information from {@code GET /file/info}
 */
@Value
public class V4FileInfo implements FileInfo {

    V4File file;

    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V4;
    }

    @Override
    public String getId() {
        return file.getId();
    }

    @Override
    public String getName() {
        return file.getName();
    }

    @Override
    public long getSize() {
        return file.getSize();
    }

    @Override
    public boolean isFolder() {
        return file.isFolder();
    }

    /**
     * Plain path; the raw value when the server reports a URI outside the user's scope
     */
    @Override
    public String getPath() {
        String uri = file.getPath();
        return uri != null && uri.startsWith(V4Uris.PREFIX) ? V4Uris.uriToPath(uri) : uri;
    }

    /**
     * Resource URI as reported by the server
     */
    public String getUri() {
        return file.getPath();
    }

    @Override
    public String getCreatedAt() {
        return file.getCreatedAt();
    }

    @Override
    public String getUpdatedAt() {
        return file.getUpdatedAt();
    }
}
