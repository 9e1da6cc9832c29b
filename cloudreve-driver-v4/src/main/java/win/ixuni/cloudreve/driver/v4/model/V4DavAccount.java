package win.ixuni.cloudreve.driver.v4.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.model.DavAccount;

@Data
@NoArgsConstructor
public class V4DavAccount implements DavAccount {

    private String id;

    @JsonProperty("created_at")
    private String createdAt;

    private String name;

    /**
     * Root resource URI exposed over WebDAV
     */
    private String uri;

    private String password;

    /**
     * Option bitmask (read-only, proxy, ...)
     */
    private String options;

    @JsonIgnore
    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V4;
    }

    @JsonIgnore
    @Override
    public String getRoot() {
        return uri;
    }
}
