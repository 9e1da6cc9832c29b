package win.ixuni.cloudreve.driver.v4.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.model.ShareItem;

@Data
@NoArgsConstructor
public class V4ShareLink implements ShareItem {

    private String id;

    private String name;

    private String url;

    private long visited;

    private long downloaded;

    private boolean unlocked;

    private String password;

    private boolean expired;

    /**
     * Expiry timestamp, absent for links that never expire
     */
    private String expires;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonIgnore
    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V4;
    }
}
