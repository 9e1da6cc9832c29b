package win.ixuni.cloudreve.driver.v3.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.model.ShareItem;

/**
 * Share link of the current user as listed by {@code GET /share}
 */
@Data
@NoArgsConstructor
public class V3Share implements ShareItem {

    private String key;

    @JsonProperty("is_dir")
    private boolean dir;

    private String password;

    @JsonProperty("create_date")
    private String createDate;

    private int downloads;

    @JsonProperty("remain_downloads")
    private int remainDownloads;

    private int views;

    /**
     * Seconds until expiry, negative when the link never expires
     */
    private long expire;

    private boolean expired;

    private boolean preview;

    private Source source;

    /**
     * Public URL, filled in by the client from the base URL and the key
     */
    @JsonIgnore
    private String url;

    @JsonIgnore
    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V3;
    }

    @JsonIgnore
    @Override
    public String getId() {
        return key;
    }

    @JsonIgnore
    @Override
    public String getName() {
        return source == null ? null : source.getName();
    }

    @JsonIgnore
    @Override
    public String getCreatedAt() {
        return createDate;
    }

    @Data
    @NoArgsConstructor
    public static class Source {

        private String name;

        private long size;
    }
}
