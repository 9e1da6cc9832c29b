package win.ixuni.cloudreve.driver.v3.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.model.DavAccount;

/**
 * V3 WebDAV 账户（字段为大写开头的 Go 风格命名）
 */
@Data
@NoArgsConstructor
public class V3WebdavAccount implements DavAccount {

    @JsonProperty("ID")
    private long accountId;

    @JsonProperty("Name")
    private String name;

    @JsonProperty("Root")
    private String root;

    @JsonProperty("Password")
    private String password;

    @JsonProperty("CreatedAt")
    private String createdAt;

    @JsonIgnore
    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V3;
    }

    @JsonIgnore
    @Override
    public String getId() {
        return String.valueOf(accountId);
    }
}
