package win.ixuni.cloudreve.driver.v4.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import win.ixuni.cloudreve.core.auth.SessionCredentials;
import win.ixuni.cloudreve.core.config.ClientProperties;
import win.ixuni.cloudreve.core.config.DriverConfig;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.operation.DriverContext;
import win.ixuni.cloudreve.core.operation.OperationHandlerRegistry;
import win.ixuni.cloudreve.driver.v4.client.V4ApiClient;

/**
 * V4 驱动上下文
 */
@Getter
@Builder
public class V4DriverContext implements DriverContext {

    private final DriverConfig config;

    private final SessionCredentials credentials;

    private final V4ApiClient client;

    /**
     * Operation handler registry (injected at runtime)
     */
    @Setter
    private OperationHandlerRegistry handlerRegistry;

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V4;
    }

    // ============ 配置项 ============

    public int getListPageSize() {
        return config.getInt(ClientProperties.LIST_PAGE_SIZE, ClientProperties.DEFAULT_LIST_PAGE_SIZE);
    }

    public int getDavLookupPageSize() {
        return config.getInt(ClientProperties.DAV_LOOKUP_PAGE_SIZE, ClientProperties.DEFAULT_DAV_LOOKUP_PAGE_SIZE);
    }

    public String getTempDirPrefix() {
        return config.getString(ClientProperties.TEMP_DIR_PREFIX, ClientProperties.DEFAULT_TEMP_DIR_PREFIX);
    }
}
