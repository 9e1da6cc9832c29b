package win.ixuni.cloudreve.driver.v3.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import win.ixuni.cloudreve.core.auth.SessionCredentials;
import win.ixuni.cloudreve.core.config.DriverConfig;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.operation.DriverContext;
import win.ixuni.cloudreve.core.operation.OperationHandlerRegistry;
import win.ixuni.cloudreve.driver.v3.client.V3ApiClient;
import win.ixuni.cloudreve.driver.v3.client.V3ObjectResolver;

/**
 * V3 驱动上下文
 * <p>
 * Holds the endpoint client, the path resolver and the session cookie store.
 */
@Getter
@Builder
public class V3DriverContext implements DriverContext {

    private final DriverConfig config;

    private final SessionCredentials credentials;

    private final V3ApiClient client;

    private final V3ObjectResolver resolver;

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
        return ApiVersion.V3;
    }
}
