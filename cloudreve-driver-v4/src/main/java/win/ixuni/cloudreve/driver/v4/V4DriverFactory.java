package win.ixuni.cloudreve.driver.v4;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.cloudreve.core.config.DriverConfig;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.driver.CloudreveDriver;
import win.ixuni.cloudreve.core.driver.DriverFactory;
import win.ixuni.cloudreve.core.transport.HttpTransport;

/**
 * V4 driver factory
 */
@Slf4j
public class V4DriverFactory implements DriverFactory {

    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V4;
    }

    @Override
    public CloudreveDriver createDriver(DriverConfig config, HttpTransport transport) {
        log.info("Creating V4 driver instance: {} -> {}", config.getName(), config.getBaseUrl());
        return new V4CloudreveDriver(config, transport);
    }

    @Override
    public String getDescription() {
        return "Cloudreve V4 driver (bearer token, URI-addressed)";
    }
}
