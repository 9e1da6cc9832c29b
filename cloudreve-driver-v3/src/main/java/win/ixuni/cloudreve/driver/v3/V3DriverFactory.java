package win.ixuni.cloudreve.driver.v3;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.cloudreve.core.config.DriverConfig;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.driver.CloudreveDriver;
import win.ixuni.cloudreve.core.driver.DriverFactory;
import win.ixuni.cloudreve.core.transport.HttpTransport;

/**
 * V3 driver factory
 * <p>
 * Registered through {@code META-INF/services}.
 */
@Slf4j
public class V3DriverFactory implements DriverFactory {

    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V3;
    }

    @Override
    public CloudreveDriver createDriver(DriverConfig config, HttpTransport transport) {
        log.info("Creating V3 driver instance: {} -> {}", config.getName(), config.getBaseUrl());
        return new V3CloudreveDriver(config, transport);
    }

    @Override
    public String getDescription() {
        return "Cloudreve V3 driver (cookie session, ID-addressed mutations)";
    }
}
