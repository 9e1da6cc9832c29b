package win.ixuni.cloudreve.core.driver;

import win.ixuni.cloudreve.core.config.DriverConfig;
import win.ixuni.cloudreve.core.transport.HttpTransport;

/**
 * Driver factory interface
 * <p>
 * Each protocol version provides a factory, discovered through {@link DriverFactoryLoader}.
 */
public interface DriverFactory {

    /**
     * Get the protocol version served by drivers of this factory
     *
     * @return API version
     */
    ApiVersion getApiVersion();

    /**
     * Create a driver instance
     *
     * @param config    driver configuration (base URL, timeouts)
     * @param transport HTTP transport shared by all requests of the driver
     * @return driver instance
     */
    CloudreveDriver createDriver(DriverConfig config, HttpTransport transport);

    /**
     * Get the driver description
     *
     * @return description text
     */
    default String getDescription() {
        return "Cloudreve " + getApiVersion() + " driver";
    }
}
