package win.ixuni.cloudreve.client;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.config.DriverConfig;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.driver.CloudreveDriver;
import win.ixuni.cloudreve.core.driver.DriverFactory;
import win.ixuni.cloudreve.core.driver.DriverFactoryLoader;
import win.ixuni.cloudreve.core.exception.VersionDetectionException;
import win.ixuni.cloudreve.core.transport.HttpTransport;

import java.util.function.Function;

/**
 * 协议版本探测
 * <p>
 * Pings the V4 endpoint first and falls back to V3; the first driver that answers is kept.
 * An explicit version skips probing entirely. Single pass, no retries.
 */
@Slf4j
public class VersionDetector {

    private final DriverConfig config;

    private final HttpTransport transport;

    private final Function<ApiVersion, DriverFactory> factories;

    public VersionDetector(DriverConfig config, HttpTransport transport) {
        this(config, transport, DriverFactoryLoader::find);
    }

    VersionDetector(DriverConfig config, HttpTransport transport, Function<ApiVersion, DriverFactory> factories) {
        this.config = config;
        this.transport = transport;
        this.factories = factories;
    }

    /**
     * Create the driver for a known version without touching the network
     */
    public CloudreveDriver create(ApiVersion version) {
        DriverConfig versioned = config.withType(version.getId());
        return factories.apply(version).createDriver(versioned, transport);
    }

    /**
     * Probe V4 then V3
     *
     * @return driver of the first version whose ping succeeded
     */
    public Mono<CloudreveDriver> detect() {
        return probe(ApiVersion.V4)
                .onErrorResume(v4Error -> {
                    log.debug("V4 ping failed at {}: {}", config.getBaseUrl(), v4Error.getMessage());
                    return probe(ApiVersion.V3)
                            .onErrorMap(v3Error -> {
                                log.debug("V3 ping failed at {}: {}", config.getBaseUrl(), v3Error.getMessage());
                                return new VersionDetectionException(config.getBaseUrl(), v3Error);
                            });
                })
                .doOnNext(driver -> log.info("Detected Cloudreve {} at {}",
                        driver.getApiVersion(), config.getBaseUrl()));
    }

    private Mono<CloudreveDriver> probe(ApiVersion version) {
        return Mono.defer(() -> {
            CloudreveDriver driver = create(version);
            return driver.ping()
                    .thenReturn(driver)
                    .onErrorResume(e -> driver.shutdown().then(Mono.<CloudreveDriver>error(e)));
        });
    }
}
