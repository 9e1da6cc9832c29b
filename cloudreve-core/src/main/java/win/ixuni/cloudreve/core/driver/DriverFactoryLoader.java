package win.ixuni.cloudreve.core.driver;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.cloudreve.core.exception.DriverNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Driver factory loader
 * <p>
 * Uses Java SPI (ServiceLoader) to discover DriverFactory implementations on the classpath.
 * Driver modules declare themselves in META-INF/services.
 */
@Slf4j
public final class DriverFactoryLoader {

    private DriverFactoryLoader() {
        // Utility class, not instantiable
    }

    /**
     * Load all DriverFactory implementations via SPI
     *
     * @return list of discovered factories
     */
    public static List<DriverFactory> load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    /**
     * Load all DriverFactory implementations via SPI
     *
     * @param classLoader class loader
     * @return list of discovered factories
     */
    public static List<DriverFactory> load(ClassLoader classLoader) {
        ServiceLoader<DriverFactory> loader = ServiceLoader.load(DriverFactory.class, classLoader);
        List<DriverFactory> factories = new ArrayList<>();

        for (DriverFactory factory : loader) {
            factories.add(factory);
            log.debug("Discovered driver factory via SPI: {} - {}",
                    factory.getApiVersion(), factory.getDescription());
        }

        if (factories.isEmpty()) {
            log.warn("No DriverFactory implementations found via SPI");
        }

        return Collections.unmodifiableList(factories);
    }

    /**
     * Find the factory serving a protocol version
     *
     * @param version API version
     * @return factory
     * @throws DriverNotFoundException if no driver module for the version is on the classpath
     */
    public static DriverFactory find(ApiVersion version) {
        return load().stream()
                .filter(factory -> factory.getApiVersion() == version)
                .findFirst()
                .orElseThrow(() -> new DriverNotFoundException(version.getId()));
    }
}
