package win.ixuni.cloudreve.core.driver;

import lombok.Getter;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.OperationHandlerRegistry;
import win.ixuni.cloudreve.core.operation.interceptor.ErrorTranslationInterceptor;
import win.ixuni.cloudreve.core.operation.interceptor.LoggingInterceptor;
import win.ixuni.cloudreve.core.operation.site.PingOperation;

import java.util.Set;

/**
 * Abstract base class for protocol drivers
 * <p>
 * Installs the common interceptors; subclasses build their context and register handlers.
 */
public abstract class AbstractCloudreveDriver implements CloudreveDriver {

    @Getter
    protected final OperationHandlerRegistry handlerRegistry = new OperationHandlerRegistry();

    protected AbstractCloudreveDriver() {
        handlerRegistry.addInterceptor(new LoggingInterceptor());
        handlerRegistry.addInterceptor(new ErrorTranslationInterceptor());
    }

    @Override
    public Set<Capability> getCapabilities() {
        // Aggregated from all registered handler-declared capabilities
        return handlerRegistry.getAggregatedCapabilities();
    }

    @Override
    public Mono<String> ping() {
        return execute(new PingOperation());
    }

    @Override
    public Mono<Void> shutdown() {
        getDriverContext().getCredentials().clear();
        return Mono.empty();
    }
}
