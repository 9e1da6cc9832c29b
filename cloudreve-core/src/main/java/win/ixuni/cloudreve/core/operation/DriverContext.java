package win.ixuni.cloudreve.core.operation;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.auth.SessionCredentials;
import win.ixuni.cloudreve.core.config.DriverConfig;
import win.ixuni.cloudreve.core.driver.ApiVersion;

/**
 * Driver context interface
 * <p>
 * Provides the shared dependencies handlers need: configuration, the endpoint client of the
 * driver (exposed by the concrete context) and the in-memory credentials.
 * 每个驱动实现自己的上下文类。
 */
public interface DriverContext {

    /**
     * 获取驱动配置
     *
     * @return 驱动配置
     */
    DriverConfig getConfig();

    /**
     * Get the driver name
     *
     * @return 驱动实例名称
     */
    String getDriverName();

    /**
     * Get the protocol version spoken by this driver
     *
     * @return API version
     */
    ApiVersion getApiVersion();

    /**
     * Get the credentials held for this driver instance
     *
     * @return credentials, never null
     */
    SessionCredentials getCredentials();

    /**
     * Get the operation handler registry
     *
     * @return handler registry
     */
    OperationHandlerRegistry getHandlerRegistry();

    /**
     * 设置操作处理器注册表
     * <p>
     * Called during driver initialization to inject the handler registry.
     *
     * @param registry 处理器注册表
     */
    void setHandlerRegistry(OperationHandlerRegistry registry);

    /**
     * Execute an operation
     * <p>
     * Allows handlers to compose other operations (e.g. the emulated copy issues
     * create-directory, move, rename and delete) without depending on other handler instances.
     *
     * @param operation the operation instance
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, this);
    }
}
