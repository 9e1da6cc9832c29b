package win.ixuni.cloudreve.core.driver;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.operation.DriverContext;
import win.ixuni.cloudreve.core.operation.Operation;
import win.ixuni.cloudreve.core.operation.OperationHandlerRegistry;

/**
 * Cloudreve protocol driver
 * <p>
 * Command-pattern architecture where all operations are executed via {@link #execute(Operation)}.
 * There is one driver per protocol version; each registers the handlers it can express.
 */
public interface CloudreveDriver extends DriverCapabilities {

        // ==================== Core Methods ====================

        /**
         * Get the operation handler registry
         *
         * @return handler registry
         */
        OperationHandlerRegistry getHandlerRegistry();

        /**
         * Get the driver context
         *
         * @return driver context
         */
        DriverContext getDriverContext();

        /**
         * Execute an operation
         * <p>
         * This is the unified entry point for all operations, with interceptor chain support.
         *
         * @param operation the operation instance
         * @param <O>       operation type
         * @param <R>       return type
         * @return operation result
         */
        default <O extends Operation<R>, R> Mono<R> execute(O operation) {
                return getHandlerRegistry().execute(operation, getDriverContext());
        }

        // ==================== Driver Metadata ====================

        /**
         * Get the protocol version of this driver
         *
         * @return API version
         */
        ApiVersion getApiVersion();

        /**
         * Get the driver instance name
         *
         * @return instance name (as specified in configuration)
         */
        String getDriverName();

        /**
         * Liveness probe of the protocol endpoint
         *
         * @return server version string reported by the ping endpoint
         */
        Mono<String> ping();

        /**
         * Shut down the driver and release resources
         *
         * @return completion signal
         */
        Mono<Void> shutdown();
}
