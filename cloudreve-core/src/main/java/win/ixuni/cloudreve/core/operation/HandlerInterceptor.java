package win.ixuni.cloudreve.core.operation;

import reactor.core.publisher.Mono;

/**
 * Handler 拦截器接口
 * <p>
 * Wraps every handler invocation of a driver, e.g. for logging or error translation.
 */
public interface HandlerInterceptor {

    /**
     * 拦截 Handler 执行
     *
     * @param operation the operation instance
     * @param context   驱动上下文
     * @param chain     后续拦截器链
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            DriverContext context,
            InterceptorChain<O, R> chain);

    /**
     * Get interceptor priority (lower number = runs further outside)
     *
     * @return priority ordinal
     */
    default int getOrder() {
        return 0;
    }
}
