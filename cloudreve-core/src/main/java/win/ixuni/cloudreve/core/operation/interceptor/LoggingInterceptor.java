package win.ixuni.cloudreve.core.operation.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.exception.ApiException;
import win.ixuni.cloudreve.core.operation.DriverContext;
import win.ixuni.cloudreve.core.operation.HandlerInterceptor;
import win.ixuni.cloudreve.core.operation.InterceptorChain;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * 日志拦截器
 * <p>
 * 在操作执行前后记录日志，包括执行时间和结果状态。
 * Nested operations (issued by a handler through the context) are logged too.
 * Only the operation name is logged, never its arguments: they may carry passwords or file content.
 */
@Slf4j
public class LoggingInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            DriverContext context,
            InterceptorChain<O, R> chain) {

        final String operationName = operation.getOperationName();
        final String source = context.getDriverName() + "/" + context.getApiVersion().getId();

        return Mono.defer(() -> {
            final long startTime = System.currentTimeMillis();
            log.debug("[{}] {} started", source, operationName);

            return chain.proceed(operation, context)
                    .doOnSuccess(result -> log.debug("[{}] {} done in {}ms",
                            source, operationName, System.currentTimeMillis() - startTime))
                    .doOnError(error -> log.warn("[{}] {} failed after {}ms: {}",
                            source, operationName, System.currentTimeMillis() - startTime, describe(error)));
        });
    }

    private static String describe(Throwable error) {
        if (error instanceof ApiException) {
            return "code " + ((ApiException) error).getCode() + ", " + error.getMessage();
        }
        return error.getMessage();
    }

    @Override
    public int getOrder() {
        return -100; // 最外层拦截器
    }
}
