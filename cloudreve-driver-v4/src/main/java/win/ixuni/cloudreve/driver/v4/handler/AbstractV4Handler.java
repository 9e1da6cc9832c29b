package win.ixuni.cloudreve.driver.v4.handler;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.operation.DriverContext;
import win.ixuni.cloudreve.core.operation.Operation;
import win.ixuni.cloudreve.core.operation.OperationHandler;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;

/**
 * V4 Handler 抽象基类
 *
 * @param <O> 操作类型
 * @param <R> 返回类型
 */
public abstract class AbstractV4Handler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, DriverContext context) {
        if (!(context instanceof V4DriverContext)) {
            return Mono.error(new IllegalArgumentException(
                    "Expected V4DriverContext but got: " + context.getClass().getName()));
        }
        return doHandle(operation, (V4DriverContext) context);
    }

    protected abstract Mono<R> doHandle(O operation, V4DriverContext context);
}
