package win.ixuni.cloudreve.driver.v3.handler;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.operation.DriverContext;
import win.ixuni.cloudreve.core.operation.Operation;
import win.ixuni.cloudreve.core.operation.OperationHandler;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;

/**
 * V3 Handler 抽象基类
 * <p>
 * 提供类型安全的 Context 访问，子类无需手动强制转换。
 *
 * @param <O> 操作类型
 * @param <R> 返回类型
 */
public abstract class AbstractV3Handler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, DriverContext context) {
        if (!(context instanceof V3DriverContext)) {
            return Mono.error(new IllegalArgumentException(
                    "Expected V3DriverContext but got: " + context.getClass().getName()));
        }
        return doHandle(operation, (V3DriverContext) context);
    }

    /**
     * 子类实现的处理方法
     *
     * @param operation 操作
     * @param context   V3 驱动上下文
     * @return operation result
     */
    protected abstract Mono<R> doHandle(O operation, V3DriverContext context);
}
