package win.ixuni.cloudreve.core.operation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.OperationNotSupportedException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 操作处理器注册表
 * <p>
 * Each protocol driver registers one handler per operation it can serve. An operation without
 * a handler fails with {@link OperationNotSupportedException} naming the driver's API version,
 * which is how the facade reports features a server generation lacks.
 * <p>
 * Every execution, nested ones included, passes through the interceptors in ascending order.
 */
@Slf4j
public class OperationHandlerRegistry {

    private final Map<Class<?>, OperationHandler<?, ?>> handlers = new ConcurrentHashMap<>();

    private volatile List<HandlerInterceptor> interceptors = Collections.emptyList();

    /**
     * @throws IllegalStateException if the operation already has a handler
     */
    public <O extends Operation<R>, R> void register(OperationHandler<O, R> handler) {
        Class<O> operationType = handler.getOperationType();
        OperationHandler<?, ?> previous = handlers.putIfAbsent(operationType, handler);
        if (previous != null) {
            throw new IllegalStateException(operationType.getSimpleName() + " is already served by "
                    + previous.getClass().getSimpleName() + ", cannot register "
                    + handler.getClass().getSimpleName());
        }
        log.debug("{} -> {}", operationType.getSimpleName(), handler.getClass().getSimpleName());
    }

    /**
     * 添加拦截器，order 越小越靠外
     */
    public synchronized void addInterceptor(HandlerInterceptor interceptor) {
        List<HandlerInterceptor> sorted = new ArrayList<>(interceptors);
        sorted.add(interceptor);
        sorted.sort(Comparator.comparingInt(HandlerInterceptor::getOrder));
        interceptors = Collections.unmodifiableList(sorted);
    }

    /**
     * Run an operation through the interceptors and its handler
     *
     * @return the handler's result, or an {@link OperationNotSupportedException} when no handler is registered
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> Mono<R> execute(O operation, DriverContext context) {
        OperationHandler<O, R> handler = (OperationHandler<O, R>) handlers.get(operation.getClass());
        if (handler == null) {
            log.debug("{} has no handler on {}", operation.getOperationName(), context.getApiVersion());
            return Mono.error(new OperationNotSupportedException(
                    operation.getOperationName(), context.getApiVersion()));
        }
        return buildChain(handler, interceptors, 0).proceed(operation, context);
    }

    private <O extends Operation<R>, R> InterceptorChain<O, R> buildChain(
            OperationHandler<O, R> handler, List<HandlerInterceptor> chain, int index) {
        if (index >= chain.size()) {
            // synchronous throws from a handler still surface as errors of the Mono
            return (op, ctx) -> Mono.defer(() -> handler.handle(op, ctx));
        }
        HandlerInterceptor interceptor = chain.get(index);
        InterceptorChain<O, R> next = buildChain(handler, chain, index + 1);
        return (op, ctx) -> interceptor.intercept(op, ctx, next);
    }

    /**
     * Union of the capabilities declared by the registered handlers
     */
    public Set<Capability> getAggregatedCapabilities() {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        for (OperationHandler<?, ?> handler : handlers.values()) {
            capabilities.addAll(handler.getProvidedCapabilities());
        }
        return capabilities;
    }
}
