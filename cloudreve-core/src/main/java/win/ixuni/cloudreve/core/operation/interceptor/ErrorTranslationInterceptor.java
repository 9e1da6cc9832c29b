package win.ixuni.cloudreve.core.operation.interceptor;

import com.fasterxml.jackson.core.JacksonException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.exception.CloudreveException;
import win.ixuni.cloudreve.core.exception.DecodeException;
import win.ixuni.cloudreve.core.exception.TransportException;
import win.ixuni.cloudreve.core.operation.DriverContext;
import win.ixuni.cloudreve.core.operation.HandlerInterceptor;
import win.ixuni.cloudreve.core.operation.InterceptorChain;
import win.ixuni.cloudreve.core.operation.Operation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;

/**
 * Error translation interceptor
 * <p>
 * Converts raw failures that escaped a handler (JDK I/O, Jackson, future wrappers)
 * into the {@link CloudreveException} hierarchy, so callers only branch on one taxonomy.
 * Exceptions already in the hierarchy pass through untouched.
 */
@Slf4j
public class ErrorTranslationInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation, DriverContext context, InterceptorChain<O, R> chain) {
        return chain.proceed(operation, context)
                .onErrorMap(e -> !(e instanceof CloudreveException), e -> translate(operation, e));
    }

    Throwable translate(Operation<?> operation, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof CloudreveException) {
            return cause;
        }
        if (cause instanceof JacksonException) {
            return new DecodeException("Failed to decode response of " + operation.getOperationName()
                    + ": " + cause.getMessage(), cause);
        }
        if (cause instanceof IOException) {
            return new TransportException(cause.getMessage(), cause);
        }
        log.debug("Unmapped error in {}: {}, passing through",
                operation.getOperationName(), cause.getClass().getName());
        return cause;
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof UncheckedIOException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public int getOrder() {
        // Innermost: translate before the logging interceptor sees the error
        return 100;
    }
}
