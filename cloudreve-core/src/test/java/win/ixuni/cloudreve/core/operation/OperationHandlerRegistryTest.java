package win.ixuni.cloudreve.core.operation;

import com.fasterxml.jackson.core.JsonParseException;
import lombok.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.DecodeException;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.exception.OperationNotSupportedException;
import win.ixuni.cloudreve.core.exception.TransportException;
import win.ixuni.cloudreve.core.operation.interceptor.ErrorTranslationInterceptor;
import win.ixuni.cloudreve.core.operation.interceptor.LoggingInterceptor;

import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * 处理器注册表测试
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OperationHandlerRegistryTest {

    @Mock
    private DriverContext context;

    private OperationHandlerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new OperationHandlerRegistry();
        registry.addInterceptor(new ErrorTranslationInterceptor());
        registry.addInterceptor(new LoggingInterceptor());
        when(context.getDriverName()).thenReturn("test");
        when(context.getApiVersion()).thenReturn(ApiVersion.V3);
    }

    @Value
    static class EchoOperation implements Operation<String> {
        String text;
    }

    @Value
    static class OtherOperation implements Operation<Void> {
    }

    static class EchoHandler implements OperationHandler<EchoOperation, String> {

        private final Function<EchoOperation, Mono<String>> body;

        EchoHandler(Function<EchoOperation, Mono<String>> body) {
            this.body = body;
        }

        @Override
        public Mono<String> handle(EchoOperation operation, DriverContext context) {
            return body.apply(operation);
        }

        @Override
        public Class<EchoOperation> getOperationType() {
            return EchoOperation.class;
        }

        @Override
        public Set<Capability> getProvidedCapabilities() {
            return EnumSet.of(Capability.READ, Capability.SITE);
        }
    }

    @Test
    void dispatchesToHandler() {
        registry.register(new EchoHandler(op -> Mono.just(op.getText().toUpperCase())));

        StepVerifier.create(registry.execute(new EchoOperation("hi"), context))
                .expectNext("HI")
                .verifyComplete();
        assertEquals("Echo", new EchoOperation("x").getOperationName());
        assertEquals(EnumSet.of(Capability.READ, Capability.SITE), registry.getAggregatedCapabilities());
    }

    @Test
    @DisplayName("An operation without a handler is reported as unsupported for the context's version")
    void unsupportedOperation() {
        StepVerifier.create(registry.execute(new OtherOperation(), context))
                .expectErrorSatisfies(e -> {
                    OperationNotSupportedException unsupported = assertInstanceOf(OperationNotSupportedException.class, e);
                    assertEquals("Other", unsupported.getOperation());
                    assertEquals(ApiVersion.V3, unsupported.getApiVersion());
                    assertEquals("NotImplemented", unsupported.getErrorCode());
                })
                .verify();
    }

    @Test
    @DisplayName("A handler throwing synchronously surfaces as an error signal")
    void synchronousThrow() {
        registry.register(new EchoHandler(op -> {
            throw new InvalidArgumentException("bad");
        }));

        Mono<String> result = registry.execute(new EchoOperation("x"), context);

        StepVerifier.create(result)
                .expectError(InvalidArgumentException.class)
                .verify();
    }

    @Test
    void translatesForeignErrors() {
        registry.register(new EchoHandler(op -> Mono.error(
                new UncheckedIOException(new ConnectException("Connection refused")))));

        StepVerifier.create(registry.execute(new EchoOperation("x"), context))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(TransportException.class, e);
                    assertEquals("Transport failure: Connection refused", e.getMessage());
                    assertInstanceOf(ConnectException.class, e.getCause());
                })
                .verify();
    }

    @Test
    void translatesJsonErrors() {
        registry.register(new EchoHandler(op -> Mono.error(new JsonParseException(null, "Unexpected character"))));

        StepVerifier.create(registry.execute(new EchoOperation("x"), context))
                .expectError(DecodeException.class)
                .verify();
    }

    @Test
    @DisplayName("Interceptors run in order, lowest first")
    void interceptorOrder() {
        List<String> calls = new ArrayList<>();
        registry.addInterceptor(recording(calls, "inner", 50));
        registry.addInterceptor(recording(calls, "outer", -50));
        registry.register(new EchoHandler(op -> {
            calls.add("handler");
            return Mono.just("ok");
        }));

        registry.execute(new EchoOperation("x"), context).block();

        assertEquals(List.of("outer", "inner", "handler"), calls);
    }

    @Test
    @DisplayName("An operation is served by exactly one handler")
    void rejectsSecondHandlerForSameOperation() {
        registry.register(new EchoHandler(op -> Mono.just("first")));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> registry.register(new EchoHandler(op -> Mono.just("second"))));
        assertTrue(e.getMessage().startsWith("EchoOperation is already served by EchoHandler"), e.getMessage());
        StepVerifier.create(registry.execute(new EchoOperation("x"), context))
                .expectNext("first")
                .verifyComplete();
    }

    @Test
    void noCapabilitiesWithoutHandlers() {
        assertTrue(registry.getAggregatedCapabilities().isEmpty());
    }

    private static HandlerInterceptor recording(List<String> calls, String name, int order) {
        return new HandlerInterceptor() {
            @Override
            public <O extends Operation<R>, R> Mono<R> intercept(O operation, DriverContext context,
                                                                 InterceptorChain<O, R> chain) {
                return Mono.defer(() -> {
                    calls.add(name);
                    return chain.proceed(operation, context);
                });
            }

            @Override
            public int getOrder() {
                return order;
            }
        };
    }
}
