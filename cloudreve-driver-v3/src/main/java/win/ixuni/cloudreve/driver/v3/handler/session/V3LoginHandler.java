package win.ixuni.cloudreve.driver.v3.handler.session;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.LoginResponse;
import win.ixuni.cloudreve.core.operation.session.LoginOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;
import win.ixuni.cloudreve.driver.v3.model.V3LoginResponse;

import java.util.EnumSet;
import java.util.Set;

/**
 * V3 登录处理器
 * <p>
 * Any previous session cookie is dropped first; the new one comes from {@code Set-Cookie}.
 */
public class V3LoginHandler extends AbstractV3Handler<LoginOperation, LoginResponse> {

    @Override
    protected Mono<LoginResponse> doHandle(LoginOperation operation, V3DriverContext context) {
        CloudrevePaths.requireText(operation.getEmail(), "email");
        CloudrevePaths.requireText(operation.getPassword(), "password");
        return context.getClient().login(operation.getEmail(), operation.getPassword())
                .map(V3LoginResponse::new);
    }

    @Override
    public Class<LoginOperation> getOperationType() {
        return LoginOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.SESSION);
    }
}
