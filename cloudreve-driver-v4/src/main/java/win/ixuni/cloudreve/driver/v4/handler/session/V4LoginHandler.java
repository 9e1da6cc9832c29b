package win.ixuni.cloudreve.driver.v4.handler.session;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.LoginResponse;
import win.ixuni.cloudreve.core.operation.session.LoginOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.Set;

/**
 * V4 登录处理器
 */
public class V4LoginHandler extends AbstractV4Handler<LoginOperation, LoginResponse> {

    @Override
    protected Mono<LoginResponse> doHandle(LoginOperation operation, V4DriverContext context) {
        CloudrevePaths.requireText(operation.getEmail(), "email");
        CloudrevePaths.requireText(operation.getPassword(), "password");
        return context.getClient().login(operation.getEmail(), operation.getPassword())
                .cast(LoginResponse.class);
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
