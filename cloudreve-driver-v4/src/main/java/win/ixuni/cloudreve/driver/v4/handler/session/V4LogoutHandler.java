package win.ixuni.cloudreve.driver.v4.handler.session;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.session.LogoutOperation;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.Set;

/**
 * V4 注销处理器，本地令牌总是被清除
 */
public class V4LogoutHandler extends AbstractV4Handler<LogoutOperation, Void> {

    @Override
    protected Mono<Void> doHandle(LogoutOperation operation, V4DriverContext context) {
        return context.getClient().logout()
                .doFinally(signal -> context.getCredentials().clear());
    }

    @Override
    public Class<LogoutOperation> getOperationType() {
        return LogoutOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.SESSION);
    }
}
