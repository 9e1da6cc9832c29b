package win.ixuni.cloudreve.driver.v3.handler.session;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.session.LogoutOperation;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;

import java.util.EnumSet;
import java.util.Set;

/**
 * V3 注销处理器
 * <p>
 * The local cookie is dropped whether or not the server call succeeds.
 */
public class V3LogoutHandler extends AbstractV3Handler<LogoutOperation, Void> {

    @Override
    protected Mono<Void> doHandle(LogoutOperation operation, V3DriverContext context) {
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
