package win.ixuni.cloudreve.driver.v3.handler.user;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.NotAuthenticatedException;
import win.ixuni.cloudreve.core.model.UserInfo;
import win.ixuni.cloudreve.core.operation.user.GetUserInfoOperation;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;

import java.util.EnumSet;
import java.util.Set;

/**
 * V3 has no profile endpoint; the user captured at login is returned
 */
public class V3GetUserInfoHandler extends AbstractV3Handler<GetUserInfoOperation, UserInfo> {

    @Override
    protected Mono<UserInfo> doHandle(GetUserInfoOperation operation, V3DriverContext context) {
        return Mono.justOrEmpty(context.getCredentials().getUser())
                .switchIfEmpty(Mono.error(() -> new NotAuthenticatedException("No user is logged in")));
    }

    @Override
    public Class<GetUserInfoOperation> getOperationType() {
        return GetUserInfoOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.USER);
    }
}
