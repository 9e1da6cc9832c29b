package win.ixuni.cloudreve.driver.v4.handler.user;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.NotAuthenticatedException;
import win.ixuni.cloudreve.core.model.UserInfo;
import win.ixuni.cloudreve.core.operation.user.GetUserInfoOperation;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4User;

import java.util.EnumSet;
import java.util.Set;

/**
 * V4 用户信息
 * <p>
 * Fetches a fresh profile for the user captured at login.
 */
public class V4GetUserInfoHandler extends AbstractV4Handler<GetUserInfoOperation, UserInfo> {

    @Override
    protected Mono<UserInfo> doHandle(GetUserInfoOperation operation, V4DriverContext context) {
        String userId = context.getCredentials().getUser()
                .map(UserInfo::getId)
                .orElseThrow(() -> new NotAuthenticatedException("No user is logged in"));
        return context.getClient().userInfo(userId)
                .map(V4User::toUserInfo);
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
