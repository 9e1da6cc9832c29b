package win.ixuni.cloudreve.driver.v4.handler.session;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.NotAuthenticatedException;
import win.ixuni.cloudreve.core.model.TokenPair;
import win.ixuni.cloudreve.core.operation.session.RefreshTokenOperation;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4Token;

import java.util.EnumSet;
import java.util.Set;

/**
 * V4 令牌刷新
 * <p>
 * Without an explicit refresh token the one stored at login is used.
 */
public class V4RefreshTokenHandler extends AbstractV4Handler<RefreshTokenOperation, TokenPair> {

    @Override
    protected Mono<TokenPair> doHandle(RefreshTokenOperation operation, V4DriverContext context) {
        String refreshToken = operation.getRefreshToken() != null
                ? operation.getRefreshToken()
                : context.getCredentials().getRefreshToken()
                        .orElseThrow(() -> new NotAuthenticatedException("No refresh token available"));
        return context.getClient().refreshToken(refreshToken)
                .map(V4Token::toTokenPair);
    }

    @Override
    public Class<RefreshTokenOperation> getOperationType() {
        return RefreshTokenOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.TOKEN_REFRESH);
    }
}
