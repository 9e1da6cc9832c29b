package win.ixuni.cloudreve.core.operation.session;

import lombok.Value;
import win.ixuni.cloudreve.core.model.TokenPair;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Renews the V4 access token
 */
@Value
public class RefreshTokenOperation implements Operation<TokenPair> {

    /**
     * Refresh token; null uses the one kept from login
     */
    String refreshToken;
}
