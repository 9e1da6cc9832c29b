package win.ixuni.cloudreve.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Access and refresh token issued by the V4 session endpoints
 */
@Value
@Builder
public class TokenPair {

    String accessToken;

    String refreshToken;

    String accessExpires;

    String refreshExpires;
}
