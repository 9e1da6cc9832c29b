package win.ixuni.cloudreve.driver.v4.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.model.TokenPair;

@Data
@NoArgsConstructor
public class V4Token {

    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("refresh_token")
    private String refreshToken;

    @JsonProperty("access_expires")
    private String accessExpires;

    @JsonProperty("refresh_expires")
    private String refreshExpires;

    public TokenPair toTokenPair() {
        return TokenPair.builder()
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .accessExpires(accessExpires)
                .refreshExpires(refreshExpires)
                .build();
    }
}
