package win.ixuni.cloudreve.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Editable properties of a share link; null means "leave unchanged"
 */
@Value
@Builder
public class ShareUpdate {

    String password;

    /**
     * Seconds until expiry
     */
    Integer expiresIn;
}
