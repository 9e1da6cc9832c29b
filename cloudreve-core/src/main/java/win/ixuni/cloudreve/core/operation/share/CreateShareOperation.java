package win.ixuni.cloudreve.core.operation.share;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * 创建分享链接
 * <p>
 * Emits the share URL (V4) or share key (V3).
 */
@Value
public class CreateShareOperation implements Operation<String> {

    String path;

    /**
     * Seconds until expiry, null for never
     */
    Integer expiresIn;

    /**
     * Null for a public link
     */
    String password;
}
