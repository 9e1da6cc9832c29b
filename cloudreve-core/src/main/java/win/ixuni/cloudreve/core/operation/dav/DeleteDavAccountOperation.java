package win.ixuni.cloudreve.core.operation.dav;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Deletes a WebDAV account
 */
@Value
public class DeleteDavAccountOperation implements Operation<Void> {

    String accountId;
}
