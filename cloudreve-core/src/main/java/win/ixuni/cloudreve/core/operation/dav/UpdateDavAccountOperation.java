package win.ixuni.cloudreve.core.operation.dav;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Updates a WebDAV account; null fields keep their current value
 */
@Value
public class UpdateDavAccountOperation implements Operation<Void> {

    String accountId;

    String root;

    String name;

    Boolean readOnly;

    Boolean proxy;
}
