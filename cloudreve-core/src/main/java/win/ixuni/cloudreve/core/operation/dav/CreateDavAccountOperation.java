package win.ixuni.cloudreve.core.operation.dav;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Creates a WebDAV account
 */
@Value
public class CreateDavAccountOperation implements Operation<Void> {

    /**
     * Path or URI exposed by the account
     */
    String root;

    String name;

    boolean readOnly;

    boolean proxy;
}
