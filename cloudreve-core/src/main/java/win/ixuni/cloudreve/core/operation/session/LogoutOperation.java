package win.ixuni.cloudreve.core.operation.session;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Ends the server session and clears the local credentials
 */
@Value
public class LogoutOperation implements Operation<Void> {
}
