package win.ixuni.cloudreve.core.operation.site;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Liveness probe, emits the server version
 */
@Value
public class PingOperation implements Operation<String> {
}
