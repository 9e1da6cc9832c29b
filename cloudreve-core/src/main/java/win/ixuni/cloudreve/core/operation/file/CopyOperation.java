package win.ixuni.cloudreve.core.operation.file;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Copies a file or folder, destination rules as for {@link MoveOperation}
 */
@Value
public class CopyOperation implements Operation<Void> {

    String source;

    String destination;
}
