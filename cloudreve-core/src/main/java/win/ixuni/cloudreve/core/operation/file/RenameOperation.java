package win.ixuni.cloudreve.core.operation.file;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Renames in place
 */
@Value
public class RenameOperation implements Operation<Void> {

    String path;

    /**
     * New leaf name, no separators
     */
    String newName;
}
