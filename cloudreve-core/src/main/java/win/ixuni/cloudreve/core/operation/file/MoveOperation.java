package win.ixuni.cloudreve.core.operation.file;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Moves a file or folder
 * <p>
 * Same directory with a different leaf name means rename. Otherwise the destination is a target
 * directory, unless its leaf equals the source leaf (then its parent is the target directory).
 */
@Value
public class MoveOperation implements Operation<Void> {

    String source;

    String destination;
}
