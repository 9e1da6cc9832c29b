package win.ixuni.cloudreve.core.operation.file;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

import java.util.List;

/**
 * Restores entries from the trash
 */
@Value
public class RestoreOperation implements Operation<Void> {

    List<String> paths;
}
