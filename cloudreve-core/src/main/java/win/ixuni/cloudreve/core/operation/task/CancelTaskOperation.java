package win.ixuni.cloudreve.core.operation.task;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Cancels a remote download
 */
@Value
public class CancelTaskOperation implements Operation<Void> {

    String taskId;
}
